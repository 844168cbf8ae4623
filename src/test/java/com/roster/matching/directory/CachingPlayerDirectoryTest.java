package com.roster.matching.directory;

import com.roster.matching.cache.CacheConfig;
import com.roster.matching.cache.CacheStats;
import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.metrics.MetricsService;
import com.roster.matching.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingPlayerDirectoryTest {

    private static final PlayerRecord ROBERT =
            new PlayerRecord("p1", "Robert", "Smith", "Tennaqua", "Tennaqua - 19", "APTA_CHICAGO");
    private static final DirectoryQuery QUERY =
            DirectoryQuery.builder().lastName("Smith").leagueId("APTA_CHICAGO").build();

    @Mock
    private PlayerDirectory delegate;

    @Test
    @DisplayName("Repeated queries are served from the cache")
    void testCacheHit() {
        when(delegate.query(QUERY)).thenReturn(List.of(ROBERT));
        CachingPlayerDirectory caching = new CachingPlayerDirectory(delegate, CacheConfig.defaults());

        assertEquals(List.of(ROBERT), caching.query(QUERY));
        assertEquals(List.of(ROBERT), caching.query(
                DirectoryQuery.builder().lastName("Smith").leagueId("APTA_CHICAGO").build()));

        verify(delegate, times(1)).query(QUERY);
        CacheStats stats = caching.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 1e-9);
    }

    @Test
    @DisplayName("Hits and misses are counted")
    void testMetrics() {
        when(delegate.query(QUERY)).thenReturn(List.of(ROBERT));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CachingPlayerDirectory caching = new CachingPlayerDirectory(delegate, CacheConfig.defaults(),
                new MicrometerMetricsService(registry));

        caching.query(QUERY);
        caching.query(QUERY);
        caching.query(QUERY);

        assertEquals(2.0, registry.get("roster.directory.cache.hit").counter().count());
        assertEquals(1.0, registry.get("roster.directory.cache.miss").counter().count());
    }

    @Test
    @DisplayName("A failing metrics backend does not break lookups")
    void testMetricsFailureIgnored() {
        when(delegate.query(QUERY)).thenReturn(List.of(ROBERT));
        MetricsService metrics = mock(MetricsService.class);
        doThrow(new IllegalStateException("registry closed")).when(metrics).recordCacheMiss();
        doThrow(new IllegalStateException("registry closed")).when(metrics).recordCacheHit();
        CachingPlayerDirectory caching = new CachingPlayerDirectory(delegate, CacheConfig.defaults(), metrics);

        assertEquals(List.of(ROBERT), caching.query(QUERY));
        assertEquals(List.of(ROBERT), caching.query(QUERY));

        verify(delegate, times(1)).query(QUERY);
        assertEquals(1, caching.getStats().hitCount());
    }

    @Test
    @DisplayName("Disabled cache always calls the delegate")
    void testDisabled() {
        when(delegate.query(QUERY)).thenReturn(List.of(ROBERT));
        CachingPlayerDirectory caching = new CachingPlayerDirectory(delegate, CacheConfig.disabled());

        caching.query(QUERY);
        caching.query(QUERY);

        verify(delegate, times(2)).query(QUERY);
    }

    @Test
    @DisplayName("Invalidation forces a fresh lookup")
    void testInvalidateAll() {
        when(delegate.query(QUERY)).thenReturn(List.of(ROBERT));
        CachingPlayerDirectory caching = new CachingPlayerDirectory(delegate, CacheConfig.defaults());

        caching.query(QUERY);
        caching.invalidateAll();
        caching.query(QUERY);

        verify(delegate, times(2)).query(QUERY);
    }

    @Test
    @DisplayName("Delegate failures are not cached")
    void testFailureNotCached() {
        when(delegate.query(QUERY)).thenThrow(new IllegalStateException("directory unavailable"));
        CachingPlayerDirectory caching = new CachingPlayerDirectory(delegate, CacheConfig.defaults());

        assertThrows(IllegalStateException.class, () -> caching.query(QUERY));
        assertThrows(IllegalStateException.class, () -> caching.query(QUERY));

        verify(delegate, times(2)).query(QUERY);
    }

    @Test
    @DisplayName("Cache config validates sizes")
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        assertFalse(CacheConfig.disabled().enabled());
        assertEquals(0.0, CacheStats.empty().hitRate());
    }
}
