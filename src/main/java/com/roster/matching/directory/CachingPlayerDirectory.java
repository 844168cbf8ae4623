package com.roster.matching.directory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.roster.matching.cache.CacheConfig;
import com.roster.matching.cache.CacheStats;
import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.metrics.MetricsService;
import com.roster.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Caffeine-backed decorator that memoizes directory lookups per {@link DirectoryQuery}.
 *
 * <p>Only valid over a snapshot that does not change while cached; call
 * {@link #invalidateAll()} after the import pipeline replaces the snapshot.
 * Exceptions from the delegate are not cached and reach the caller unchanged.</p>
 */
public class CachingPlayerDirectory implements PlayerDirectory {
    private static final Logger log = LoggerFactory.getLogger(CachingPlayerDirectory.class);

    private final PlayerDirectory delegate;
    private final Cache<DirectoryQuery, List<PlayerRecord>> cache;
    private final MetricsService metricsService;
    private final boolean enabled;

    public CachingPlayerDirectory(PlayerDirectory delegate, CacheConfig config) {
        this(delegate, config, new NoOpMetricsService());
    }

    public CachingPlayerDirectory(PlayerDirectory delegate, CacheConfig config, MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingPlayerDirectory initialized: enabled={}, maxSize={}, ttl={}s",
                enabled, config.maxSize(), config.ttlSeconds());
    }

    @Override
    public List<PlayerRecord> query(DirectoryQuery query) {
        if (!enabled) {
            return delegate.query(query);
        }
        List<PlayerRecord> cached = cache.getIfPresent(query);
        if (cached != null) {
            recordLookup(true);
            return cached;
        }
        recordLookup(false);
        List<PlayerRecord> result = List.copyOf(delegate.query(query));
        cache.put(query, result);
        return result;
    }

    private void recordLookup(boolean hit) {
        try {
            if (hit) {
                metricsService.recordCacheHit();
            } else {
                metricsService.recordCacheMiss();
            }
        } catch (RuntimeException e) {
            log.warn("directory.cache.metrics.failed hit={} error={}", hit, e.getMessage(), e);
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Directory cache invalidated");
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}
