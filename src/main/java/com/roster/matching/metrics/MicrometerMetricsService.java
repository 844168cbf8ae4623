package com.roster.matching.metrics;

import com.roster.matching.core.model.LeagueFamily;
import com.roster.matching.core.model.MatchOutcome;
import com.roster.matching.core.model.Tier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code roster.resolution.duration}: Timer (tags: leagueFamily, outcome)</li>
 *   <li>{@code roster.tier.attempt}: Counter (tags: tier, result)</li>
 *   <li>{@code roster.series.normalization.failed}: Counter (tag: leagueFamily)</li>
 *   <li>{@code roster.directory.cache.hit}: Counter</li>
 *   <li>{@code roster.directory.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("roster.directory.cache.hit")
                .description("Number of player directory cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("roster.directory.cache.miss")
                .description("Number of player directory cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(LeagueFamily family, MatchOutcome outcome, Duration duration) {
        String key = family.name() + ":" + outcome.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("roster.resolution.duration")
                        .description("Duration of player resolutions")
                        .tag("leagueFamily", family.name())
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTierAttempt(Tier tier, String result) {
        String key = "tier:" + tier.name() + ":" + result;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("roster.tier.attempt")
                        .description("Tier attempts by result")
                        .tag("tier", tier.name())
                        .tag("result", result)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementSeriesNormalizationFailed(LeagueFamily family) {
        String key = "series-failed:" + family.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("roster.series.normalization.failed")
                        .description("Series strings that matched no rule")
                        .tag("leagueFamily", family.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
