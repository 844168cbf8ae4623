package com.roster.matching.metrics;

import com.roster.matching.core.model.LeagueFamily;
import com.roster.matching.core.model.MatchOutcome;
import com.roster.matching.core.model.Tier;

import java.time.Duration;

/**
 * Records roster-matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordResolutionDuration(LeagueFamily family, MatchOutcome outcome, Duration duration);

    /**
     * @param result one of {@code NONE}, {@code UNIQUE}, {@code MULTIPLE}, {@code SKIPPED}
     */
    void incrementTierAttempt(Tier tier, String result);

    void incrementSeriesNormalizationFailed(LeagueFamily family);

    void recordCacheHit();

    void recordCacheMiss();
}
