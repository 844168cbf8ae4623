package com.roster.matching.metrics;

import com.roster.matching.core.model.LeagueFamily;
import com.roster.matching.core.model.MatchOutcome;
import com.roster.matching.core.model.Tier;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(LeagueFamily family, MatchOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementTierAttempt(Tier tier, String result) {
    }

    @Override
    public void incrementSeriesNormalizationFailed(LeagueFamily family) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
