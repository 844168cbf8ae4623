package com.roster.matching.tier;

import com.roster.matching.core.model.MatchQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one structured line per tier attempt.
 */
public class LoggingTierAttemptListener implements TierAttemptListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingTierAttemptListener.class);

    @Override
    public void onTierAttempt(MatchQuery query, TierOutcome outcome) {
        if (outcome.seriesFallback()) {
            log.info("tier.attempt tier={} constraints={} candidates={} outcome={} seriesFallback=true seriesRaw='{}'",
                    outcome.tier(), outcome.constraints(), outcome.candidateCount(), outcome.resultLabel(),
                    outcome.seriesUsed());
        } else {
            log.info("tier.attempt tier={} constraints={} candidates={} outcome={} seriesFallback=false",
                    outcome.tier(), outcome.constraints(), outcome.candidateCount(), outcome.resultLabel());
        }
    }
}
