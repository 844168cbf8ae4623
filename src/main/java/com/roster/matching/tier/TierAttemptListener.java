package com.roster.matching.tier;

import com.roster.matching.core.model.MatchQuery;

/**
 * Observer of individual tier attempts. Listeners cannot influence the
 * resolution; an exception thrown by a listener is logged and ignored.
 */
@FunctionalInterface
public interface TierAttemptListener {

    void onTierAttempt(MatchQuery query, TierOutcome outcome);
}
