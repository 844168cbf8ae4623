package com.roster.matching.tier;

import com.roster.matching.core.model.MatchResult;

import java.util.List;

/**
 * Turns ordered tier outcomes into a {@link MatchResult}.
 *
 * <p>The first outcome with exactly one candidate wins, even when an earlier tier
 * was ambiguous. Otherwise the earliest outcome with two or more candidates is
 * reported, since earlier tiers are more precise. Otherwise the result is unresolved.</p>
 */
public class AmbiguityPolicy {

    public MatchResult finalizeOutcome(List<TierOutcome> tierOutcomes) {
        TierOutcome earliestAmbiguous = null;
        for (TierOutcome outcome : tierOutcomes) {
            if (outcome.isUnique()) {
                return MatchResult.resolved(outcome.candidates().get(0), outcome.tier());
            }
            if (earliestAmbiguous == null && outcome.isAmbiguous()) {
                earliestAmbiguous = outcome;
            }
        }
        if (earliestAmbiguous != null) {
            return MatchResult.ambiguous(earliestAmbiguous.candidates(), earliestAmbiguous.tier());
        }
        return MatchResult.unresolved();
    }
}
