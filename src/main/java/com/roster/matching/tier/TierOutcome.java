package com.roster.matching.tier;

import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.core.model.Tier;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * What one tier attempt found.
 *
 * @param tier           the tier attempted
 * @param constraints    the attributes it constrained on
 * @param candidates     matching records after in-memory name filtering
 * @param seriesUsed     series key sent to the directory, or null when the tier ignores series
 * @param seriesFallback true when the series did not normalize and the raw string was used
 * @param skipped        true when a required query field was blank and the directory was not queried
 */
public record TierOutcome(
        Tier tier,
        Set<Constraint> constraints,
        List<PlayerRecord> candidates,
        String seriesUsed,
        boolean seriesFallback,
        boolean skipped
) {
    public TierOutcome {
        Objects.requireNonNull(tier, "tier is required");
        constraints = constraints != null ? constraints : Set.of();
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    /**
     * Outcome of a tier whose constraints could not be satisfied by the query.
     */
    public static TierOutcome skipped(TierConstraints tierConstraints) {
        return new TierOutcome(tierConstraints.tier(), tierConstraints.constraints(), List.of(), null, false, true);
    }

    /**
     * Outcome with candidates only, for policy evaluation and tests.
     */
    public static TierOutcome of(Tier tier, List<PlayerRecord> candidates) {
        return new TierOutcome(tier, Set.of(), candidates, null, false, false);
    }

    public int candidateCount() {
        return candidates.size();
    }

    public boolean isUnique() {
        return candidates.size() == 1;
    }

    public boolean isAmbiguous() {
        return candidates.size() >= 2;
    }

    /**
     * {@code SKIPPED}, {@code NONE}, {@code UNIQUE} or {@code MULTIPLE}.
     */
    public String resultLabel() {
        if (skipped) {
            return "SKIPPED";
        }
        if (candidates.isEmpty()) {
            return "NONE";
        }
        return isUnique() ? "UNIQUE" : "MULTIPLE";
    }
}
