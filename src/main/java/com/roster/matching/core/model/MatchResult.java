package com.roster.matching.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of resolving one {@link MatchQuery} against a player directory.
 *
 * <ul>
 *   <li>{@link MatchOutcome#RESOLVED}: exactly one candidate, and the tier that found it</li>
 *   <li>{@link MatchOutcome#AMBIGUOUS}: two or more candidates from the earliest ambiguous tier</li>
 *   <li>{@link MatchOutcome#UNRESOLVED}: no candidates and no tier</li>
 * </ul>
 */
public record MatchResult(
        MatchOutcome outcome,
        Tier tier,
        List<PlayerRecord> candidates
) {
    private static final MatchResult UNRESOLVED = new MatchResult(MatchOutcome.UNRESOLVED, null, List.of());

    public MatchResult {
        Objects.requireNonNull(outcome, "outcome is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        switch (outcome) {
            case RESOLVED -> {
                if (candidates.size() != 1) {
                    throw new IllegalArgumentException("A resolved result has exactly one candidate");
                }
                Objects.requireNonNull(tier, "tier is required for a resolved result");
            }
            case AMBIGUOUS -> {
                if (candidates.size() < 2) {
                    throw new IllegalArgumentException("An ambiguous result has at least two candidates");
                }
                Objects.requireNonNull(tier, "tier is required for an ambiguous result");
            }
            case UNRESOLVED -> {
                if (!candidates.isEmpty() || tier != null) {
                    throw new IllegalArgumentException("An unresolved result carries no candidates or tier");
                }
            }
        }
    }

    public static MatchResult resolved(PlayerRecord player, Tier tier) {
        return new MatchResult(MatchOutcome.RESOLVED, tier, List.of(player));
    }

    public static MatchResult ambiguous(List<PlayerRecord> candidates, Tier tier) {
        return new MatchResult(MatchOutcome.AMBIGUOUS, tier, candidates);
    }

    public static MatchResult unresolved() {
        return UNRESOLVED;
    }

    public boolean isResolved() {
        return outcome == MatchOutcome.RESOLVED;
    }

    public boolean isAmbiguous() {
        return outcome == MatchOutcome.AMBIGUOUS;
    }

    /**
     * Returns the matched player's id when resolved.
     */
    public Optional<String> getPlayerId() {
        return isResolved() ? Optional.of(candidates.get(0).playerId()) : Optional.empty();
    }

    /**
     * Returns the matched player when resolved.
     */
    public Optional<PlayerRecord> getPlayer() {
        return isResolved() ? Optional.of(candidates.get(0)) : Optional.empty();
    }
}
