package com.roster.matching.tier;

import com.roster.matching.core.model.MatchOutcome;
import com.roster.matching.core.model.MatchResult;
import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.core.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AmbiguityPolicyTest {

    private static final PlayerRecord A = new PlayerRecord("a", "Robert", "Smith", "Tennaqua", "Tennaqua - 19", "APTA_CHICAGO");
    private static final PlayerRecord B = new PlayerRecord("b", "Bobby", "Smith", "Tennaqua", "Tennaqua - 19", "APTA_CHICAGO");
    private static final PlayerRecord C = new PlayerRecord("c", "Rob", "Smith", "Glenview", "Glenview - 19", "APTA_CHICAGO");

    private final AmbiguityPolicy policy = new AmbiguityPolicy();

    @Test
    @DisplayName("No attempts is unresolved")
    void testEmpty() {
        assertEquals(MatchOutcome.UNRESOLVED, policy.finalizeOutcome(List.of()).outcome());
    }

    @Test
    @DisplayName("A unique PRIMARY outcome resolves at PRIMARY")
    void testUniquePrimary() {
        MatchResult result = policy.finalizeOutcome(List.of(TierOutcome.of(Tier.PRIMARY, List.of(A))));

        assertEquals(MatchResult.resolved(A, Tier.PRIMARY), result);
    }

    @Test
    @DisplayName("A unique later outcome beats an earlier ambiguous one")
    void testUniqueBeatsAmbiguous() {
        MatchResult result = policy.finalizeOutcome(List.of(
                TierOutcome.of(Tier.PRIMARY, List.of(A, B)),
                TierOutcome.of(Tier.FALLBACK1, List.of(C))));

        assertEquals(MatchResult.resolved(C, Tier.FALLBACK1), result);
    }

    @Test
    @DisplayName("Earliest ambiguous outcome is kept over later, larger sets")
    void testEarliestAmbiguous() {
        MatchResult result = policy.finalizeOutcome(List.of(
                TierOutcome.of(Tier.PRIMARY, List.of(A, B)),
                TierOutcome.of(Tier.FALLBACK1, List.of(A, B, C)),
                TierOutcome.of(Tier.FALLBACK2, List.of()),
                TierOutcome.of(Tier.FALLBACK3, List.of(A, C))));

        assertEquals(MatchOutcome.AMBIGUOUS, result.outcome());
        assertEquals(Tier.PRIMARY, result.tier());
        assertEquals(List.of(A, B), result.candidates());
    }

    @Test
    @DisplayName("Ambiguity found only in a later tier is reported at that tier")
    void testLaterAmbiguous() {
        MatchResult result = policy.finalizeOutcome(List.of(
                TierOutcome.of(Tier.PRIMARY, List.of()),
                TierOutcome.of(Tier.FALLBACK1, List.of()),
                TierOutcome.of(Tier.FALLBACK2, List.of(A, B)),
                TierOutcome.of(Tier.FALLBACK3, List.of(A, B, C))));

        assertEquals(Tier.FALLBACK2, result.tier());
        assertEquals(2, result.candidates().size());
    }

    @Test
    @DisplayName("Skipped and empty tiers are unresolved")
    void testAllEmpty() {
        TierConstraints primary = TierPlan.standard().tiers().get(0);
        MatchResult result = policy.finalizeOutcome(List.of(
                TierOutcome.skipped(primary),
                TierOutcome.of(Tier.FALLBACK1, List.of())));

        assertSame(MatchResult.unresolved(), result);
    }
}
