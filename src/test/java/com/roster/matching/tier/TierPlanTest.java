package com.roster.matching.tier;

import com.roster.matching.core.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static com.roster.matching.tier.Constraint.*;
import static org.junit.jupiter.api.Assertions.*;

class TierPlanTest {

    @Test
    @DisplayName("Standard plan has four tiers in order")
    void testStandardOrder() {
        List<TierConstraints> tiers = TierPlan.standard().tiers();

        assertEquals(List.of(Tier.PRIMARY, Tier.FALLBACK1, Tier.FALLBACK2, Tier.FALLBACK3),
                tiers.stream().map(TierConstraints::tier).toList());
        assertEquals(EnumSet.allOf(Constraint.class), tiers.get(0).constraints());
        assertEquals(EnumSet.of(LAST_NAME, SERIES, LEAGUE), tiers.get(1).constraints());
        assertEquals(EnumSet.of(LAST_NAME, CLUB, SERIES, LEAGUE), tiers.get(2).constraints());
        assertEquals(EnumSet.of(LAST_NAME, CLUB, LEAGUE), tiers.get(3).constraints());
    }

    @Test
    @DisplayName("Only PRIMARY constrains the first name")
    void testFirstNameOnlyInPrimary() {
        List<TierConstraints> tiers = TierPlan.standard().tiers();

        assertTrue(tiers.get(0).uses(FIRST_NAME));
        assertTrue(tiers.stream().skip(1).noneMatch(t -> t.uses(FIRST_NAME)));
    }

    @Test
    @DisplayName("Custom plans must constrain last name and league")
    void testRequiredConstraints() {
        assertThrows(IllegalArgumentException.class, () -> TierPlan.of(List.of(
                TierConstraints.of(Tier.PRIMARY, FIRST_NAME, LEAGUE))));
        assertThrows(IllegalArgumentException.class, () -> TierPlan.of(List.of(
                TierConstraints.of(Tier.PRIMARY, LAST_NAME, CLUB))));
    }

    @Test
    @DisplayName("Custom plans reject duplicates and empty lists")
    void testInvalidPlans() {
        TierConstraints fallback = TierConstraints.of(Tier.FALLBACK3, LAST_NAME, CLUB, LEAGUE);

        assertThrows(IllegalArgumentException.class, () -> TierPlan.of(List.of(fallback, fallback)));
        assertThrows(IllegalArgumentException.class, () -> TierPlan.of(List.of()));
    }

    @Test
    @DisplayName("Constraint sets are immutable")
    void testImmutableConstraints() {
        TierConstraints tc = TierConstraints.of(Tier.FALLBACK3, LAST_NAME, CLUB, LEAGUE);

        assertThrows(UnsupportedOperationException.class, () -> tc.constraints().add(SERIES));
    }
}
