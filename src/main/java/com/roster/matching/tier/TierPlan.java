package com.roster.matching.tier;

import com.roster.matching.core.model.Tier;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.roster.matching.tier.Constraint.*;

/**
 * Ordered tiers consumed by {@link TierResolver}. Reordering or removing a tier
 * is a change to this list, not to the resolver.
 */
public final class TierPlan {

    private static final TierPlan STANDARD = new TierPlan(List.of(
            TierConstraints.of(Tier.PRIMARY, FIRST_NAME, LAST_NAME, CLUB, SERIES, LEAGUE),
            TierConstraints.of(Tier.FALLBACK1, LAST_NAME, SERIES, LEAGUE),
            TierConstraints.of(Tier.FALLBACK2, LAST_NAME, CLUB, SERIES, LEAGUE),
            TierConstraints.of(Tier.FALLBACK3, LAST_NAME, CLUB, LEAGUE)
    ));

    private final List<TierConstraints> tiers;

    private TierPlan(List<TierConstraints> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    /**
     * The standard four tiers. FALLBACK1 drops club and first name, FALLBACK2
     * drops only first name, FALLBACK3 drops series and first name: series is
     * treated as more discriminating than club.
     */
    public static TierPlan standard() {
        return STANDARD;
    }

    /**
     * Builds a custom plan. Every tier must constrain last name and league,
     * and no tier may appear twice.
     */
    public static TierPlan of(List<TierConstraints> tiers) {
        Objects.requireNonNull(tiers, "tiers is required");
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("A tier plan needs at least one tier");
        }
        Set<Tier> seen = EnumSet.noneOf(Tier.class);
        for (TierConstraints tc : tiers) {
            if (!tc.uses(LAST_NAME) || !tc.uses(LEAGUE)) {
                throw new IllegalArgumentException("Tier " + tc.tier() + " must constrain LAST_NAME and LEAGUE");
            }
            if (!seen.add(tc.tier())) {
                throw new IllegalArgumentException("Tier " + tc.tier() + " appears more than once");
            }
        }
        return new TierPlan(tiers);
    }

    public List<TierConstraints> tiers() {
        return tiers;
    }

    public int size() {
        return tiers.size();
    }
}
