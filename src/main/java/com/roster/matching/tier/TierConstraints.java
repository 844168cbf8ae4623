package com.roster.matching.tier;

import com.roster.matching.core.model.Tier;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The set of attributes one tier constrains on.
 */
public record TierConstraints(Tier tier, Set<Constraint> constraints) {

    public TierConstraints {
        Objects.requireNonNull(tier, "tier is required");
        Objects.requireNonNull(constraints, "constraints is required");
        if (constraints.isEmpty()) {
            throw new IllegalArgumentException("Tier " + tier + " must constrain at least one attribute");
        }
        constraints = Collections.unmodifiableSet(EnumSet.copyOf(constraints));
    }

    public static TierConstraints of(Tier tier, Constraint first, Constraint... rest) {
        return new TierConstraints(tier, EnumSet.of(first, rest));
    }

    public boolean uses(Constraint constraint) {
        return constraints.contains(constraint);
    }
}
