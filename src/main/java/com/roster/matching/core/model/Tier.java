package com.roster.matching.core.model;

/**
 * One attempt of the multi-tier resolver. Declaration order is the
 * precision order: earlier tiers carry strictly more constraints.
 */
public enum Tier {
    PRIMARY("Exact match: name, club and series all match"),
    FALLBACK1("Probable match: last name and series match, club and first name not checked"),
    FALLBACK2("High-confidence match: last name, club and series match, first name differs"),
    FALLBACK3("High-confidence match: last name and club match, first name and series not checked");

    private final String description;

    Tier(String description) {
        this.description = description;
    }

    /**
     * Human-readable summary of what a match at this tier guarantees.
     */
    public String getDescription() {
        return description;
    }
}
