package com.roster.matching.core.model;

/**
 * Final outcome of one resolution.
 */
public enum MatchOutcome {
    /**
     * Exactly one directory record was found at some tier.
     */
    RESOLVED,

    /**
     * No tier narrowed to one record, but at least one tier returned several.
     * The candidates are those of the earliest such tier.
     */
    AMBIGUOUS,

    /**
     * No tier returned any record.
     */
    UNRESOLVED
}
