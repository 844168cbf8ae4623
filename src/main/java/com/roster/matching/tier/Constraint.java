package com.roster.matching.tier;

/**
 * A query attribute a tier may constrain on.
 */
public enum Constraint {
    FIRST_NAME,
    LAST_NAME,
    CLUB,
    SERIES,
    LEAGUE
}
