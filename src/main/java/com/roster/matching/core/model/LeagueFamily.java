package com.roster.matching.core.model;

import java.util.Locale;
import java.util.Map;

/**
 * Naming-convention group that decides which series rules apply to a league.
 * Leagues sharing a convention share a family.
 */
public enum LeagueFamily {
    APTA_CHICAGO("APTA Chicago"),
    NSTF("NSTF");

    private static final Map<String, LeagueFamily> KNOWN_LEAGUES = Map.of(
            "APTA_CHICAGO", APTA_CHICAGO,
            "APTA", APTA_CHICAGO,
            "CNSWPL", APTA_CHICAGO,
            "CITA", APTA_CHICAGO,
            "NSTF", NSTF
    );

    private final String label;

    LeagueFamily(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Maps a league identifier to its naming family.
     * Unrecognised or blank identifiers use the dash convention of {@link #APTA_CHICAGO}.
     */
    public static LeagueFamily forLeagueId(String leagueId) {
        if (leagueId == null || leagueId.isBlank()) {
            return APTA_CHICAGO;
        }
        return KNOWN_LEAGUES.getOrDefault(leagueId.trim().toUpperCase(Locale.ROOT), APTA_CHICAGO);
    }
}
