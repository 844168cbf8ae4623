package com.roster.matching.core.model;

import java.util.Objects;

/**
 * A player entry from a league directory snapshot. Read-only from the
 * matcher's point of view.
 *
 * @param playerId        directory identifier of the player
 * @param firstName       first name as published by the league
 * @param lastName        last name as published by the league
 * @param club            club name
 * @param seriesCanonical canonical series key, e.g. {@code "Tennaqua - 19"}
 * @param leagueId        league identifier, e.g. {@code "APTA_CHICAGO"}
 */
public record PlayerRecord(
        String playerId,
        String firstName,
        String lastName,
        String club,
        String seriesCanonical,
        String leagueId
) {
    public PlayerRecord {
        Objects.requireNonNull(playerId, "playerId is required");
        firstName = firstName != null ? firstName : "";
        lastName = lastName != null ? lastName : "";
        club = club != null ? club : "";
        seriesCanonical = seriesCanonical != null ? seriesCanonical : "";
        leagueId = leagueId != null ? leagueId : "";
    }

    /**
     * Returns "First Last (Club, Series)" for log lines and caller messaging.
     */
    public String displayText() {
        return firstName + " " + lastName + " (" + club + ", " + seriesCanonical + ")";
    }
}
