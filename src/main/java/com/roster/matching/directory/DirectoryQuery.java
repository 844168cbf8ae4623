package com.roster.matching.directory;

import java.util.Objects;
import java.util.Optional;

/**
 * Constraints of one directory lookup. Absent optional fields are not filtered on.
 *
 * @param firstName       advisory first name, or null
 * @param lastName        last name, always filtered
 * @param club            club name, or null
 * @param seriesCanonical canonical (or raw fallback) series key, or null
 * @param leagueId        league identifier, always filtered
 */
public record DirectoryQuery(
        String firstName,
        String lastName,
        String club,
        String seriesCanonical,
        String leagueId
) {
    public DirectoryQuery {
        Objects.requireNonNull(lastName, "lastName is required");
        Objects.requireNonNull(leagueId, "leagueId is required");
    }

    public Optional<String> getFirstName() {
        return Optional.ofNullable(firstName);
    }

    public Optional<String> getClub() {
        return Optional.ofNullable(club);
    }

    public Optional<String> getSeriesCanonical() {
        return Optional.ofNullable(seriesCanonical);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String firstName;
        private String lastName;
        private String club;
        private String seriesCanonical;
        private String leagueId;

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder club(String club) {
            this.club = club;
            return this;
        }

        public Builder seriesCanonical(String seriesCanonical) {
            this.seriesCanonical = seriesCanonical;
            return this;
        }

        public Builder leagueId(String leagueId) {
            this.leagueId = leagueId;
            return this;
        }

        public DirectoryQuery build() {
            return new DirectoryQuery(firstName, lastName, club, seriesCanonical, leagueId);
        }
    }
}
