package com.roster.matching.core.model;

/**
 * Identity supplied by a user for one resolution attempt.
 * Missing fields are stored as empty strings; they make the tiers that need
 * them unsatisfiable instead of failing the call.
 */
public record MatchQuery(
        String firstName,
        String lastName,
        String club,
        String seriesRaw,
        String leagueId
) {
    public MatchQuery {
        firstName = firstName != null ? firstName : "";
        lastName = lastName != null ? lastName : "";
        club = club != null ? club : "";
        seriesRaw = seriesRaw != null ? seriesRaw : "";
        leagueId = leagueId != null ? leagueId : "";
    }

    /**
     * Returns the naming family governing this query's series string.
     */
    public LeagueFamily leagueFamily() {
        return LeagueFamily.forLeagueId(leagueId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String firstName;
        private String lastName;
        private String club;
        private String seriesRaw;
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

        public Builder series(String seriesRaw) {
            this.seriesRaw = seriesRaw;
            return this;
        }

        public Builder leagueId(String leagueId) {
            this.leagueId = leagueId;
            return this;
        }

        public MatchQuery build() {
            return new MatchQuery(firstName, lastName, club, seriesRaw, leagueId);
        }
    }
}
