package com.roster.matching.series;

import com.roster.matching.core.model.LeagueFamily;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One series-name pattern for a league family.
 * A rule applies when its pattern matches the whole input and its extractor
 * produces a key; otherwise the normalizer moves on to the next rule.
 */
public final class SeriesRule {
    private final String name;
    private final LeagueFamily leagueFamily;
    private final Pattern pattern;
    private final Extractor extractor;

    private SeriesRule(Builder builder) {
        this.name = builder.name;
        this.leagueFamily = builder.leagueFamily;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.extractor = builder.extractor;
    }

    /**
     * Builds a canonical key from a successful match.
     */
    @FunctionalInterface
    public interface Extractor {

        /**
         * @param matcher a matcher that has matched the whole series string
         * @param club    the club name, trimmed with whitespace collapsed
         * @return the canonical key, or empty to let later rules try
         */
        Optional<String> extract(Matcher matcher, String club);
    }

    public String getName() {
        return name;
    }

    public LeagueFamily getLeagueFamily() {
        return leagueFamily;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /**
     * Applies this rule to a series string that has already been trimmed and
     * whitespace-collapsed.
     */
    public Optional<String> apply(String series, String club) {
        Matcher matcher = pattern.matcher(series);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return extractor.extract(matcher, club);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SeriesRule that = (SeriesRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "SeriesRule{" +
                "name='" + name + '\'' +
                ", leagueFamily=" + leagueFamily +
                ", pattern=" + pattern.pattern() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private LeagueFamily leagueFamily;
        private String pattern;
        private Extractor extractor;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder leagueFamily(LeagueFamily leagueFamily) {
            this.leagueFamily = leagueFamily;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder extractor(Extractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public SeriesRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(leagueFamily, "leagueFamily is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(extractor, "extractor is required");
            return new SeriesRule(this);
        }
    }
}
