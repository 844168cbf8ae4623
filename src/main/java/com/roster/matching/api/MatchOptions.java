package com.roster.matching.api;

/**
 * Options for first-name tolerance during resolution.
 */
public class MatchOptions {

    private static final double DEFAULT_FUZZY_THRESHOLD = 0.80;
    private static final int DEFAULT_MIN_FUZZY_LENGTH = 3;

    private final double fuzzyThreshold;
    private final int minFuzzyLength;
    private final boolean nicknameMatchingEnabled;
    private final boolean fuzzyMatchingEnabled;

    private MatchOptions(Builder builder) {
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.minFuzzyLength = builder.minFuzzyLength;
        this.nicknameMatchingEnabled = builder.nicknameMatchingEnabled;
        this.fuzzyMatchingEnabled = builder.fuzzyMatchingEnabled;
    }

    /**
     * Minimum edit-distance ratio for two first names to be treated as the same.
     */
    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    /**
     * Names shorter than this never match by edit distance.
     */
    public int getMinFuzzyLength() {
        return minFuzzyLength;
    }

    public boolean isNicknameMatchingEnabled() {
        return nicknameMatchingEnabled;
    }

    public boolean isFuzzyMatchingEnabled() {
        return fuzzyMatchingEnabled;
    }

    public static MatchOptions defaults() {
        return builder().build();
    }

    /**
     * Exact and nickname matches only; no edit-distance tolerance.
     */
    public static MatchOptions strict() {
        return builder().fuzzyMatchingEnabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private int minFuzzyLength = DEFAULT_MIN_FUZZY_LENGTH;
        private boolean nicknameMatchingEnabled = true;
        private boolean fuzzyMatchingEnabled = true;

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder minFuzzyLength(int minFuzzyLength) {
            this.minFuzzyLength = minFuzzyLength;
            return this;
        }

        public Builder nicknameMatchingEnabled(boolean nicknameMatchingEnabled) {
            this.nicknameMatchingEnabled = nicknameMatchingEnabled;
            return this;
        }

        public Builder fuzzyMatchingEnabled(boolean fuzzyMatchingEnabled) {
            this.fuzzyMatchingEnabled = fuzzyMatchingEnabled;
            return this;
        }

        public MatchOptions build() {
            if (fuzzyThreshold <= 0.0 || fuzzyThreshold > 1.0) {
                throw new IllegalArgumentException("fuzzyThreshold must be in (0.0, 1.0]");
            }
            if (minFuzzyLength < 1) {
                throw new IllegalArgumentException("minFuzzyLength must be >= 1");
            }
            return new MatchOptions(this);
        }
    }
}
