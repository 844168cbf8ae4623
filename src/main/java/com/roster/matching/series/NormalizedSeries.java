package com.roster.matching.series;

import com.roster.matching.similarity.NameNormalizer;

/**
 * Outcome of {@link SeriesNormalizer#normalize}: either a canonical key and the
 * rule that produced it, or the "normalization failed" sentinel carrying the raw input.
 */
public record NormalizedSeries(String raw, String canonicalKey, String ruleName) {

    public NormalizedSeries {
        raw = raw != null ? raw : "";
    }

    public static NormalizedSeries canonical(String raw, String canonicalKey, String ruleName) {
        return new NormalizedSeries(raw, canonicalKey, ruleName);
    }

    public static NormalizedSeries failed(String raw) {
        return new NormalizedSeries(raw, null, null);
    }

    public boolean isFailed() {
        return canonicalKey == null;
    }

    /**
     * The key to query with: the canonical key, or the trimmed raw string when
     * normalization failed.
     */
    public String effectiveKey() {
        return isFailed() ? NameNormalizer.collapseWhitespace(raw) : canonicalKey;
    }
}
