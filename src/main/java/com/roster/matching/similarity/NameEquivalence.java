package com.roster.matching.similarity;

import com.roster.matching.api.MatchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * First- and last-name equivalence predicates.
 *
 * <p>Last names match exactly after {@link NameNormalizer} normalization; they are
 * the primary discriminator and are never relaxed. First names match when any of
 * the following holds, checked in this order:</p>
 * <ol>
 *   <li>they are equal after normalization</li>
 *   <li>they share a curated {@link NicknameTable} group</li>
 *   <li>their edit-distance ratio reaches the configured threshold and both are
 *       at least {@link MatchOptions#getMinFuzzyLength()} characters long</li>
 * </ol>
 * Blank names never match.
 */
public class NameEquivalence {
    private static final Logger log = LoggerFactory.getLogger(NameEquivalence.class);

    private final NicknameTable nicknames;
    private final SimilarityAlgorithm similarity;
    private final MatchOptions options;

    public NameEquivalence(NicknameTable nicknames, MatchOptions options) {
        this(nicknames, new LevenshteinSimilarity(), options);
    }

    public NameEquivalence(NicknameTable nicknames, SimilarityAlgorithm similarity, MatchOptions options) {
        this.nicknames = Objects.requireNonNull(nicknames, "nicknames is required");
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * Equivalence with the bundled nickname table and default options.
     */
    public static NameEquivalence defaults() {
        return new NameEquivalence(NicknameTable.defaults(), MatchOptions.defaults());
    }

    public boolean lastNameMatches(String candidate, String query) {
        String a = NameNormalizer.normalize(candidate);
        return !a.isEmpty() && a.equals(NameNormalizer.normalize(query));
    }

    public boolean firstNameMatches(String candidate, String query) {
        String a = NameNormalizer.normalize(candidate);
        String b = NameNormalizer.normalize(query);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.equals(b)) {
            return true;
        }
        if (options.isNicknameMatchingEnabled() && nicknames.sameGroup(a, b)) {
            log.trace("First names '{}' and '{}' share a nickname group", a, b);
            return true;
        }
        return fuzzyMatches(a, b);
    }

    /**
     * Returns the similarity score used by the fuzzy rule, for diagnostics.
     */
    public double similarity(String candidate, String query) {
        return similarity.compute(NameNormalizer.normalize(candidate), NameNormalizer.normalize(query));
    }

    private boolean fuzzyMatches(String a, String b) {
        if (!options.isFuzzyMatchingEnabled()) {
            return false;
        }
        int minLength = options.getMinFuzzyLength();
        if (a.length() < minLength || b.length() < minLength) {
            return false;
        }
        double score = similarity.compute(a, b);
        boolean matches = score >= options.getFuzzyThreshold();
        if (matches) {
            log.debug("Fuzzy first-name match '{}' ~ '{}' ({}={})", a, b, similarity.getName(), score);
        }
        return matches;
    }
}
