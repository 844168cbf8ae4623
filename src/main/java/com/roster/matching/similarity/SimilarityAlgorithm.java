package com.roster.matching.similarity;

/**
 * String similarity measure used for first-name tolerance.
 * Implementations return a score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two already-normalized names.
     */
    double compute(String s1, String s2);

    String getName();
}
