package com.event.reconciliation.similarity;

/**
 * A string similarity measure.
 * Implementations return a score between 0.0 (unrelated) and 1.0 (identical) and must be symmetric.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string, may be null
     * @param s2 second string, may be null
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
