package com.caret.analyze.similarity;

/**
 * Interface for string similarity computation used by fuzzy lookups.
 * All implementations must return a score between 0.0 (no similarity) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param candidate the string taken from the searched item
     * @param target    the string the caller is looking for
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String candidate, String target);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
