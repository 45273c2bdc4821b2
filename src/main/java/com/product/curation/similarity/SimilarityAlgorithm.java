package com.product.curation.similarity;

/**
 * String similarity measure used for duplicate detection.
 * Scores range from 0.0 (nothing in common) to 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Scores the similarity of two already-normalized strings.
     * A null or empty operand scores 0.0.
     */
    double compute(String s1, String s2);

    String getName();
}
