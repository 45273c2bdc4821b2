package com.product.curation.scoring;

import java.util.List;

/**
 * Outcome of scoring one candidate.
 *
 * @param candidateId scored candidate
 * @param score       relevance in [0, 1]
 * @param reasons     human-readable contributions, in the order they were applied
 * @param claimCount  number of claims considered
 * @param feedCount   number of distinct feeds among those claims
 */
public record ScoringResult(long candidateId, double score, List<String> reasons, int claimCount, int feedCount) {

    public ScoringResult {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1], got " + score);
        }
    }
}
