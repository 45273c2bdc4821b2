package com.product.curation.metrics;

import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.ChangeType;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpCurationMetrics implements CurationMetrics {

    @Override
    public void recordRelevanceScore(double score) {
    }

    @Override
    public void incrementPromoted(int count) {
    }

    @Override
    public void incrementDuplicatesMerged(int count) {
    }

    @Override
    public void incrementMergeFailure() {
    }

    @Override
    public void recordPassDuration(String pass, Duration duration) {
    }

    @Override
    public void incrementStatusTransition(CandidateStatus to) {
    }

    @Override
    public void incrementPageFetch(boolean success) {
    }

    @Override
    public void incrementChangeDetected(ChangeType type) {
    }
}
