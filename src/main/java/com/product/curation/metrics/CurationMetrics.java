package com.product.curation.metrics;

import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.ChangeType;

import java.time.Duration;

/**
 * Sink for curation and tracking metrics. {@link NoOpCurationMetrics} is the default,
 * so nothing needs a metrics backend to run.
 */
public interface CurationMetrics {

    void recordRelevanceScore(double score);

    void incrementPromoted(int count);

    void incrementDuplicatesMerged(int count);

    void incrementMergeFailure();

    /**
     * @param pass pass name, {@code "curation"} or {@code "update-check"}
     */
    void recordPassDuration(String pass, Duration duration);

    void incrementStatusTransition(CandidateStatus to);

    void incrementPageFetch(boolean success);

    void incrementChangeDetected(ChangeType type);
}
