package com.product.curation.core.model;

import java.util.Objects;

/**
 * A change observed by the update tracker that has not yet been written to the changelog.
 */
public record DetectedChange(
        long candidateId,
        String candidateName,
        ChangeType changeType,
        String description,
        String sourceUrl
) {
    public DetectedChange {
        Objects.requireNonNull(changeType, "changeType is required");
        Objects.requireNonNull(description, "description is required");
    }
}
