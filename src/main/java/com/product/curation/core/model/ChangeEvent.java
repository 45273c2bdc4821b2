package com.product.curation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Recorded changelog entry. Never modified once appended.
 */
public record ChangeEvent(
        long id,
        long candidateId,
        ChangeType changeType,
        String description,
        String sourceUrl,
        Instant detectedAt
) {
    public ChangeEvent {
        Objects.requireNonNull(changeType, "changeType is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(detectedAt, "detectedAt is required");
    }
}
