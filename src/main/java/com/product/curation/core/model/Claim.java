package com.product.curation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A factual assertion about a candidate extracted from a raw mention.
 *
 * @param id          store-assigned identifier
 * @param candidateId owning candidate
 * @param feedId      feed the assertion came from
 * @param claimType   kind of assertion, may be {@code null} when extraction did not classify it
 * @param content     the assertion text
 * @param confidence  extraction confidence in [0, 1]
 * @param rawText     supporting excerpt, may be {@code null}
 * @param createdAt   when the claim was recorded
 */
public record Claim(
        long id,
        long candidateId,
        long feedId,
        ClaimType claimType,
        String content,
        double confidence,
        String rawText,
        Instant createdAt
) {
    public Claim {
        Objects.requireNonNull(content, "content is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
    }

    /**
     * Returns a copy of this claim attached to another candidate.
     */
    public Claim withCandidateId(long newCandidateId) {
        return new Claim(id, newCandidateId, feedId, claimType, content, confidence, rawText, createdAt);
    }
}
