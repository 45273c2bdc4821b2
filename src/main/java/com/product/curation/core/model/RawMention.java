package com.product.curation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Unprocessed text item from a feed.
 *
 * @param candidateId candidate the mention was linked to after processing, or {@code null}
 */
public record RawMention(
        long id,
        long feedId,
        String sourceUrl,
        String rawText,
        boolean processed,
        Long candidateId,
        Instant createdAt
) {
    public RawMention {
        Objects.requireNonNull(rawText, "rawText is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public RawMention processedFor(Long linkedCandidateId) {
        return new RawMention(id, feedId, sourceUrl, rawText, true, linkedCandidateId, createdAt);
    }

    public RawMention withCandidateId(Long newCandidateId) {
        return new RawMention(id, feedId, sourceUrl, rawText, processed, newCandidateId, createdAt);
    }
}
