package com.product.curation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Extracted state of a candidate's web page at one fetch. Snapshots are append-only;
 * the latest one per candidate is the comparison baseline for the next fetch.
 *
 * @param pricingText  extracted pricing text or {@code null} when none was found
 * @param featuresText extracted features text or {@code null} when none was found
 */
public record Snapshot(
        long candidateId,
        String url,
        String title,
        String contentHash,
        String pricingText,
        String featuresText,
        Instant fetchedAt
) {
    public Snapshot {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(contentHash, "contentHash is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
    }
}
