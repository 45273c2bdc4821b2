package com.product.curation.tracker;

import java.time.Duration;

/**
 * Update tracker tuning.
 *
 * @param fetchTimeout upper bound for one page fetch
 * @param parallelism  number of candidates checked concurrently, 1 for sequential
 * @param userAgent    User-Agent header sent with page fetches
 */
public record TrackerOptions(Duration fetchTimeout, int parallelism, String userAgent) {

    public TrackerOptions {
        if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be positive");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent must not be blank");
        }
    }

    /**
     * 30 second fetches, one at a time.
     */
    public static TrackerOptions defaults() {
        return new TrackerOptions(Duration.ofSeconds(30), 1,
                "Mozilla/5.0 (compatible; product-curation/1.0; +update-tracker)");
    }
}
