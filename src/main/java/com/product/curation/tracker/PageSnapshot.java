package com.product.curation.tracker;

import java.util.Objects;

/**
 * What the tracker extracted from one fetched page, before it is stored.
 *
 * @param title        page title, {@code null} if the page has none
 * @param contentHash  fingerprint of the visible text
 * @param pricingText  joined pricing matches, {@code null} if none
 * @param featuresText joined feature matches, {@code null} if none
 */
public record PageSnapshot(String title, String contentHash, String pricingText, String featuresText) {

    public PageSnapshot {
        Objects.requireNonNull(contentHash, "contentHash is required");
    }
}
