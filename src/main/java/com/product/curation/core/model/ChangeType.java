package com.product.curation.core.model;

/**
 * Types of changelog entries.
 */
public enum ChangeType {
    /**
     * Candidate was approved and entered the index.
     * This is the entry that exposes a candidate to the update tracker.
     */
    NEW("new"),
    PRICING_CHANGE("pricing_change"),
    FEATURE_ADDED("feature_added"),
    /**
     * Page content changed but neither pricing nor features differ.
     */
    CONTENT_CHANGE("content_change"),
    /**
     * Page title changed.
     */
    NEWS("news");

    private final String wireName;

    ChangeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
