package com.product.curation.core.model;

/**
 * Reliability tier assigned to a feed.
 */
public enum FeedReliability {
    AUTHORITATIVE,
    HIGH,
    MEDIUM,
    LOW,
    UNRATED
}
