package com.product.curation.core.model;

import java.util.Objects;

/**
 * Upstream information feed that produced raw mentions.
 *
 * @param id             store-assigned identifier
 * @param name           unique feed name
 * @param url            feed location, may be {@code null}
 * @param reliability    reliability tier
 * @param totalMentions  mentions processed from this feed
 * @param usefulMentions mentions that yielded at least one candidate
 */
public record Feed(
        long id,
        String name,
        String url,
        FeedReliability reliability,
        long totalMentions,
        long usefulMentions
) {
    public Feed {
        Objects.requireNonNull(name, "name is required");
        reliability = reliability != null ? reliability : FeedReliability.UNRATED;
        if (usefulMentions > totalMentions) {
            throw new IllegalArgumentException("usefulMentions cannot exceed totalMentions");
        }
    }

    public Feed withCounters(long total, long useful) {
        return new Feed(id, name, url, reliability, total, useful);
    }

    public double usefulRatio() {
        return totalMentions == 0 ? 0.0 : (double) usefulMentions / totalMentions;
    }
}
