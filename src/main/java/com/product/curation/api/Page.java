package com.product.curation.api;

import java.util.List;

/**
 * One window of a listing plus the size of the whole listing.
 */
public record Page<T>(List<T> items, long total, PageRequest request) {

    public Page {
        items = items != null ? List.copyOf(items) : List.of();
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
    }

    /**
     * Cuts the requested window out of a fully materialized listing.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        int from = Math.min(request.offset(), all.size());
        int to = Math.min(from + request.limit(), all.size());
        return new Page<>(all.subList(from, to), all.size(), request);
    }

    public boolean hasNext() {
        return (long) request.offset() + items.size() < total;
    }
}
