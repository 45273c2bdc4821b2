package com.product.curation.api;

/**
 * Offset/limit window over a listing.
 */
public record PageRequest(int offset, int limit) {

    private static final int MAX_LIMIT = 1_000;

    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be > 0 and <= " + MAX_LIMIT);
        }
    }

    /**
     * Zero-based page {@code page} of {@code size} items.
     */
    public static PageRequest of(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        return new PageRequest(page * size, size);
    }

    public static PageRequest first(int size) {
        return of(0, size);
    }
}
