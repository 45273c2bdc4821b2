package com.product.curation.intake;

/**
 * Receives progress of a long-running import.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records handled so far
     * @param total     total records, or -1 while unknown
     * @param message   short status text
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
