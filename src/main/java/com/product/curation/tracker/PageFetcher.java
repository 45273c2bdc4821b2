package com.product.curation.tracker;

/**
 * Retrieves the HTML of a candidate's public page. Implementations must return or fail
 * within a bounded time.
 */
public interface PageFetcher {

    /**
     * @return the page body
     * @throws PageFetchException on timeout, transport error or a non-success response
     */
    String fetch(String url) throws PageFetchException;
}
