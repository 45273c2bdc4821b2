package com.product.curation.tracker;

/**
 * A candidate page could not be retrieved.
 */
public class PageFetchException extends Exception {

    private final String url;

    public PageFetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public PageFetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
