package com.product.curation.tracker;

/**
 * A candidate whose page could not be checked during an update pass.
 */
public record FetchFailure(long candidateId, String url, String message) {
}
