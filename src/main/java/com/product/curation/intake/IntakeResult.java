package com.product.curation.intake;

import java.util.List;

/**
 * What one extraction result added to the store.
 *
 * @param candidateIds      stored (or already known) candidates, in extraction order
 * @param claimsAdded       claims attached to those candidates
 * @param skippedWithoutUrl extracted candidates dropped for lacking a URL
 */
public record IntakeResult(List<Long> candidateIds, int claimsAdded, int skippedWithoutUrl) {

    public IntakeResult {
        candidateIds = candidateIds != null ? List.copyOf(candidateIds) : List.of();
    }

    public boolean useful() {
        return !candidateIds.isEmpty();
    }
}
