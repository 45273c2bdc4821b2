package com.product.curation.merge;

import java.util.List;

/**
 * Outcome of merging one duplicate group.
 *
 * @param success       whether every write of the group committed
 * @param canonicalId   surviving candidate
 * @param mergedIds     candidates deleted into the canonical one (empty on failure)
 * @param claimsMoved   claims re-parented to the canonical candidate
 * @param mentionsMoved raw mentions re-parented to the canonical candidate
 * @param errorMessage  failure cause, {@code null} on success
 */
public record GroupMergeResult(
        boolean success,
        long canonicalId,
        List<Long> mergedIds,
        int claimsMoved,
        int mentionsMoved,
        String errorMessage
) {
    public GroupMergeResult {
        mergedIds = mergedIds != null ? List.copyOf(mergedIds) : List.of();
    }

    public static GroupMergeResult success(long canonicalId, List<Long> mergedIds, int claimsMoved, int mentionsMoved) {
        return new GroupMergeResult(true, canonicalId, mergedIds, claimsMoved, mentionsMoved, null);
    }

    /**
     * A rolled-back merge. Nothing the group touched was left modified.
     */
    public static GroupMergeResult failure(long canonicalId, String errorMessage) {
        return new GroupMergeResult(false, canonicalId, List.of(), 0, 0, errorMessage);
    }

    public boolean isFailure() {
        return !success;
    }
}
