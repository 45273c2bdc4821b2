package com.product.curation.merge;

import java.util.List;

/**
 * Outcome of a duplicate scan, with or without merging.
 *
 * @param groupsFound     number of duplicate groups detected
 * @param duplicatesFound number of non-canonical candidates across all groups
 * @param merged          duplicates actually deleted into their canonical candidate
 * @param groups          the detected groups
 * @param failedMerges    groups whose merge was rolled back
 */
public record DeduplicationResult(
        int groupsFound,
        int duplicatesFound,
        int merged,
        List<DuplicateGroup> groups,
        List<GroupMergeResult> failedMerges
) {
    public DeduplicationResult {
        groups = groups != null ? List.copyOf(groups) : List.of();
        failedMerges = failedMerges != null ? List.copyOf(failedMerges) : List.of();
    }

    public static DeduplicationResult detected(List<DuplicateGroup> groups) {
        return new DeduplicationResult(groups.size(), countDuplicates(groups), 0, groups, List.of());
    }

    public static DeduplicationResult merged(List<DuplicateGroup> groups, List<GroupMergeResult> results) {
        int merged = results.stream()
                .filter(GroupMergeResult::success)
                .mapToInt(r -> r.mergedIds().size())
                .sum();
        List<GroupMergeResult> failed = results.stream()
                .filter(GroupMergeResult::isFailure)
                .toList();
        return new DeduplicationResult(groups.size(), countDuplicates(groups), merged, groups, failed);
    }

    private static int countDuplicates(List<DuplicateGroup> groups) {
        return groups.stream().mapToInt(g -> g.duplicates().size()).sum();
    }
}
