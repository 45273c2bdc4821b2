package com.product.curation.merge;

import com.product.curation.core.model.Candidate;

import java.util.List;
import java.util.Objects;

/**
 * A canonical candidate and the later candidates that duplicate it.
 */
public record DuplicateGroup(Candidate canonical, List<DuplicateMatch> duplicates) {

    public DuplicateGroup {
        Objects.requireNonNull(canonical, "canonical is required");
        duplicates = duplicates != null ? List.copyOf(duplicates) : List.of();
        if (duplicates.isEmpty()) {
            throw new IllegalArgumentException("A duplicate group needs at least one duplicate");
        }
    }

    public List<Long> duplicateIds() {
        return duplicates.stream()
                .map(d -> d.candidate().getId())
                .toList();
    }
}
