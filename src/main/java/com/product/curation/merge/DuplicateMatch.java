package com.product.curation.merge;

import com.product.curation.core.model.Candidate;

import java.util.Objects;

/**
 * A candidate judged to denote the same product as its group's canonical candidate.
 *
 * @param similarity the larger of the name and URL similarity to the canonical candidate
 */
public record DuplicateMatch(Candidate candidate, double similarity) {

    public DuplicateMatch {
        Objects.requireNonNull(candidate, "candidate is required");
    }
}
