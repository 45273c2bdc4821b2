package com.product.curation.store;

/**
 * Thrown when an operation references a candidate id that does not exist.
 */
public class CandidateNotFoundException extends RuntimeException {

    private final long candidateId;

    public CandidateNotFoundException(long candidateId) {
        super("Candidate not found: " + candidateId);
        this.candidateId = candidateId;
    }

    public long getCandidateId() {
        return candidateId;
    }
}
