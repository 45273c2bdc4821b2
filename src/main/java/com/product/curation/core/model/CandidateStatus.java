package com.product.curation.core.model;

import java.util.Locale;

/**
 * Pipeline stage of a product candidate.
 * Conventional flow: inbox → analyzing → review → {approved, rejected}.
 */
public enum CandidateStatus {
    INBOX("inbox"),
    ANALYZING("analyzing"),
    REVIEW("review"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String wireName;

    CandidateStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether entering this status records a human review decision.
     */
    public boolean isDecision() {
        return this == APPROVED || this == REJECTED;
    }

    /**
     * Parses a status from its wire name ({@code "review"}) or enum name ({@code "REVIEW"}).
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static CandidateStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status must not be null or blank");
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (CandidateStatus status : values()) {
            if (status.wireName.equals(key)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status '" + value + "'. Must be one of: "
                + "inbox, analyzing, review, approved, rejected");
    }
}
