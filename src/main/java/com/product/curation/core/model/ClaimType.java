package com.product.curation.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of factual assertion a claim makes about a candidate.
 */
public enum ClaimType {
    FEATURE("feature"),
    PRICING("pricing"),
    INTEGRATION("integration"),
    LIMITATION("limitation"),
    COMPARISON("comparison"),
    USE_CASE("use_case"),
    AUDIENCE("audience");

    private final String wireName;

    ClaimType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ClaimType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (ClaimType type : values()) {
            if (type.wireName.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
