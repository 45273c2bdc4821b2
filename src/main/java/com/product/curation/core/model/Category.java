package com.product.curation.core.model;

import java.util.Locale;

/**
 * Fixed product taxonomy. Anything the extraction step cannot place lands in {@link #OTHER}.
 */
public enum Category {
    PROSPECTING("prospecting"),
    ENRICHMENT("enrichment"),
    OUTREACH("outreach"),
    CONVERSATION("conversation"),
    CRM("crm"),
    SCHEDULING("scheduling"),
    ANALYTICS("analytics"),
    COACHING("coaching"),
    OTHER("other");

    private final String wireName;

    Category(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Lenient lookup: null, blank and unknown values map to {@link #OTHER}.
     */
    public static Category fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.wireName.equals(key)) {
                return category;
            }
        }
        return OTHER;
    }
}
