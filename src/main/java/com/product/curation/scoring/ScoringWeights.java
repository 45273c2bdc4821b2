package com.product.curation.scoring;

import com.product.curation.core.model.Category;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tunable constants of the relevance formula.
 *
 * <p>Defaults:</p>
 * <ul>
 *   <li>category: weight × 0.3, weights prospecting 1.0, outreach 1.0, enrichment 0.9,
 *       conversation 0.8, crm 0.7, scheduling 0.6, analytics 0.5, coaching 0.5, other 0.3</li>
 *   <li>claims: +0.05 per claim, capped at 0.2</li>
 *   <li>keywords: high +0.15, medium +0.08, low +0.03 per matching signal, capped at 0.4</li>
 *   <li>average claim confidence × 0.15</li>
 *   <li>description keywords at half weight</li>
 *   <li>+0.05 per distinct feed when more than one feed contributed, capped at 0.15</li>
 * </ul>
 */
public class ScoringWeights {

    private final Map<Category, Double> categoryWeights;
    private final double categoryFactor;
    private final double perClaimBonus;
    private final double claimBonusCap;
    private final double highSignalWeight;
    private final double mediumSignalWeight;
    private final double lowSignalWeight;
    private final double keywordCap;
    private final double confidenceFactor;
    private final double descriptionFactor;
    private final double perFeedBonus;
    private final double feedBonusCap;
    private final int maxKeywordReasons;

    private ScoringWeights(Builder builder) {
        this.categoryWeights = Map.copyOf(builder.categoryWeights);
        this.categoryFactor = builder.categoryFactor;
        this.perClaimBonus = builder.perClaimBonus;
        this.claimBonusCap = builder.claimBonusCap;
        this.highSignalWeight = builder.highSignalWeight;
        this.mediumSignalWeight = builder.mediumSignalWeight;
        this.lowSignalWeight = builder.lowSignalWeight;
        this.keywordCap = builder.keywordCap;
        this.confidenceFactor = builder.confidenceFactor;
        this.descriptionFactor = builder.descriptionFactor;
        this.perFeedBonus = builder.perFeedBonus;
        this.feedBonusCap = builder.feedBonusCap;
        this.maxKeywordReasons = builder.maxKeywordReasons;
    }

    /**
     * Weight of a category before {@link #getCategoryFactor()} is applied.
     * Categories without an explicit weight use the weight of {@link Category#OTHER}.
     */
    public double categoryWeight(Category category) {
        Category key = category != null ? category : Category.OTHER;
        Double weight = categoryWeights.get(key);
        if (weight != null) {
            return weight;
        }
        return categoryWeights.getOrDefault(Category.OTHER, 0.0);
    }

    public double getCategoryFactor() {
        return categoryFactor;
    }

    public double getPerClaimBonus() {
        return perClaimBonus;
    }

    public double getClaimBonusCap() {
        return claimBonusCap;
    }

    public double getHighSignalWeight() {
        return highSignalWeight;
    }

    public double getMediumSignalWeight() {
        return mediumSignalWeight;
    }

    public double getLowSignalWeight() {
        return lowSignalWeight;
    }

    public double getKeywordCap() {
        return keywordCap;
    }

    public double getConfidenceFactor() {
        return confidenceFactor;
    }

    public double getDescriptionFactor() {
        return descriptionFactor;
    }

    public double getPerFeedBonus() {
        return perFeedBonus;
    }

    public double getFeedBonusCap() {
        return feedBonusCap;
    }

    public int getMaxKeywordReasons() {
        return maxKeywordReasons;
    }

    public static ScoringWeights defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<Category, Double> categoryWeights = new EnumMap<>(Category.class);
        private double categoryFactor = 0.3;
        private double perClaimBonus = 0.05;
        private double claimBonusCap = 0.2;
        private double highSignalWeight = 0.15;
        private double mediumSignalWeight = 0.08;
        private double lowSignalWeight = 0.03;
        private double keywordCap = 0.4;
        private double confidenceFactor = 0.15;
        private double descriptionFactor = 0.5;
        private double perFeedBonus = 0.05;
        private double feedBonusCap = 0.15;
        private int maxKeywordReasons = 3;

        private Builder() {
            categoryWeights.put(Category.PROSPECTING, 1.0);
            categoryWeights.put(Category.OUTREACH, 1.0);
            categoryWeights.put(Category.ENRICHMENT, 0.9);
            categoryWeights.put(Category.CONVERSATION, 0.8);
            categoryWeights.put(Category.CRM, 0.7);
            categoryWeights.put(Category.SCHEDULING, 0.6);
            categoryWeights.put(Category.ANALYTICS, 0.5);
            categoryWeights.put(Category.COACHING, 0.5);
            categoryWeights.put(Category.OTHER, 0.3);
        }

        public Builder categoryWeight(Category category, double weight) {
            validateNonNegative("category weight", weight);
            categoryWeights.put(category, weight);
            return this;
        }

        public Builder categoryFactor(double categoryFactor) {
            validateNonNegative("categoryFactor", categoryFactor);
            this.categoryFactor = categoryFactor;
            return this;
        }

        public Builder perClaimBonus(double perClaimBonus) {
            validateNonNegative("perClaimBonus", perClaimBonus);
            this.perClaimBonus = perClaimBonus;
            return this;
        }

        public Builder claimBonusCap(double claimBonusCap) {
            validateNonNegative("claimBonusCap", claimBonusCap);
            this.claimBonusCap = claimBonusCap;
            return this;
        }

        public Builder signalWeights(double high, double medium, double low) {
            validateNonNegative("high signal weight", high);
            validateNonNegative("medium signal weight", medium);
            validateNonNegative("low signal weight", low);
            this.highSignalWeight = high;
            this.mediumSignalWeight = medium;
            this.lowSignalWeight = low;
            return this;
        }

        public Builder keywordCap(double keywordCap) {
            validateNonNegative("keywordCap", keywordCap);
            this.keywordCap = keywordCap;
            return this;
        }

        public Builder confidenceFactor(double confidenceFactor) {
            validateNonNegative("confidenceFactor", confidenceFactor);
            this.confidenceFactor = confidenceFactor;
            return this;
        }

        public Builder descriptionFactor(double descriptionFactor) {
            validateNonNegative("descriptionFactor", descriptionFactor);
            this.descriptionFactor = descriptionFactor;
            return this;
        }

        public Builder perFeedBonus(double perFeedBonus) {
            validateNonNegative("perFeedBonus", perFeedBonus);
            this.perFeedBonus = perFeedBonus;
            return this;
        }

        public Builder feedBonusCap(double feedBonusCap) {
            validateNonNegative("feedBonusCap", feedBonusCap);
            this.feedBonusCap = feedBonusCap;
            return this;
        }

        public Builder maxKeywordReasons(int maxKeywordReasons) {
            if (maxKeywordReasons < 0) {
                throw new IllegalArgumentException("maxKeywordReasons must be >= 0");
            }
            this.maxKeywordReasons = maxKeywordReasons;
            return this;
        }

        public ScoringWeights build() {
            return new ScoringWeights(this);
        }

        private static void validateNonNegative(String name, double value) {
            if (Double.isNaN(value) || value < 0.0) {
                throw new IllegalArgumentException(name + " must be >= 0, got " + value);
            }
        }
    }
}
