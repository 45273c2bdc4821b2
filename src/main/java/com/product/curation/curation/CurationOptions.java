package com.product.curation.curation;

import java.time.Duration;

/**
 * Defaults and tuning for curation passes.
 */
public class CurationOptions {

    private static final double DEFAULT_MIN_RELEVANCE = 0.3;
    private static final int DEFAULT_MAX_REVIEW_QUEUE = 50;
    private static final double DEFAULT_NAME_THRESHOLD = 0.85;
    private static final double DEFAULT_URL_THRESHOLD = 0.9;
    private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final double minRelevance;
    private final boolean autoMerge;
    private final int maxReviewQueue;
    private final double nameThreshold;
    private final double urlThreshold;
    private final Duration lockTimeout;

    private CurationOptions(Builder builder) {
        this.minRelevance = builder.minRelevance;
        this.autoMerge = builder.autoMerge;
        this.maxReviewQueue = builder.maxReviewQueue;
        this.nameThreshold = builder.nameThreshold;
        this.urlThreshold = builder.urlThreshold;
        this.lockTimeout = builder.lockTimeout;
    }

    public double getMinRelevance() {
        return minRelevance;
    }

    public boolean isAutoMerge() {
        return autoMerge;
    }

    public int getMaxReviewQueue() {
        return maxReviewQueue;
    }

    public double getNameThreshold() {
        return nameThreshold;
    }

    public double getUrlThreshold() {
        return urlThreshold;
    }

    /**
     * How long a pass waits for a concurrent pass of the same kind to finish.
     */
    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public static CurationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double minRelevance = DEFAULT_MIN_RELEVANCE;
        private boolean autoMerge = true;
        private int maxReviewQueue = DEFAULT_MAX_REVIEW_QUEUE;
        private double nameThreshold = DEFAULT_NAME_THRESHOLD;
        private double urlThreshold = DEFAULT_URL_THRESHOLD;
        private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;

        public Builder minRelevance(double minRelevance) {
            validateUnitInterval("minRelevance", minRelevance);
            this.minRelevance = minRelevance;
            return this;
        }

        public Builder autoMerge(boolean autoMerge) {
            this.autoMerge = autoMerge;
            return this;
        }

        public Builder maxReviewQueue(int maxReviewQueue) {
            if (maxReviewQueue < 0) {
                throw new IllegalArgumentException("maxReviewQueue must be >= 0, got " + maxReviewQueue);
            }
            this.maxReviewQueue = maxReviewQueue;
            return this;
        }

        public Builder nameThreshold(double nameThreshold) {
            validateUnitInterval("nameThreshold", nameThreshold);
            this.nameThreshold = nameThreshold;
            return this;
        }

        public Builder urlThreshold(double urlThreshold) {
            validateUnitInterval("urlThreshold", urlThreshold);
            this.urlThreshold = urlThreshold;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
                throw new IllegalArgumentException("lockTimeout must be positive");
            }
            this.lockTimeout = lockTimeout;
            return this;
        }

        public CurationOptions build() {
            return new CurationOptions(this);
        }

        static void validateUnitInterval(String name, double value) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
            }
        }
    }
}
