package com.product.curation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A discovered product moving through the curation pipeline.
 * Instances are immutable snapshots of the stored row; use {@link #builder(Candidate)}
 * to derive a modified copy.
 */
public class Candidate {
    private final long id;
    private final String name;
    private final String url;
    private final String description;
    private final Category category;
    private final CandidateStatus status;
    private final Double relevanceScore;
    private final String rejectionReason;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant reviewedAt;

    private Candidate(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Candidate name must not be null or blank");
        }
        if (builder.relevanceScore != null
                && (builder.relevanceScore.isNaN() || builder.relevanceScore < 0.0 || builder.relevanceScore > 1.0)) {
            throw new IllegalArgumentException("relevanceScore must be in [0, 1], got " + builder.relevanceScore);
        }
        this.id = builder.id;
        this.name = builder.name;
        this.url = builder.url;
        this.description = builder.description;
        this.category = builder.category != null ? builder.category : Category.OTHER;
        this.status = builder.status != null ? builder.status : CandidateStatus.INBOX;
        this.relevanceScore = builder.relevanceScore;
        this.rejectionReason = builder.rejectionReason;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.reviewedAt = builder.reviewedAt;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public String getDescription() {
        return description;
    }

    public Category getCategory() {
        return category;
    }

    public CandidateStatus getStatus() {
        return status;
    }

    /**
     * Last computed relevance, or {@code null} if the candidate was never scored.
     */
    public Double getRelevanceScore() {
        return relevanceScore;
    }

    public String getRejectionReason() {
        return rejectionReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Candidate candidate = (Candidate) o;
        return id == candidate.id
                && Objects.equals(name, candidate.name)
                && Objects.equals(url, candidate.url)
                && Objects.equals(description, candidate.description)
                && category == candidate.category
                && status == candidate.status
                && Objects.equals(relevanceScore, candidate.relevanceScore)
                && Objects.equals(rejectionReason, candidate.rejectionReason)
                && Objects.equals(reviewedAt, candidate.reviewedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, url, status);
    }

    @Override
    public String toString() {
        return "Candidate{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", url='" + url + '\'' +
                ", category=" + category +
                ", status=" + status +
                ", relevanceScore=" + relevanceScore +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Candidate candidate) {
        return new Builder()
                .id(candidate.id)
                .name(candidate.name)
                .url(candidate.url)
                .description(candidate.description)
                .category(candidate.category)
                .status(candidate.status)
                .relevanceScore(candidate.relevanceScore)
                .rejectionReason(candidate.rejectionReason)
                .createdAt(candidate.createdAt)
                .updatedAt(candidate.updatedAt)
                .reviewedAt(candidate.reviewedAt);
    }

    public static class Builder {
        private long id;
        private String name;
        private String url;
        private String description;
        private Category category;
        private CandidateStatus status;
        private Double relevanceScore;
        private String rejectionReason;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant reviewedAt;

        /**
         * Identifier; leave at 0 for drafts handed to the store, which assigns one.
         */
        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(Category category) {
            this.category = category;
            return this;
        }

        public Builder status(CandidateStatus status) {
            this.status = status;
            return this;
        }

        public Builder relevanceScore(Double relevanceScore) {
            this.relevanceScore = relevanceScore;
            return this;
        }

        public Builder rejectionReason(String rejectionReason) {
            this.rejectionReason = rejectionReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Candidate build() {
            return new Candidate(this);
        }
    }
}
