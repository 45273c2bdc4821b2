package com.product.curation.intake;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything the extraction step produced for one raw mention.
 *
 * <p>The feed is identified by {@code feedId}, or by {@code feedName} when no id is given
 * (an unknown name registers a new, unrated feed). {@code mentionId} is optional.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionResult(
        @JsonProperty("mention_id") Long mentionId,
        @JsonProperty("feed_id") Long feedId,
        @JsonProperty("feed_name") String feedName,
        @JsonProperty("candidates") List<ExtractedCandidate> candidates,
        @JsonProperty("claims") List<ExtractedClaim> claims
) {
    public ExtractionResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        claims = claims != null ? List.copyOf(claims) : List.of();
    }
}
