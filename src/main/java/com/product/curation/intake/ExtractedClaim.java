package com.product.curation.intake;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A claim the extraction step attributed to a product by name.
 *
 * @param candidateName name of the extracted candidate the claim belongs to, compared case-insensitively
 * @param confidence    extraction confidence; {@code null} means 0.5
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedClaim(
        @JsonProperty("candidate_name") String candidateName,
        @JsonProperty("claim_type") String claimType,
        @JsonProperty("content") String content,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("raw_text") String rawText
) {
}
