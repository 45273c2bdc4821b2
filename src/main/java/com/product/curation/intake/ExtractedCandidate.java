package com.product.curation.intake;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A product the extraction step found in a raw mention.
 *
 * @param category taxonomy wire name; unknown values fall back to "other"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedCandidate(
        @JsonProperty("name") String name,
        @JsonProperty("url") String url,
        @JsonProperty("description") String description,
        @JsonProperty("category") String category
) {
}
