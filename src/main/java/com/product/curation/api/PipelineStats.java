package com.product.curation.api;

import com.product.curation.core.model.CandidateStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of the pipeline: candidate counts per stage plus intake backlog and store totals.
 *
 * @param countsByStatus      candidates per status, every status present
 * @param unprocessedMentions raw mentions still waiting for extraction
 * @param totalClaims         claims across all candidates
 * @param totalFeeds          registered feeds
 */
public record PipelineStats(Map<CandidateStatus, Long> countsByStatus, long unprocessedMentions,
                            long totalClaims, long totalFeeds) {

    public PipelineStats {
        EnumMap<CandidateStatus, Long> complete = new EnumMap<>(CandidateStatus.class);
        for (CandidateStatus status : CandidateStatus.values()) {
            complete.put(status, countsByStatus != null ? countsByStatus.getOrDefault(status, 0L) : 0L);
        }
        countsByStatus = Map.copyOf(complete);
    }

    public long count(CandidateStatus status) {
        return countsByStatus.get(status);
    }

    public long total() {
        return countsByStatus.values().stream().mapToLong(Long::longValue).sum();
    }
}
