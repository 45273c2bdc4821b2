package com.product.curation.curation;

import java.util.List;

/**
 * Counters reported by one curation pass.
 *
 * @param scored           analyzing candidates scored
 * @param promoted         candidates moved to review
 * @param belowThreshold   scored candidates below the minimum relevance
 * @param duplicatesFound  duplicates detected by the dedup step
 * @param duplicatesMerged duplicates merged away by the dedup step
 * @param minScore         lowest score of the pass, 0 when nothing was scored
 * @param maxScore         highest score of the pass, 0 when nothing was scored
 * @param avgScore         mean score of the pass, 0 when nothing was scored
 * @param interrupted      whether the pass stopped early on thread interruption
 */
public record CurationSummary(
        int scored,
        int promoted,
        int belowThreshold,
        int duplicatesFound,
        int duplicatesMerged,
        double minScore,
        double maxScore,
        double avgScore,
        boolean interrupted
) {

    /**
     * Summary of a pass that found no analyzing candidates.
     */
    public static CurationSummary nothingToScore(int duplicatesFound, int duplicatesMerged) {
        return new CurationSummary(0, 0, 0, duplicatesFound, duplicatesMerged, 0.0, 0.0, 0.0, false);
    }

    static CurationSummary of(List<Double> scores, int promoted, int belowThreshold,
                              int duplicatesFound, int duplicatesMerged, boolean interrupted) {
        double min = scores.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double avg = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new CurationSummary(scores.size(), promoted, belowThreshold, duplicatesFound, duplicatesMerged,
                min, max, avg, interrupted);
    }
}
