package com.product.curation.tracker;

import com.product.curation.core.model.DetectedChange;

import java.util.List;

/**
 * Outcome of checking every approved candidate.
 *
 * @param checked     approved candidates processed, including failed ones
 * @param changes     changes detected, grouped by candidate in candidate id order
 * @param failures    candidates whose page could not be fetched or parsed
 * @param interrupted whether the pass stopped early on thread interruption
 */
public record UpdateCheckResult(int checked, List<DetectedChange> changes, List<FetchFailure> failures,
                                boolean interrupted) {

    public UpdateCheckResult {
        changes = changes != null ? List.copyOf(changes) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public int changesDetected() {
        return changes.size();
    }
}
