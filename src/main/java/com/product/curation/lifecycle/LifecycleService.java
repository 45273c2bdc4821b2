package com.product.curation.lifecycle;

import com.product.curation.api.Page;
import com.product.curation.api.PageRequest;
import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.ChangeType;
import com.product.curation.metrics.CurationMetrics;
import com.product.curation.metrics.NoOpCurationMetrics;
import com.product.curation.store.CandidateNotFoundException;
import com.product.curation.store.CandidateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the status field of candidates and the side effects of entering each status.
 *
 * <p>Any valid status may be entered from any other; the conventional flow is
 * inbox → analyzing → review → approved or rejected. Side effects:</p>
 * <ul>
 *   <li>approved or rejected stamps the review timestamp</li>
 *   <li>rejected stores the optional rejection reason; every other status clears it</li>
 *   <li>approved appends a {@link ChangeType#NEW} changelog entry, which makes the
 *       candidate visible to the update tracker</li>
 * </ul>
 */
public class LifecycleService {
    private static final Logger log = LoggerFactory.getLogger(LifecycleService.class);

    private static final Comparator<Candidate> REVIEW_ORDER = Comparator
            .comparing((Candidate c) -> c.getRelevanceScore() != null ? c.getRelevanceScore() : -1.0)
            .reversed()
            .thenComparing(Candidate::getCreatedAt, Comparator.reverseOrder())
            .thenComparing(Comparator.comparingLong(Candidate::getId).reversed());

    private final CandidateStore store;
    private final CurationMetrics metrics;

    public LifecycleService(CandidateStore store) {
        this(store, new NoOpCurationMetrics());
    }

    public LifecycleService(CandidateStore store, CurationMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Moves a candidate to the status named by {@code status}.
     *
     * @throws IllegalArgumentException   if the status name is not valid
     * @throws CandidateNotFoundException if the candidate does not exist
     */
    public Candidate setStatus(long candidateId, String status, String reason) {
        return setStatus(candidateId, CandidateStatus.fromWireName(status), reason);
    }

    public Candidate setStatus(long candidateId, CandidateStatus status, String reason) {
        Objects.requireNonNull(status, "status is required");
        Candidate current = store.getCandidate(candidateId)
                .orElseThrow(() -> new CandidateNotFoundException(candidateId));

        Instant reviewedAt = status.isDecision() ? Instant.now() : current.getReviewedAt();
        String rejectionReason = status == CandidateStatus.REJECTED ? blankToNull(reason) : null;
        Candidate updated = store.setStatus(candidateId, status, rejectionReason, reviewedAt);

        if (status == CandidateStatus.APPROVED) {
            store.appendChangeEvent(candidateId, ChangeType.NEW,
                    "Candidate approved: " + updated.getName(), updated.getUrl());
        }
        metrics.incrementStatusTransition(status);
        log.info("lifecycle.transition candidateId={} from={} to={}",
                candidateId, current.getStatus().wireName(), status.wireName());
        return updated;
    }

    public Candidate approve(long candidateId) {
        return setStatus(candidateId, CandidateStatus.APPROVED, null);
    }

    public Candidate reject(long candidateId, String reason) {
        return setStatus(candidateId, CandidateStatus.REJECTED, reason);
    }

    /**
     * Promotes an analyzing candidate to review. A candidate that left analyzing or
     * disappeared since it was read is left alone.
     *
     * @return the promoted candidate, or empty if it was skipped
     */
    public Optional<Candidate> promoteToReview(long candidateId) {
        Optional<Candidate> current = store.getCandidate(candidateId);
        if (current.isEmpty()) {
            log.warn("lifecycle.promote.skipped candidateId={} reason=missing", candidateId);
            return Optional.empty();
        }
        if (current.get().getStatus() != CandidateStatus.ANALYZING) {
            log.info("lifecycle.promote.skipped candidateId={} status={}",
                    candidateId, current.get().getStatus().wireName());
            return Optional.empty();
        }
        return Optional.of(setStatus(candidateId, CandidateStatus.REVIEW, null));
    }

    /**
     * Candidates awaiting a human decision, highest relevance first; equal scores newest first.
     */
    public Page<Candidate> pendingReview(PageRequest request) {
        List<Candidate> pending = store.listCandidatesByStatus(CandidateStatus.REVIEW).stream()
                .sorted(REVIEW_ORDER)
                .toList();
        return Page.slice(pending, request);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
