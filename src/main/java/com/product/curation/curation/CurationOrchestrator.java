package com.product.curation.curation;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.lifecycle.LifecycleService;
import com.product.curation.lock.PassLock;
import com.product.curation.logging.LogContext;
import com.product.curation.merge.DeduplicationResult;
import com.product.curation.merge.DuplicateDetector;
import com.product.curation.merge.DuplicateGroup;
import com.product.curation.merge.DuplicateMerger;
import com.product.curation.merge.GroupMergeResult;
import com.product.curation.metrics.CurationMetrics;
import com.product.curation.scoring.RelevanceScorer;
import com.product.curation.scoring.ScoringResult;
import com.product.curation.store.CandidateStore;
import com.product.curation.tracing.Span;
import com.product.curation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a curation pass: deduplicate, score every analyzing candidate, then promote the best
 * ones into review without letting the review queue grow past its capacity.
 *
 * <p>Passes are serialized through a {@link PassLock}. A pass checks for thread interruption
 * between candidates; an interrupted pass keeps the scores it already stored, promotes
 * nothing further and reports {@code interrupted=true}.</p>
 */
public class CurationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CurationOrchestrator.class);

    static final String PASS_NAME = "curation";

    private final CandidateStore store;
    private final DuplicateDetector detector;
    private final DuplicateMerger merger;
    private final RelevanceScorer scorer;
    private final LifecycleService lifecycle;
    private final CurationMetrics metrics;
    private final TracingService tracing;
    private final PassLock passLock;

    public CurationOrchestrator(CandidateStore store, DuplicateDetector detector, DuplicateMerger merger,
                                RelevanceScorer scorer, LifecycleService lifecycle, CurationMetrics metrics,
                                TracingService tracing, PassLock passLock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.detector = Objects.requireNonNull(detector, "detector is required");
        this.merger = Objects.requireNonNull(merger, "merger is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracing = Objects.requireNonNull(tracing, "tracing is required");
        this.passLock = Objects.requireNonNull(passLock, "passLock is required");
    }

    /**
     * Runs one curation pass.
     *
     * @param minRelevance   lowest score that qualifies for review, in [0, 1]
     * @param autoMerge      whether detected duplicate groups are merged
     * @param maxReviewQueue capacity of the review stage, at least 0
     * @throws IllegalArgumentException if an argument is out of range
     */
    public CurationSummary curate(double minRelevance, boolean autoMerge, int maxReviewQueue) {
        CurationOptions.Builder.validateUnitInterval("minRelevance", minRelevance);
        if (maxReviewQueue < 0) {
            throw new IllegalArgumentException("maxReviewQueue must be >= 0, got " + maxReviewQueue);
        }

        String passId = LogContext.generatePassId();
        long start = System.nanoTime();
        passLock.acquire(PASS_NAME);
        try (LogContext ctx = LogContext.forCuration(passId);
             Span span = tracing.startSpan("curation.run", Map.of(
                     "minRelevance", Double.toString(minRelevance),
                     "autoMerge", Boolean.toString(autoMerge),
                     "maxReviewQueue", Integer.toString(maxReviewQueue)))) {
            log.info("curation.starting minRelevance={} autoMerge={} maxReviewQueue={}",
                    minRelevance, autoMerge, maxReviewQueue);
            try {
                CurationSummary summary = runPass(passId, minRelevance, autoMerge, maxReviewQueue);
                span.setAttribute("scored", summary.scored());
                span.setAttribute("promoted", summary.promoted());
                span.markOk();
                log.info("curation.completed scored={} promoted={} belowThreshold={} duplicatesFound={} "
                                + "duplicatesMerged={} interrupted={}",
                        summary.scored(), summary.promoted(), summary.belowThreshold(),
                        summary.duplicatesFound(), summary.duplicatesMerged(), summary.interrupted());
                return summary;
            } catch (RuntimeException e) {
                span.markError(e);
                log.error("curation.failed error={}", e.getMessage());
                throw e;
            }
        } finally {
            passLock.release(PASS_NAME);
            metrics.recordPassDuration(PASS_NAME, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Detects duplicate groups and, when {@code merge} is set, merges each of them.
     * Merging takes the curation pass lock so it never overlaps a running pass.
     *
     * @throws com.product.curation.lock.PassLockException if merging and the lock is not acquired in time
     */
    public DeduplicationResult deduplicate(boolean merge) {
        String passId = LogContext.generatePassId();
        if (!merge) {
            return deduplicate(false, passId);
        }
        passLock.acquire(PASS_NAME);
        try (LogContext ctx = LogContext.forCuration(passId)) {
            return deduplicate(true, passId);
        } finally {
            passLock.release(PASS_NAME);
        }
    }

    private DeduplicationResult deduplicate(boolean merge, String passId) {
        List<DuplicateGroup> groups = detector.detect();
        if (!merge || groups.isEmpty()) {
            return DeduplicationResult.detected(groups);
        }
        List<GroupMergeResult> results = merger.mergeAll(groups, passId);
        DeduplicationResult result = DeduplicationResult.merged(groups, results);
        if (!result.failedMerges().isEmpty()) {
            log.warn("dedup.partial groups={} failedGroups={}", groups.size(), result.failedMerges().size());
        }
        return result;
    }

    private CurationSummary runPass(String passId, double minRelevance, boolean autoMerge, int maxReviewQueue) {
        DeduplicationResult dedup = deduplicate(autoMerge, passId);

        List<Candidate> analyzing = store.listCandidatesByStatus(CandidateStatus.ANALYZING);
        if (analyzing.isEmpty()) {
            log.info("curation.empty duplicatesFound={} duplicatesMerged={}",
                    dedup.duplicatesFound(), dedup.merged());
            return CurationSummary.nothingToScore(dedup.duplicatesFound(), dedup.merged());
        }

        List<ScoringResult> results = new ArrayList<>(analyzing.size());
        boolean interrupted = false;
        for (Candidate candidate : analyzing) {
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }
            ScoringResult result = scorer.score(candidate, store.listClaims(candidate.getId()));
            store.setScore(candidate.getId(), result.score());
            metrics.recordRelevanceScore(result.score());
            results.add(result);
        }
        List<Double> scores = results.stream().map(ScoringResult::score).toList();

        if (interrupted) {
            log.warn("curation.interrupted scored={} of={}", results.size(), analyzing.size());
            int below = (int) scores.stream().filter(s -> s < minRelevance).count();
            return CurationSummary.of(scores, 0, below, dedup.duplicatesFound(), dedup.merged(), true);
        }

        long inReview = store.countByStatus(CandidateStatus.REVIEW);
        long available = Math.max(0, maxReviewQueue - inReview);
        log.debug("curation.capacity inReview={} available={}", inReview, available);

        // List.sort is stable, so equal scores keep fetch order.
        List<ScoringResult> ranked = new ArrayList<>(results);
        ranked.sort(Comparator.comparingDouble(ScoringResult::score).reversed());

        int promoted = 0;
        int belowThreshold = 0;
        for (ScoringResult result : ranked) {
            if (result.score() < minRelevance) {
                belowThreshold++;
                continue;
            }
            if (promoted >= available) {
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }
            if (lifecycle.promoteToReview(result.candidateId()).isPresent()) {
                promoted++;
            }
        }
        if (interrupted) {
            belowThreshold = (int) scores.stream().filter(s -> s < minRelevance).count();
        }
        metrics.incrementPromoted(promoted);
        return CurationSummary.of(scores, promoted, belowThreshold,
                dedup.duplicatesFound(), dedup.merged(), interrupted);
    }
}
