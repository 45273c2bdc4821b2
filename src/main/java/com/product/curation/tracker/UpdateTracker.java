package com.product.curation.tracker;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.DetectedChange;
import com.product.curation.core.model.Snapshot;
import com.product.curation.lock.PassLock;
import com.product.curation.logging.LogContext;
import com.product.curation.metrics.CurationMetrics;
import com.product.curation.store.CandidateStore;
import com.product.curation.store.StoreException;
import com.product.curation.tracing.Span;
import com.product.curation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Re-checks the public pages of approved candidates and reports what changed.
 *
 * <p>Each check fetches the page, extracts a {@link PageSnapshot}, compares it with the latest
 * stored {@link Snapshot} and appends the new snapshot. The first check of a candidate only
 * establishes the baseline. A failed fetch writes nothing, so the previous snapshot stays the
 * baseline. Detected changes are returned, never written to the changelog here.</p>
 *
 * <p>Failures of one candidate never abort a pass; they are reported in
 * {@link UpdateCheckResult#failures()}. Only a fatal {@link StoreException} propagates.</p>
 */
public class UpdateTracker {
    private static final Logger log = LoggerFactory.getLogger(UpdateTracker.class);

    static final String PASS_NAME = "update-check";

    private final CandidateStore store;
    private final PageFetcher fetcher;
    private final PageParser parser;
    private final SnapshotComparator comparator;
    private final TrackerOptions options;
    private final CurationMetrics metrics;
    private final TracingService tracing;
    private final PassLock passLock;

    public UpdateTracker(CandidateStore store, PageFetcher fetcher, TrackerOptions options,
                         CurationMetrics metrics, TracingService tracing, PassLock passLock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.options = Objects.requireNonNull(options, "options are required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracing = Objects.requireNonNull(tracing, "tracing is required");
        this.passLock = Objects.requireNonNull(passLock, "passLock is required");
        this.parser = new PageParser();
        this.comparator = new SnapshotComparator();
    }

    /**
     * Checks one candidate. A failed fetch is logged and yields no changes.
     *
     * @return detected changes, empty on first observation, failure or a candidate without URL
     */
    public List<DetectedChange> check(Candidate candidate) {
        return inspect(candidate).changes();
    }

    /**
     * Checks every approved candidate, in id order unless parallelism is configured.
     */
    public UpdateCheckResult checkAllApproved() {
        String passId = LogContext.generatePassId();
        long start = System.nanoTime();
        passLock.acquire(PASS_NAME);
        try (LogContext ctx = LogContext.forUpdateCheck(passId);
             Span span = tracing.startSpan("tracker.check-all",
                     Map.of("parallelism", Integer.toString(options.parallelism())))) {
            List<Candidate> approved = store.listCandidatesByStatus(CandidateStatus.APPROVED);
            log.info("tracker.starting candidates={} parallelism={}", approved.size(), options.parallelism());
            try {
                UpdateCheckResult result = options.parallelism() > 1 && approved.size() > 1
                        ? checkConcurrently(approved)
                        : checkSequentially(approved);
                span.setAttribute("checked", result.checked());
                span.setAttribute("changes", result.changesDetected());
                span.markOk();
                log.info("tracker.completed checked={} changes={} failures={} interrupted={}",
                        result.checked(), result.changesDetected(), result.failures().size(), result.interrupted());
                return result;
            } catch (RuntimeException e) {
                span.markError(e);
                throw e;
            }
        } finally {
            passLock.release(PASS_NAME);
            metrics.recordPassDuration(PASS_NAME, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private UpdateCheckResult checkSequentially(List<Candidate> approved) {
        List<DetectedChange> changes = new ArrayList<>();
        List<FetchFailure> failures = new ArrayList<>();
        int checked = 0;
        for (Candidate candidate : approved) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("tracker.interrupted checked={} of={}", checked, approved.size());
                return new UpdateCheckResult(checked, changes, failures, true);
            }
            CandidateCheck outcome = inspect(candidate);
            changes.addAll(outcome.changes());
            outcome.failure().ifPresent(failures::add);
            checked++;
        }
        return new UpdateCheckResult(checked, changes, failures, false);
    }

    private UpdateCheckResult checkConcurrently(List<Candidate> approved) {
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(options.parallelism(), approved.size()));
        try {
            List<Future<CandidateCheck>> futures = new ArrayList<>(approved.size());
            for (Candidate candidate : approved) {
                futures.add(executor.submit(() -> inspect(candidate)));
            }
            List<DetectedChange> changes = new ArrayList<>();
            List<FetchFailure> failures = new ArrayList<>();
            int checked = 0;
            for (Future<CandidateCheck> future : futures) {
                try {
                    CandidateCheck outcome = future.get();
                    changes.addAll(outcome.changes());
                    outcome.failure().ifPresent(failures::add);
                    checked++;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("tracker.interrupted checked={} of={}", checked, approved.size());
                    return new UpdateCheckResult(checked, changes, failures, true);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    throw new IllegalStateException("Update check failed", cause);
                }
            }
            return new UpdateCheckResult(checked, changes, failures, false);
        } finally {
            executor.shutdownNow();
        }
    }

    private CandidateCheck inspect(Candidate candidate) {
        try (LogContext ctx = LogContext.forCandidate(candidate.getId())) {
            if (!candidate.hasUrl()) {
                log.debug("tracker.skipped candidateId={} reason=no-url", candidate.getId());
                return CandidateCheck.unchanged();
            }
            String url = candidate.getUrl();
            try {
                String html = fetcher.fetch(url);
                metrics.incrementPageFetch(true);
                PageSnapshot page = parser.parse(html);

                Optional<Snapshot> previous = store.getLatestSnapshot(candidate.getId());
                List<DetectedChange> changes = previous
                        .map(p -> comparator.compare(candidate, p, page))
                        .orElse(List.of());
                store.appendSnapshot(new Snapshot(candidate.getId(), url, page.title(), page.contentHash(),
                        page.pricingText(), page.featuresText(), Instant.now()));

                changes.forEach(c -> metrics.incrementChangeDetected(c.changeType()));
                if (previous.isEmpty()) {
                    log.info("tracker.baseline candidateId={} url={}", candidate.getId(), url);
                } else if (!changes.isEmpty()) {
                    log.info("tracker.changed candidateId={} changes={}", candidate.getId(), changes.size());
                }
                return new CandidateCheck(changes, Optional.empty());
            } catch (PageFetchException e) {
                metrics.incrementPageFetch(false);
                log.warn("tracker.fetch.failed candidateId={} url={} error={}", candidate.getId(), url, e.getMessage());
                return CandidateCheck.failed(candidate, e.getMessage());
            } catch (StoreException e) {
                if (e.isFatal()) {
                    throw e;
                }
                log.warn("tracker.store.failed candidateId={} error={}", candidate.getId(), e.getMessage());
                return CandidateCheck.failed(candidate, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("tracker.check.failed candidateId={} url={} error={}",
                        candidate.getId(), url, e.getMessage(), e);
                return CandidateCheck.failed(candidate, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    private record CandidateCheck(List<DetectedChange> changes, Optional<FetchFailure> failure) {

        static CandidateCheck unchanged() {
            return new CandidateCheck(List.of(), Optional.empty());
        }

        static CandidateCheck failed(Candidate candidate, String message) {
            return new CandidateCheck(List.of(),
                    Optional.of(new FetchFailure(candidate.getId(), candidate.getUrl(), message)));
        }
    }
}
