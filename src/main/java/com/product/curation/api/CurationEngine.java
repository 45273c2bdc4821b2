package com.product.curation.api;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.ChangeEvent;
import com.product.curation.core.model.DetectedChange;
import com.product.curation.curation.CurationOptions;
import com.product.curation.curation.CurationOrchestrator;
import com.product.curation.curation.CurationSummary;
import com.product.curation.intake.CandidateIntake;
import com.product.curation.intake.ExtractionResult;
import com.product.curation.intake.ImportResult;
import com.product.curation.intake.IntakeResult;
import com.product.curation.intake.JsonExtractionImporter;
import com.product.curation.intake.ProgressCallback;
import com.product.curation.lifecycle.LifecycleService;
import com.product.curation.lock.LocalPassLock;
import com.product.curation.lock.PassLock;
import com.product.curation.merge.DeduplicationResult;
import com.product.curation.merge.DuplicateDetector;
import com.product.curation.merge.DuplicateMerger;
import com.product.curation.metrics.CurationMetrics;
import com.product.curation.metrics.NoOpCurationMetrics;
import com.product.curation.rules.DefaultNormalizationRules;
import com.product.curation.rules.NormalizationEngine;
import com.product.curation.scoring.KeywordSignals;
import com.product.curation.scoring.RelevanceScorer;
import com.product.curation.scoring.ScoringResult;
import com.product.curation.scoring.ScoringWeights;
import com.product.curation.similarity.SequenceMatcherSimilarity;
import com.product.curation.store.CandidateStore;
import com.product.curation.tracing.NoOpTracingService;
import com.product.curation.tracing.TracingService;
import com.product.curation.tracker.HttpPageFetcher;
import com.product.curation.tracker.PageFetcher;
import com.product.curation.tracker.TrackerOptions;
import com.product.curation.tracker.UpdateCheckResult;
import com.product.curation.tracker.UpdateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the curation engine. Wires the scorer, the duplicate detector and merger,
 * the curation orchestrator, the lifecycle and the update tracker around one
 * {@link CandidateStore}.
 *
 * <pre>
 * CurationEngine engine = CurationEngine.builder()
 *     .store(new InMemoryCandidateStore())
 *     .curationOptions(CurationOptions.builder().maxReviewQueue(20).build())
 *     .build();
 *
 * CurationSummary summary = engine.runCuration();
 * engine.setStatus(candidateId, "approved", null);
 * UpdateCheckResult changes = engine.runUpdateCheck();
 * </pre>
 */
public class CurationEngine {
    private static final Logger log = LoggerFactory.getLogger(CurationEngine.class);

    private final CandidateStore store;
    private final CurationOptions options;
    private final RelevanceScorer scorer;
    private final LifecycleService lifecycle;
    private final CurationOrchestrator orchestrator;
    private final UpdateTracker tracker;
    private final CandidateIntake intake;

    private CurationEngine(Builder builder) {
        this.store = builder.store;
        this.options = builder.curationOptions;
        CurationMetrics metrics = builder.metrics != null ? builder.metrics : new NoOpCurationMetrics();
        TracingService tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();
        PassLock passLock = builder.passLock != null ? builder.passLock : new LocalPassLock(options.getLockTimeout());
        NormalizationEngine normalizer = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        TrackerOptions trackerOptions = builder.trackerOptions;
        PageFetcher fetcher = builder.pageFetcher != null
                ? builder.pageFetcher
                : HttpPageFetcher.builder()
                        .timeout(trackerOptions.fetchTimeout())
                        .userAgent(trackerOptions.userAgent())
                        .build();

        this.scorer = new RelevanceScorer(store, builder.scoringWeights, builder.keywordSignals);
        this.lifecycle = new LifecycleService(store, metrics);
        DuplicateDetector detector = new DuplicateDetector(store, normalizer, new SequenceMatcherSimilarity(),
                options.getNameThreshold(), options.getUrlThreshold());
        DuplicateMerger merger = new DuplicateMerger(store, metrics);
        this.orchestrator = new CurationOrchestrator(store, detector, merger, scorer, lifecycle,
                metrics, tracing, passLock);
        this.tracker = new UpdateTracker(store, fetcher, trackerOptions, metrics, tracing, passLock);
        this.intake = new CandidateIntake(store);
    }

    /**
     * Scores one candidate and stores the score.
     *
     * @throws com.product.curation.store.CandidateNotFoundException if the candidate does not exist
     */
    public ScoringResult scoreCandidate(long candidateId) {
        ScoringResult result = scorer.score(candidateId);
        store.setScore(candidateId, result.score());
        return result;
    }

    public CurationSummary runCuration(double minRelevance, boolean autoMerge, int maxReviewQueue) {
        return orchestrator.curate(minRelevance, autoMerge, maxReviewQueue);
    }

    /**
     * Runs curation with the configured defaults.
     */
    public CurationSummary runCuration() {
        return runCuration(options.getMinRelevance(), options.isAutoMerge(), options.getMaxReviewQueue());
    }

    /**
     * Scans for duplicates; with {@code merge} set, merges them under the curation pass lock.
     */
    public DeduplicationResult deduplicate(boolean merge) {
        return orchestrator.deduplicate(merge);
    }

    /**
     * Sets a candidate's status by wire name ("approved", "rejected", ...).
     *
     * @throws IllegalArgumentException if the status is not valid
     * @throws com.product.curation.store.CandidateNotFoundException if the candidate does not exist
     */
    public Candidate setStatus(long candidateId, String status, String reason) {
        return lifecycle.setStatus(candidateId, status, reason);
    }

    public Candidate setStatus(long candidateId, CandidateStatus status, String reason) {
        return lifecycle.setStatus(candidateId, status, reason);
    }

    /**
     * Checks every approved candidate's page and appends each detected change to the changelog.
     */
    public UpdateCheckResult runUpdateCheck() {
        UpdateCheckResult result = tracker.checkAllApproved();
        for (DetectedChange change : result.changes()) {
            store.appendChangeEvent(change.candidateId(), change.changeType(),
                    change.description(), change.sourceUrl());
        }
        log.info("tracker.recorded changes={}", result.changesDetected());
        return result;
    }

    public Page<Candidate> pendingReview(PageRequest request) {
        return lifecycle.pendingReview(request);
    }

    /**
     * Changelog entries of the last {@code days} days, newest first.
     */
    public List<ChangeEvent> recentChanges(int days, int limit) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0");
        }
        return store.listChangeEventsSince(Instant.now().minus(Duration.ofDays(days)), limit);
    }

    public List<ChangeEvent> changelog(long candidateId) {
        return store.listChangeEvents(candidateId);
    }

    public PipelineStats pipelineStats() {
        Map<CandidateStatus, Long> counts = new EnumMap<>(CandidateStatus.class);
        for (CandidateStatus status : CandidateStatus.values()) {
            counts.put(status, store.countByStatus(status));
        }
        return new PipelineStats(counts, store.countUnprocessedMentions(), store.countClaims(), store.countFeeds());
    }

    public IntakeResult ingest(ExtractionResult result) {
        return intake.ingest(result);
    }

    public ImportResult importExtractions(Reader reader, ProgressCallback callback) {
        return new JsonExtractionImporter(intake).importResults(reader, callback);
    }

    public CandidateStore getStore() {
        return store;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CandidateStore store;
        private CurationOptions curationOptions = CurationOptions.defaults();
        private TrackerOptions trackerOptions = TrackerOptions.defaults();
        private ScoringWeights scoringWeights = ScoringWeights.defaults();
        private KeywordSignals keywordSignals = KeywordSignals.defaults();
        private NormalizationEngine normalizationEngine;
        private PageFetcher pageFetcher;
        private CurationMetrics metrics;
        private TracingService tracing;
        private PassLock passLock;

        public Builder store(CandidateStore store) {
            this.store = store;
            return this;
        }

        public Builder curationOptions(CurationOptions curationOptions) {
            this.curationOptions = curationOptions;
            return this;
        }

        public Builder trackerOptions(TrackerOptions trackerOptions) {
            this.trackerOptions = trackerOptions;
            return this;
        }

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder keywordSignals(KeywordSignals keywordSignals) {
            this.keywordSignals = keywordSignals;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder pageFetcher(PageFetcher pageFetcher) {
            this.pageFetcher = pageFetcher;
            return this;
        }

        public Builder metrics(CurationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder passLock(PassLock passLock) {
            this.passLock = passLock;
            return this;
        }

        public CurationEngine build() {
            Objects.requireNonNull(store, "store is required");
            Objects.requireNonNull(curationOptions, "curationOptions are required");
            Objects.requireNonNull(trackerOptions, "trackerOptions are required");
            Objects.requireNonNull(scoringWeights, "scoringWeights are required");
            Objects.requireNonNull(keywordSignals, "keywordSignals are required");
            return new CurationEngine(this);
        }
    }
}
