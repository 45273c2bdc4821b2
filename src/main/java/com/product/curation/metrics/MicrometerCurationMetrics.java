package com.product.curation.metrics;

import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.ChangeType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link CurationMetrics}.
 *
 * <p>Meters:</p>
 * <ul>
 *   <li>{@code curation.relevance.score}: DistributionSummary</li>
 *   <li>{@code curation.promoted}: Counter</li>
 *   <li>{@code curation.duplicates.merged}: Counter</li>
 *   <li>{@code curation.merge.failures}: Counter</li>
 *   <li>{@code curation.pass.duration}: Timer (tag: pass)</li>
 *   <li>{@code curation.status.transitions}: Counter (tag: status)</li>
 *   <li>{@code tracker.page.fetch}: Counter (tag: outcome)</li>
 *   <li>{@code tracker.changes.detected}: Counter (tag: changeType)</li>
 * </ul>
 */
public class MicrometerCurationMetrics implements CurationMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary relevanceSummary;
    private final Counter promotedCounter;
    private final Counter mergedCounter;
    private final Counter mergeFailureCounter;

    public MicrometerCurationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.relevanceSummary = DistributionSummary.builder("curation.relevance.score")
                .description("Relevance scores computed during curation")
                .register(registry);
        this.promotedCounter = Counter.builder("curation.promoted")
                .description("Candidates promoted to the review queue")
                .register(registry);
        this.mergedCounter = Counter.builder("curation.duplicates.merged")
                .description("Duplicate candidates folded into a canonical candidate")
                .register(registry);
        this.mergeFailureCounter = Counter.builder("curation.merge.failures")
                .description("Duplicate groups whose merge was rolled back")
                .register(registry);
    }

    @Override
    public void recordRelevanceScore(double score) {
        relevanceSummary.record(score);
    }

    @Override
    public void incrementPromoted(int count) {
        promotedCounter.increment(count);
    }

    @Override
    public void incrementDuplicatesMerged(int count) {
        mergedCounter.increment(count);
    }

    @Override
    public void incrementMergeFailure() {
        mergeFailureCounter.increment();
    }

    @Override
    public void recordPassDuration(String pass, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(pass, k ->
                Timer.builder("curation.pass.duration")
                        .description("Duration of curation and update-check passes")
                        .tag("pass", pass)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementStatusTransition(CandidateStatus to) {
        counter("status:" + to.name(), "curation.status.transitions", "status", to.wireName(),
                "Candidate status transitions").increment();
    }

    @Override
    public void incrementPageFetch(boolean success) {
        String outcome = success ? "success" : "failure";
        counter("fetch:" + outcome, "tracker.page.fetch", "outcome", outcome,
                "Candidate page fetches").increment();
    }

    @Override
    public void incrementChangeDetected(ChangeType type) {
        counter("change:" + type.name(), "tracker.changes.detected", "changeType", type.wireName(),
                "Changes detected on candidate pages").increment();
    }

    private Counter counter(String key, String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
