package com.product.curation.cdi;

import com.product.curation.api.CurationEngine;
import com.product.curation.curation.CurationOptions;
import com.product.curation.lifecycle.LifecycleService;
import com.product.curation.metrics.CurationMetrics;
import com.product.curation.metrics.MicrometerCurationMetrics;
import com.product.curation.metrics.NoOpCurationMetrics;
import com.product.curation.store.CandidateStore;
import com.product.curation.store.InMemoryCandidateStore;
import com.product.curation.tracker.TrackerOptions;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires the curation engine from MicroProfile Config properties.
 *
 * <pre>
 * product-curation.curation.min-relevance=0.3
 * product-curation.curation.max-review-queue=50
 * product-curation.tracker.fetch-timeout-seconds=30
 * </pre>
 *
 * <p>The candidate store defaults to {@link InMemoryCandidateStore}; applications with a
 * persistent store provide their own {@link CandidateStore} alternative. When a
 * {@link MeterRegistry} bean exists, metrics go to Micrometer.</p>
 */
@ApplicationScoped
public class CurationEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(CurationEngineProducer.class);

    // ── Curation ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "product-curation.curation.min-relevance", defaultValue = "0.3")
    double minRelevance;

    @Inject
    @ConfigProperty(name = "product-curation.curation.auto-merge", defaultValue = "true")
    boolean autoMerge;

    @Inject
    @ConfigProperty(name = "product-curation.curation.max-review-queue", defaultValue = "50")
    int maxReviewQueue;

    @Inject
    @ConfigProperty(name = "product-curation.curation.lock-timeout-millis", defaultValue = "5000")
    long lockTimeoutMillis;

    // ── Dedup ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "product-curation.dedup.name-threshold", defaultValue = "0.85")
    double nameThreshold;

    @Inject
    @ConfigProperty(name = "product-curation.dedup.url-threshold", defaultValue = "0.9")
    double urlThreshold;

    // ── Tracker ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "product-curation.tracker.fetch-timeout-seconds", defaultValue = "30")
    long fetchTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "product-curation.tracker.parallelism", defaultValue = "1")
    int trackerParallelism;

    @Inject
    @ConfigProperty(name = "product-curation.tracker.user-agent",
            defaultValue = "Mozilla/5.0 (compatible; product-curation/1.0; +update-tracker)")
    String userAgent;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "product-curation.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public CandidateStore candidateStore() {
        log.info("Producing in-memory CandidateStore");
        return new InMemoryCandidateStore();
    }

    @Produces
    @ApplicationScoped
    public CurationEngine curationEngine(CandidateStore store) {
        CurationOptions options = curationOptions();
        TrackerOptions trackerOptions = trackerOptions();
        log.info("Producing CurationEngine: minRelevance={} maxReviewQueue={} nameThreshold={} urlThreshold={} "
                        + "fetchTimeout={}s parallelism={}",
                options.getMinRelevance(), options.getMaxReviewQueue(), options.getNameThreshold(),
                options.getUrlThreshold(), trackerOptions.fetchTimeout().toSeconds(), trackerOptions.parallelism());
        return CurationEngine.builder()
                .store(store)
                .curationOptions(options)
                .trackerOptions(trackerOptions)
                .metrics(createMetrics())
                .build();
    }

    @Produces
    @ApplicationScoped
    public LifecycleService lifecycleService(CandidateStore store) {
        return new LifecycleService(store, createMetrics());
    }

    CurationOptions curationOptions() {
        return CurationOptions.builder()
                .minRelevance(minRelevance)
                .autoMerge(autoMerge)
                .maxReviewQueue(maxReviewQueue)
                .nameThreshold(nameThreshold)
                .urlThreshold(urlThreshold)
                .lockTimeout(Duration.ofMillis(lockTimeoutMillis))
                .build();
    }

    TrackerOptions trackerOptions() {
        return new TrackerOptions(Duration.ofSeconds(fetchTimeoutSeconds), trackerParallelism, userAgent);
    }

    CurationMetrics createMetrics() {
        if (metricsEnabled && meterRegistries != null && meterRegistries.isResolvable()) {
            log.info("Curation metrics enabled: registry={}", meterRegistries.get().getClass().getSimpleName());
            return new MicrometerCurationMetrics(meterRegistries.get());
        }
        return new NoOpCurationMetrics();
    }
}
