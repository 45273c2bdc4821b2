package com.product.curation.merge;

import com.product.curation.core.model.Candidate;
import com.product.curation.rules.DefaultNormalizationRules;
import com.product.curation.rules.NormalizationEngine;
import com.product.curation.similarity.SequenceMatcherSimilarity;
import com.product.curation.similarity.SimilarityAlgorithm;
import com.product.curation.store.CandidateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds groups of candidates that denote the same product.
 *
 * <p>Candidates are scanned once in ascending id order. The first candidate not yet in a
 * group becomes canonical, and every later ungrouped candidate matching it joins its group.
 * A candidate already grouped is never compared again, so matches are not transitive:
 * A~B and B~C put C in A's group only when A~C holds as well.</p>
 *
 * <p>Two candidates match when their normalized names are at least {@code nameThreshold}
 * similar, or when both have a URL and their normalized URLs are at least
 * {@code urlThreshold} similar.</p>
 */
public class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    public static final double DEFAULT_NAME_THRESHOLD = 0.85;
    public static final double DEFAULT_URL_THRESHOLD = 0.9;

    private final CandidateStore store;
    private final NormalizationEngine normalizer;
    private final SimilarityAlgorithm similarity;
    private final double nameThreshold;
    private final double urlThreshold;

    public DuplicateDetector(CandidateStore store) {
        this(store, DefaultNormalizationRules.createDefaultEngine(), new SequenceMatcherSimilarity(),
                DEFAULT_NAME_THRESHOLD, DEFAULT_URL_THRESHOLD);
    }

    public DuplicateDetector(CandidateStore store, NormalizationEngine normalizer, SimilarityAlgorithm similarity,
                             double nameThreshold, double urlThreshold) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        validateThreshold("nameThreshold", nameThreshold);
        validateThreshold("urlThreshold", urlThreshold);
        this.nameThreshold = nameThreshold;
        this.urlThreshold = urlThreshold;
    }

    /**
     * Scans every stored candidate.
     */
    public List<DuplicateGroup> detect() {
        return detect(store.listCandidates());
    }

    /**
     * Scans the given candidates. Input order does not matter; the scan always runs in id order.
     */
    public List<DuplicateGroup> detect(List<Candidate> candidates) {
        List<Keyed> keyed = candidates.stream()
                .sorted(Comparator.comparingLong(Candidate::getId))
                .map(c -> new Keyed(c, normalizer.normalizeName(c.getName()), normalizer.normalizeUrl(c.getUrl())))
                .toList();

        boolean[] grouped = new boolean[keyed.size()];
        List<DuplicateGroup> groups = new ArrayList<>();
        for (int i = 0; i < keyed.size(); i++) {
            if (grouped[i]) {
                continue;
            }
            Keyed canonical = keyed.get(i);
            List<DuplicateMatch> duplicates = new ArrayList<>();
            for (int j = i + 1; j < keyed.size(); j++) {
                if (grouped[j]) {
                    continue;
                }
                Keyed other = keyed.get(j);
                double nameSimilarity = similarity.compute(canonical.name(), other.name());
                double urlSimilarity = bothPresent(canonical.url(), other.url())
                        ? similarity.compute(canonical.url(), other.url())
                        : 0.0;
                if (nameSimilarity >= nameThreshold || urlSimilarity >= urlThreshold) {
                    grouped[j] = true;
                    duplicates.add(new DuplicateMatch(other.candidate(), Math.max(nameSimilarity, urlSimilarity)));
                    log.debug("dedup.match canonicalId={} duplicateId={} nameSimilarity={} urlSimilarity={}",
                            canonical.candidate().getId(), other.candidate().getId(), nameSimilarity, urlSimilarity);
                }
            }
            if (!duplicates.isEmpty()) {
                grouped[i] = true;
                groups.add(new DuplicateGroup(canonical.candidate(), duplicates));
            }
        }
        log.info("dedup.scanned candidates={} groups={}", keyed.size(), groups.size());
        return groups;
    }

    public double getNameThreshold() {
        return nameThreshold;
    }

    public double getUrlThreshold() {
        return urlThreshold;
    }

    private static boolean bothPresent(String a, String b) {
        return !a.isEmpty() && !b.isEmpty();
    }

    private static void validateThreshold(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }

    private record Keyed(Candidate candidate, String name, String url) {}
}
