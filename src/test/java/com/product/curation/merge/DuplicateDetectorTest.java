package com.product.curation.merge;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.rules.DefaultNormalizationRules;
import com.product.curation.similarity.SequenceMatcherSimilarity;
import com.product.curation.store.InMemoryCandidateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DuplicateDetector Tests")
class DuplicateDetectorTest {

    private InMemoryCandidateStore store;
    private DuplicateDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        detector = new DuplicateDetector(store);
    }

    private Candidate add(String name, String url) {
        return store.addCandidate(Candidate.builder().name(name).url(url)
                .status(CandidateStatus.ANALYZING).build());
    }

    @Test
    @DisplayName("Name and URL variants of one product form a single group")
    void groupsVariants() {
        Candidate apollo = add("Apollo.io", "https://apollo.io");
        Candidate apolloDup = add("Apollo", "https://www.apollo.io/");
        add("Gong", "https://gong.io");

        List<DuplicateGroup> groups = detector.detect();

        assertEquals(1, groups.size());
        DuplicateGroup group = groups.get(0);
        assertEquals(apollo.getId(), group.canonical().getId());
        assertEquals(List.of(apolloDup.getId()), group.duplicateIds());
        assertEquals(1.0, group.duplicates().get(0).similarity());
    }

    @Test
    @DisplayName("Matching URLs are enough even when names differ")
    void urlOnlyMatch() {
        add("Seamless", "https://seamless.ai");
        Candidate renamed = add("Seamless Contact Finder", "https://www.seamless.ai/");

        List<DuplicateGroup> groups = detector.detect();

        assertEquals(List.of(renamed.getId()), groups.get(0).duplicateIds());
    }

    @Test
    @DisplayName("Candidates without URLs are compared on names only")
    void missingUrlsNeverMatch() {
        add("Alpha", null);
        add("Zeta", null);

        assertTrue(detector.detect().isEmpty());
    }

    @Test
    @DisplayName("Grouping is not transitive")
    void notTransitive() {
        Candidate a = add("abcdefghijklmnopqrst", null);
        Candidate b = add("abcdefghijklmnopqrsx", null);
        Candidate c = add("abcdefghijklmnopwwyx", null);
        SequenceMatcherSimilarity similarity = new SequenceMatcherSimilarity();
        assertTrue(similarity.compute("abcdefghijklmnopqrsx", "abcdefghijklmnopwwyx") >= 0.85);

        List<DuplicateGroup> groups = detector.detect();

        assertEquals(1, groups.size());
        assertEquals(a.getId(), groups.get(0).canonical().getId());
        assertEquals(List.of(b.getId()), groups.get(0).duplicateIds());
        assertFalse(groups.get(0).duplicateIds().contains(c.getId()));
    }

    @Test
    @DisplayName("Detection writes nothing and repeats identically")
    void idempotent() {
        add("Apollo.io", "https://apollo.io");
        add("Apollo", "https://www.apollo.io/");
        List<Candidate> before = store.listCandidates();

        List<DuplicateGroup> first = detector.detect();
        List<DuplicateGroup> second = detector.detect();

        assertEquals(first, second);
        assertEquals(before, store.listCandidates());
    }

    @Test
    @DisplayName("The lowest id is canonical whatever the input order")
    void lowestIdIsCanonical() {
        Candidate first = add("Lavender", "https://lavender.ai");
        Candidate second = add("Lavender.ai", "https://www.lavender.ai");

        List<DuplicateGroup> groups = detector.detect(List.of(second, first));

        assertEquals(first.getId(), groups.get(0).canonical().getId());
    }

    @Test
    @DisplayName("Thresholds are configurable and validated")
    void thresholds() {
        add("abcd", null);
        add("bcde", null);
        DuplicateDetector lenient = new DuplicateDetector(store, DefaultNormalizationRules.createDefaultEngine(),
                new SequenceMatcherSimilarity(), 0.7, 0.9);

        assertTrue(detector.detect().isEmpty());
        assertEquals(1, lenient.detect().size());
        assertThrows(IllegalArgumentException.class, () -> new DuplicateDetector(store,
                DefaultNormalizationRules.createDefaultEngine(), new SequenceMatcherSimilarity(), 1.2, 0.9));
    }
}
