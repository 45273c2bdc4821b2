package com.product.curation.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SequenceMatcherSimilarityTest {

    private final SequenceMatcherSimilarity similarity = new SequenceMatcherSimilarity();

    @Test
    @DisplayName("Identical strings score 1.0")
    void identicalStrings() {
        assertEquals(1.0, similarity.compute("apollo", "apollo"));
    }

    @Test
    @DisplayName("Null or empty operands score 0.0")
    void emptyOperands() {
        assertEquals(0.0, similarity.compute("", "apollo"));
        assertEquals(0.0, similarity.compute("apollo", ""));
        assertEquals(0.0, similarity.compute("", ""));
        assertEquals(0.0, similarity.compute(null, "apollo"));
    }

    @ParameterizedTest(name = "{0} vs {1} = {2}")
    @CsvSource({
            "abcd, bcde, 0.75",
            "hubspot, hubspotcrm, 0.8235294117647058",
            "abcdefghijklmnopqrst, abcdefghijklmnopqrsx, 0.95",
            "abcdefghijklmnopqrst, abcdefghijklmnopwwyx, 0.8",
            "tide, diet, 0.25",
            "diet, tide, 0.5"
    })
    @DisplayName("Ratio is 2M / (|a| + |b|) over recursively matched blocks")
    void knownRatios(String a, String b, double expected) {
        assertEquals(expected, similarity.compute(a, b), 1e-9);
    }

    @Test
    @DisplayName("Completely different strings score 0.0")
    void disjointStrings() {
        assertEquals(0.0, similarity.compute("abc", "xyz"));
    }

    @Test
    @DisplayName("Long inputs stay within [0, 1]")
    void longInputs() {
        String a = "ab".repeat(150) + "unique-tail";
        String b = "ba".repeat(150) + "unique-tail";
        double score = similarity.compute(a, b);
        assertTrue(score > 0.0 && score <= 1.0, "score was " + score);
    }

    @Test
    void name() {
        assertEquals("SequenceMatcher", similarity.getName());
    }
}
