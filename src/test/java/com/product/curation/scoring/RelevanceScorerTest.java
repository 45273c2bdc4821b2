package com.product.curation.scoring;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.Category;
import com.product.curation.core.model.Claim;
import com.product.curation.core.model.ClaimType;
import com.product.curation.store.CandidateNotFoundException;
import com.product.curation.store.InMemoryCandidateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RelevanceScorer Tests")
class RelevanceScorerTest {

    private InMemoryCandidateStore store;
    private RelevanceScorer scorer;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        scorer = new RelevanceScorer(store);
    }

    private static Candidate candidate(Category category, String description) {
        return Candidate.builder().id(1).name("Tool").category(category).description(description).build();
    }

    private static Claim claim(long feedId, String content, double confidence) {
        return new Claim(0, 1, feedId, ClaimType.FEATURE, content, confidence, null, Instant.now());
    }

    @Nested
    @DisplayName("Category contribution")
    class CategoryContribution {

        @Test
        @DisplayName("A prospecting tool with no claims scores 0.30 with one reason")
        void prospectingWithoutClaims() {
            ScoringResult result = scorer.score(candidate(Category.PROSPECTING, null), List.of());

            assertEquals(0.30, result.score(), 1e-9);
            assertEquals(List.of("Category 'prospecting': +0.30"), result.reasons());
            assertEquals(0, result.claimCount());
            assertEquals(0, result.feedCount());
        }

        @Test
        void otherCategoryUsesLowestWeight() {
            ScoringResult result = scorer.score(candidate(Category.OTHER, null), null);

            assertEquals(0.09, result.score(), 1e-9);
            assertEquals(List.of("Category 'other': +0.09"), result.reasons());
        }

        @Test
        void customWeightsApply() {
            RelevanceScorer custom = new RelevanceScorer(store,
                    ScoringWeights.builder().categoryWeight(Category.ANALYTICS, 1.0).build(),
                    KeywordSignals.defaults());

            assertEquals(0.30, custom.score(candidate(Category.ANALYTICS, null), List.of()).score(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Claims and keywords")
    class ClaimsAndKeywords {

        @Test
        @DisplayName("Every contribution is reported in order and the total is clamped to 1.0")
        void fullBreakdownIsClamped() {
            List<Claim> claims = List.of(
                    claim(1, "Automates cold email outreach for SDR teams", 1.0),
                    claim(2, "Syncs with your CRM pipeline", 0.5));

            ScoringResult result = scorer.score(candidate(Category.OUTREACH, null), claims);

            assertEquals(1.0, result.score());
            assertEquals(List.of(
                    "Category 'outreach': +0.30",
                    "2 claims: +0.10",
                    "'SDR': +0.15",
                    "'cold email': +0.15",
                    "'outreach': +0.15",
                    "Avg confidence 0.75: +0.11",
                    "2 sources: +0.10"), result.reasons());
            assertEquals(2, result.claimCount());
            assertEquals(2, result.feedCount());
        }

        @Test
        @DisplayName("Claims from a single feed earn no source bonus")
        void singleFeedHasNoSourceBonus() {
            List<Claim> claims = List.of(
                    claim(1, "Dialer", 1.0),
                    claim(1, "Call recording", 1.0));

            ScoringResult result = scorer.score(candidate(Category.CONVERSATION, null), claims);

            // 0.24 category + 0.10 claims + 0.15 confidence
            assertEquals(0.49, result.score(), 1e-9);
            assertEquals(1, result.feedCount());
            assertTrue(result.reasons().stream().noneMatch(r -> r.contains("sources")));
        }

        @Test
        @DisplayName("The claim bonus is capped")
        void claimBonusCapped() {
            List<Claim> claims = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                claims.add(claim(1, "Feature " + i, 0.0));
            }

            ScoringResult result = scorer.score(candidate(Category.OTHER, null), claims);

            assertEquals(0.29, result.score(), 1e-9);
            assertTrue(result.reasons().contains("10 claims: +0.20"));
        }

        @Test
        @DisplayName("Keyword score is capped and reasons are limited to high signals")
        void keywordCap() {
            RelevanceScorer.KeywordScore score = scorer.keywordScore(
                    "SDR BDR prospecting outreach lead gen sales automation");

            assertEquals(0.4, score.score(), 1e-9);
            assertEquals(3, score.reasons().size());
            assertEquals("'SDR': +0.15", score.reasons().get(0));
        }

        @Test
        void keywordsMatchWholeWordsOnly() {
            assertEquals(0.0, scorer.keywordScore("meetings about maintenance").score());
            assertEquals(0.08, scorer.keywordScore("book a meeting").score(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Description")
    class Description {

        @Test
        @DisplayName("Description keywords contribute at half weight")
        void descriptionKeywords() {
            ScoringResult result = scorer.score(
                    candidate(Category.CRM, "Keeps your CRM in sync with LinkedIn"), List.of());

            assertEquals(0.29, result.score(), 1e-9);
            assertEquals(List.of("Category 'crm': +0.21", "Description keywords: +0.08"), result.reasons());
        }

        @Test
        @DisplayName("A description without keywords adds no reason")
        void descriptionWithoutKeywords() {
            ScoringResult result = scorer.score(candidate(Category.CRM, "A nice tool"), List.of());

            assertEquals(1, result.reasons().size());
        }
    }

    @Nested
    @DisplayName("Stored candidates")
    class StoredCandidates {

        @Test
        @DisplayName("Scoring by id uses the stored claims and is deterministic")
        void scoresStoredCandidate() {
            Candidate stored = store.addCandidate(Candidate.builder().name("Apollo").url("https://apollo.io")
                    .category(Category.PROSPECTING).status(CandidateStatus.ANALYZING).build());
            store.addClaim(stored.getId(), 1, ClaimType.FEATURE, "B2B prospecting database", 0.9, null);

            ScoringResult first = scorer.score(stored.getId());
            ScoringResult second = scorer.score(stored.getId());

            assertEquals(first, second);
            assertEquals(stored.getId(), first.candidateId());
            assertEquals(1, first.claimCount());
            assertNull(store.getCandidate(stored.getId()).orElseThrow().getRelevanceScore());
        }

        @Test
        void unknownCandidateThrows() {
            assertThrows(CandidateNotFoundException.class, () -> scorer.score(404L));
        }
    }

    @ParameterizedTest
    @EnumSource(Category.class)
    @DisplayName("Scores stay in [0, 1] for every category")
    void scoreWithinRange(Category category) {
        List<Claim> claims = new ArrayList<>();
        for (long feed = 1; feed <= 6; feed++) {
            claims.add(claim(feed, "SDR outreach prospecting CRM pipeline AI workflow", 1.0));
        }

        double score = scorer.score(candidate(category, "cold email outreach for SDR teams"), claims).score();

        assertTrue(score >= 0.0 && score <= 1.0, "score was " + score);
    }
}
