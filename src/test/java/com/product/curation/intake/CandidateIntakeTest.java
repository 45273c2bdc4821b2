package com.product.curation.intake;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.Category;
import com.product.curation.core.model.Claim;
import com.product.curation.core.model.ClaimType;
import com.product.curation.core.model.Feed;
import com.product.curation.core.model.FeedReliability;
import com.product.curation.core.model.RawMention;
import com.product.curation.store.InMemoryCandidateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CandidateIntake Tests")
class CandidateIntakeTest {

    private InMemoryCandidateStore store;
    private CandidateIntake intake;
    private Feed feed;
    private RawMention mention;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        intake = new CandidateIntake(store);
        feed = store.addFeed("sales-newsletter", "https://news.example", FeedReliability.HIGH);
        mention = store.addMention(feed.id(), "https://news.example/42", "Apollo and Gong ship new AI features");
    }

    private static ExtractedCandidate candidate(String name, String url, String category) {
        return new ExtractedCandidate(name, url, name + " description", category);
    }

    private static ExtractedClaim claim(String candidateName, String type, String content, Double confidence) {
        return new ExtractedClaim(candidateName, type, content, confidence, null);
    }

    @Nested
    @DisplayName("Storing")
    class Storing {

        @Test
        @DisplayName("Candidates land in analyzing with their claims attached")
        void storesCandidatesAndClaims() {
            ExtractionResult result = new ExtractionResult(mention.id(), feed.id(), null,
                    List.of(candidate("Apollo", "https://apollo.io", "prospecting"),
                            candidate("Gong", "https://gong.io", "conversation")),
                    List.of(claim("apollo", "feature", "AI email writer", 0.9),
                            claim("Gong", "pricing", "Custom pricing", null),
                            claim("Unknown", "feature", "Orphan claim", 0.4)));

            IntakeResult intakeResult = intake.ingest(result);

            assertEquals(2, intakeResult.candidateIds().size());
            assertEquals(2, intakeResult.claimsAdded());
            assertTrue(intakeResult.useful());
            Candidate apollo = store.getCandidate(intakeResult.candidateIds().get(0)).orElseThrow();
            assertEquals(CandidateStatus.ANALYZING, apollo.getStatus());
            assertEquals(Category.PROSPECTING, apollo.getCategory());
            List<Claim> apolloClaims = store.listClaims(apollo.getId());
            assertEquals(1, apolloClaims.size());
            assertEquals(ClaimType.FEATURE, apolloClaims.get(0).claimType());
            assertEquals(feed.id(), apolloClaims.get(0).feedId());
            Claim gongClaim = store.listClaims(intakeResult.candidateIds().get(1)).get(0);
            assertEquals(0.5, gongClaim.confidence());
        }

        @Test
        @DisplayName("The mention is linked to the first candidate and the feed counted as useful")
        void marksMentionAndFeed() {
            IntakeResult intakeResult = intake.ingest(new ExtractionResult(mention.id(), feed.id(), null,
                    List.of(candidate("Apollo", "https://apollo.io", "prospecting")), List.of()));

            RawMention processed = store.getMention(mention.id()).orElseThrow();
            assertTrue(processed.processed());
            assertEquals(intakeResult.candidateIds().get(0), processed.candidateId());
            Feed counted = store.getFeed(feed.id()).orElseThrow();
            assertEquals(1, counted.totalMentions());
            assertEquals(1, counted.usefulMentions());
        }

        @Test
        @DisplayName("Candidates without URL are skipped and the mention is not useful")
        void skipsWithoutUrl() {
            IntakeResult intakeResult = intake.ingest(new ExtractionResult(mention.id(), feed.id(), null,
                    List.of(candidate("Mystery tool", null, "other")),
                    List.of(claim("Mystery tool", "feature", "Does things", 0.7))));

            assertFalse(intakeResult.useful());
            assertEquals(1, intakeResult.skippedWithoutUrl());
            assertEquals(0, intakeResult.claimsAdded());
            assertTrue(store.listCandidates().isEmpty());
            assertNull(store.getMention(mention.id()).orElseThrow().candidateId());
            assertEquals(0, store.getFeed(feed.id()).orElseThrow().usefulMentions());
        }

        @Test
        @DisplayName("A known URL reuses the stored candidate")
        void reusesKnownUrl() {
            IntakeResult first = intake.ingest(new ExtractionResult(null, feed.id(), null,
                    List.of(candidate("Apollo", "https://apollo.io", "prospecting")), List.of()));
            IntakeResult second = intake.ingest(new ExtractionResult(null, feed.id(), null,
                    List.of(candidate("Apollo.io", "https://apollo.io", "prospecting")),
                    List.of(claim("Apollo.io", "integration", "Salesforce sync", 0.8))));

            assertEquals(first.candidateIds(), second.candidateIds());
            assertEquals(1, store.listCandidates().size());
            assertEquals(1, store.listClaims(first.candidateIds().get(0)).size());
        }

        @Test
        @DisplayName("A feed given by name is registered on first use")
        void registersFeedByName() {
            intake.ingest(new ExtractionResult(null, null, "reddit-sales",
                    List.of(candidate("Clay", "https://clay.com", "enrichment")), List.of()));

            Feed registered = store.getFeedByName("reddit-sales").orElseThrow();
            assertEquals(FeedReliability.UNRATED, registered.reliability());
            assertEquals(1, registered.usefulMentions());
        }

        @Test
        void unknownCategoryAndClaimTypeAreTolerated() {
            IntakeResult intakeResult = intake.ingest(new ExtractionResult(null, feed.id(), null,
                    List.of(candidate("Clay", "https://clay.com", "spreadsheets")),
                    List.of(claim("Clay", "rumour", "Raising a round", 0.3))));

            long id = intakeResult.candidateIds().get(0);
            assertEquals(Category.OTHER, store.getCandidate(id).orElseThrow().getCategory());
            assertNull(store.listClaims(id).get(0).claimType());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void unknownFeedIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> intake.ingest(
                    new ExtractionResult(null, 999L, null, List.of(), List.of())));
        }

        @Test
        void missingFeedIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> intake.ingest(
                    new ExtractionResult(null, null, " ", List.of(), List.of())));
        }

        @Test
        void unknownMentionIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> intake.ingest(
                    new ExtractionResult(999L, feed.id(), null, List.of(), List.of())));
        }

        @Test
        @DisplayName("Invalid claims are rejected before anything is written")
        void invalidClaimWritesNothing() {
            ExtractionResult result = new ExtractionResult(mention.id(), feed.id(), null,
                    List.of(candidate("Apollo", "https://apollo.io", "prospecting")),
                    List.of(claim("Apollo", "feature", "Too sure", 1.5)));

            assertThrows(IllegalArgumentException.class, () -> intake.ingest(result));
            assertTrue(store.listCandidates().isEmpty());
            assertFalse(store.getMention(mention.id()).orElseThrow().processed());
            assertEquals(0, store.getFeed(feed.id()).orElseThrow().totalMentions());
        }

        @Test
        void namelessCandidateIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> intake.ingest(new ExtractionResult(
                    null, feed.id(), null, List.of(candidate(" ", "https://x.example", null)), List.of())));
        }
    }
}
