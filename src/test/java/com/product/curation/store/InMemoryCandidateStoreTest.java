package com.product.curation.store;

import com.product.curation.core.model.Candidate;
import com.product.curation.core.model.CandidateStatus;
import com.product.curation.core.model.ChangeEvent;
import com.product.curation.core.model.ChangeType;
import com.product.curation.core.model.Claim;
import com.product.curation.core.model.ClaimType;
import com.product.curation.core.model.Feed;
import com.product.curation.core.model.FeedReliability;
import com.product.curation.core.model.RawMention;
import com.product.curation.core.model.Snapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCandidateStore Tests")
class InMemoryCandidateStoreTest {

    private InMemoryCandidateStore store;
    private Feed feed;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        feed = store.addFeed("newsletter", null, FeedReliability.HIGH);
    }

    private Candidate add(String name, String url) {
        return store.addCandidate(Candidate.builder().name(name).url(url)
                .status(CandidateStatus.ANALYZING).build());
    }

    @Nested
    @DisplayName("Candidates")
    class Candidates {

        @Test
        @DisplayName("Ids are assigned in insertion order")
        void assignsIds() {
            Candidate a = add("Apollo", "https://apollo.io");
            Candidate b = add("Gong", "https://gong.io");

            assertEquals(1L, a.getId());
            assertEquals(2L, b.getId());
            assertEquals(List.of(a, b), store.listCandidates());
        }

        @Test
        @DisplayName("A known URL returns the existing candidate instead of inserting")
        void upsertsByUrl() {
            Candidate first = add("Apollo", "https://apollo.io");
            Candidate second = add("Apollo.io", "https://apollo.io");

            assertEquals(first.getId(), second.getId());
            assertEquals("Apollo", second.getName());
            assertEquals(1, store.listCandidates().size());
        }

        @Test
        @DisplayName("Candidates without URL are never merged on insert")
        void noUrlAlwaysInserts() {
            add("Apollo", null);
            add("Apollo", null);

            assertEquals(2, store.listCandidates().size());
        }

        @Test
        void filtersAndCountsByStatus() {
            Candidate a = add("Apollo", "https://apollo.io");
            add("Gong", "https://gong.io");
            store.setStatus(a.getId(), CandidateStatus.REVIEW, null, null);

            assertEquals(1, store.countByStatus(CandidateStatus.REVIEW));
            assertEquals(1, store.countByStatus(CandidateStatus.ANALYZING));
            assertEquals("Gong", store.listCandidatesByStatus(CandidateStatus.ANALYZING).get(0).getName());
        }

        @Test
        void setScoreValidatesRange() {
            Candidate a = add("Apollo", "https://apollo.io");

            assertEquals(0.42, store.setScore(a.getId(), 0.42).getRelevanceScore());
            assertThrows(IllegalArgumentException.class, () -> store.setScore(a.getId(), 1.01));
            assertThrows(IllegalArgumentException.class, () -> store.setScore(a.getId(), -0.1));
        }

        @Test
        void missingCandidateThrowsNotFound() {
            CandidateNotFoundException e = assertThrows(CandidateNotFoundException.class,
                    () -> store.setScore(99, 0.5));
            assertEquals("Candidate not found: 99", e.getMessage());
            assertTrue(store.getCandidate(99).isEmpty());
        }
    }

    @Nested
    @DisplayName("Delete and restore")
    class DeleteAndRestore {

        @Test
        @DisplayName("Delete is refused while claims are attached")
        void refusesWithClaims() {
            Candidate a = add("Apollo", "https://apollo.io");
            store.addClaim(a.getId(), feed.id(), ClaimType.FEATURE, "Dialer", 0.9, null);

            StoreException e = assertThrows(StoreException.class, () -> store.deleteCandidate(a.getId()));
            assertFalse(e.isFatal());
            assertTrue(store.getCandidate(a.getId()).isPresent());
        }

        @Test
        @DisplayName("Delete is refused while mentions are linked")
        void refusesWithMentions() {
            Candidate a = add("Apollo", "https://apollo.io");
            RawMention mention = store.addMention(feed.id(), null, "Apollo is great");
            store.markMentionProcessed(mention.id(), a.getId());

            assertThrows(StoreException.class, () -> store.deleteCandidate(a.getId()));
        }

        @Test
        @DisplayName("Restore puts the candidate back with its id and URL index")
        void restoresDeletedCandidate() {
            Candidate a = add("Apollo", "https://apollo.io");
            Candidate removed = store.deleteCandidate(a.getId());
            assertTrue(store.getCandidate(a.getId()).isEmpty());

            store.restoreCandidate(removed);

            assertEquals(a, store.getCandidate(a.getId()).orElseThrow());
            assertEquals(a.getId(), add("Apollo again", "https://apollo.io").getId());
        }

        @Test
        void restoreRefusesExistingId() {
            Candidate a = add("Apollo", "https://apollo.io");

            assertThrows(StoreException.class, () -> store.restoreCandidate(a));
        }
    }

    @Nested
    @DisplayName("Claims and mentions")
    class ClaimsAndMentions {

        @Test
        @DisplayName("Reparenting moves every claim and reports the moved ids")
        void reparentClaims() {
            Candidate a = add("Apollo", "https://apollo.io");
            Candidate b = add("Apollo.io", "https://www.apollo.io");
            Claim c1 = store.addClaim(b.getId(), feed.id(), ClaimType.FEATURE, "Dialer", 0.9, null);
            Claim c2 = store.addClaim(b.getId(), feed.id(), ClaimType.PRICING, "$49/mo", 0.7, null);

            List<Long> moved = store.reparentClaims(b.getId(), a.getId());

            assertEquals(List.of(c1.id(), c2.id()), moved);
            assertEquals(2, store.listClaims(a.getId()).size());
            assertTrue(store.listClaims(b.getId()).isEmpty());
        }

        @Test
        @DisplayName("Assign moves claims back for compensation")
        void assignClaimsBack() {
            Candidate a = add("Apollo", "https://apollo.io");
            Candidate b = add("Apollo.io", "https://www.apollo.io");
            store.addClaim(b.getId(), feed.id(), ClaimType.FEATURE, "Dialer", 0.9, null);
            List<Long> moved = store.reparentClaims(b.getId(), a.getId());

            store.assignClaims(moved, b.getId());

            assertEquals(1, store.listClaims(b.getId()).size());
            assertTrue(store.listClaims(a.getId()).isEmpty());
        }

        @Test
        void reparentAndAssignMentions() {
            Candidate a = add("Apollo", "https://apollo.io");
            Candidate b = add("Apollo.io", "https://www.apollo.io");
            RawMention mention = store.addMention(feed.id(), "https://news.example/1", "Apollo raises");
            store.markMentionProcessed(mention.id(), b.getId());

            List<Long> moved = store.reparentMentions(b.getId(), a.getId());
            assertEquals(List.of(mention.id()), moved);
            assertEquals(1, store.listMentions(a.getId()).size());

            store.assignMentions(moved, b.getId());
            assertEquals(1, store.listMentions(b.getId()).size());
        }

        @Test
        void markProcessedRequiresKnownMention() {
            assertThrows(IllegalArgumentException.class, () -> store.markMentionProcessed(42, null));
        }

        @Test
        void markProcessedWithoutCandidate() {
            RawMention mention = store.addMention(feed.id(), null, "nothing useful");

            store.markMentionProcessed(mention.id(), null);

            RawMention stored = store.getMention(mention.id()).orElseThrow();
            assertTrue(stored.processed());
            assertNull(stored.candidateId());
        }

        @Test
        @DisplayName("Unprocessed mentions come back oldest first, up to the limit")
        void listUnprocessedMentions() {
            RawMention first = store.addMention(feed.id(), null, "Apollo raises");
            RawMention handled = store.addMention(feed.id(), null, "Clay launches");
            RawMention third = store.addMention(feed.id(), null, "Gong adds forecasting");
            RawMention fourth = store.addMention(feed.id(), null, "Lavender ships coaching");
            store.markMentionProcessed(handled.id(), null);

            assertEquals(List.of(first.id(), third.id(), fourth.id()),
                    store.listUnprocessedMentions(10).stream().map(RawMention::id).toList());
            assertEquals(List.of(first.id(), third.id()),
                    store.listUnprocessedMentions(2).stream().map(RawMention::id).toList());
            assertTrue(store.listUnprocessedMentions(0).isEmpty());
            assertEquals(3, store.countUnprocessedMentions());
            assertThrows(IllegalArgumentException.class, () -> store.listUnprocessedMentions(-1));
        }

        @Test
        void countsClaims() {
            Candidate a = add("Apollo", "https://apollo.io");
            Candidate b = add("Clay", "https://clay.com");
            store.addClaim(a.getId(), feed.id(), ClaimType.FEATURE, "Dialer", 0.9, null);
            store.addClaim(b.getId(), feed.id(), ClaimType.PRICING, "$149/mo", 0.7, null);

            assertEquals(2, store.countClaims());
        }
    }

    @Nested
    @DisplayName("Feeds")
    class Feeds {

        @Test
        void addFeedIsIdempotentByName() {
            Feed again = store.addFeed("newsletter", "https://other", FeedReliability.LOW);

            assertEquals(feed.id(), again.id());
            assertEquals(FeedReliability.HIGH, again.reliability());
        }

        @Test
        void countersTrackUsefulMentions() {
            store.incrementFeedCounters(feed.id(), true);
            Feed updated = store.incrementFeedCounters(feed.id(), false);

            assertEquals(2, updated.totalMentions());
            assertEquals(1, updated.usefulMentions());
            assertEquals(0.5, updated.usefulRatio());
        }

        @Test
        void countsFeeds() {
            store.addFeed("hn", null, FeedReliability.MEDIUM);
            store.addFeed("newsletter", null, FeedReliability.LOW);

            assertEquals(2, store.countFeeds());
        }
    }

    @Nested
    @DisplayName("Changelog and snapshots")
    class ChangelogAndSnapshots {

        @Test
        @DisplayName("Per-candidate changelog is oldest first")
        void changelogOrder() {
            ChangeEvent first = store.appendChangeEvent(1, ChangeType.NEW, "Candidate approved: Apollo", null);
            ChangeEvent second = store.appendChangeEvent(1, ChangeType.NEWS, "Title changed", null);
            store.appendChangeEvent(2, ChangeType.NEW, "Candidate approved: Gong", null);

            assertEquals(List.of(first, second), store.listChangeEvents(1));
        }

        @Test
        @DisplayName("Recent changes are newest first and limited")
        void recentChanges() {
            store.appendChangeEvent(1, ChangeType.NEW, "a", null);
            store.appendChangeEvent(2, ChangeType.NEW, "b", null);
            ChangeEvent last = store.appendChangeEvent(3, ChangeType.NEW, "c", null);

            List<ChangeEvent> recent = store.listChangeEventsSince(Instant.now().minus(1, ChronoUnit.DAYS), 2);

            assertEquals(2, recent.size());
            assertEquals(last, recent.get(0));
            assertTrue(store.listChangeEventsSince(Instant.now().plus(1, ChronoUnit.DAYS), 10).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> store.listChangeEventsSince(Instant.EPOCH, 0));
        }

        @Test
        void latestSnapshotIsTheLastAppended() {
            Instant now = Instant.now();
            store.appendSnapshot(new Snapshot(1, "https://apollo.io", "Apollo", "aa-1", null, null, now));
            Snapshot latest = store.appendSnapshot(
                    new Snapshot(1, "https://apollo.io", "Apollo", "bb-2", "$49/mo", null, now));

            assertEquals(latest, store.getLatestSnapshot(1).orElseThrow());
            assertEquals(2, store.countSnapshots(1));
            assertEquals(0, store.countSnapshots(2));
            assertTrue(store.getLatestSnapshot(2).isEmpty());
        }
    }
}
