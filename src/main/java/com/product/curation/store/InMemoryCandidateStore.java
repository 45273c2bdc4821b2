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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link CandidateStore}.
 * Suitable for testing and single-JVM deployments. All operations synchronize on the
 * store, so each one is atomic with respect to the others.
 */
public class InMemoryCandidateStore implements CandidateStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCandidateStore.class);

    private final TreeMap<Long, Candidate> candidates = new TreeMap<>();
    private final Map<String, Long> candidateIdsByUrl = new HashMap<>();
    private final TreeMap<Long, Claim> claims = new TreeMap<>();
    private final TreeMap<Long, RawMention> mentions = new TreeMap<>();
    private final TreeMap<Long, Feed> feeds = new TreeMap<>();
    private final List<ChangeEvent> changelog = new ArrayList<>();
    private final Map<Long, List<Snapshot>> snapshots = new HashMap<>();

    private final AtomicLong candidateSequence = new AtomicLong();
    private final AtomicLong claimSequence = new AtomicLong();
    private final AtomicLong mentionSequence = new AtomicLong();
    private final AtomicLong feedSequence = new AtomicLong();
    private final AtomicLong changeSequence = new AtomicLong();

    // ── Candidates ──────────────────────────────────────────────

    @Override
    public synchronized Candidate addCandidate(Candidate draft) {
        Objects.requireNonNull(draft, "draft is required");
        Instant now = Instant.now();
        if (draft.hasUrl()) {
            Long existingId = candidateIdsByUrl.get(draft.getUrl());
            if (existingId != null) {
                Candidate touched = Candidate.builder(candidates.get(existingId)).updatedAt(now).build();
                candidates.put(existingId, touched);
                log.debug("Candidate with url {} already stored as {}", draft.getUrl(), existingId);
                return touched;
            }
        }
        long id = candidateSequence.incrementAndGet();
        Candidate stored = Candidate.builder(draft)
                .id(id)
                .createdAt(now)
                .updatedAt(now)
                .build();
        candidates.put(id, stored);
        if (stored.hasUrl()) {
            candidateIdsByUrl.put(stored.getUrl(), id);
        }
        log.debug("Stored candidate {} ({})", id, stored.getName());
        return stored;
    }

    @Override
    public synchronized Optional<Candidate> getCandidate(long id) {
        return Optional.ofNullable(candidates.get(id));
    }

    @Override
    public synchronized List<Candidate> listCandidates() {
        return List.copyOf(candidates.values());
    }

    @Override
    public synchronized List<Candidate> listCandidatesByStatus(CandidateStatus status) {
        return candidates.values().stream()
                .filter(c -> c.getStatus() == status)
                .toList();
    }

    @Override
    public synchronized long countByStatus(CandidateStatus status) {
        return candidates.values().stream()
                .filter(c -> c.getStatus() == status)
                .count();
    }

    @Override
    public synchronized Candidate setStatus(long id, CandidateStatus status, String rejectionReason,
                                            Instant reviewedAt) {
        Objects.requireNonNull(status, "status is required");
        Candidate updated = Candidate.builder(require(id))
                .status(status)
                .rejectionReason(rejectionReason)
                .reviewedAt(reviewedAt)
                .updatedAt(Instant.now())
                .build();
        candidates.put(id, updated);
        return updated;
    }

    @Override
    public synchronized Candidate setScore(long id, double score) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1], got " + score);
        }
        Candidate updated = Candidate.builder(require(id))
                .relevanceScore(score)
                .updatedAt(Instant.now())
                .build();
        candidates.put(id, updated);
        return updated;
    }

    @Override
    public synchronized Candidate deleteCandidate(long id) {
        Candidate candidate = require(id);
        boolean hasClaims = claims.values().stream().anyMatch(c -> c.candidateId() == id);
        boolean hasMentions = mentions.values().stream()
                .anyMatch(m -> m.candidateId() != null && m.candidateId() == id);
        if (hasClaims || hasMentions) {
            throw new StoreException("Candidate " + id + " still has attached claims or mentions", false);
        }
        candidates.remove(id);
        if (candidate.hasUrl()) {
            candidateIdsByUrl.remove(candidate.getUrl(), id);
        }
        log.debug("Deleted candidate {}", id);
        return candidate;
    }

    @Override
    public synchronized void restoreCandidate(Candidate candidate) {
        Objects.requireNonNull(candidate, "candidate is required");
        if (candidates.containsKey(candidate.getId())) {
            throw new StoreException("Candidate " + candidate.getId() + " already exists", false);
        }
        candidates.put(candidate.getId(), candidate);
        if (candidate.hasUrl()) {
            candidateIdsByUrl.putIfAbsent(candidate.getUrl(), candidate.getId());
        }
        log.debug("Restored candidate {}", candidate.getId());
    }

    // ── Claims ──────────────────────────────────────────────────

    @Override
    public synchronized Claim addClaim(long candidateId, long feedId, ClaimType claimType, String content,
                                       double confidence, String rawText) {
        require(candidateId);
        long id = claimSequence.incrementAndGet();
        Claim claim = new Claim(id, candidateId, feedId, claimType, content, confidence, rawText, Instant.now());
        claims.put(id, claim);
        return claim;
    }

    @Override
    public synchronized List<Claim> listClaims(long candidateId) {
        return claims.values().stream()
                .filter(c -> c.candidateId() == candidateId)
                .toList();
    }

    @Override
    public synchronized List<Long> reparentClaims(long fromId, long toId) {
        require(toId);
        List<Long> moved = new ArrayList<>();
        for (Claim claim : List.copyOf(claims.values())) {
            if (claim.candidateId() == fromId) {
                claims.put(claim.id(), claim.withCandidateId(toId));
                moved.add(claim.id());
            }
        }
        return List.copyOf(moved);
    }

    @Override
    public synchronized void assignClaims(Collection<Long> claimIds, long candidateId) {
        require(candidateId);
        for (Long claimId : claimIds) {
            Claim claim = claims.get(claimId);
            if (claim != null) {
                claims.put(claimId, claim.withCandidateId(candidateId));
            }
        }
    }

    @Override
    public synchronized long countClaims() {
        return claims.size();
    }

    // ── Raw mentions ────────────────────────────────────────────

    @Override
    public synchronized RawMention addMention(long feedId, String sourceUrl, String rawText) {
        long id = mentionSequence.incrementAndGet();
        RawMention mention = new RawMention(id, feedId, sourceUrl, rawText, false, null, Instant.now());
        mentions.put(id, mention);
        return mention;
    }

    @Override
    public synchronized Optional<RawMention> getMention(long mentionId) {
        return Optional.ofNullable(mentions.get(mentionId));
    }

    @Override
    public synchronized List<RawMention> listMentions(long candidateId) {
        return mentions.values().stream()
                .filter(m -> m.candidateId() != null && m.candidateId() == candidateId)
                .toList();
    }

    @Override
    public synchronized List<RawMention> listUnprocessedMentions(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        return mentions.values().stream()
                .filter(m -> !m.processed())
                .sorted(Comparator.comparing(RawMention::createdAt).thenComparingLong(RawMention::id))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized long countUnprocessedMentions() {
        return mentions.values().stream().filter(m -> !m.processed()).count();
    }

    @Override
    public synchronized void markMentionProcessed(long mentionId, Long candidateId) {
        RawMention mention = mentions.get(mentionId);
        if (mention == null) {
            throw new IllegalArgumentException("Mention not found: " + mentionId);
        }
        if (candidateId != null) {
            require(candidateId);
        }
        mentions.put(mentionId, mention.processedFor(candidateId));
    }

    @Override
    public synchronized List<Long> reparentMentions(long fromId, long toId) {
        require(toId);
        List<Long> moved = new ArrayList<>();
        for (RawMention mention : List.copyOf(mentions.values())) {
            if (mention.candidateId() != null && mention.candidateId() == fromId) {
                mentions.put(mention.id(), mention.withCandidateId(toId));
                moved.add(mention.id());
            }
        }
        return List.copyOf(moved);
    }

    @Override
    public synchronized void assignMentions(Collection<Long> mentionIds, long candidateId) {
        require(candidateId);
        for (Long mentionId : mentionIds) {
            RawMention mention = mentions.get(mentionId);
            if (mention != null) {
                mentions.put(mentionId, mention.withCandidateId(candidateId));
            }
        }
    }

    // ── Feeds ───────────────────────────────────────────────────

    @Override
    public synchronized Feed addFeed(String name, String url, FeedReliability reliability) {
        Optional<Feed> existing = getFeedByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        long id = feedSequence.incrementAndGet();
        Feed feed = new Feed(id, name, url, reliability, 0, 0);
        feeds.put(id, feed);
        return feed;
    }

    @Override
    public synchronized long countFeeds() {
        return feeds.size();
    }

    @Override
    public synchronized Optional<Feed> getFeed(long feedId) {
        return Optional.ofNullable(feeds.get(feedId));
    }

    @Override
    public synchronized Optional<Feed> getFeedByName(String name) {
        return feeds.values().stream()
                .filter(f -> f.name().equals(name))
                .findFirst();
    }

    @Override
    public synchronized Feed incrementFeedCounters(long feedId, boolean useful) {
        Feed feed = feeds.get(feedId);
        if (feed == null) {
            throw new IllegalArgumentException("Feed not found: " + feedId);
        }
        Feed updated = feed.withCounters(feed.totalMentions() + 1,
                feed.usefulMentions() + (useful ? 1 : 0));
        feeds.put(feedId, updated);
        return updated;
    }

    // ── Changelog ───────────────────────────────────────────────

    @Override
    public synchronized ChangeEvent appendChangeEvent(long candidateId, ChangeType changeType,
                                                      String description, String sourceUrl) {
        ChangeEvent event = new ChangeEvent(changeSequence.incrementAndGet(), candidateId, changeType,
                description, sourceUrl, Instant.now());
        changelog.add(event);
        return event;
    }

    @Override
    public synchronized List<ChangeEvent> listChangeEvents(long candidateId) {
        return changelog.stream()
                .filter(e -> e.candidateId() == candidateId)
                .toList();
    }

    @Override
    public synchronized List<ChangeEvent> listChangeEventsSince(Instant since, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return changelog.stream()
                .filter(e -> !e.detectedAt().isBefore(since))
                .sorted(Comparator.comparing(ChangeEvent::detectedAt)
                        .thenComparingLong(ChangeEvent::id)
                        .reversed())
                .limit(limit)
                .toList();
    }

    // ── Snapshots ───────────────────────────────────────────────

    @Override
    public synchronized Optional<Snapshot> getLatestSnapshot(long candidateId) {
        List<Snapshot> history = snapshots.get(candidateId);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(history.get(history.size() - 1));
    }

    @Override
    public synchronized Snapshot appendSnapshot(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot is required");
        snapshots.computeIfAbsent(snapshot.candidateId(), k -> new ArrayList<>()).add(snapshot);
        return snapshot;
    }

    @Override
    public synchronized int countSnapshots(long candidateId) {
        List<Snapshot> history = snapshots.get(candidateId);
        return history == null ? 0 : history.size();
    }

    private Candidate require(long id) {
        Candidate candidate = candidates.get(id);
        if (candidate == null) {
            throw new CandidateNotFoundException(id);
        }
        return candidate;
    }
}
