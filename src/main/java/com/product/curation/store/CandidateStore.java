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

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for candidates and everything attached to them.
 *
 * <p>Implementations must be safe for concurrent use. Every single operation is atomic;
 * multi-step units of work (such as a duplicate merge) are made atomic by the caller
 * through compensating operations ({@link #assignClaims}, {@link #assignMentions},
 * {@link #restoreCandidate}).</p>
 *
 * <p>Operations referencing a missing candidate throw {@link CandidateNotFoundException}.
 * Infrastructure failures surface as {@link StoreException}.</p>
 */
public interface CandidateStore {

    // ── Candidates ──────────────────────────────────────────────

    /**
     * Inserts a candidate from a draft (its id is ignored). A candidate whose URL is already
     * stored is not duplicated: the existing row is touched and returned unchanged otherwise.
     *
     * @return the stored candidate
     */
    Candidate addCandidate(Candidate draft);

    Optional<Candidate> getCandidate(long id);

    /**
     * Returns all candidates in ascending id order.
     */
    List<Candidate> listCandidates();

    /**
     * Returns candidates in the given status in ascending id order.
     */
    List<Candidate> listCandidatesByStatus(CandidateStatus status);

    long countByStatus(CandidateStatus status);

    /**
     * Writes the status-related fields of a candidate.
     *
     * @param rejectionReason reason to store, {@code null} clears it
     * @param reviewedAt      review timestamp to store, {@code null} clears it
     * @return the updated candidate
     */
    Candidate setStatus(long id, CandidateStatus status, String rejectionReason, Instant reviewedAt);

    /**
     * Stores a relevance score.
     *
     * @throws IllegalArgumentException if the score is outside [0, 1]
     */
    Candidate setScore(long id, double score);

    /**
     * Removes a candidate. Claims and mentions must have been moved away first.
     *
     * @return the removed candidate
     * @throws StoreException if claims or mentions still reference the candidate
     */
    Candidate deleteCandidate(long id);

    /**
     * Re-inserts a previously deleted candidate with its original id and fields.
     */
    void restoreCandidate(Candidate candidate);

    // ── Claims ──────────────────────────────────────────────────

    Claim addClaim(long candidateId, long feedId, ClaimType claimType, String content,
                   double confidence, String rawText);

    /**
     * Returns the claims of a candidate in ascending id order.
     */
    List<Claim> listClaims(long candidateId);

    /**
     * Moves every claim of {@code fromId} to {@code toId}.
     *
     * @return ids of the claims that moved
     */
    List<Long> reparentClaims(long fromId, long toId);

    /**
     * Attaches the given claims to a candidate regardless of their current parent.
     */
    void assignClaims(Collection<Long> claimIds, long candidateId);

    long countClaims();

    // ── Raw mentions ────────────────────────────────────────────

    RawMention addMention(long feedId, String sourceUrl, String rawText);

    Optional<RawMention> getMention(long mentionId);

    List<RawMention> listMentions(long candidateId);

    /**
     * Mentions not yet handed to extraction, oldest first.
     *
     * @param limit maximum number of mentions returned, at least 0
     */
    List<RawMention> listUnprocessedMentions(int limit);

    long countUnprocessedMentions();

    /**
     * Marks a mention processed and links it to a candidate ({@code null} for no link).
     */
    void markMentionProcessed(long mentionId, Long candidateId);

    List<Long> reparentMentions(long fromId, long toId);

    void assignMentions(Collection<Long> mentionIds, long candidateId);

    // ── Feeds ───────────────────────────────────────────────────

    /**
     * Registers a feed. Feed names are unique; registering an existing name returns the stored feed.
     */
    Feed addFeed(String name, String url, FeedReliability reliability);

    long countFeeds();

    Optional<Feed> getFeed(long feedId);

    Optional<Feed> getFeedByName(String name);

    /**
     * Counts one processed mention for a feed, and one useful mention when {@code useful}.
     */
    Feed incrementFeedCounters(long feedId, boolean useful);

    // ── Changelog ───────────────────────────────────────────────

    ChangeEvent appendChangeEvent(long candidateId, ChangeType changeType, String description, String sourceUrl);

    /**
     * Returns the changelog of a candidate, oldest first.
     */
    List<ChangeEvent> listChangeEvents(long candidateId);

    /**
     * Returns events detected at or after {@code since}, newest first, at most {@code limit}.
     */
    List<ChangeEvent> listChangeEventsSince(Instant since, int limit);

    // ── Snapshots ───────────────────────────────────────────────

    Optional<Snapshot> getLatestSnapshot(long candidateId);

    Snapshot appendSnapshot(Snapshot snapshot);

    int countSnapshots(long candidateId);
}
