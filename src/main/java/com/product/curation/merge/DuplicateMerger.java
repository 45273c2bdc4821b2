package com.product.curation.merge;

import com.product.curation.core.model.Candidate;
import com.product.curation.logging.LogContext;
import com.product.curation.metrics.CurationMetrics;
import com.product.curation.metrics.NoOpCurationMetrics;
import com.product.curation.store.CandidateStore;
import com.product.curation.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds each duplicate group into its canonical candidate.
 *
 * <p>For every duplicate, claims and raw mentions are re-parented to the canonical candidate
 * and the duplicate is deleted. A group commits as a whole: if any write fails, the writes
 * already made for that group are undone and a failed {@link GroupMergeResult} is returned.
 * Other groups are unaffected. A fatal {@link StoreException} is rethrown after rollback.</p>
 */
public class DuplicateMerger {
    private static final Logger log = LoggerFactory.getLogger(DuplicateMerger.class);

    private final CandidateStore store;
    private final CurationMetrics metrics;

    public DuplicateMerger(CandidateStore store) {
        this(store, new NoOpCurationMetrics());
    }

    public DuplicateMerger(CandidateStore store, CurationMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public List<GroupMergeResult> mergeAll(List<DuplicateGroup> groups, String passId) {
        List<GroupMergeResult> results = new ArrayList<>(groups.size());
        for (DuplicateGroup group : groups) {
            results.add(merge(group, passId));
        }
        return results;
    }

    public GroupMergeResult merge(DuplicateGroup group) {
        return merge(group, LogContext.generatePassId());
    }

    public GroupMergeResult merge(DuplicateGroup group, String passId) {
        long canonicalId = group.canonical().getId();
        try (LogContext ctx = LogContext.forMerge(passId, canonicalId)) {
            log.info("merge.starting canonicalId={} duplicateIds={}", canonicalId, group.duplicateIds());

            try (GroupMergeTransaction tx = new GroupMergeTransaction(canonicalId)) {
                int claimsMoved = 0;
                int mentionsMoved = 0;
                for (DuplicateMatch match : group.duplicates()) {
                    long duplicateId = match.candidate().getId();

                    List<Long> claimIds = tx.execute("reparent claims of " + duplicateId,
                            () -> store.reparentClaims(duplicateId, canonicalId),
                            moved -> store.assignClaims(moved, duplicateId));
                    claimsMoved += claimIds.size();

                    List<Long> mentionIds = tx.execute("reparent mentions of " + duplicateId,
                            () -> store.reparentMentions(duplicateId, canonicalId),
                            moved -> store.assignMentions(moved, duplicateId));
                    mentionsMoved += mentionIds.size();

                    // Undo order matters: the duplicate is restored before its claims move back.
                    tx.execute("delete duplicate " + duplicateId,
                            () -> store.deleteCandidate(duplicateId),
                            (Candidate deleted) -> store.restoreCandidate(deleted));
                }
                tx.commit();

                metrics.incrementDuplicatesMerged(group.duplicates().size());
                log.info("merge.completed canonicalId={} merged={} claimsMoved={} mentionsMoved={}",
                        canonicalId, group.duplicates().size(), claimsMoved, mentionsMoved);
                return GroupMergeResult.success(canonicalId, group.duplicateIds(), claimsMoved, mentionsMoved);
            } catch (StoreException e) {
                metrics.incrementMergeFailure();
                if (e.isFatal()) {
                    log.error("merge.aborted canonicalId={} error={}", canonicalId, e.getMessage());
                    throw e;
                }
                log.error("merge.failed canonicalId={} error={}", canonicalId, e.getMessage());
                return GroupMergeResult.failure(canonicalId, "Merge failed: " + e.getMessage());
            } catch (RuntimeException e) {
                metrics.incrementMergeFailure();
                log.error("merge.failed canonicalId={} error={}", canonicalId, e.getMessage());
                return GroupMergeResult.failure(canonicalId, "Merge failed: " + e.getMessage());
            }
        }
    }
}
