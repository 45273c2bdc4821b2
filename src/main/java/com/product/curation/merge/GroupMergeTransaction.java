package com.product.curation.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Makes the store writes of one duplicate-group merge all-or-nothing.
 *
 * <p>Every step registers an undo action fed with the step's own result. Undo actions run
 * newest first when a step throws, or when the transaction closes without
 * {@link #commit()}.</p>
 *
 * <pre>
 * try (GroupMergeTransaction tx = new GroupMergeTransaction(canonicalId)) {
 *     List&lt;Long&gt; moved = tx.execute("reparent claims",
 *             () -&gt; store.reparentClaims(dupId, canonicalId),
 *             ids -&gt; store.assignClaims(ids, dupId));
 *     tx.execute("delete duplicate", () -&gt; store.deleteCandidate(dupId), store::restoreCandidate);
 *     tx.commit();
 * }
 * </pre>
 */
public class GroupMergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GroupMergeTransaction.class);

    private final long canonicalId;
    private final Deque<UndoAction> undoStack = new ArrayDeque<>();
    private boolean committed = false;
    private boolean closed = false;

    public GroupMergeTransaction(long canonicalId) {
        this.canonicalId = canonicalId;
    }

    /**
     * Runs one step and remembers how to undo it.
     *
     * @param description step name for logs
     * @param step        the write to perform
     * @param undo        reverses the write, given the value the step returned
     * @return the value returned by {@code step}
     * @throws RuntimeException the step's failure, rethrown after every earlier step was undone
     */
    public <T> T execute(String description, Supplier<T> step, Consumer<T> undo) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        try {
            log.debug("merge.step canonicalId={} step='{}'", canonicalId, description);
            T result = step.get();
            undoStack.push(new UndoAction(description, () -> undo.accept(result)));
            return result;
        } catch (RuntimeException e) {
            log.warn("merge.step.failed canonicalId={} step='{}' error={}", canonicalId, description, e.getMessage());
            rollback();
            throw e;
        }
    }

    /**
     * Number of steps that would be undone on rollback.
     */
    public int pendingSteps() {
        return undoStack.size();
    }

    public void commit() {
        this.committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (!closed && !committed) {
            log.warn("merge.rollback canonicalId={} steps={}", canonicalId, undoStack.size());
            rollback();
        }
        closed = true;
    }

    private void rollback() {
        while (!undoStack.isEmpty()) {
            UndoAction action = undoStack.pop();
            try {
                log.debug("merge.undo canonicalId={} step='{}'", canonicalId, action.description());
                action.undo().run();
            } catch (RuntimeException e) {
                // Keep undoing the remaining steps.
                log.error("merge.undo.failed canonicalId={} step='{}' error={}",
                        canonicalId, action.description(), e.getMessage(), e);
            }
        }
    }

    private record UndoAction(String description, Runnable undo) {}
}
