package com.product.curation.lock;

/**
 * Serializes whole passes (curation, update check) that must not overlap.
 */
public interface PassLock {

    /**
     * Blocks until the named pass lock is held by the calling thread.
     *
     * @throws PassLockException if the lock is not obtained within the configured timeout
     */
    void acquire(String passName);

    /**
     * Releases the named pass lock if the calling thread holds it.
     */
    void release(String passName);
}
