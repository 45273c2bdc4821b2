package com.product.curation.lock;

/**
 * Lets every pass through. For callers that serialize passes themselves.
 */
public class NoOpPassLock implements PassLock {

    @Override
    public void acquire(String passName) {
    }

    @Override
    public void release(String passName) {
    }
}
