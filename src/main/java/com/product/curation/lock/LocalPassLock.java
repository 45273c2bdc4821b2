package com.product.curation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link PassLock} for a single JVM, one {@link ReentrantLock} per pass name.
 */
public class LocalPassLock implements PassLock {
    private static final Logger log = LoggerFactory.getLogger(LocalPassLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public LocalPassLock(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeout = timeout;
    }

    @Override
    public void acquire(String passName) {
        ReentrantLock lock = locks.computeIfAbsent(passName, k -> new ReentrantLock());
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new PassLockException(
                        "Pass '" + passName + "' is already running; gave up after " + timeout.toMillis() + "ms");
            }
            log.debug("Pass lock acquired: {}", passName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PassLockException("Interrupted while waiting for pass lock: " + passName, e);
        }
    }

    @Override
    public void release(String passName) {
        ReentrantLock lock = locks.get(passName);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Pass lock released: {}", passName);
        }
    }
}
