package com.product.curation.lock;

/**
 * Thrown when a pass lock cannot be obtained within its timeout.
 */
public class PassLockException extends RuntimeException {

    public PassLockException(String message) {
        super(message);
    }

    public PassLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
