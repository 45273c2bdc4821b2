package com.product.curation.store;

/**
 * Raised when the candidate store cannot complete an operation.
 * A fatal failure means the store itself is unavailable and the current pass must abort;
 * a non-fatal failure concerns only the unit of work that triggered it.
 */
public class StoreException extends RuntimeException {

    private final boolean fatal;

    public StoreException(String message, boolean fatal) {
        super(message);
        this.fatal = fatal;
    }

    public StoreException(String message, boolean fatal, Throwable cause) {
        super(message, cause);
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
