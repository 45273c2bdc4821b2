package com.product.curation.tracing;

/**
 * A traced unit of work; closing it ends the span.
 *
 * <pre>
 * try (Span span = tracing.startSpan("curation.run")) {
 *     span.setAttribute("candidates", count);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void markOk();

    /**
     * Records the failure on the span and flags it as errored.
     */
    void markError(Throwable t);

    @Override
    void close();
}
