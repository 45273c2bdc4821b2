package com.product.curation.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for curation passes. Closing a context restores whatever the
 * keys held before it was opened, so contexts nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCuration(passId)) {
 *     log.info("curation.scored candidateId={} score={}", id, score);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forCuration(String passId) {
        LogContext ctx = new LogContext();
        ctx.put("passId", passId);
        ctx.put("operation", "curation");
        return ctx;
    }

    public static LogContext forUpdateCheck(String passId) {
        LogContext ctx = new LogContext();
        ctx.put("passId", passId);
        ctx.put("operation", "update-check");
        return ctx;
    }

    /**
     * Context for folding a duplicate group into its canonical candidate.
     */
    public static LogContext forMerge(String passId, long canonicalId) {
        LogContext ctx = new LogContext();
        ctx.put("passId", passId);
        ctx.put("canonicalId", Long.toString(canonicalId));
        ctx.put("operation", "merge");
        return ctx;
    }

    public static LogContext forCandidate(long candidateId) {
        LogContext ctx = new LogContext();
        ctx.put("candidateId", Long.toString(candidateId));
        return ctx;
    }

    public static String generatePassId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
