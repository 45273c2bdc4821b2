package com.product.curation.tracing;

import java.util.Map;

/**
 * Starts spans for curation passes. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    Span startSpan(String operationName, Map<String, String> attributes);
}
