package com.resource.guard.tracing;

import java.util.Map;

/**
 * Entry point for distributed tracing. {@link NoOpTracingService} is the default;
 * {@link OpenTelemetryTracingService} bridges to an OpenTelemetry {@code Tracer}.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
