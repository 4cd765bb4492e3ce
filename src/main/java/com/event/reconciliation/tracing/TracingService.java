package com.event.reconciliation.tracing;

import java.util.Map;

/**
 * Opens spans around sync passes. {@link #NOOP} is used when no tracer is configured;
 * {@link OpenTelemetryTracingService} exports through the OpenTelemetry API.
 */
public interface TracingService {

    TracingService NOOP = new TracingService() {
        @Override
        public Span startSpan(String operationName) {
            return Span.NOOP;
        }

        @Override
        public Span startSpan(String operationName, Map<String, String> attributes) {
            return Span.NOOP;
        }
    };

    Span startSpan(String operationName);

    /**
     * Opens a span carrying initial attributes, such as the sync id and the feed name.
     */
    Span startSpan(String operationName, Map<String, String> attributes);
}
