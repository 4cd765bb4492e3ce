package com.event.reconciliation.tracing;

/**
 * Timing and outcome of one traced piece of sync work, normally a whole pass
 * ({@code event-request.sync}). Closing the span ends it, so a pass opens it with try-with-resources.
 */
public interface Span extends AutoCloseable {

    /**
     * Span that records nothing, handed out by {@link TracingService#NOOP}.
     */
    Span NOOP = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    void setAttribute(String key, String value);

    /**
     * Numeric attribute, used for the pass counters (rows, existing, created, updated, errors).
     */
    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    /**
     * Attaches the failure that aborted the pass.
     */
    void recordException(Throwable t);

    @Override
    void close();

    /**
     * OK for a pass that ran to completion, ERROR for one aborted before applying rows.
     */
    enum SpanStatus { OK, ERROR }
}
