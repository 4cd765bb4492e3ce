package com.event.reconciliation.sync;

/**
 * Callback for tracking progress of a sync pass.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed rows processed so far
     * @param total     total rows in this pass
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
