package com.event.reconciliation.lock;

/**
 * Configuration for lock acquisition.
 *
 * @param timeoutMs    how long each attempt waits for the lock, 0 to fail immediately
 * @param maxRetries   additional attempts after the first
 * @param retryDelayMs pause between attempts in milliseconds
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs) {

    public LockConfig {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s wait, no retries, 100ms delay.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 0, 100);
    }

    /**
     * Gives up at once if another pass holds the lock.
     */
    public static LockConfig failFast() {
        return new LockConfig(0, 0, 100);
    }
}
