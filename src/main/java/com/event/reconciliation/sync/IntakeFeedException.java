package com.event.reconciliation.sync;

/**
 * Thrown when an intake feed cannot be read or parsed.
 */
public class IntakeFeedException extends RuntimeException {

    public IntakeFeedException(String message) {
        super(message);
    }

    public IntakeFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
