package com.event.reconciliation.lock;

/**
 * Thrown when the sync lock cannot be acquired, meaning another sync pass is in progress.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
