package com.event.reconciliation.sync;

/**
 * A sync pass aborted before applying any change, because the feed or the store could not be read.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
