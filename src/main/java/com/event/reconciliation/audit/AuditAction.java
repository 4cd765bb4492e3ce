package com.event.reconciliation.audit;

/**
 * Types of auditable actions performed by the intake sync.
 */
public enum AuditAction {
    SYNC_STARTED,
    SYNC_COMPLETED,
    SYNC_FAILED,
    EVENT_REQUEST_CREATED,
    EVENT_REQUEST_UPDATED,
    AMBIGUOUS_MATCH,
    ROW_FAILED
}
