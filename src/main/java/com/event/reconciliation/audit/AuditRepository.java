package com.event.reconciliation.audit;

import java.time.Instant;
import java.util.List;

/**
 * Storage for audit entries. Implementations are append-only.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByRequestId(String requestId);

    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Entries with {@code start <= timestamp <= end}.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * The most recent entries in insertion order, at most {@code limit}.
     */
    List<AuditEntry> findRecent(int limit);
}
