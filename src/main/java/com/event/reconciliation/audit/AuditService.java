package com.event.reconciliation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records sync decisions (creates, updates, ambiguous matches, pass outcomes) for human review.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository(), Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for request {} by {}",
                entry.action(), entry.requestId(), entry.actorId());
        return entry;
    }

    /**
     * Records an entry stamped with the service clock.
     */
    public AuditEntry record(AuditAction action, String requestId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .requestId(requestId)
                .actorId(actorId)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    public AuditEntry record(AuditAction action, String requestId, String actorId) {
        return record(action, requestId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForRequest(String requestId) {
        return repository.findByRequestId(requestId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
