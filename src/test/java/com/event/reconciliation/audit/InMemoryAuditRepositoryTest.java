package com.event.reconciliation.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAuditRepositoryTest {

    private InMemoryAuditRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditRepository();
    }

    private static AuditEntry entry(AuditAction action, String requestId, Instant timestamp) {
        return AuditEntry.builder()
                .action(action)
                .requestId(requestId)
                .actorId("intake_sync")
                .timestamp(timestamp)
                .build();
    }

    @Test
    @DisplayName("Should save and count entries")
    void testSaveAndCount() {
        AuditEntry saved = repository.save(entry(AuditAction.SYNC_STARTED, null, Instant.now()));

        assertEquals(1, repository.count());
        assertSame(saved, repository.findAll().get(0));
    }

    @Test
    @DisplayName("findAll returns an unmodifiable copy")
    void testFindAllUnmodifiable() {
        repository.save(entry(AuditAction.SYNC_STARTED, null, Instant.now()));
        List<AuditEntry> all = repository.findAll();

        assertThrows(UnsupportedOperationException.class, () -> all.clear());
        assertEquals(1, repository.count());
    }

    @Test
    @DisplayName("Should find entries between two instants inclusive")
    void testFindBetween() {
        Instant t1 = Instant.parse("2025-10-01T10:00:00Z");
        Instant t2 = Instant.parse("2025-10-01T11:00:00Z");
        Instant t3 = Instant.parse("2025-10-01T12:00:00Z");
        repository.save(entry(AuditAction.EVENT_REQUEST_CREATED, "a", t1));
        repository.save(entry(AuditAction.EVENT_REQUEST_CREATED, "b", t2));
        repository.save(entry(AuditAction.EVENT_REQUEST_CREATED, "c", t3));

        List<AuditEntry> found = repository.findBetween(t1, t2);
        assertEquals(2, found.size());
        assertEquals("a", found.get(0).requestId());
        assertEquals("b", found.get(1).requestId());
    }

    @Test
    @DisplayName("findByRequestId skips pass-level entries without a request")
    void testFindByRequestIdWithNulls() {
        repository.save(entry(AuditAction.SYNC_STARTED, null, Instant.now()));
        repository.save(entry(AuditAction.EVENT_REQUEST_UPDATED, "a", Instant.now()));

        assertEquals(1, repository.findByRequestId("a").size());
    }

    @Test
    @DisplayName("findRecent returns everything when under the limit")
    void testFindRecentUnderLimit() {
        repository.save(entry(AuditAction.SYNC_STARTED, null, Instant.now()));

        assertEquals(1, repository.findRecent(10).size());
    }

    @Test
    @DisplayName("Entry requires an action")
    void testEntryRequiresAction() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().actorId("sys").build());
    }
}
