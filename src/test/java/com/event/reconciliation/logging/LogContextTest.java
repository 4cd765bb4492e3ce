package com.event.reconciliation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forSyncPass should set syncId and operation in MDC")
    void forSyncPassSetsMDC() {
        try (LogContext ctx = LogContext.forSyncPass("sync-123")) {
            assertEquals("sync-123", MDC.get("syncId"));
            assertEquals("sync", MDC.get("operation"));
        }
        assertNull(MDC.get("syncId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forRow should tolerate a missing row id")
    void forRowSetsMDC() {
        try (LogContext ctx = LogContext.forRow(null)) {
            assertEquals("", MDC.get("externalRowId"));
        }
        assertNull(MDC.get("externalRowId"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forSyncPass("sync-123").with("feed", "csv:intake.csv")) {
            assertEquals("csv:intake.csv", MDC.get("feed"));
        }
        assertNull(MDC.get("feed"));
    }

    @Test
    @DisplayName("Closing a row context keeps the pass context")
    void nestedContexts() {
        try (LogContext pass = LogContext.forSyncPass("outer")) {
            try (LogContext row = LogContext.forRow("7")) {
                assertEquals("7", MDC.get("externalRowId"));
                assertEquals("outer", MDC.get("syncId"));
            }
            assertNull(MDC.get("externalRowId"));
            assertEquals("outer", MDC.get("syncId"));
        }
        assertNull(MDC.get("syncId"));
    }

    @Test
    @DisplayName("generateSyncId should return unique UUIDs")
    void generateSyncIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateSyncId());
        }
        assertEquals(100, ids.size());
        assertTrue(LogContext.generateSyncId()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
