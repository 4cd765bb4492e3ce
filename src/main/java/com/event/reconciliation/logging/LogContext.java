package com.event.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper: keys added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSyncPass(syncId)) {
 *     log.info("sync.started rows={}", rows.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one whole sync pass.
     */
    public static LogContext forSyncPass(String syncId) {
        LogContext ctx = new LogContext();
        ctx.put("syncId", syncId);
        ctx.put("operation", "sync");
        return ctx;
    }

    /**
     * Context for one row within a pass; nest inside {@link #forSyncPass(String)}.
     */
    public static LogContext forRow(String externalRowId) {
        LogContext ctx = new LogContext();
        ctx.put("externalRowId", externalRowId != null ? externalRowId : "");
        return ctx;
    }

    public static String generateSyncId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
