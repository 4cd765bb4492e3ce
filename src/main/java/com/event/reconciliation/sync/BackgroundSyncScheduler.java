package com.event.reconciliation.sync;

import com.event.reconciliation.lock.LockAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link EventRequestSyncService#sync()} periodically on a single daemon thread.
 *
 * <p>A pass skipped because another one holds the lock waits for the next tick. A failed pass
 * is logged and does not cancel the schedule.</p>
 */
public class BackgroundSyncScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackgroundSyncScheduler.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

    private final EventRequestSyncService syncService;
    private final Duration interval;
    private final Duration initialDelay;
    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> scheduled;

    public BackgroundSyncScheduler(EventRequestSyncService syncService) {
        this(syncService, DEFAULT_INTERVAL, Duration.ZERO);
    }

    public BackgroundSyncScheduler(EventRequestSyncService syncService, Duration interval, Duration initialDelay) {
        this.syncService = Objects.requireNonNull(syncService, "syncService is required");
        Objects.requireNonNull(interval, "interval is required");
        Objects.requireNonNull(initialDelay, "initialDelay is required");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "event-request-sync");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedules the periodic pass. Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (scheduled != null) {
            log.debug("sync.scheduler.already_started");
            return;
        }
        scheduled = executor.scheduleWithFixedDelay(this::runOnce,
                initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("sync.scheduler.started interval={}s", interval.toSeconds());
    }

    public synchronized boolean isRunning() {
        return scheduled != null;
    }

    /**
     * Cancels the schedule. A pass already in progress is allowed to finish.
     */
    public synchronized void stop() {
        if (scheduled == null) {
            return;
        }
        scheduled.cancel(false);
        scheduled = null;
        log.info("sync.scheduler.stopped");
    }

    void runOnce() {
        try {
            SyncResult result = syncService.sync();
            log.debug("sync.scheduler.pass created={} updated={} errors={}",
                    result.created(), result.updated(), result.errorCount());
        } catch (LockAcquisitionException e) {
            log.debug("sync.scheduler.skipped reason=lock_held");
        } catch (RuntimeException e) {
            log.error("sync.scheduler.pass_failed error={}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
