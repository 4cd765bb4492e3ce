package com.event.reconciliation.sync;

import com.event.reconciliation.audit.AuditAction;
import com.event.reconciliation.audit.AuditService;
import com.event.reconciliation.core.model.ExistingEventRequest;
import com.event.reconciliation.core.model.IncomingRow;
import com.event.reconciliation.core.model.MatchResult;
import com.event.reconciliation.core.model.MatchTier;
import com.event.reconciliation.core.model.NormalizedRow;
import com.event.reconciliation.lock.DistributedLock;
import com.event.reconciliation.lock.LocalDistributedLock;
import com.event.reconciliation.lock.LockAcquisitionException;
import com.event.reconciliation.lock.LockConfig;
import com.event.reconciliation.logging.LogContext;
import com.event.reconciliation.matching.CandidateMatcher;
import com.event.reconciliation.matching.EventRequestSnapshot;
import com.event.reconciliation.metrics.MetricsService;
import com.event.reconciliation.metrics.NoOpMetricsService;
import com.event.reconciliation.rules.IntakeDateParser;
import com.event.reconciliation.rules.RowNormalizer;
import com.event.reconciliation.tracing.Span;
import com.event.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs sync passes that fold the intake feed into the event-request store.
 *
 * <p>A pass holds the sync lock for its whole duration, so at most one pass is in flight.
 * It reads the feed and all existing records once, then processes rows sequentially:
 * each row is normalized, matched against the snapshot, and either creates a new record
 * or updates the matched one. Updated records replace their snapshot entry; created records
 * are appended to it when {@link SyncOptions#isAppendCreatedToSnapshot()} is set.</p>
 *
 * <p>If the feed or the store cannot be read the pass aborts with a {@link SyncException}
 * before any write. A failure while applying a single row is recorded in
 * {@link SyncResult#errors()} and the pass continues.</p>
 *
 * <pre>
 * EventRequestSyncService sync = EventRequestSyncService.builder()
 *         .feed(CsvIntakeFeed.fromPath(path))
 *         .store(store)
 *         .build();
 * SyncResult result = sync.sync();
 * </pre>
 */
public class EventRequestSyncService {
    private static final Logger log = LoggerFactory.getLogger(EventRequestSyncService.class);

    static final String SPAN_NAME = "event-request.sync";

    private final IntakeFeed feed;
    private final EventRequestStore store;
    private final RowNormalizer normalizer;
    private final CandidateMatcher matcher;
    private final ExternalIdGenerator externalIdGenerator;
    private final EventRequestMapper mapper;
    private final DistributedLock lock;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final SyncOptions options;
    private final Clock clock;

    private EventRequestSyncService(Builder builder) {
        this.feed = Objects.requireNonNull(builder.feed, "feed is required");
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.clock = builder.clock;
        this.normalizer = builder.normalizer != null
                ? builder.normalizer
                : new RowNormalizer(new IntakeDateParser(builder.zone));
        this.matcher = builder.matcher != null ? builder.matcher : new CandidateMatcher();
        this.externalIdGenerator = new ExternalIdGenerator();
        this.mapper = new EventRequestMapper(clock, new StatusResolver(clock, builder.zone));
        this.lock = builder.lock != null ? builder.lock : new LocalDistributedLock(LockConfig.failFast());
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : TracingService.NOOP;
        this.options = builder.options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SyncOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    /**
     * Runs one sync pass without progress reporting.
     */
    public SyncResult sync() {
        return sync(ProgressCallback.NOOP);
    }

    /**
     * Runs one sync pass.
     *
     * @throws LockAcquisitionException if another pass holds the sync lock
     * @throws SyncException            if the feed or the existing records cannot be read
     */
    public SyncResult sync(ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String lockKey = options.getLockKey();
        if (!lock.tryLock(lockKey)) {
            throw new LockAcquisitionException("Sync already in progress for key: " + lockKey);
        }
        String syncId = LogContext.generateSyncId();
        Instant start = clock.instant();
        long startNanos = System.nanoTime();
        try (LogContext ctx = LogContext.forSyncPass(syncId).with("feed", feed.getName());
             Span span = tracingService.startSpan(SPAN_NAME, Map.of("syncId", syncId, "feed", feed.getName()))) {
            auditService.record(AuditAction.SYNC_STARTED, null, options.getActorId(),
                    Map.of("syncId", syncId, "feed", feed.getName()));
            log.info("sync.started syncId={} feed={}", syncId, feed.getName());

            List<IncomingRow> rows;
            EventRequestSnapshot snapshot;
            try {
                rows = feed.readRows();
                snapshot = EventRequestSnapshot.of(store.findAll());
            } catch (RuntimeException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                metricsService.recordSyncDuration(false, elapsed);
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                auditService.record(AuditAction.SYNC_FAILED, null, options.getActorId(),
                        Map.of("syncId", syncId, "error", String.valueOf(e.getMessage())));
                log.error("sync.failed syncId={} error={}", syncId, e.getMessage(), e);
                throw new SyncException("Sync pass aborted before applying changes: " + e.getMessage(), e);
            }

            metricsService.recordBatchSize(rows.size());
            span.setAttribute("rows", rows.size());
            span.setAttribute("existing", snapshot.size());

            SyncResult result = processRows(syncId, rows, snapshot, cb, start);

            metricsService.recordSyncDuration(true, Duration.ofNanos(System.nanoTime() - startNanos));
            span.setAttribute("created", result.created());
            span.setAttribute("updated", result.updated());
            span.setAttribute("errors", result.errorCount());
            span.setStatus(Span.SpanStatus.OK);

            Map<String, Object> details = new HashMap<>();
            details.put("syncId", syncId);
            details.put("rows", result.totalRows());
            details.put("created", result.created());
            details.put("updated", result.updated());
            details.put("errors", result.errorCount());
            auditService.record(AuditAction.SYNC_COMPLETED, null, options.getActorId(), details);
            cb.onProgress(result.totalRows(), result.totalRows(), "Sync completed");
            log.info("sync.completed result={}", result);
            return result;
        } finally {
            lock.unlock(lockKey);
        }
    }

    private SyncResult processRows(String syncId, List<IncomingRow> rows, EventRequestSnapshot initial,
                                   ProgressCallback cb, Instant start) {
        EventRequestSnapshot snapshot = initial;
        Map<MatchTier, Long> tierCounts = new EnumMap<>(MatchTier.class);
        List<SyncResult.RowError> errors = new ArrayList<>();
        long created = 0;
        long updated = 0;
        long ambiguous = 0;
        long processed = 0;

        for (IncomingRow raw : rows) {
            processed++;
            String rowId = "";
            try {
                rowId = rowIdOf(raw);
                try (LogContext rowCtx = LogContext.forRow(rowId)) {
                    IncomingRow row = externalIdGenerator.ensureExternalId(raw);
                    NormalizedRow normalized = normalizer.normalize(row);
                    MatchResult match = matcher.match(normalized, snapshot);

                    metricsService.recordMatch(match.tier());
                    if (match.tier().isFuzzy()) {
                        metricsService.recordSimilarityScore(match.organizationSimilarity());
                    }
                    tierCounts.merge(match.tier(), 1L, Long::sum);

                    if (match.isAmbiguous()) {
                        ambiguous++;
                        reportAmbiguity(rowId, match);
                    }

                    if (match.hasMatch()) {
                        ExistingEventRequest merged = mapper.merge(match.matched(), normalized, match,
                                options.getMergePolicy());
                        ExistingEventRequest saved = store.update(merged);
                        snapshot = snapshot.withReplaced(saved);
                        updated++;
                        metricsService.incrementUpdated();
                        auditService.record(AuditAction.EVENT_REQUEST_UPDATED, saved.getId(), options.getActorId(),
                                rowDetails(syncId, rowId, match));
                        log.debug("sync.row.updated requestId={} tier={}", saved.getId(), match.tier());
                    } else {
                        ExistingEventRequest saved = store.create(mapper.toNewRequest(normalized, options.getActorId()));
                        if (options.isAppendCreatedToSnapshot()) {
                            snapshot = snapshot.withAdded(saved);
                        }
                        created++;
                        metricsService.incrementCreated();
                        auditService.record(AuditAction.EVENT_REQUEST_CREATED, saved.getId(), options.getActorId(),
                                rowDetails(syncId, rowId, match));
                        log.debug("sync.row.created requestId={} status={}", saved.getId(), saved.getStatus());
                    }
                }
            } catch (RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                errors.add(new SyncResult.RowError(processed, rowId, message));
                metricsService.incrementRowError();
                auditService.record(AuditAction.ROW_FAILED, null, options.getActorId(),
                        Map.of("syncId", syncId, "externalRowId", rowId, "error", message));
                log.warn("sync.row.error row={} externalRowId={} error={}", processed, rowId, message);
            }

            if (processed % options.getProgressInterval() == 0) {
                cb.onProgress(processed, rows.size(), "Processed " + processed + " rows");
            }
        }

        return new SyncResult(syncId, rows.size(), created, updated, ambiguous, tierCounts, errors,
                Duration.between(start, clock.instant()));
    }

    private static String rowIdOf(IncomingRow row) {
        Objects.requireNonNull(row, "feed returned a null row");
        return row.externalRowId() != null ? row.externalRowId().trim() : "";
    }

    private void reportAmbiguity(String rowId, MatchResult match) {
        metricsService.incrementAmbiguousMatch();
        log.warn("sync.match.ambiguous externalRowId={} tier={} chosen={} others={}",
                rowId, match.tier(), match.matchedId().orElse(""), match.otherCandidateIds());
        auditService.record(AuditAction.AMBIGUOUS_MATCH, match.matchedId().orElse(null), options.getActorId(),
                Map.of("externalRowId", rowId,
                        "tier", match.tier().label(),
                        "otherCandidateIds", match.otherCandidateIds()));
    }

    private static Map<String, Object> rowDetails(String syncId, String rowId, MatchResult match) {
        Map<String, Object> details = new HashMap<>();
        details.put("syncId", syncId);
        details.put("externalRowId", rowId);
        details.put("tier", match.tier().label());
        if (match.tier().isFuzzy()) {
            details.put("organizationSimilarity", match.organizationSimilarity());
        }
        return details;
    }

    public static class Builder {
        private IntakeFeed feed;
        private EventRequestStore store;
        private RowNormalizer normalizer;
        private CandidateMatcher matcher;
        private DistributedLock lock;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private SyncOptions options = SyncOptions.defaults();
        private Clock clock = Clock.systemUTC();
        private ZoneId zone = ZoneOffset.UTC;

        public Builder feed(IntakeFeed feed) {
            this.feed = feed;
            return this;
        }

        public Builder store(EventRequestStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets a custom normalizer; otherwise one is built for the configured zone.
         */
        public Builder normalizer(RowNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder matcher(CandidateMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        /**
         * Sets the single-flight lock. Defaults to a fail-fast in-process lock.
         */
        public Builder lock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder options(SyncOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        /**
         * Zone used to interpret zone-less feed dates and to decide which event dates lie in the past.
         */
        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone is required");
            return this;
        }

        public EventRequestSyncService build() {
            return new EventRequestSyncService(this);
        }
    }
}
