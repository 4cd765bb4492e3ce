package com.event.reconciliation.sync;

import com.event.reconciliation.core.model.MatchTier;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one sync pass.
 *
 * @param syncId      id of the pass, also present in the MDC of its log lines
 * @param totalRows   number of rows read from the feed
 * @param created     records created for unmatched rows
 * @param updated     matched records updated
 * @param ambiguous   rows whose winning tier had more than one candidate
 * @param tierCounts  matches per tier, NONE counting the created rows
 * @param errors      rows that failed; the pass continued past them
 * @param duration    wall-clock time of the pass
 */
public record SyncResult(
        String syncId,
        long totalRows,
        long created,
        long updated,
        long ambiguous,
        Map<MatchTier, Long> tierCounts,
        List<RowError> errors,
        Duration duration
) {
    public SyncResult {
        EnumMap<MatchTier, Long> counts = new EnumMap<>(MatchTier.class);
        if (tierCounts != null) {
            counts.putAll(tierCounts);
        }
        tierCounts = Map.copyOf(counts);
        errors = errors != null ? List.copyOf(errors) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public long matchesFor(MatchTier tier) {
        return tierCounts.getOrDefault(tier, 0L);
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be applied.
     *
     * @param rowNumber     1-based position of the row in the feed
     * @param externalRowId the row's external row id, "" when absent
     * @param message       the error message
     */
    public record RowError(long rowNumber, String externalRowId, String message) {}

    @Override
    public String toString() {
        return "SyncResult{syncId=" + syncId +
                ", total=" + totalRows +
                ", created=" + created +
                ", updated=" + updated +
                ", ambiguous=" + ambiguous +
                ", errors=" + errors.size() +
                ", duration=" + duration.toMillis() + "ms}";
    }
}
