package com.event.reconciliation.metrics;

import com.event.reconciliation.core.model.MatchTier;

import java.time.Duration;

/**
 * Records intake-sync metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs without a metrics backend.
 */
public interface MetricsService {

    void recordSyncDuration(boolean success, Duration duration);

    void recordMatch(MatchTier tier);

    void incrementCreated();

    void incrementUpdated();

    void incrementRowError();

    void incrementAmbiguousMatch();

    void recordSimilarityScore(double score);

    void recordBatchSize(int size);
}
