package com.event.reconciliation.metrics;

import com.event.reconciliation.core.model.MatchTier;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSyncDuration(boolean success, Duration duration) {
    }

    @Override
    public void recordMatch(MatchTier tier) {
    }

    @Override
    public void incrementCreated() {
    }

    @Override
    public void incrementUpdated() {
    }

    @Override
    public void incrementRowError() {
    }

    @Override
    public void incrementAmbiguousMatch() {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
