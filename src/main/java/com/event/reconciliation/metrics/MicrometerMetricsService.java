package com.event.reconciliation.metrics;

import com.event.reconciliation.core.model.MatchTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code event.sync.duration}: Timer (tag: outcome)</li>
 *   <li>{@code event.sync.match}: Counter (tag: tier)</li>
 *   <li>{@code event.sync.created}: Counter</li>
 *   <li>{@code event.sync.updated}: Counter</li>
 *   <li>{@code event.sync.row.error}: Counter</li>
 *   <li>{@code event.sync.ambiguous}: Counter</li>
 *   <li>{@code event.sync.similarity.score}: DistributionSummary</li>
 *   <li>{@code event.sync.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer successTimer;
    private final Timer failureTimer;
    private final Map<MatchTier, Counter> matchCounters = new EnumMap<>(MatchTier.class);
    private final Counter createdCounter;
    private final Counter updatedCounter;
    private final Counter rowErrorCounter;
    private final Counter ambiguousCounter;
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.successTimer = syncTimer(registry, "success");
        this.failureTimer = syncTimer(registry, "failure");
        for (MatchTier tier : MatchTier.values()) {
            matchCounters.put(tier, Counter.builder("event.sync.match")
                    .description("Incoming rows by matching tier")
                    .tag("tier", tier.name())
                    .register(registry));
        }
        this.createdCounter = Counter.builder("event.sync.created")
                .description("Event requests created by the sync")
                .register(registry);
        this.updatedCounter = Counter.builder("event.sync.updated")
                .description("Event requests updated by the sync")
                .register(registry);
        this.rowErrorCounter = Counter.builder("event.sync.row.error")
                .description("Rows that failed to persist")
                .register(registry);
        this.ambiguousCounter = Counter.builder("event.sync.ambiguous")
                .description("Rows matching more than one record in the winning tier")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("event.sync.similarity.score")
                .description("Organization similarity of fuzzy matches")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("event.sync.batch.size")
                .description("Rows read per sync pass")
                .register(registry);
    }

    private static Timer syncTimer(MeterRegistry registry, String outcome) {
        return Timer.builder("event.sync.duration")
                .description("Duration of sync passes")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordSyncDuration(boolean success, Duration duration) {
        (success ? successTimer : failureTimer).record(duration);
    }

    @Override
    public void recordMatch(MatchTier tier) {
        matchCounters.get(tier).increment();
    }

    @Override
    public void incrementCreated() {
        createdCounter.increment();
    }

    @Override
    public void incrementUpdated() {
        updatedCounter.increment();
    }

    @Override
    public void incrementRowError() {
        rowErrorCounter.increment();
    }

    @Override
    public void incrementAmbiguousMatch() {
        ambiguousCounter.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
