package com.event.reconciliation.matching;

import com.event.reconciliation.core.model.MatchTier;
import com.event.reconciliation.core.model.NormalizedRow;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tier 2: same email, same event date, and submission timestamps no further apart than the
 * tolerance (inclusive, symmetric).
 */
public class ExactCompositeMatchStrategy implements MatchStrategy {

    private final Duration tolerance;

    public ExactCompositeMatchStrategy(Duration tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance is required");
    }

    @Override
    public MatchTier tier() {
        return MatchTier.EXACT;
    }

    @Override
    public boolean matches(NormalizedRow row, SnapshotEntry candidate) {
        if (row.email().isEmpty() || !row.email().equals(candidate.email())) {
            return false;
        }
        if (!MatchStrategy.sameEventDate(row.desiredEventDate(), candidate.desiredEventDate())) {
            return false;
        }
        if (row.submittedAt().isEmpty() || candidate.submittedAt().isEmpty()) {
            return false;
        }
        return withinTolerance(row.submittedAt().get(), candidate.submittedAt().get());
    }

    private boolean withinTolerance(Instant a, Instant b) {
        return Duration.between(a, b).abs().compareTo(tolerance) <= 0;
    }
}
