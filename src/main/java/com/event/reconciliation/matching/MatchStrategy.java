package com.event.reconciliation.matching;

import com.event.reconciliation.core.model.MatchTier;
import com.event.reconciliation.core.model.NormalizedRow;

import java.time.LocalDate;
import java.util.Optional;

/**
 * One tier (or Tier-3 priority) of the matching cascade: a predicate over an incoming row and
 * one existing record. Implementations are stateless and never throw for absent fields; an
 * absent field simply fails the check.
 */
public interface MatchStrategy {

    /**
     * The tier reported when this strategy matches.
     */
    MatchTier tier();

    /**
     * Returns true if the candidate satisfies this strategy for the row.
     */
    boolean matches(NormalizedRow row, SnapshotEntry candidate);

    /**
     * Organization similarity to report for a match, 0.0 for strategies that do not score names.
     */
    default double organizationSimilarity(NormalizedRow row, SnapshotEntry candidate) {
        return 0.0;
    }

    /**
     * Calendar-date equality where an absent date never equals anything, not even another absent date.
     */
    static boolean sameEventDate(Optional<LocalDate> a, Optional<LocalDate> b) {
        return a.isPresent() && b.isPresent() && a.get().equals(b.get());
    }
}
