package com.event.reconciliation.matching;

import com.event.reconciliation.core.model.MatchTier;
import com.event.reconciliation.core.model.NormalizedRow;

/**
 * Tier 1: the row is already linked to the record, by feed row id or by stable external id.
 * Content fields are deliberately not consulted, so an edited row still resolves to its record.
 */
public class ExternalIdMatchStrategy implements MatchStrategy {

    @Override
    public MatchTier tier() {
        return MatchTier.ID;
    }

    @Override
    public boolean matches(NormalizedRow row, SnapshotEntry candidate) {
        boolean rowIdMatch = row.externalRowId().isPresent()
                && row.externalRowId().equals(candidate.externalRowId());
        boolean externalIdMatch = row.externalId().isPresent()
                && row.externalId().equals(candidate.externalId());
        return rowIdMatch || externalIdMatch;
    }
}
