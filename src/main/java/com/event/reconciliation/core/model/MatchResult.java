package com.event.reconciliation.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of matching one incoming row against the existing records.
 * Either no match, or exactly one matched record plus the tier that produced it.
 *
 * @param matched                the matched record, null for no match
 * @param tier                   the tier that produced the match, {@link MatchTier#NONE} otherwise
 * @param organizationSimilarity organization similarity for fuzzy tiers, 0.0 otherwise
 * @param otherCandidateIds      ids of further records that satisfied the same tier (data-quality signal)
 */
public record MatchResult(
        ExistingEventRequest matched,
        MatchTier tier,
        double organizationSimilarity,
        List<String> otherCandidateIds
) {
    public MatchResult {
        Objects.requireNonNull(tier, "tier is required");
        if (organizationSimilarity < 0.0 || organizationSimilarity > 1.0) {
            throw new IllegalArgumentException("organizationSimilarity must be between 0.0 and 1.0");
        }
        if ((matched == null) != (tier == MatchTier.NONE)) {
            throw new IllegalArgumentException("A matched record requires a tier other than NONE");
        }
        otherCandidateIds = otherCandidateIds != null ? List.copyOf(otherCandidateIds) : List.of();
    }

    /**
     * Creates a no-match result.
     */
    public static MatchResult noMatch() {
        return new MatchResult(null, MatchTier.NONE, 0.0, List.of());
    }

    /**
     * Creates a result for an exact tier (ID or EXACT).
     */
    public static MatchResult of(ExistingEventRequest matched, MatchTier tier) {
        return new MatchResult(matched, tier, 0.0, List.of());
    }

    public boolean hasMatch() {
        return matched != null;
    }

    public Optional<String> matchedId() {
        return matched != null ? Optional.of(matched.getId()) : Optional.empty();
    }

    /**
     * Returns true if more than one record satisfied the winning tier.
     */
    public boolean isAmbiguous() {
        return !otherCandidateIds.isEmpty();
    }

    /**
     * Note written into the record's audit/notes field for human review.
     */
    public String auditNote() {
        if (!hasMatch()) {
            return "Sync: no existing match, created new request";
        }
        StringBuilder note = new StringBuilder("Sync: matched via ").append(tier.label());
        if (tier.isFuzzy()) {
            note.append(String.format(Locale.ROOT, " (%.0f%% organization similarity)", organizationSimilarity * 100));
        }
        if (isAmbiguous()) {
            note.append("; also matched ").append(String.join(", ", otherCandidateIds));
        }
        return note.toString();
    }
}
