package com.event.reconciliation.matching;

import com.event.reconciliation.core.model.MatchTier;
import com.event.reconciliation.core.model.NormalizedRow;
import com.event.reconciliation.rules.RowNormalizer;
import com.event.reconciliation.similarity.SimilarityAlgorithm;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Tier 3: a contact signal (email, phone or full name) plus organization similarity at or above
 * the threshold. Every priority requires the same event date first.
 */
public class FuzzyOrganizationMatchStrategy implements MatchStrategy {

    private final MatchTier tier;
    private final BiPredicate<NormalizedRow, SnapshotEntry> contactMatch;
    private final SimilarityAlgorithm similarity;
    private final double threshold;

    private FuzzyOrganizationMatchStrategy(MatchTier tier,
                                           BiPredicate<NormalizedRow, SnapshotEntry> contactMatch,
                                           SimilarityAlgorithm similarity,
                                           double threshold) {
        this.tier = tier;
        this.contactMatch = contactMatch;
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.threshold = threshold;
    }

    /**
     * Priority 3: same normalized email.
     */
    public static FuzzyOrganizationMatchStrategy byEmail(SimilarityAlgorithm similarity, double threshold) {
        return new FuzzyOrganizationMatchStrategy(MatchTier.FUZZY_EMAIL,
                (row, candidate) -> row.email().isPresent() && row.email().equals(candidate.email()),
                similarity, threshold);
    }

    /**
     * Priority 4a: same digits-only phone.
     */
    public static FuzzyOrganizationMatchStrategy byPhone(SimilarityAlgorithm similarity, double threshold) {
        return new FuzzyOrganizationMatchStrategy(MatchTier.FUZZY_PHONE,
                (row, candidate) -> row.phone().isPresent() && row.phone().equals(candidate.phone()),
                similarity, threshold);
    }

    /**
     * Priority 4b: same first and last name, case-insensitive; both parts must be present.
     */
    public static FuzzyOrganizationMatchStrategy byFullName(SimilarityAlgorithm similarity, double threshold) {
        return new FuzzyOrganizationMatchStrategy(MatchTier.FUZZY_NAME,
                FuzzyOrganizationMatchStrategy::sameFullName, similarity, threshold);
    }

    @Override
    public MatchTier tier() {
        return tier;
    }

    @Override
    public boolean matches(NormalizedRow row, SnapshotEntry candidate) {
        if (!MatchStrategy.sameEventDate(row.desiredEventDate(), candidate.desiredEventDate())) {
            return false;
        }
        if (!contactMatch.test(row, candidate)) {
            return false;
        }
        String existingOrganization = RowNormalizer.normalizeOrganization(candidate.request().getOrganizationName());
        if (row.organizationName().isEmpty() || existingOrganization.isEmpty()) {
            return false;
        }
        return similarity.compute(row.organizationName(), existingOrganization) >= threshold;
    }

    @Override
    public double organizationSimilarity(NormalizedRow row, SnapshotEntry candidate) {
        return similarity.compute(row.organizationName(),
                RowNormalizer.normalizeOrganization(candidate.request().getOrganizationName()));
    }

    private static boolean sameFullName(NormalizedRow row, SnapshotEntry candidate) {
        if (!row.hasFullName() || candidate.firstName().isEmpty() || candidate.lastName().isEmpty()) {
            return false;
        }
        return RowNormalizer.normalizeNamePart(row.firstName()).equals(candidate.firstName())
                && RowNormalizer.normalizeNamePart(row.lastName()).equals(candidate.lastName());
    }
}
