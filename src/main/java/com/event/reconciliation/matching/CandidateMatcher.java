package com.event.reconciliation.matching;

import com.event.reconciliation.core.model.ExistingEventRequest;
import com.event.reconciliation.core.model.MatchResult;
import com.event.reconciliation.core.model.NormalizedRow;
import com.event.reconciliation.similarity.OrganizationNameSimilarity;
import com.event.reconciliation.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether an incoming row is an already-known event request.
 *
 * <p>Strategies are evaluated in strict precedence order and the first one with any matching
 * candidate wins:</p>
 * <ol>
 *   <li>Tier 1, external row id or external id</li>
 *   <li>Tier 2, email + event date + submission time within tolerance</li>
 *   <li>Tier 3 priority 3, email + event date + organization similarity</li>
 *   <li>Tier 3 priority 4a, phone + event date + organization similarity</li>
 *   <li>Tier 3 priority 4b, full name + event date + organization similarity</li>
 * </ol>
 *
 * <p>Within a tier the first candidate in snapshot order is returned; any further candidates
 * satisfying the same tier are reported in {@link MatchResult#otherCandidateIds()} for the caller
 * to surface. Below Tier 1 a record with a different (or absent) event date is never matched.</p>
 *
 * <p>The matcher holds no mutable state and performs no I/O; it is safe for concurrent use.</p>
 */
public class CandidateMatcher {
    private static final Logger log = LoggerFactory.getLogger(CandidateMatcher.class);

    private final MatchingOptions options;
    private final List<MatchStrategy> strategies;

    public CandidateMatcher() {
        this(MatchingOptions.defaults());
    }

    public CandidateMatcher(MatchingOptions options) {
        this(options, new OrganizationNameSimilarity());
    }

    public CandidateMatcher(MatchingOptions options, SimilarityAlgorithm organizationSimilarity) {
        this.options = Objects.requireNonNull(options, "options is required");
        Objects.requireNonNull(organizationSimilarity, "organizationSimilarity is required");
        double threshold = options.getOrganizationSimilarityThreshold();
        this.strategies = List.of(
                new ExternalIdMatchStrategy(),
                new ExactCompositeMatchStrategy(options.getSubmissionTolerance()),
                FuzzyOrganizationMatchStrategy.byEmail(organizationSimilarity, threshold),
                FuzzyOrganizationMatchStrategy.byPhone(organizationSimilarity, threshold),
                FuzzyOrganizationMatchStrategy.byFullName(organizationSimilarity, threshold)
        );
    }

    public MatchingOptions getOptions() {
        return options;
    }

    /**
     * Returns the strategies in evaluation order.
     */
    public List<MatchStrategy> getStrategies() {
        return strategies;
    }

    /**
     * Matches a row against a list of existing records.
     */
    public MatchResult match(NormalizedRow row, Collection<ExistingEventRequest> existing) {
        return match(row, EventRequestSnapshot.of(existing));
    }

    /**
     * Matches a row against a snapshot of existing records.
     *
     * @return the matched record and tier, or {@link MatchResult#noMatch()}
     */
    public MatchResult match(NormalizedRow row, EventRequestSnapshot snapshot) {
        Objects.requireNonNull(row, "row is required");
        Objects.requireNonNull(snapshot, "snapshot is required");

        for (MatchStrategy strategy : strategies) {
            SnapshotEntry winner = null;
            List<String> others = new ArrayList<>();
            for (SnapshotEntry candidate : snapshot.entries()) {
                if (!strategy.matches(row, candidate)) {
                    continue;
                }
                if (winner == null) {
                    winner = candidate;
                } else {
                    others.add(candidate.id());
                }
            }
            if (winner != null) {
                double similarity = clamp(strategy.organizationSimilarity(row, winner));
                log.debug("match.found tier={} requestId={} externalRowId={} others={}",
                        strategy.tier(), winner.id(), row.externalRowId().orElse(""), others.size());
                return new MatchResult(winner.request(), strategy.tier(), similarity, others);
            }
            log.debug("match.tier.miss tier={} externalRowId={}", strategy.tier(), row.externalRowId().orElse(""));
        }

        log.debug("match.none externalRowId={} candidates={}", row.externalRowId().orElse(""), snapshot.size());
        return MatchResult.noMatch();
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
