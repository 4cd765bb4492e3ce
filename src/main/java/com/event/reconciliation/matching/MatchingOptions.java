package com.event.reconciliation.matching;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds for the candidate matcher.
 * This is the single definition point of the organization similarity threshold and the
 * submission-time tolerance.
 */
public class MatchingOptions {

    /**
     * Minimum organization similarity (inclusive) for every fuzzy tier.
     */
    public static final double DEFAULT_ORGANIZATION_SIMILARITY_THRESHOLD = 0.6;

    /**
     * Maximum distance (inclusive) between two submission timestamps for an exact match.
     */
    public static final Duration DEFAULT_SUBMISSION_TOLERANCE = Duration.ofMinutes(5);

    private final double organizationSimilarityThreshold;
    private final Duration submissionTolerance;

    private MatchingOptions(Builder builder) {
        this.organizationSimilarityThreshold = builder.organizationSimilarityThreshold;
        this.submissionTolerance = builder.submissionTolerance;
    }

    public double getOrganizationSimilarityThreshold() {
        return organizationSimilarityThreshold;
    }

    public Duration getSubmissionTolerance() {
        return submissionTolerance;
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MatchingOptions{organizationSimilarityThreshold=" + organizationSimilarityThreshold +
                ", submissionTolerance=" + submissionTolerance + '}';
    }

    public static class Builder {
        private double organizationSimilarityThreshold = DEFAULT_ORGANIZATION_SIMILARITY_THRESHOLD;
        private Duration submissionTolerance = DEFAULT_SUBMISSION_TOLERANCE;

        public Builder organizationSimilarityThreshold(double threshold) {
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("organizationSimilarityThreshold must be between 0.0 and 1.0");
            }
            this.organizationSimilarityThreshold = threshold;
            return this;
        }

        public Builder submissionTolerance(Duration tolerance) {
            Objects.requireNonNull(tolerance, "submissionTolerance is required");
            if (tolerance.isNegative()) {
                throw new IllegalArgumentException("submissionTolerance must not be negative");
            }
            this.submissionTolerance = tolerance;
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }
    }
}
