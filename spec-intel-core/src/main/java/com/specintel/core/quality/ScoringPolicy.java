package com.specintel.core.quality;

import com.specintel.core.config.EngineConfig;
import com.specintel.core.config.EngineConfig.ScoringConfig;

import java.util.Map;

/**
 * Tunable parts of maturity scoring.
 *
 * @param penaltyPerOpenError points subtracted per open error-severity conflict
 * @param readinessThreshold score at or above which a complete report is ready for generation
 * @param categoryWeights explicit category weights; empty for equal weighting
 */
public record ScoringPolicy(
    double penaltyPerOpenError,
    double readinessThreshold,
    Map<String, Double> categoryWeights
) {
    public ScoringPolicy {
        categoryWeights = categoryWeights == null ? Map.of() : Map.copyOf(categoryWeights);
        if (penaltyPerOpenError < 0) {
            throw new IllegalArgumentException("penaltyPerOpenError must not be negative: " + penaltyPerOpenError);
        }
        if (readinessThreshold < 0 || readinessThreshold > 100) {
            throw new IllegalArgumentException("readinessThreshold must be within 0..100: " + readinessThreshold);
        }
        categoryWeights.forEach((category, weight) -> {
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("weight of category '" + category + "' must not be negative");
            }
        });
    }

    /**
     * @return 5 points per open error, threshold 100, equal weights
     */
    public static ScoringPolicy defaults() {
        return new ScoringPolicy(ScoringConfig.DEFAULT_PENALTY_PER_OPEN_ERROR,
            ScoringConfig.DEFAULT_READINESS_THRESHOLD, Map.of());
    }

    /**
     * Builds the policy configured for one domain.
     *
     * @param config engine configuration
     * @param domainId domain whose category weights to use
     * @return policy
     */
    public static ScoringPolicy from(EngineConfig config, String domainId) {
        ScoringConfig scoring = config.scoring();
        return new ScoringPolicy(scoring.penaltyPerOpenError(), scoring.readinessThreshold(),
            scoring.weightsFor(domainId));
    }

    public ScoringPolicy withCategoryWeights(Map<String, Double> weights) {
        return new ScoringPolicy(penaltyPerOpenError, readinessThreshold, weights);
    }
}
