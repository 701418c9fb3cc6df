package com.specintel.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Root configuration of the engine.
 *
 * <p>Loaded from {@code specintel.yaml} by {@link ConfigLoader}. Holds scoring policy
 * settings and the domain documents to register at startup.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * scoring:
 *   penaltyPerOpenError: 5
 *   readinessThreshold: 100
 *   categoryWeights:
 *     programming:
 *       architecture: 40
 *       testing: 20
 *
 * domains:
 *   - id: fintech
 *     path: domains/fintech.yaml
 * }</pre>
 *
 * @param scoring scoring policy settings
 * @param domains domain documents to register
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("scoring") ScoringConfig scoring,
    @JsonProperty("domains") List<DomainSource> domains
) {
    public EngineConfig {
        scoring = scoring == null ? ScoringConfig.defaults() : scoring;
        domains = domains == null ? List.of() : List.copyOf(domains);
    }

    /**
     * Creates the default configuration: standard scoring and no extra domains.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(ScoringConfig.defaults(), List.of());
    }

    /**
     * Scoring settings.
     *
     * @param penaltyPerOpenError points subtracted per open error-severity conflict
     * @param readinessThreshold score at or above which a project is ready for generation
     * @param categoryWeights per-domain category weight overrides, domain ID to category to weight
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScoringConfig(
        @JsonProperty("penaltyPerOpenError") Double penaltyPerOpenError,
        @JsonProperty("readinessThreshold") Double readinessThreshold,
        @JsonProperty("categoryWeights") Map<String, Map<String, Double>> categoryWeights
    ) {
        public static final double DEFAULT_PENALTY_PER_OPEN_ERROR = 5.0;
        public static final double DEFAULT_READINESS_THRESHOLD = 100.0;

        public ScoringConfig {
            penaltyPerOpenError = penaltyPerOpenError == null ? DEFAULT_PENALTY_PER_OPEN_ERROR : penaltyPerOpenError;
            readinessThreshold = readinessThreshold == null ? DEFAULT_READINESS_THRESHOLD : readinessThreshold;
            categoryWeights = categoryWeights == null ? Map.of() : Map.copyOf(categoryWeights);
            if (penaltyPerOpenError < 0) {
                throw new IllegalArgumentException("penaltyPerOpenError must not be negative: " + penaltyPerOpenError);
            }
            if (readinessThreshold < 0 || readinessThreshold > 100) {
                throw new IllegalArgumentException("readinessThreshold must be within 0..100: " + readinessThreshold);
            }
        }

        public static ScoringConfig defaults() {
            return new ScoringConfig(DEFAULT_PENALTY_PER_OPEN_ERROR, DEFAULT_READINESS_THRESHOLD, Map.of());
        }

        /**
         * @param domainId domain ID
         * @return category weights configured for that domain, empty for equal weighting
         */
        public Map<String, Double> weightsFor(String domainId) {
            return categoryWeights.getOrDefault(domainId, Map.of());
        }
    }

    /**
     * A domain document to register.
     *
     * @param id domain ID the document is registered under
     * @param path document path, relative to the configuration file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DomainSource(
        @JsonProperty("id") String id,
        @JsonProperty("path") String path
    ) {}
}
