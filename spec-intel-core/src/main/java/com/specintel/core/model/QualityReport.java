package com.specintel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of scoring one project against one domain.
 *
 * @param domainId domain used for scoring
 * @param projectId project that was scored
 * @param score maturity score in [0, 100]
 * @param coverageScore category coverage before penalties, in [0, 100]
 * @param coverage per-category coverage in domain order
 * @param coverageGaps categories without live specifications, in domain order
 * @param openErrorConflicts open error-severity conflicts considered
 * @param penalty points subtracted for open error conflicts
 * @param incomplete true if the score is not authoritative
 * @param missingRequiredAnalyzers required analyzers that did not run
 * @param analyzersRun analyzers that ran successfully
 * @param issues issues reported by analyzers
 * @param warnings analyzer failures and other non-fatal problems
 * @param readinessThreshold score needed for {@link #readyForGeneration()}
 */
public record QualityReport(
    String domainId,
    String projectId,
    double score,
    double coverageScore,
    List<CategoryCoverage> coverage,
    List<String> coverageGaps,
    int openErrorConflicts,
    double penalty,
    boolean incomplete,
    List<String> missingRequiredAnalyzers,
    List<String> analyzersRun,
    List<QualityIssue> issues,
    List<String> warnings,
    double readinessThreshold
) {
    /**
     * Compact constructor with validation.
     */
    public QualityReport {
        Objects.requireNonNull(domainId, "domainId must not be null");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("score must be within [0, 100]: " + score);
        }
        coverage = coverage == null ? List.of() : List.copyOf(coverage);
        coverageGaps = coverageGaps == null ? List.of() : List.copyOf(coverageGaps);
        missingRequiredAnalyzers = missingRequiredAnalyzers == null ? List.of() : List.copyOf(missingRequiredAnalyzers);
        analyzersRun = analyzersRun == null ? List.of() : List.copyOf(analyzersRun);
        issues = issues == null ? List.of() : List.copyOf(issues);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Whether the project is mature enough to generate artifacts from.
     *
     * @return true if the score reaches the threshold and the report is complete
     */
    public boolean readyForGeneration() {
        return !incomplete && score >= readinessThreshold;
    }

    /**
     * @param analyzerId analyzer ID
     * @return issues reported by that analyzer
     */
    public List<QualityIssue> issuesFor(String analyzerId) {
        return issues.stream()
            .filter(issue -> issue.analyzerId().equals(analyzerId))
            .toList();
    }
}
