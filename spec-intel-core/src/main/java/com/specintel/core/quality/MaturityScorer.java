package com.specintel.core.quality;

import com.specintel.core.conflict.ConflictLog;
import com.specintel.core.domain.Domain;
import com.specintel.core.model.CategoryCoverage;
import com.specintel.core.model.QualityAnalyzer;
import com.specintel.core.model.QualityIssue;
import com.specintel.core.model.QualityReport;
import com.specintel.core.model.Specification;
import com.specintel.core.spec.SpecificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Computes a project's 0-100 maturity score for a domain.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Coverage: each domain category carries a weight (equal by default, or from the
 *       {@link ScoringPolicy}); the coverage score is the covered share of the total weight,
 *       scaled to 100. A category is covered when at least one current, non-deprecated
 *       specification belongs to it. Category names match ignoring case and surrounding
 *       whitespace.</li>
 *   <li>Penalty: {@code penaltyPerOpenError} points per open error-severity conflict. The
 *       final score never drops below 0.</li>
 *   <li>Analyzers: every enabled analyzer runs against the snapshot and its issues are
 *       collected as-is.</li>
 * </ol>
 *
 * <p>The report is {@code incomplete} when a required analyzer is disabled, has no
 * implementation, or fails. The score is still computed.
 */
public class MaturityScorer {

    private static final Logger log = LoggerFactory.getLogger(MaturityScorer.class);

    private final Map<String, QualityAnalyzerRunner> runners;
    private final ScoringPolicy policy;

    public MaturityScorer(Map<String, ? extends QualityAnalyzerRunner> runners) {
        this(runners, ScoringPolicy.defaults());
    }

    public MaturityScorer(Map<String, ? extends QualityAnalyzerRunner> runners, ScoringPolicy policy) {
        this.runners = Map.copyOf(runners);
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public ScoringPolicy policy() {
        return policy;
    }

    /**
     * Scores a project using the stored specifications and recorded conflicts.
     *
     * @param domain domain to score against
     * @param projectId project to score
     * @param repository source of current specifications
     * @param conflicts log holding the project's conflicts
     * @return quality report
     */
    public QualityReport score(Domain domain, String projectId, SpecificationRepository repository,
                               ConflictLog conflicts) {
        return score(domain, projectId, repository.getCurrentSpecifications(projectId),
            conflicts.openErrorCount(projectId));
    }

    /**
     * Scores a project from a snapshot.
     *
     * @param domain domain to score against
     * @param projectId project to score
     * @param snapshot specifications; anything not current, not live or of another project is ignored
     * @param openErrorConflicts open error-severity conflicts of the project
     * @return quality report
     */
    public QualityReport score(Domain domain, String projectId, List<Specification> snapshot, int openErrorConflicts) {
        if (openErrorConflicts < 0) {
            throw new IllegalArgumentException("openErrorConflicts must not be negative: " + openErrorConflicts);
        }
        List<Specification> live = snapshot.stream()
            .filter(spec -> projectId.equals(spec.projectId()))
            .filter(Specification::isLive)
            .toList();

        // Coverage
        List<CategoryCoverage> coverage = calculateCoverage(domain.categories(), live);
        double totalWeight = coverage.stream().mapToDouble(CategoryCoverage::weight).sum();
        double coveredWeight = coverage.stream().filter(CategoryCoverage::covered).mapToDouble(CategoryCoverage::weight).sum();
        double coverageScore = totalWeight == 0 ? 0.0 : coveredWeight / totalWeight * 100.0;
        List<String> gaps = coverage.stream()
            .filter(category -> !category.covered())
            .map(CategoryCoverage::category)
            .toList();

        // Penalty
        double penalty = openErrorConflicts * policy.penaltyPerOpenError();
        double score = Math.max(0.0, Math.min(100.0, coverageScore - penalty));

        // Analyzers
        List<String> missingRequired = domain.qualityAnalyzers().stream()
            .filter(QualityAnalyzer::isRequiredButDisabled)
            .map(QualityAnalyzer::analyzerId)
            .toList();
        boolean incomplete = !missingRequired.isEmpty();
        List<String> analyzersRun = new ArrayList<>();
        List<QualityIssue> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (QualityAnalyzer analyzer : domain.enabledAnalyzers()) {
            QualityAnalyzerRunner runner = runners.get(analyzer.analyzerId());
            if (runner == null) {
                warnings.add("No implementation for analyzer '" + analyzer.analyzerId() + "'");
                incomplete |= analyzer.required();
                continue;
            }
            try {
                List<QualityIssue> found = runner.analyze(analyzer, live);
                issues.addAll(found == null ? List.of() : found);
                analyzersRun.add(analyzer.analyzerId());
            } catch (RuntimeException e) {
                log.warn("Analyzer {} failed for project {}: {}", analyzer.analyzerId(), projectId, e.getMessage());
                warnings.add("Analyzer '" + analyzer.analyzerId() + "' failed: " + e.getMessage());
                incomplete |= analyzer.required();
            }
        }

        log.info("Scored project {} in domain {}: {} (coverage {}, penalty {}){}",
            projectId, domain.domainId(), String.format(Locale.ROOT, "%.1f", score),
            String.format(Locale.ROOT, "%.1f", coverageScore), penalty, incomplete ? " [incomplete]" : "");
        return new QualityReport(domain.domainId(), projectId, score, coverageScore, coverage, gaps,
            openErrorConflicts, penalty, incomplete, missingRequired, analyzersRun, issues, warnings,
            policy.readinessThreshold());
    }

    private List<CategoryCoverage> calculateCoverage(List<String> categories, List<Specification> live) {
        Map<String, Integer> counts = new HashMap<>();
        for (Specification spec : live) {
            counts.merge(normalize(spec.category()), 1, Integer::sum);
        }
        Map<String, Double> overrides = new HashMap<>();
        policy.categoryWeights().forEach((category, weight) -> overrides.put(normalize(category), weight));

        List<CategoryCoverage> coverage = new ArrayList<>(categories.size());
        for (String category : categories) {
            String key = normalize(category);
            double weight = overrides.isEmpty() ? 1.0 : overrides.getOrDefault(key, 0.0);
            coverage.add(new CategoryCoverage(category, weight, counts.getOrDefault(key, 0)));
        }

        double total = coverage.stream().mapToDouble(CategoryCoverage::weight).sum();
        if (total == 0 && !coverage.isEmpty()) {
            log.warn("Configured category weights sum to zero; falling back to equal weights");
            total = coverage.size();
            coverage = coverage.stream()
                .map(entry -> new CategoryCoverage(entry.category(), 1.0, entry.specificationCount()))
                .toList();
        }
        double scale = total == 0 ? 0.0 : 100.0 / total;
        return coverage.stream()
            .map(entry -> new CategoryCoverage(entry.category(), entry.weight() * scale, entry.specificationCount()))
            .toList();
    }

    private static String normalize(String category) {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }
}
