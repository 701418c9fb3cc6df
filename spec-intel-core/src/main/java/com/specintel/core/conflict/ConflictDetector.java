package com.specintel.core.conflict;

import com.specintel.core.domain.Domain;
import com.specintel.core.model.Conflict;
import com.specintel.core.model.ConflictRule;
import com.specintel.core.model.ConflictStatus;
import com.specintel.core.model.RuleEvaluationWarning;
import com.specintel.core.model.Specification;
import com.specintel.core.spec.SpecificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Evaluates conflict rules against a project's current specifications.
 *
 * <p>Every violation becomes a new open {@link Conflict}; rules are independent, so two
 * rules flagging the same specification produce two conflicts. Runs never look at or
 * change earlier conflicts: running twice on the same snapshot yields two sets of
 * conflicts with different run IDs.
 *
 * <p>A rule that fails to evaluate is skipped and reported as a
 * {@link RuleEvaluationWarning}; the remaining rules still run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConflictDetector detector = new ConflictDetector(new NumericContradictionEvaluator());
 * DetectionResult result = detector.detect(domain, "p1", store);
 * conflictLog.append(result);
 * }</pre>
 */
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    private static final Comparator<Conflict> BY_SEVERITY = Comparator.comparing(Conflict::severity);

    private final ConditionEvaluator evaluator;
    private final Clock clock;

    public ConflictDetector(ConditionEvaluator evaluator) {
        this(evaluator, Clock.systemUTC());
    }

    public ConflictDetector(ConditionEvaluator evaluator, Clock clock) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Runs a domain's rules against a project's current specifications.
     *
     * <p>The evaluator is bound to the domain's categories, so a rule naming a category the
     * domain does not declare is skipped with a warning.
     *
     * @param domain domain providing the rules and categories
     * @param projectId project to check
     * @param repository source of the project's current specifications
     * @return conflicts and warnings of this run
     */
    public DetectionResult detect(Domain domain, String projectId, SpecificationRepository repository) {
        return run(evaluator.withCategories(domain.categories()), projectId, domain.conflictRules(),
            repository.getCurrentSpecifications(projectId));
    }

    /**
     * Runs rules against a snapshot.
     *
     * <p>Only current, non-deprecated specifications of {@code projectId} are passed to the
     * evaluator; anything else in the snapshot is ignored.
     *
     * @param projectId project to check
     * @param rules rules in evaluation order
     * @param snapshot specifications to check
     * @return conflicts sorted by severity, then rule order, and warnings for skipped rules
     */
    public DetectionResult detect(String projectId, List<ConflictRule> rules, List<Specification> snapshot) {
        return run(evaluator, projectId, rules, snapshot);
    }

    private DetectionResult run(ConditionEvaluator conditions, String projectId, List<ConflictRule> rules,
                                List<Specification> snapshot) {
        String runId = UUID.randomUUID().toString();
        Instant detectedAt = clock.instant();
        List<Specification> current = snapshot.stream()
            .filter(spec -> projectId.equals(spec.projectId()))
            .filter(Specification::isLive)
            .toList();
        Map<String, Specification> byId = current.stream()
            .collect(Collectors.toMap(Specification::id, Function.identity(), (a, b) -> a));

        List<Conflict> conflicts = new ArrayList<>();
        List<RuleEvaluationWarning> warnings = new ArrayList<>();
        int evaluated = 0;
        for (ConflictRule rule : rules) {
            if (rule.severity() == null) {
                warnings.add(skip(rule, "rule has no severity"));
                continue;
            }
            List<ConditionEvaluator.Violation> violations;
            try {
                violations = conditions.evaluate(rule, current);
            } catch (RuntimeException e) {
                warnings.add(skip(rule, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
                continue;
            }
            evaluated++;
            if (violations == null) {
                continue;
            }
            log.debug("Rule {} produced {} violation(s)", rule.ruleId(), violations.size());
            for (ConditionEvaluator.Violation violation : violations) {
                conflicts.add(new Conflict(UUID.randomUUID().toString(), runId, rule.ruleId(), projectId,
                    violation.specificationIds(), rule.severity(), render(rule, violation, byId),
                    ConflictStatus.OPEN, null, detectedAt, null));
            }
        }

        List<Conflict> sorted = conflicts.stream().sorted(BY_SEVERITY).toList();
        log.info("Detection run {} for project {}: {} rule(s) evaluated, {} conflict(s), {} skipped",
            runId, projectId, evaluated, sorted.size(), warnings.size());
        return new DetectionResult(runId, projectId, sorted, warnings, evaluated);
    }

    /**
     * Renders a rule's message template. Supports {@code {rule_id}}, {@code {name}},
     * {@code {keys}} (keys of the implicated specifications) and {@code {detail}}.
     * Without a template the message is the rule name followed by the violation detail.
     */
    static String render(ConflictRule rule, ConditionEvaluator.Violation violation, Map<String, Specification> byId) {
        String detail = violation.detail() == null ? "" : violation.detail();
        if (rule.message() == null || rule.message().isBlank()) {
            return detail.isEmpty() ? rule.name() : rule.name() + ": " + detail;
        }
        String keys = violation.specificationIds().stream()
            .map(id -> byId.containsKey(id) ? byId.get(id).key() : id)
            .collect(Collectors.joining(", "));
        return rule.message()
            .replace("{rule_id}", rule.ruleId())
            .replace("{name}", rule.name() == null ? "" : rule.name())
            .replace("{keys}", keys)
            .replace("{detail}", detail);
    }

    private static RuleEvaluationWarning skip(ConflictRule rule, String reason) {
        log.warn("Skipping rule {}: {}", rule.ruleId(), reason);
        return new RuleEvaluationWarning(rule.ruleId(), reason);
    }
}
