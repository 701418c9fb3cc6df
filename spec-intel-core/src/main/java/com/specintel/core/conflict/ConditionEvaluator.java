package com.specintel.core.conflict;

import com.specintel.core.model.ConflictRule;
import com.specintel.core.model.Specification;

import java.util.Collection;
import java.util.List;

/**
 * Executes a rule's condition against a specification snapshot.
 *
 * <p>The detector owns orchestration, ordering and failure handling; an evaluator only
 * answers whether the condition is violated and by which specifications. Evaluators
 * must not modify the snapshot.
 *
 * @see ConditionEvaluators
 * @see NumericContradictionEvaluator
 */
@FunctionalInterface
public interface ConditionEvaluator {

    /**
     * Evaluates one rule.
     *
     * @param rule rule whose condition to evaluate
     * @param snapshot current, non-deprecated specifications of one project
     * @return one entry per violation, empty if the condition holds
     * @throws RuleEvaluationException if the condition cannot be evaluated
     */
    List<Violation> evaluate(ConflictRule rule, List<Specification> snapshot);

    /**
     * Returns an evaluator bound to a domain's category list, so conditions naming a
     * category the domain does not declare fail evaluation. Evaluators that do not look at
     * categories return themselves.
     *
     * @param categories the domain's categories
     * @return evaluator restricted to those categories
     */
    default ConditionEvaluator withCategories(Collection<String> categories) {
        return this;
    }

    /**
     * One violation of a rule's condition.
     *
     * @param specificationIds implicated specification IDs
     * @param detail optional human-readable explanation
     */
    record Violation(List<String> specificationIds, String detail) {
        public Violation {
            specificationIds = specificationIds == null ? List.of() : List.copyOf(specificationIds);
        }
    }
}
