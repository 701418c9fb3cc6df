package com.specintel.core.conflict;

import com.specintel.core.model.ConflictRule;
import com.specintel.core.model.Specification;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory methods for composing {@link ConditionEvaluator}s.
 */
public final class ConditionEvaluators {

    private ConditionEvaluators() {
        // Utility class
    }

    /**
     * Dispatches each rule to the evaluator bound to its ID.
     *
     * <p>A rule with no bound evaluator fails evaluation, so the detector reports it as a
     * warning instead of silently passing it.
     *
     * @param evaluators rule ID to evaluator
     * @return dispatching evaluator
     */
    public static ConditionEvaluator byRuleId(Map<String, ? extends ConditionEvaluator> evaluators) {
        return new RuleIdDispatch(Map.copyOf(evaluators), null);
    }

    /**
     * Like {@link #byRuleId(Map)}, but rules without a bound evaluator go to {@code fallback}.
     *
     * @param evaluators rule ID to evaluator
     * @param fallback evaluator for every other rule
     * @return dispatching evaluator
     */
    public static ConditionEvaluator byRuleId(Map<String, ? extends ConditionEvaluator> evaluators,
                                              ConditionEvaluator fallback) {
        return new RuleIdDispatch(Map.copyOf(evaluators), fallback);
    }

    /**
     * Rule-ID dispatch that passes domain categories on to every evaluator it wraps.
     */
    private static final class RuleIdDispatch implements ConditionEvaluator {

        private final Map<String, ? extends ConditionEvaluator> bound;
        private final ConditionEvaluator fallback;

        private RuleIdDispatch(Map<String, ? extends ConditionEvaluator> bound, ConditionEvaluator fallback) {
            this.bound = bound;
            this.fallback = fallback;
        }

        @Override
        public List<Violation> evaluate(ConflictRule rule, List<Specification> snapshot) {
            ConditionEvaluator evaluator = bound.get(rule.ruleId());
            if (evaluator == null) {
                evaluator = fallback;
            }
            if (evaluator == null) {
                throw new RuleEvaluationException(rule.ruleId(),
                    "No condition evaluator bound to rule '" + rule.ruleId() + "'");
            }
            return evaluator.evaluate(rule, snapshot);
        }

        @Override
        public ConditionEvaluator withCategories(Collection<String> categories) {
            Map<String, ConditionEvaluator> restricted = new LinkedHashMap<>();
            bound.forEach((ruleId, evaluator) -> restricted.put(ruleId, evaluator.withCategories(categories)));
            return new RuleIdDispatch(Map.copyOf(restricted),
                fallback == null ? null : fallback.withCategories(categories));
        }
    }
}
