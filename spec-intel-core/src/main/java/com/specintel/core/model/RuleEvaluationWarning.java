package com.specintel.core.model;

/**
 * A rule that could not be evaluated during a detection run.
 *
 * <p>The rule is skipped; detection continues with the remaining rules.
 *
 * @param ruleId rule that was skipped
 * @param message reason the rule could not be evaluated
 */
public record RuleEvaluationWarning(
    String ruleId,
    String message
) {
}
