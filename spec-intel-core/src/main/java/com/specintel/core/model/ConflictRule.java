package com.specintel.core.model;

/**
 * A named predicate over a project's current specifications.
 *
 * <p>The condition is data, not code: a condition evaluator interprets it.
 *
 * @param ruleId unique rule ID within a rule set
 * @param name display name
 * @param description optional description
 * @param condition statement of what must hold
 * @param severity severity of violations, null only in invalid rule sets
 * @param message optional template for the violation explanation
 */
public record ConflictRule(
    String ruleId,
    String name,
    String description,
    String condition,
    Severity severity,
    String message
) {
}
