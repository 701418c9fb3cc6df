package com.specintel.core.conflict;

import com.specintel.core.SpecIntelException;

/**
 * Raised by a {@link ConditionEvaluator} that cannot evaluate a rule's condition.
 *
 * <p>The detector turns it into a {@link com.specintel.core.model.RuleEvaluationWarning}
 * and moves on to the next rule.
 */
public class RuleEvaluationException extends SpecIntelException {

    private final String ruleId;

    public RuleEvaluationException(String ruleId, String message) {
        super(message);
        this.ruleId = ruleId;
    }

    public RuleEvaluationException(String ruleId, String message, Throwable cause) {
        super(message, cause);
        this.ruleId = ruleId;
    }

    public String ruleId() {
        return ruleId;
    }
}
