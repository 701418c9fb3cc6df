package com.specintel.core.template;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specintel.core.model.ConflictRule;
import com.specintel.core.model.Severity;

import java.util.Arrays;
import java.util.List;

/**
 * Record kind for conflict rules. {@code severity} must be error, warning or info.
 */
public final class ConflictRuleKind implements RecordKind<ConflictRule> {

    static final String RULE_ID = "rule_id";
    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String CONDITION = "condition";
    static final String SEVERITY = "severity";
    static final String MESSAGE = "message";

    private static final List<FieldSpec> FIELDS = List.of(
        FieldSpec.requiredText(RULE_ID),
        FieldSpec.requiredText(NAME),
        FieldSpec.optionalText(DESCRIPTION),
        FieldSpec.requiredText(CONDITION).withoutIndex(),
        FieldSpec.requiredChoice(SEVERITY, Arrays.stream(Severity.values()).map(Severity::value).toList()),
        FieldSpec.optionalText(MESSAGE)
    );

    @Override
    public String name() {
        return "conflict rule";
    }

    @Override
    public String idField() {
        return RULE_ID;
    }

    @Override
    public List<FieldSpec> fields() {
        return FIELDS;
    }

    @Override
    public ConflictRule bind(StructuredRecord record) {
        return new ConflictRule(
            record.text(RULE_ID),
            record.text(NAME),
            record.text(DESCRIPTION),
            record.text(CONDITION),
            Severity.fromValue(record.text(SEVERITY)).orElseThrow(),
            record.text(MESSAGE)
        );
    }

    @Override
    public void unbind(ConflictRule rule, ObjectNode target) {
        StructuredRecord.putText(target, RULE_ID, rule.ruleId());
        StructuredRecord.putText(target, NAME, rule.name());
        StructuredRecord.putText(target, DESCRIPTION, rule.description());
        StructuredRecord.putText(target, CONDITION, rule.condition());
        StructuredRecord.putText(target, SEVERITY, rule.severity() == null ? null : rule.severity().value());
        StructuredRecord.putText(target, MESSAGE, rule.message());
    }
}
