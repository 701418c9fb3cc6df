package com.specintel.core.template;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specintel.core.model.QualityAnalyzer;

import java.util.List;

/**
 * Record kind for quality analyzer declarations.
 *
 * <p>{@code enabled} defaults to true and {@code required} to false when absent.
 */
public final class QualityAnalyzerKind implements RecordKind<QualityAnalyzer> {

    static final String ANALYZER_ID = "analyzer_id";
    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String ANALYZER_TYPE = "analyzer_type";
    static final String ENABLED = "enabled";
    static final String REQUIRED = "required";
    static final String TAGS = "tags";

    private static final List<FieldSpec> FIELDS = List.of(
        FieldSpec.requiredText(ANALYZER_ID),
        FieldSpec.requiredText(NAME),
        FieldSpec.optionalText(DESCRIPTION),
        FieldSpec.requiredText(ANALYZER_TYPE),
        FieldSpec.flag(ENABLED),
        FieldSpec.flag(REQUIRED),
        FieldSpec.list(TAGS, true)
    );

    @Override
    public String name() {
        return "quality analyzer";
    }

    @Override
    public String idField() {
        return ANALYZER_ID;
    }

    @Override
    public List<FieldSpec> fields() {
        return FIELDS;
    }

    @Override
    public QualityAnalyzer bind(StructuredRecord record) {
        return new QualityAnalyzer(
            record.text(ANALYZER_ID),
            record.text(NAME),
            record.text(DESCRIPTION),
            record.text(ANALYZER_TYPE),
            record.flag(ENABLED, true),
            record.flag(REQUIRED, false),
            record.list(TAGS)
        );
    }

    @Override
    public void unbind(QualityAnalyzer analyzer, ObjectNode target) {
        StructuredRecord.putText(target, ANALYZER_ID, analyzer.analyzerId());
        StructuredRecord.putText(target, NAME, analyzer.name());
        StructuredRecord.putText(target, DESCRIPTION, analyzer.description());
        StructuredRecord.putText(target, ANALYZER_TYPE, analyzer.analyzerType());
        target.put(ENABLED, analyzer.enabled());
        target.put(REQUIRED, analyzer.required());
        StructuredRecord.putList(target, TAGS, analyzer.tags());
    }
}
