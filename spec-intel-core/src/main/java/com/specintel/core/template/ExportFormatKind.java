package com.specintel.core.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specintel.core.model.ExportFormat;
import com.specintel.core.model.ValidationIssue;
import com.specintel.core.model.ValidationIssue.IssueType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Record kind for export formats.
 *
 * <p>Both {@code format_id} and {@code template_id} are unique within a set. File
 * extensions start with a dot; MIME types have the {@code type/subtype} shape.
 */
public final class ExportFormatKind implements RecordKind<ExportFormat> {

    static final String FORMAT_ID = "format_id";
    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String FILE_EXTENSION = "file_extension";
    static final String MIME_TYPE = "mime_type";
    static final String TEMPLATE_ID = "template_id";

    private static final Pattern MIME_TYPE_PATTERN = Pattern.compile("^[A-Za-z0-9][\\w.+-]*/[A-Za-z0-9][\\w.+-]*$");

    private static final List<FieldSpec> FIELDS = List.of(
        FieldSpec.requiredText(FORMAT_ID),
        FieldSpec.requiredText(NAME),
        FieldSpec.optionalText(DESCRIPTION),
        FieldSpec.requiredText(FILE_EXTENSION),
        FieldSpec.requiredText(MIME_TYPE),
        FieldSpec.requiredText(TEMPLATE_ID)
    );

    @Override
    public String name() {
        return "export format";
    }

    @Override
    public String idField() {
        return FORMAT_ID;
    }

    @Override
    public List<FieldSpec> fields() {
        return FIELDS;
    }

    @Override
    public List<String> uniqueFields() {
        return List.of(FORMAT_ID, TEMPLATE_ID);
    }

    @Override
    public ExportFormat bind(StructuredRecord record) {
        return new ExportFormat(
            record.text(FORMAT_ID),
            record.text(NAME),
            record.text(DESCRIPTION),
            record.text(FILE_EXTENSION),
            record.text(MIME_TYPE),
            record.text(TEMPLATE_ID)
        );
    }

    @Override
    public void unbind(ExportFormat format, ObjectNode target) {
        StructuredRecord.putText(target, FORMAT_ID, format.formatId());
        StructuredRecord.putText(target, NAME, format.name());
        StructuredRecord.putText(target, DESCRIPTION, format.description());
        StructuredRecord.putText(target, FILE_EXTENSION, format.fileExtension());
        StructuredRecord.putText(target, MIME_TYPE, format.mimeType());
        StructuredRecord.putText(target, TEMPLATE_ID, format.templateId());
    }

    @Override
    public List<ValidationIssue> checkRecord(JsonNode node, String recordId) {
        List<ValidationIssue> issues = new ArrayList<>();
        String extension = node.path(FILE_EXTENSION).asText();
        if (!extension.startsWith(".") || extension.length() < 2) {
            issues.add(new ValidationIssue(name(), recordId, FILE_EXTENSION, IssueType.INVALID_FORMAT,
                "file_extension must start with a dot: " + extension));
        }
        String mimeType = node.path(MIME_TYPE).asText();
        if (!MIME_TYPE_PATTERN.matcher(mimeType).matches()) {
            issues.add(new ValidationIssue(name(), recordId, MIME_TYPE, IssueType.INVALID_FORMAT,
                "mime_type must have the form type/subtype: " + mimeType));
        }
        return issues;
    }
}
