package com.specintel.core.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specintel.core.model.ValidationIssue;

import java.util.List;

/**
 * Describes one kind of configuration record to the generic {@link TemplateEngine}.
 *
 * <p>A kind is pure data plus two conversions: it declares its fields and unique keys,
 * and maps between the typed record and its structured form. The engine does
 * everything else (loading, validation, filtering, grouping, serialization) the same
 * way for every kind.
 *
 * @param <T> record type
 */
public interface RecordKind<T> {

    /**
     * @return human-readable kind name used in issues and logs, e.g. "conflict rule"
     */
    String name();

    /**
     * @return name of the field identifying a record
     */
    String idField();

    /**
     * @return field declarations in serialization order
     */
    List<FieldSpec> fields();

    /**
     * Fields whose values must be unique across a record set.
     *
     * @return unique field names; defaults to the ID field
     */
    default List<String> uniqueFields() {
        return List.of(idField());
    }

    /**
     * Builds a typed record from structured form that passed the field checks.
     *
     * @param record structured record
     * @return typed record
     */
    T bind(StructuredRecord record);

    /**
     * Writes a typed record into structured form.
     *
     * @param record typed record
     * @param target empty object to populate
     */
    void unbind(T record, ObjectNode target);

    /**
     * Kind-specific checks on one record beyond required fields, types and legal values.
     *
     * @param node structured record
     * @param recordId ID used to name the record in issues
     * @return issues found, empty if none
     */
    default List<ValidationIssue> checkRecord(JsonNode node, String recordId) {
        return List.of();
    }

    /**
     * Kind-specific checks across a whole record set, such as references between records.
     *
     * @param records typed records
     * @return issues found, empty if none
     */
    default List<ValidationIssue> checkSet(List<T> records) {
        return List.of();
    }
}
