package com.specintel.core.template;

import java.util.List;
import java.util.Objects;

/**
 * Declares one field of a configuration record kind.
 *
 * <p>The generic {@link TemplateEngine} reads these declarations to check required
 * fields, types and legal values, and to decide which fields can be filtered or
 * grouped on.
 *
 * @param name field name as written in configuration documents
 * @param type value type
 * @param required whether the field must be present and non-blank
 * @param legalValues allowed values for string fields; empty means any value
 * @param indexed whether {@link TemplateEngine#filterBy} and {@link TemplateEngine#groupBy} accept the field
 */
public record FieldSpec(
    String name,
    FieldType type,
    boolean required,
    List<String> legalValues,
    boolean indexed
) {
    /**
     * Compact constructor with validation.
     */
    public FieldSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        legalValues = legalValues == null ? List.of() : List.copyOf(legalValues);
    }

    /**
     * Value type of a field.
     */
    public enum FieldType {
        STRING,
        BOOLEAN,
        STRING_LIST
    }

    public static FieldSpec requiredText(String name) {
        return new FieldSpec(name, FieldType.STRING, true, List.of(), true);
    }

    public static FieldSpec optionalText(String name) {
        return new FieldSpec(name, FieldType.STRING, false, List.of(), false);
    }

    public static FieldSpec requiredChoice(String name, List<String> legalValues) {
        return new FieldSpec(name, FieldType.STRING, true, legalValues, true);
    }

    public static FieldSpec optionalChoice(String name, List<String> legalValues) {
        return new FieldSpec(name, FieldType.STRING, false, legalValues, true);
    }

    public static FieldSpec flag(String name) {
        return new FieldSpec(name, FieldType.BOOLEAN, false, List.of(), true);
    }

    public static FieldSpec list(String name, boolean indexed) {
        return new FieldSpec(name, FieldType.STRING_LIST, false, List.of(), indexed);
    }

    /**
     * Returns a copy of this field that can be filtered and grouped on.
     *
     * @return indexed copy
     */
    public FieldSpec asIndexed() {
        return new FieldSpec(name, type, required, legalValues, true);
    }

    /**
     * Returns a copy of this field that cannot be filtered or grouped on.
     *
     * @return non-indexed copy
     */
    public FieldSpec withoutIndex() {
        return new FieldSpec(name, type, required, legalValues, false);
    }
}
