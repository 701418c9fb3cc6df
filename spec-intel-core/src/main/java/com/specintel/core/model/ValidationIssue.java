package com.specintel.core.model;

import java.util.Objects;

/**
 * A problem found while validating configuration records.
 *
 * <p>Issues are collected and returned, never thrown. Loaders turn a non-empty issue
 * list into an exception; pre-flight checks only report it.
 *
 * @param kind record kind, e.g. "conflict rule"
 * @param recordId ID of the offending record, or {@code #index} when it has none
 * @param field offending field, or null for record-level problems
 * @param type problem category
 * @param message human-readable description
 */
public record ValidationIssue(
    String kind,
    String recordId,
    String field,
    IssueType type,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Category of a validation problem.
     */
    public enum IssueType {
        /** Two records share a value that must be unique. */
        DUPLICATE_ID,
        /** A required field is absent or blank. */
        MISSING_FIELD,
        /** A value is outside the legal set for its field. */
        ILLEGAL_VALUE,
        /** A value has the wrong type or shape. */
        INVALID_FORMAT,
        /** Records reference each other in a cycle. */
        CIRCULAR_DEPENDENCY,
        /** A record references an ID that does not exist. */
        UNKNOWN_REFERENCE
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append(' ').append(recordId);
        if (field != null) {
            sb.append('.').append(field);
        }
        return sb.append(": ").append(message).toString();
    }
}
