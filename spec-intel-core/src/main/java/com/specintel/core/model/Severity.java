package com.specintel.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Severity of a conflict rule and of the conflicts it produces.
 *
 * <p>Declaration order is the display order: errors first, then warnings, then info.
 *
 * @see PresentationSeverity
 */
public enum Severity {
    /**
     * Contradiction that blocks a project from being considered mature.
     */
    ERROR("error"),

    /**
     * Inconsistency that should be reviewed.
     */
    WARNING("warning"),

    /**
     * Informational finding.
     */
    INFO("info");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    /**
     * @return the value used in configuration documents
     */
    public String value() {
        return value;
    }

    /**
     * Looks up a severity by its configuration value. Matching is exact.
     *
     * @param value configuration value, e.g. "warning"
     * @return matching severity, or empty when the value is not legal
     */
    public static Optional<Severity> fromValue(String value) {
        return Arrays.stream(values())
            .filter(severity -> severity.value.equals(value))
            .findFirst();
    }
}
