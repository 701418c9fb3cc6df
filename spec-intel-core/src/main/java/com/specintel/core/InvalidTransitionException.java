package com.specintel.core;

/**
 * Raised when a status change is not allowed by a lifecycle.
 *
 * <p>Covers specification status transitions and conflict resolution.
 */
public class InvalidTransitionException extends SpecIntelException {

    private final String subjectId;
    private final String from;
    private final String to;

    public InvalidTransitionException(String subjectId, String from, String to) {
        super(String.format("Invalid transition for %s: %s -> %s", subjectId, from, to));
        this.subjectId = subjectId;
        this.from = from;
        this.to = to;
    }

    public String subjectId() {
        return subjectId;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }
}
