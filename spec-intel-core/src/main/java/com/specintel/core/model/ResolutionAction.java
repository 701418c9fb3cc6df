package com.specintel.core.model;

/**
 * How a person or agent settled a conflict.
 */
public enum ResolutionAction {
    /** Keep the existing specification, discard the newer one. */
    KEEP_OLD("keep_old"),
    /** Replace the existing specification with the newer one. */
    REPLACE("replace"),
    /** Combine both into a new specification version. */
    MERGE("merge"),
    /** Accept the conflict as-is. */
    IGNORE("ignore");

    private final String value;

    ResolutionAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Formats the stored resolution text: the action, followed by notes when present.
     *
     * @param notes free-text notes, may be null or blank
     * @return resolution text such as {@code "merge: kept both limits"}
     */
    public String describe(String notes) {
        if (notes == null || notes.isBlank()) {
            return value;
        }
        return value + ": " + notes.strip();
    }
}
