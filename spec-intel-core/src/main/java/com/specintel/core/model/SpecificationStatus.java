package com.specintel.core.model;

/**
 * Lifecycle status of a specification.
 *
 * <p>Forward-only: draft, approved, implemented. {@link #DEPRECATED} is reachable from
 * any other state and is terminal.
 */
public enum SpecificationStatus {
    DRAFT,
    APPROVED,
    IMPLEMENTED,
    DEPRECATED;

    /**
     * Checks whether this status may move to {@code target}.
     *
     * @param target requested status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(SpecificationStatus target) {
        return switch (this) {
            case DRAFT -> target == APPROVED || target == DEPRECATED;
            case APPROVED -> target == IMPLEMENTED || target == DEPRECATED;
            case IMPLEMENTED -> target == DEPRECATED;
            case DEPRECATED -> false;
        };
    }
}
