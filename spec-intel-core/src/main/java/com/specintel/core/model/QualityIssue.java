package com.specintel.core.model;

/**
 * A finding reported by a quality analyzer. Opaque to the scorer.
 *
 * @param analyzerId analyzer that reported the issue
 * @param specificationId specification concerned, or null for project-wide findings
 * @param message description of the issue
 */
public record QualityIssue(
    String analyzerId,
    String specificationId,
    String message
) {
}
