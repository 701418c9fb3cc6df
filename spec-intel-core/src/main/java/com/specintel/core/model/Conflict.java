package com.specintel.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A recorded violation of a conflict rule against one specification snapshot.
 *
 * <p>Conflicts are evidence, not a live index: a new detection run appends new
 * conflicts and never revives or updates earlier ones. The only mutation is
 * resolution, which produces a copy with status {@link ConflictStatus#RESOLVED}.
 *
 * @param conflictId unique conflict ID
 * @param runId detection run that produced this conflict
 * @param ruleId rule that was violated
 * @param projectId project whose snapshot was evaluated
 * @param specificationIds IDs of the implicated specifications
 * @param severity severity inherited from the rule
 * @param message explanation rendered from the rule's message template
 * @param status open or resolved
 * @param resolution resolution text, null while open
 * @param detectedAt detection time
 * @param resolvedAt resolution time, null while open
 */
public record Conflict(
    String conflictId,
    String runId,
    String ruleId,
    String projectId,
    List<String> specificationIds,
    Severity severity,
    String message,
    ConflictStatus status,
    String resolution,
    Instant detectedAt,
    Instant resolvedAt
) {
    /**
     * Compact constructor normalizing specification IDs.
     */
    public Conflict {
        specificationIds = specificationIds == null ? List.of() : List.copyOf(specificationIds);
    }

    /**
     * @param resolutionText stored resolution text
     * @param at resolution time
     * @return resolved copy of this conflict
     */
    public Conflict resolved(String resolutionText, Instant at) {
        return new Conflict(conflictId, runId, ruleId, projectId, specificationIds, severity, message,
            ConflictStatus.RESOLVED, resolutionText, detectedAt, at);
    }

    public boolean isOpen() {
        return status == ConflictStatus.OPEN;
    }
}
