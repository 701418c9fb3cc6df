package com.specintel.core.model;

import java.time.Instant;

/**
 * A versioned fact about a project.
 *
 * <p>For a given {@code (projectId, key)} exactly one record is current. Superseding a
 * record produces a copy with {@code current=false}; no other field ever changes.
 *
 * @param id unique record ID
 * @param projectId owning project
 * @param category free-text classification, e.g. "security"
 * @param key short identifier, unique per project among current records
 * @param value the fact itself
 * @param status lifecycle status
 * @param version version number, starting at 1
 * @param current whether this is the current version for its key
 * @param createdAt creation time of this version
 */
public record Specification(
    String id,
    String projectId,
    String category,
    String key,
    String value,
    SpecificationStatus status,
    int version,
    boolean current,
    Instant createdAt
) {
    /**
     * @return copy of this record no longer marked current
     */
    public Specification superseded() {
        return new Specification(id, projectId, category, key, value, status, version, false, createdAt);
    }

    /**
     * @param target new status
     * @return copy of this record with the given status
     */
    public Specification withStatus(SpecificationStatus target) {
        return new Specification(id, projectId, category, key, value, target, version, current, createdAt);
    }

    /**
     * @return true if the record is current and not deprecated
     */
    public boolean isLive() {
        return current && status != SpecificationStatus.DEPRECATED;
    }
}
