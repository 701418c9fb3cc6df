package com.specintel.core.model;

/**
 * Status of a recorded conflict. Conflicts only ever move from open to resolved.
 */
public enum ConflictStatus {
    OPEN,
    RESOLVED
}
