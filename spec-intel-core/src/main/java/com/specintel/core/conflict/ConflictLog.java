package com.specintel.core.conflict;

import com.specintel.core.InvalidTransitionException;
import com.specintel.core.NotFoundException;
import com.specintel.core.model.Conflict;
import com.specintel.core.model.ConflictStatus;
import com.specintel.core.model.ResolutionAction;
import com.specintel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only record of detected conflicts.
 *
 * <p>Conflicts are only ever added. The one permitted change is resolving an open
 * conflict, which replaces its entry with a resolved copy; a resolved conflict is never
 * reopened. All methods are synchronized on the log.
 */
public class ConflictLog {

    private static final Logger log = LoggerFactory.getLogger(ConflictLog.class);

    private final Clock clock;
    private final List<Conflict> arena = new ArrayList<>();
    private final Map<String, Integer> slotsById = new HashMap<>();

    public ConflictLog() {
        this(Clock.systemUTC());
    }

    public ConflictLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Records every conflict of a detection run.
     *
     * @param result detection run
     * @return the same result, for chaining
     */
    public DetectionResult append(DetectionResult result) {
        append(result.conflicts());
        return result;
    }

    public synchronized void append(Collection<Conflict> conflicts) {
        for (Conflict conflict : conflicts) {
            if (slotsById.containsKey(conflict.conflictId())) {
                throw new IllegalArgumentException("Conflict already recorded: " + conflict.conflictId());
            }
        }
        for (Conflict conflict : conflicts) {
            slotsById.put(conflict.conflictId(), arena.size());
            arena.add(conflict);
        }
        log.debug("Recorded {} conflict(s), {} total", conflicts.size(), arena.size());
    }

    /**
     * Resolves an open conflict.
     *
     * @param conflictId conflict to resolve
     * @param action how it was settled
     * @param notes optional notes appended to the resolution text
     * @return the resolved conflict
     * @throws NotFoundException if no conflict has that ID
     * @throws InvalidTransitionException if the conflict is already resolved
     */
    public synchronized Conflict resolve(String conflictId, ResolutionAction action, String notes) {
        Integer slot = slotsById.get(conflictId);
        if (slot == null) {
            throw new NotFoundException("conflict", conflictId);
        }
        Conflict conflict = arena.get(slot);
        if (!conflict.isOpen()) {
            throw new InvalidTransitionException(conflictId, "resolved", "resolved");
        }
        Conflict resolved = conflict.resolved(action.describe(notes), clock.instant());
        arena.set(slot, resolved);
        log.info("Resolved conflict {} ({}) with {}", conflictId, conflict.ruleId(), action.value());
        return resolved;
    }

    public synchronized Optional<Conflict> findById(String conflictId) {
        Integer slot = slotsById.get(conflictId);
        return slot == null ? Optional.empty() : Optional.of(arena.get(slot));
    }

    /**
     * @return every conflict of the project in recording order
     */
    public synchronized List<Conflict> list(String projectId) {
        return arena.stream()
            .filter(conflict -> conflict.projectId().equals(projectId))
            .toList();
    }

    public synchronized List<Conflict> list(String projectId, ConflictStatus status) {
        return arena.stream()
            .filter(conflict -> conflict.projectId().equals(projectId))
            .filter(conflict -> conflict.status() == status)
            .toList();
    }

    /**
     * @return number of open error-severity conflicts of the project
     */
    public synchronized int openErrorCount(String projectId) {
        return (int) arena.stream()
            .filter(conflict -> conflict.projectId().equals(projectId))
            .filter(conflict -> conflict.isOpen() && conflict.severity() == Severity.ERROR)
            .count();
    }

    public synchronized int size() {
        return arena.size();
    }
}
