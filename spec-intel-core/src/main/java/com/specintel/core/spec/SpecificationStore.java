package com.specintel.core.spec;

import com.specintel.core.InvalidTransitionException;
import com.specintel.core.NotFoundException;
import com.specintel.core.model.Specification;
import com.specintel.core.model.SpecificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory specification history with lifecycle rules.
 *
 * <p>Every version ever created stays in an append-only arena. A separate index points at
 * the current version of each {@code (projectId, key)}; superseding a version only clears
 * its current flag. Status transitions rewrite the status of one version in place and
 * never touch its value or version number.
 *
 * <p>All methods are synchronized on the store.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SpecificationStore store = new SpecificationStore();
 * Specification v1 = store.create("p1", "security", "auth", "OAuth2");
 * Specification v2 = store.createVersion("p1", "auth", "JWT");
 * store.transitionStatus(v2.id(), SpecificationStatus.APPROVED);
 * }</pre>
 */
public class SpecificationStore implements SpecificationRepository {

    private static final Logger log = LoggerFactory.getLogger(SpecificationStore.class);

    private final Clock clock;
    private final List<Specification> arena = new ArrayList<>();
    private final Map<String, Integer> slotsById = new HashMap<>();
    private final Map<SpecKey, Integer> currentSlots = new LinkedHashMap<>();
    private final Map<SpecKey, List<Integer>> historySlots = new HashMap<>();

    public SpecificationStore() {
        this(Clock.systemUTC());
    }

    public SpecificationStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ==================== Lifecycle ====================

    /**
     * Creates version 1 of a specification in draft status.
     *
     * @return the new current record
     * @throws DuplicateKeyException if the key already has a current version
     * @throws IllegalArgumentException if project ID or key is blank
     */
    public synchronized Specification create(String projectId, String category, String key, String value) {
        SpecKey specKey = SpecKey.of(projectId, key);
        if (currentSlots.containsKey(specKey)) {
            throw new DuplicateKeyException(projectId, key);
        }
        Specification created = append(specKey, category, value, 1);
        log.info("Created specification {}/{} v1", projectId, key);
        return created;
    }

    /**
     * Supersedes the current version of a key with a new draft.
     *
     * <p>The category carries over from the superseded version.
     *
     * @return the new current record, numbered one above the previous version
     * @throws NotFoundException if the key has no current version
     */
    public synchronized Specification createVersion(String projectId, String key, String value) {
        SpecKey specKey = SpecKey.of(projectId, key);
        Integer slot = currentSlots.get(specKey);
        if (slot == null) {
            throw new NotFoundException("specification", projectId + "/" + key,
                "Use create() for the first version");
        }
        Specification previous = arena.get(slot);
        arena.set(slot, previous.superseded());
        Specification created = append(specKey, previous.category(), value, previous.version() + 1);
        log.info("Created specification {}/{} v{} superseding v{}",
            projectId, key, created.version(), previous.version());
        return created;
    }

    /**
     * Moves a specification version to a new status.
     *
     * @param specId record ID
     * @param target requested status
     * @return the updated record
     * @throws NotFoundException if no record has that ID
     * @throws InvalidTransitionException if the lifecycle does not allow the move
     */
    public synchronized Specification transitionStatus(String specId, SpecificationStatus target) {
        int slot = slotOf(specId);
        Specification spec = arena.get(slot);
        if (!spec.status().canTransitionTo(target)) {
            throw new InvalidTransitionException(specId, spec.status().name().toLowerCase(Locale.ROOT),
                target.name().toLowerCase(Locale.ROOT));
        }
        Specification updated = spec.withStatus(target);
        arena.set(slot, updated);
        log.debug("Specification {} moved {} -> {}", specId, spec.status(), target);
        return updated;
    }

    /**
     * Logically deletes a specification version.
     */
    public Specification deprecate(String specId) {
        return transitionStatus(specId, SpecificationStatus.DEPRECATED);
    }

    // ==================== Queries ====================

    public synchronized Optional<Specification> findById(String specId) {
        Integer slot = slotsById.get(specId);
        return slot == null ? Optional.empty() : Optional.of(arena.get(slot));
    }

    public synchronized Optional<Specification> currentVersion(String projectId, String key) {
        Integer slot = currentSlots.get(SpecKey.of(projectId, key));
        return slot == null ? Optional.empty() : Optional.of(arena.get(slot));
    }

    /**
     * @return every version of the key in ascending version order, empty if unknown
     */
    public synchronized List<Specification> history(String projectId, String key) {
        List<Integer> slots = historySlots.getOrDefault(SpecKey.of(projectId, key), List.of());
        return slots.stream().map(arena::get).toList();
    }

    @Override
    public synchronized List<Specification> getCurrentSpecifications(String projectId) {
        return currentSlots.entrySet().stream()
            .filter(entry -> entry.getKey().projectId().equals(projectId))
            .map(entry -> arena.get(entry.getValue()))
            .toList();
    }

    // ==================== Internals ====================

    private Specification append(SpecKey specKey, String category, String value, int version) {
        Specification spec = new Specification(UUID.randomUUID().toString(), specKey.projectId(), category,
            specKey.key(), value, SpecificationStatus.DRAFT, version, true, clock.instant());
        int slot = arena.size();
        arena.add(spec);
        slotsById.put(spec.id(), slot);
        currentSlots.put(specKey, slot);
        historySlots.computeIfAbsent(specKey, k -> new ArrayList<>()).add(slot);
        return spec;
    }

    private int slotOf(String specId) {
        Integer slot = slotsById.get(specId);
        if (slot == null) {
            throw new NotFoundException("specification", specId);
        }
        return slot;
    }

    private record SpecKey(String projectId, String key) {
        static SpecKey of(String projectId, String key) {
            if (projectId == null || projectId.isBlank()) {
                throw new IllegalArgumentException("projectId must not be blank");
            }
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key must not be blank");
            }
            return new SpecKey(projectId, key);
        }
    }
}
