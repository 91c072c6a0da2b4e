package com.rostersync.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable, versioned roster: every monitored entity at one point in time.
 *
 * Snapshots are never modified after construction. Producing the next roster
 * always means building a new Snapshot, so any number of readers can hold one
 * concurrently without locking.
 *
 * Equality covers the version, the capture time and the entity map; the order
 * in which entities were supplied never matters.
 */
public final class Snapshot {

    private static final Snapshot EMPTY = new Snapshot(0, 0, Collections.emptyMap());

    private final long version;
    private final long capturedAt;
    private final Map<String, Entity> entities;

    private Snapshot(long version, long capturedAt, Map<String, Entity> entities) {
        this.version = version;
        this.capturedAt = capturedAt;
        this.entities = entities;
    }

    /**
     * The cold-start roster: no entities, version 0.
     */
    public static Snapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from a collection of entities.
     *
     * @throws IllegalArgumentException if two entities share an id
     */
    public static Snapshot of(long version, long capturedAt, Collection<Entity> entities) {
        Map<String, Entity> byId = new HashMap<>(Math.max(16, entities.size() * 2));
        for (Entity entity : entities) {
            Objects.requireNonNull(entity, "entity");
            if (byId.putIfAbsent(entity.getId(), entity) != null) {
                throw new IllegalArgumentException("Duplicate entity id in snapshot: " + entity.getId());
            }
        }
        return new Snapshot(version, capturedAt, Collections.unmodifiableMap(byId));
    }

    /**
     * Wraps an already id-keyed map. The map is copied.
     */
    public static Snapshot fromMap(long version, long capturedAt, Map<String, Entity> entities) {
        for (Map.Entry<String, Entity> entry : entities.entrySet()) {
            if (!entry.getKey().equals(entry.getValue().getId())) {
                throw new IllegalArgumentException("Entity keyed under '" + entry.getKey()
                        + "' has id '" + entry.getValue().getId() + "'");
            }
        }
        return new Snapshot(version, capturedAt, Collections.unmodifiableMap(new HashMap<>(entities)));
    }

    public long getVersion() {
        return version;
    }

    public long getCapturedAt() {
        return capturedAt;
    }

    /**
     * Unmodifiable id to entity view.
     */
    public Map<String, Entity> getEntities() {
        return entities;
    }

    public Set<String> ids() {
        return entities.keySet();
    }

    /**
     * Gets an entity by id, or null if it is not on this roster.
     */
    public Entity get(String id) {
        return entities.get(id);
    }

    public boolean contains(String id) {
        return entities.containsKey(id);
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /**
     * Entities in ascending id order, for deterministic encoding.
     */
    public List<Entity> sortedEntities() {
        List<Entity> sorted = new ArrayList<>(entities.values());
        sorted.sort(Comparator.comparing(Entity::getId));
        return sorted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Snapshot)) {
            return false;
        }
        Snapshot other = (Snapshot) o;
        return version == other.version
                && capturedAt == other.capturedAt
                && entities.equals(other.entities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, capturedAt, entities);
    }

    @Override
    public String toString() {
        return "Snapshot{" +
                "version=" + version +
                ", entityCount=" + entities.size() +
                ", capturedAt=" + capturedAt +
                '}';
    }
}
