package com.rostersync.delta;

import java.util.List;
import java.util.Objects;

/**
 * The change-set leading from one roster version to the next.
 *
 * Packages produced by {@link DeltaCalculator} always span exactly one
 * version (targetVersion = baseVersion + 1). The applicator only requires
 * targetVersion to be greater than baseVersion.
 *
 * The version pair lets a replica detect a missed update: a package whose
 * baseVersion is not the replica's version is never applied.
 */
public final class DeltaPackage {

    private final long baseVersion;
    private final long targetVersion;
    private final List<EntityChange> changes;
    private final DeltaMetadata metadata;

    public DeltaPackage(long baseVersion, long targetVersion, List<EntityChange> changes, DeltaMetadata metadata) {
        this.baseVersion = baseVersion;
        this.targetVersion = targetVersion;
        this.changes = List.copyOf(changes);
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public long getBaseVersion() {
        return baseVersion;
    }

    public long getTargetVersion() {
        return targetVersion;
    }

    public List<EntityChange> getChanges() {
        return changes;
    }

    public DeltaMetadata getMetadata() {
        return metadata;
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeltaPackage)) {
            return false;
        }
        DeltaPackage other = (DeltaPackage) o;
        return baseVersion == other.baseVersion
                && targetVersion == other.targetVersion
                && changes.equals(other.changes)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseVersion, targetVersion, changes, metadata);
    }

    @Override
    public String toString() {
        return "DeltaPackage{" +
                baseVersion + " -> " + targetVersion +
                ", changes=" + changes +
                '}';
    }
}
