package com.rostersync.delta;

/**
 * Why a delta could not be applied to the local replica.
 *
 * Every desync is recoverable by requesting a full snapshot, so this is a
 * plain value rather than an exception.
 */
public final class DesyncError {

    public enum Kind {
        /** The package does not start at the replica's version. */
        VERSION_MISMATCH,
        /** An update targeted an id the replica does not hold. */
        UNKNOWN_ENTITY,
        /** A create targeted an id the replica already holds. */
        DUPLICATE_ENTITY
    }

    private final Kind kind;
    private final String entityId;
    private final long expectedVersion;
    private final long receivedVersion;

    private DesyncError(Kind kind, String entityId, long expectedVersion, long receivedVersion) {
        this.kind = kind;
        this.entityId = entityId;
        this.expectedVersion = expectedVersion;
        this.receivedVersion = receivedVersion;
    }

    public static DesyncError versionMismatch(long expectedVersion, long receivedVersion) {
        return new DesyncError(Kind.VERSION_MISMATCH, null, expectedVersion, receivedVersion);
    }

    public static DesyncError unknownEntity(String entityId) {
        return new DesyncError(Kind.UNKNOWN_ENTITY, entityId, -1, -1);
    }

    public static DesyncError duplicateEntity(String entityId) {
        return new DesyncError(Kind.DUPLICATE_ENTITY, entityId, -1, -1);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The offending entity id, or null for a version mismatch.
     */
    public String getEntityId() {
        return entityId;
    }

    /**
     * The replica's version, or -1 when the error is not a version mismatch.
     */
    public long getExpectedVersion() {
        return expectedVersion;
    }

    /**
     * The package's base version, or -1 when the error is not a version mismatch.
     */
    public long getReceivedVersion() {
        return receivedVersion;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case VERSION_MISMATCH -> "VersionMismatch{expected=" + expectedVersion + ", received=" + receivedVersion + "}";
            case UNKNOWN_ENTITY -> "UnknownEntity{" + entityId + "}";
            case DUPLICATE_ENTITY -> "DuplicateEntity{" + entityId + "}";
        };
    }
}
