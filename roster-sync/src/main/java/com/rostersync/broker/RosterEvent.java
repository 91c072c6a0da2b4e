package com.rostersync.broker;

import com.rostersync.delta.EntityChange;
import com.rostersync.state.Snapshot;

import java.util.List;

/**
 * Payload delivered to subscribers.
 *
 * - RESET: snapshot is the new roster
 * - UPDATE: changes, resultingVersion and the resulting snapshot
 * - CONNECTION_STATE: connectionState
 *
 * Fields a type does not use are null (or empty for changes).
 */
public final class RosterEvent {

    private final RosterEventType type;
    private final Snapshot snapshot;
    private final List<EntityChange> changes;
    private final long resultingVersion;
    private final ConnectionState connectionState;

    private RosterEvent(RosterEventType type, Snapshot snapshot, List<EntityChange> changes,
                        long resultingVersion, ConnectionState connectionState) {
        this.type = type;
        this.snapshot = snapshot;
        this.changes = changes;
        this.resultingVersion = resultingVersion;
        this.connectionState = connectionState;
    }

    public static RosterEvent reset(Snapshot snapshot) {
        return new RosterEvent(RosterEventType.RESET, snapshot, List.of(), snapshot.getVersion(), null);
    }

    public static RosterEvent update(List<EntityChange> changes, Snapshot resulting) {
        return new RosterEvent(RosterEventType.UPDATE, resulting, List.copyOf(changes), resulting.getVersion(), null);
    }

    public static RosterEvent connectionState(ConnectionState state) {
        return new RosterEvent(RosterEventType.CONNECTION_STATE, null, List.of(), -1, state);
    }

    public RosterEventType getType() {
        return type;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public List<EntityChange> getChanges() {
        return changes;
    }

    public long getResultingVersion() {
        return resultingVersion;
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    @Override
    public String toString() {
        return switch (type) {
            case RESET -> "RosterEvent{RESET, version=" + resultingVersion + "}";
            case UPDATE -> "RosterEvent{UPDATE, version=" + resultingVersion + ", changes=" + changes.size() + "}";
            case CONNECTION_STATE -> "RosterEvent{CONNECTION_STATE, " + connectionState + "}";
        };
    }
}
