package com.rostersync.state;

/**
 * Notified after every successful {@link SnapshotStore#replace(Snapshot)}.
 */
@FunctionalInterface
public interface SnapshotObserver {

    void onSnapshotReplaced(Snapshot snapshot);
}
