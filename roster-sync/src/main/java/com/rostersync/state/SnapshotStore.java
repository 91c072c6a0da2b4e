package com.rostersync.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the last fully reconciled roster.
 *
 * Thread Safety:
 * - The current snapshot sits in an AtomicReference, so replace is a single
 *   atomic swap and readers never see a partially written roster
 * - Snapshots are immutable, so readers need no locking at all
 *
 * No validation lives here. Callers (the broker) only commit snapshots that
 * the applicator accepted or that arrived as a full snapshot.
 */
public class SnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

    private final AtomicReference<Snapshot> current;
    private final SnapshotObserver observer;

    public SnapshotStore() {
        this(null);
    }

    public SnapshotStore(SnapshotObserver observer) {
        this.current = new AtomicReference<>(Snapshot.empty());
        this.observer = observer;
    }

    public Snapshot current() {
        return current.get();
    }

    /**
     * Atomically swaps in the next roster and notifies the observer.
     */
    public void replace(Snapshot next) {
        Objects.requireNonNull(next, "next");
        Snapshot previous = current.getAndSet(next);
        logger.debug("Snapshot replaced: version {} -> {} ({} entities)",
                previous.getVersion(), next.getVersion(), next.size());

        if (observer != null) {
            observer.onSnapshotReplaced(next);
        }
    }
}
