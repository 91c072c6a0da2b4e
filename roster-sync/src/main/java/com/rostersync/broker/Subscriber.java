package com.rostersync.broker;

import java.util.Set;

/**
 * A registered interest, owned by the broker.
 */
final class Subscriber {

    private final String subscriberId;
    private final Set<RosterEventType> eventTypes;
    private final RosterListener listener;

    // Cleared by unsubscribe before the entry leaves the registry, so a
    // dispatch already iterating the registry skips it
    private volatile boolean active = true;

    Subscriber(String subscriberId, Set<RosterEventType> eventTypes, RosterListener listener) {
        this.subscriberId = subscriberId;
        this.eventTypes = eventTypes;
        this.listener = listener;
    }

    String getSubscriberId() {
        return subscriberId;
    }

    RosterListener getListener() {
        return listener;
    }

    boolean accepts(RosterEventType type) {
        return active && eventTypes.contains(type);
    }

    boolean isActive() {
        return active;
    }

    void deactivate() {
        active = false;
    }
}
