package com.rostersync.broker;

/**
 * Subscriber callback.
 *
 * Invoked on the broker's dispatch loop, never concurrently for the same
 * subscriber. Implementations must return quickly; expensive work belongs on
 * the subscriber's own executor.
 */
@FunctionalInterface
public interface RosterListener {

    void onEvent(RosterEvent event);
}
