package com.rostersync.broker;

/**
 * Event types a subscriber can register for.
 */
public enum RosterEventType {
    /** The roster was replaced from a full snapshot. */
    RESET,
    /** A delta was applied. */
    UPDATE,
    /** The upstream connection changed state. */
    CONNECTION_STATE
}
