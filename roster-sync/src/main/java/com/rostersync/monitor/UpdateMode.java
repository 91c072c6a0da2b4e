package com.rostersync.monitor;

/**
 * How a roster update reached the replica.
 */
public enum UpdateMode {
    /** The whole roster was replaced from a full snapshot. */
    FULL,
    /** A change-set was applied on top of the previous roster. */
    DELTA
}
