package com.rostersync.protocol;

/**
 * Defines all frame types exchanged with the upstream roster feed.
 *
 * Observer → Feed:
 * - SUBSCRIBE: Announce the observer, once per connection
 * - RESYNC_REQUEST: Ask for a full snapshot
 *
 * Feed → Observer:
 * - FULL_SNAPSHOT: Complete roster
 * - DELTA: Change-set from one version to the next
 *
 * Both directions:
 * - HEARTBEAT: Keep-alive
 */
public enum FrameType {
    // Observer → Feed
    SUBSCRIBE,
    RESYNC_REQUEST,

    // Feed → Observer
    FULL_SNAPSHOT,
    DELTA,

    // Both
    HEARTBEAT
}
