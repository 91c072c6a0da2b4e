package com.rostersync.broker;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window counter of protocol violations.
 * Confined to the broker's dispatch loop; not thread-safe.
 */
class ProtocolErrorWindow {

    private final long windowMillis;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    ProtocolErrorWindow(Duration window) {
        this.windowMillis = window.toMillis();
    }

    /**
     * Records a violation at {@code now} and returns how many fall inside the window.
     */
    int record(long now) {
        timestamps.addLast(now);
        while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowMillis) {
            timestamps.removeFirst();
        }
        return timestamps.size();
    }

    void clear() {
        timestamps.clear();
    }
}
