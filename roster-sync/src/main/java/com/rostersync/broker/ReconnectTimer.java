package com.rostersync.broker;

import java.time.Duration;

/**
 * The broker's single cancellable reconnect timer.
 *
 * At most one task is pending: scheduling replaces (and cancels) the previous
 * one, so reconnect attempts can never overlap.
 */
public interface ReconnectTimer {

    void schedule(Duration delay, Runnable task);

    /**
     * Cancels the pending task, if any.
     */
    void cancel();

    boolean isPending();
}
