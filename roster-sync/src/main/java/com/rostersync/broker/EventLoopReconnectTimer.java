package com.rostersync.broker;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link ReconnectTimer} backed by the broker's event loop, so the retry task
 * runs on the same thread as all other broker work.
 */
public class EventLoopReconnectTimer implements ReconnectTimer {

    private final EventExecutor executor;
    private ScheduledFuture<?> pending;

    public EventLoopReconnectTimer(EventExecutor executor) {
        this.executor = executor;
    }

    @Override
    public synchronized void schedule(Duration delay, Runnable task) {
        cancel();
        pending = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    @Override
    public synchronized boolean isPending() {
        return pending != null && !pending.isDone();
    }
}
