package com.rostersync.broker.netty;

import com.rostersync.broker.UpstreamConnection;
import com.rostersync.broker.UpstreamListener;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One WebSocket connection attempt to the upstream roster feed.
 *
 * Thread Safety:
 * - The channel reference is published once, before any callback fires
 * - onClosed is reported exactly once, whichever of connect failure,
 *   channel inactive or explicit close gets there first
 */
final class NettyUpstreamConnection implements UpstreamConnection {

    private final UpstreamListener listener;
    private final AtomicBoolean closeReported = new AtomicBoolean();

    private volatile Channel channel;
    private volatile boolean open;
    private volatile boolean closeRequested;
    private volatile Throwable failure;

    NettyUpstreamConnection(UpstreamListener listener) {
        this.listener = listener;
    }

    void attach(Channel channel) {
        this.channel = channel;
        if (closeRequested) {
            channel.close();
        }
    }

    void opened() {
        open = true;
        listener.onOpen(this);
    }

    void received(String text) {
        listener.onText(this, text);
    }

    /**
     * Remembers the first failure; it becomes the cause reported on close.
     */
    void recordFailure(Throwable cause) {
        if (failure == null) {
            failure = cause;
        }
    }

    void notifyClosed() {
        open = false;
        if (closeReported.compareAndSet(false, true)) {
            listener.onClosed(this, failure);
        }
    }

    void fail(Throwable cause) {
        recordFailure(cause);
        notifyClosed();
    }

    boolean isOpen() {
        return open;
    }

    @Override
    public boolean send(String text) {
        Channel ch = channel;
        if (!open || ch == null || !ch.isActive()) {
            return false;
        }
        ch.writeAndFlush(new TextWebSocketFrame(text));
        return true;
    }

    @Override
    public void close() {
        closeRequested = true;
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public String toString() {
        Channel ch = channel;
        return "NettyUpstreamConnection{" +
                "channel=" + (ch != null ? ch.id().asShortText() : "pending") +
                ", open=" + open +
                '}';
    }
}
