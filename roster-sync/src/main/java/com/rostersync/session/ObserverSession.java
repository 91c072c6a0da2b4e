package com.rostersync.session;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A connected roster observer on the feed server.
 *
 * Thread Safety:
 * - Session ID and channel are immutable after creation
 * - Client ID and subscription flag are atomics, written by the channel's
 *   event loop and read by the publisher
 */
public class ObserverSession {

    private final String sessionId;
    private final Channel channel;
    private final long connectedAt;

    private final AtomicReference<String> clientId;
    private final AtomicBoolean subscribed;

    public ObserverSession(Channel channel) {
        this.sessionId = UUID.randomUUID().toString();
        this.channel = channel;
        this.connectedAt = System.currentTimeMillis();
        this.clientId = new AtomicReference<>(null);
        this.subscribed = new AtomicBoolean(false);
    }

    public String getSessionId() {
        return sessionId;
    }

    public Channel getChannel() {
        return channel;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    public String getClientId() {
        return clientId.get();
    }

    public void setClientId(String id) {
        clientId.set(id);
    }

    /**
     * True once the observer asked for the stream (SUBSCRIBE or RESYNC_REQUEST).
     */
    public boolean isSubscribed() {
        return subscribed.get();
    }

    public void setSubscribed(boolean value) {
        subscribed.set(value);
    }

    /**
     * Sends a text frame. Netty queues writes from other threads in call order.
     */
    public void send(String text) {
        if (channel.isActive()) {
            channel.writeAndFlush(new TextWebSocketFrame(text));
        }
    }

    public boolean isActive() {
        return channel != null && channel.isActive();
    }

    @Override
    public String toString() {
        return "ObserverSession{" +
                "sessionId='" + sessionId + '\'' +
                ", clientId='" + clientId.get() + '\'' +
                ", subscribed=" + subscribed.get() +
                ", active=" + isActive() +
                '}';
    }
}
