package com.rostersync.broker;

import java.util.Objects;

/**
 * Lifecycle state of the upstream connection.
 *
 * Only the {@link ConnectionBroker} moves between states:
 * <pre>
 * DISCONNECTED --connect()--> CONNECTING --success--> CONNECTED
 * CONNECTED --close/error--> RECONNECTING(attempt, nextRetryAt) --timer--> CONNECTING
 * RECONNECTING --retry budget exhausted--> DEGRADED --connect()--> CONNECTING
 * </pre>
 */
public final class ConnectionState {

    public enum Kind {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        RECONNECTING,
        DEGRADED
    }

    public static final ConnectionState DISCONNECTED = new ConnectionState(Kind.DISCONNECTED, 0, 0);
    public static final ConnectionState CONNECTING = new ConnectionState(Kind.CONNECTING, 0, 0);
    public static final ConnectionState CONNECTED = new ConnectionState(Kind.CONNECTED, 0, 0);
    public static final ConnectionState DEGRADED = new ConnectionState(Kind.DEGRADED, 0, 0);

    private final Kind kind;
    private final int attempt;
    private final long nextRetryAt;

    private ConnectionState(Kind kind, int attempt, long nextRetryAt) {
        this.kind = kind;
        this.attempt = attempt;
        this.nextRetryAt = nextRetryAt;
    }

    public static ConnectionState reconnecting(int attempt, long nextRetryAt) {
        return new ConnectionState(Kind.RECONNECTING, attempt, nextRetryAt);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Which retry is scheduled (1-based); 0 outside RECONNECTING.
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * Epoch millis of the scheduled retry; 0 outside RECONNECTING.
     */
    public long getNextRetryAt() {
        return nextRetryAt;
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectionState)) {
            return false;
        }
        ConnectionState other = (ConnectionState) o;
        return kind == other.kind && attempt == other.attempt && nextRetryAt == other.nextRetryAt;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, attempt, nextRetryAt);
    }

    @Override
    public String toString() {
        return kind == Kind.RECONNECTING
                ? "RECONNECTING(attempt=" + attempt + ", nextRetryAt=" + nextRetryAt + ")"
                : kind.name();
    }
}
