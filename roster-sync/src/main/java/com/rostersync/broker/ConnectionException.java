package com.rostersync.broker;

/**
 * A transport-level failure of the upstream connection.
 *
 * Reported to the broker through {@link UpstreamListener#onClosed}; it drives
 * the reconnect state machine and is never thrown to broker callers.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
