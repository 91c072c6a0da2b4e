package com.rostersync.protocol;

/**
 * A frame could not be decoded or violates the wire contract.
 *
 * Recoverable: the broker answers it with a resync and only escalates to a
 * reconnect when violations keep recurring.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
