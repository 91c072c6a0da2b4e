package com.rostersync.broker;

/**
 * Opens upstream connections. The broker is its only caller.
 */
public interface UpstreamConnector {

    /**
     * Starts an asynchronous connection attempt. Success is reported through
     * {@link UpstreamListener#onOpen}, failure through {@link UpstreamListener#onClosed}.
     */
    UpstreamConnection connect(UpstreamListener listener);

    /**
     * Releases resources owned by the connector.
     */
    default void shutdown() {
    }
}
