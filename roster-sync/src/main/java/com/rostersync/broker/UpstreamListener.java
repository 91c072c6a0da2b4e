package com.rostersync.broker;

/**
 * Transport callbacks for one connection. May be invoked on any thread.
 */
public interface UpstreamListener {

    /**
     * The handshake completed and frames may flow.
     */
    void onOpen(UpstreamConnection connection);

    void onText(UpstreamConnection connection, String text);

    /**
     * The connection ended or could not be established. Called at most once
     * per connection.
     *
     * @param cause the failure, or null for an orderly close
     */
    void onClosed(UpstreamConnection connection, Throwable cause);
}
