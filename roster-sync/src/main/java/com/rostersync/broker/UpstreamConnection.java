package com.rostersync.broker;

/**
 * One attempt at (or one live instance of) the upstream connection.
 */
public interface UpstreamConnection {

    /**
     * Sends a text frame.
     *
     * @return false if the connection is not open and nothing was sent
     */
    boolean send(String text);

    /**
     * Closes the connection. The listener still receives onClosed.
     */
    void close();
}
