package net.wsrooms.api;

import java.io.IOException;

/**
 * A bidirectional message connection to a single client.
 * Instances are supplied by the host (such as the WebSocket server in
 * net.wsrooms.ws) and handed to Room.connect(); the room never creates
 * them. A fresh connection is in the CONNECTING state; the room performs
 * the semantic accept itself.
 * Implementations must allow the send methods and close() to be called
 * from other threads than the one blocked in receive().
 */
public interface Connection {

    /**
     * A transport-level identity for log output, such as the remote
     * address.
     */
    String getIdentity();

    /**
     * The current connectivity state.
     */
    ConnectionState getState();

    /**
     * Accept the connection, moving it from CONNECTING to CONNECTED.
     * Throws a ProtocolException if the connection is not in the
     * CONNECTING state or could not be accepted.
     */
    void accept() throws ProtocolException;

    /**
     * Block until the next frame arrives.
     * If the peer closes the connection (or has already closed it), a
     * DisconnectedException is thrown. Other IOExceptions denote transport
     * failures.
     */
    Frame receive() throws IOException, InterruptedException;

    /**
     * Send a text frame.
     */
    void sendText(String text) throws IOException;

    /**
     * Send a binary frame.
     */
    void sendBytes(byte[] data) throws IOException;

    /**
     * Send a JSON value.
     * value is anything org.json can serialize; how it is framed is up to
     * the implementation (the WebSocket one sends a text frame).
     */
    void sendJson(Object value) throws IOException;

    /**
     * Close the connection.
     * Closing an already-closed connection is a no-op; a thread blocked in
     * receive() is woken up with a DisconnectedException.
     */
    void close();

}
