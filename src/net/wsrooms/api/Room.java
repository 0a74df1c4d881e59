package net.wsrooms.api;

import java.util.List;

/**
 * A group of live connections that share a broadcast channel.
 * Connections join by being passed to connect(), which runs for the whole
 * lifetime of the connection; inbound messages are dispatched to the
 * handlers registered with onReceive() and friends, and anything pushed
 * with the push*() methods is delivered to every member present when the
 * message is sent out (including the connection that caused the push, if
 * any).
 * Handlers are normally registered once before traffic starts; registering
 * later is permitted, but which handler a concurrently processed message
 * sees is then unspecified.
 */
public interface Room {

    /**
     * The name of the room (used in log output and for routing).
     */
    String getName();

    /**
     * Serve the given connection.
     * This runs the Before-connect hook, accepts the connection, makes it a
     * member, runs the After-connect hook, and then dispatches inbound
     * frames until the connection ends, after which the connection is
     * removed again (running the disconnect hooks).
     * This method blocks until the connection is gone; hosts must run each
     * call on its own thread. Failures of the connection or of handlers are
     * logged and end the connection but are not rethrown; only a failure
     * to accept the connection is reported by a ProtocolException, in which
     * case the connection never became a member. Errors thrown by hooks or
     * handlers propagate, but only after the connection was removed.
     */
    void connect(Connection conn) throws ProtocolException;

    /**
     * Broadcast a text message to all members.
     * This never blocks; messages are delivered in the order they were
     * pushed.
     */
    void pushText(String message);

    /**
     * Broadcast a binary message to all members.
     * The array must not be modified afterwards.
     */
    void pushBytes(byte[] message);

    /**
     * Broadcast a JSON value to all members.
     */
    void pushJson(Object message);

    /**
     * Broadcast a message of the given kind.
     * The other push*() methods are shortcuts for this one.
     */
    void push(Object message, MessageKind kind);

    /**
     * Register the hook to run at the given phase of connecting.
     * A previously registered hook for the same phase is replaced; null
     * removes it.
     */
    Room onConnect(Phase phase, ConnectionHook hook);

    /**
     * Register the hook to run at the given phase of disconnecting.
     */
    Room onDisconnect(Phase phase, ConnectionHook hook);

    /**
     * Register the handler for inbound messages of the given kind.
     * A TEXT or BYTES handler takes precedence for frames of its kind; if
     * there is none, the frame is decoded as JSON for the JSON handler (if
     * any); otherwise it is dropped.
     */
    Room onReceive(MessageKind kind, MessageHandler<Object> handler);

    /**
     * Shortcut for registering a TEXT handler.
     */
    Room onText(MessageHandler<String> handler);

    /**
     * Shortcut for registering a BYTES handler.
     */
    Room onBytes(MessageHandler<byte[]> handler);

    /**
     * Shortcut for registering a JSON handler.
     */
    Room onJson(MessageHandler<Object> handler);

    /**
     * A snapshot of the current members.
     */
    List<Connection> getMembers();

    /**
     * The current amount of members.
     */
    int size();

    /**
     * Whether the broadcast publisher is running.
     * This is true exactly when the room has members.
     */
    boolean isPublishing();

    /**
     * Remove all current members (running their disconnect hooks) and stop
     * the publisher.
     * Connections that are still joining (running the Before-connect hook
     * or being accepted) are refused: their connect() closes them and
     * throws a ProtocolException. The room remains usable; connections
     * that call connect() afterwards join normally.
     */
    void close();

    /**
     * Close the room for good and release its threads.
     * Later calls to connect() throw a ProtocolException.
     */
    void dispose();

}
