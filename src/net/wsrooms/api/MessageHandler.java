package net.wsrooms.api;

/**
 * Handles inbound messages of one MessageKind.
 * The type parameter is the payload type: String for TEXT, byte[] for
 * BYTES, and the org.json value for JSON.
 * Invocations for a single connection never overlap; the next frame is
 * read only after onMessage() returned. Any exception thrown ends the
 * connection.
 */
public interface MessageHandler<T> {

    void onMessage(Room room, Connection conn, T payload) throws Exception;

}
