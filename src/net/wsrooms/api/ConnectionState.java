package net.wsrooms.api;

/**
 * Connectivity state of a Connection.
 */
public enum ConnectionState {

    /** The transport is ready but the room has not accepted it yet. */
    CONNECTING,

    /** Accepted; frames can be received and sent. */
    CONNECTED,

    /** Closed by either side. */
    DISCONNECTED

}
