package net.wsrooms.api;

/**
 * The kinds of messages a room distinguishes.
 * Inbound frames are always TEXT or BYTES; JSON is a decoding of either of
 * them that handlers can ask for. Outbound broadcasts can be of any kind.
 */
public enum MessageKind {

    /** A text frame, delivered as a String. */
    TEXT,

    /** A binary frame, delivered as a byte array. */
    BYTES,

    /**
     * A JSON value, delivered as whatever org.json produces for it
     * (JSONObject, JSONArray, String, Number, Boolean or JSONObject.NULL).
     */
    JSON

}
