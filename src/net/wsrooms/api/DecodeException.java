package net.wsrooms.api;

/**
 * Thrown when a frame cannot be decoded into the form a handler asked for,
 * e.g. because it is not valid UTF-8 or not valid JSON.
 */
public class DecodeException extends Exception {

    public DecodeException(String message) {
        super(message);
    }
    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

}
