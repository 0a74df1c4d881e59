package net.wsrooms.api;

/**
 * Thrown when a connection is operated on in a state that does not permit
 * the operation, such as receiving before the connection was accepted, or
 * when accepting a connection fails.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException() {
        super();
    }
    public ProtocolException(String message) {
        super(message);
    }
    public ProtocolException(Throwable cause) {
        super(cause);
    }
    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

}
