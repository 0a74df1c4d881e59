package net.wsrooms.api;

/**
 * Wraps a failure of an application-provided handler or hook.
 * The cause is what the handler threw; for handlers that exceeded their
 * time limit it is a java.util.concurrent.TimeoutException.
 */
public class HandlerException extends RuntimeException {

    public HandlerException(String message, Throwable cause) {
        super(message, cause);
    }

}
