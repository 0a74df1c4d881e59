package net.wsrooms.api;

import java.io.IOException;

/**
 * Signals that the peer closed a connection.
 * This is the expected way for a connection to end; rooms treat it as the
 * start of the teardown rather than as an error.
 */
public class DisconnectedException extends IOException {

    /** Close code used when no code is known. */
    public static final int NO_CODE = -1;

    private final int code;
    private final String reason;

    public DisconnectedException(int code, String reason) {
        super((reason == null || reason.isEmpty()) ?
              "Disconnected (code " + code + ")" :
              "Disconnected (code " + code + "): " + reason);
        this.code = code;
        this.reason = reason;
    }
    public DisconnectedException() {
        this(NO_CODE, null);
    }

    /**
     * The transport's close code, or NO_CODE.
     */
    public int getCode() {
        return code;
    }

    /**
     * The close reason given by the peer; may be null.
     */
    public String getReason() {
        return reason;
    }

}
