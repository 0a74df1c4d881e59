package net.wsrooms.room;

import java.io.IOException;
import net.wsrooms.api.Connection;
import net.wsrooms.api.MessageKind;

/**
 * A message waiting in a room's outbox.
 */
public final class Broadcast {

    private final Object payload;
    private final MessageKind kind;

    public Broadcast(Object payload, MessageKind kind) {
        if (kind == null) throw new NullPointerException("kind");
        if (kind == MessageKind.TEXT && ! (payload instanceof String))
            throw new IllegalArgumentException("TEXT payload must be a " +
                                               "String");
        if (kind == MessageKind.BYTES && ! (payload instanceof byte[]))
            throw new IllegalArgumentException("BYTES payload must be a " +
                                               "byte[]");
        this.payload = payload;
        this.kind = kind;
    }

    public Object getPayload() {
        return payload;
    }

    public MessageKind getKind() {
        return kind;
    }

    /**
     * Send this message to conn using the method matching its kind.
     */
    public void sendTo(Connection conn) throws IOException {
        switch (kind) {
            case TEXT:
                conn.sendText((String) payload);
                break;
            case BYTES:
                conn.sendBytes((byte[]) payload);
                break;
            case JSON:
                conn.sendJson(payload);
                break;
        }
    }

    public String toString() {
        return "Broadcast[" + kind + "]";
    }

}
