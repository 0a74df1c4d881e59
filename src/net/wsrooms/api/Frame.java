package net.wsrooms.api;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A single inbound message as read from a Connection.
 * A frame is either textual or binary; see getKind().
 */
public final class Frame {

    private final MessageKind kind;
    private final String text;
    private final byte[] bytes;

    private Frame(MessageKind kind, String text, byte[] bytes) {
        this.kind = kind;
        this.text = text;
        this.bytes = bytes;
    }

    /**
     * The kind of this frame; either TEXT or BYTES.
     */
    public MessageKind getKind() {
        return kind;
    }

    /**
     * The payload of a TEXT frame, or null for a BYTES one.
     */
    public String getText() {
        return text;
    }

    /**
     * The payload of a BYTES frame, or null for a TEXT one.
     * The array is not copied.
     */
    public byte[] getBytes() {
        return bytes;
    }

    public String toString() {
        if (kind == MessageKind.TEXT)
            return "Frame[TEXT, " + text.length() + " chars]";
        return "Frame[BYTES, " + bytes.length + " bytes]";
    }

    public boolean equals(Object other) {
        if (! (other instanceof Frame)) return false;
        Frame f = (Frame) other;
        if (kind != f.kind) return false;
        if (kind == MessageKind.TEXT) return text.equals(f.text);
        return Arrays.equals(bytes, f.bytes);
    }

    public int hashCode() {
        return (kind == MessageKind.TEXT) ? text.hashCode() :
            Arrays.hashCode(bytes);
    }

    /**
     * Create a TEXT frame.
     */
    public static Frame text(String text) {
        if (text == null) throw new NullPointerException("text");
        return new Frame(MessageKind.TEXT, text, null);
    }

    /**
     * Create a BYTES frame.
     */
    public static Frame bytes(byte[] bytes) {
        if (bytes == null) throw new NullPointerException("bytes");
        return new Frame(MessageKind.BYTES, null, bytes);
    }

    /**
     * Create a BYTES frame holding the UTF-8 encoding of the given string.
     */
    public static Frame utf8(String text) {
        return bytes(text.getBytes(StandardCharsets.UTF_8));
    }

}
