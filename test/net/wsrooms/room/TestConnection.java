package net.wsrooms.room;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.wsrooms.api.Connection;
import net.wsrooms.api.ConnectionState;
import net.wsrooms.api.DisconnectedException;
import net.wsrooms.api.Frame;
import net.wsrooms.api.MessageKind;
import net.wsrooms.api.ProtocolException;

/**
 * In-memory Connection: the test plays the peer through deliver*() and
 * disconnect(), and inspects what the room sent through getSent().
 */
public class TestConnection implements Connection {

    public static final class Sent {

        private final MessageKind kind;
        private final Object payload;

        public Sent(MessageKind kind, Object payload) {
            this.kind = kind;
            this.payload = payload;
        }

        public MessageKind getKind() {
            return kind;
        }

        public Object getPayload() {
            return payload;
        }

        public String toString() {
            return kind + ":" + payload;
        }

    }

    private static final Object END = new Object();

    private final String identity;
    private final BlockingQueue<Object> inbox;
    private final List<Sent> sent;
    private final AtomicInteger closeCalls;
    private volatile ConnectionState state;
    private volatile boolean failSends;
    private volatile boolean failAccept;

    public TestConnection(String identity) {
        this.identity = identity;
        this.inbox = new LinkedBlockingQueue<Object>();
        this.sent = new ArrayList<Sent>();
        this.closeCalls = new AtomicInteger();
        this.state = ConnectionState.CONNECTING;
    }

    public String getIdentity() {
        return identity;
    }

    public ConnectionState getState() {
        return state;
    }

    public synchronized void accept() {
        if (failAccept) throw new ProtocolException("Handshake failed");
        if (state != ConnectionState.CONNECTING)
            throw new ProtocolException("Not connecting: " + state);
        state = ConnectionState.CONNECTED;
    }

    public Frame receive() throws IOException, InterruptedException {
        Object item = inbox.take();
        if (item == END) {
            inbox.add(END);
            throw new DisconnectedException(1000, "bye");
        }
        return (Frame) item;
    }

    public void sendText(String text) throws IOException {
        record(MessageKind.TEXT, text);
    }

    public void sendBytes(byte[] data) throws IOException {
        record(MessageKind.BYTES, data);
    }

    public void sendJson(Object value) throws IOException {
        record(MessageKind.JSON, value);
    }

    private void record(MessageKind kind, Object payload)
            throws IOException {
        if (failSends) throw new IOException("Broken pipe");
        if (state == ConnectionState.DISCONNECTED)
            throw new IOException(identity + " is closed");
        synchronized (sent) {
            sent.add(new Sent(kind, payload));
            sent.notifyAll();
        }
    }

    public void close() {
        closeCalls.incrementAndGet();
        disconnect();
    }

    /* Peer side */

    public void deliver(Frame frame) {
        inbox.add(frame);
    }
    public void deliverText(String text) {
        deliver(Frame.text(text));
    }
    public void deliverBytes(byte[] data) {
        deliver(Frame.bytes(data));
    }

    public synchronized void disconnect() {
        if (state == ConnectionState.DISCONNECTED) return;
        state = ConnectionState.DISCONNECTED;
        inbox.add(END);
    }

    public void setFailSends(boolean fail) {
        failSends = fail;
    }

    public void setFailAccept(boolean fail) {
        failAccept = fail;
    }

    /* Inspection */

    public int getCloseCalls() {
        return closeCalls.get();
    }

    public List<Sent> getSent() {
        synchronized (sent) {
            return new ArrayList<Sent>(sent);
        }
    }

    public List<Object> getSentPayloads() {
        List<Object> ret = new ArrayList<Object>();
        for (Sent s : getSent()) ret.add(s.getPayload());
        return ret;
    }

    /**
     * Wait until at least count messages were sent; returns all of them
     * (possibly fewer than count if the wait timed out).
     */
    public List<Sent> awaitSent(int count, long timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() +
            TimeUnit.MILLISECONDS.toNanos(timeout);
        synchronized (sent) {
            while (sent.size() < count) {
                long left = TimeUnit.NANOSECONDS.toMillis(
                    deadline - System.nanoTime());
                if (left <= 0) break;
                sent.wait(left);
            }
            return new ArrayList<Sent>(sent);
        }
    }

    public String toString() {
        return "TestConnection[" + identity + ", " + state + "]";
    }

}
