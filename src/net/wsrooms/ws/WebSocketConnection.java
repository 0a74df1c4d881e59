package net.wsrooms.ws;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.logging.Logger;
import net.wsrooms.api.Connection;
import net.wsrooms.api.ConnectionState;
import net.wsrooms.api.DisconnectedException;
import net.wsrooms.api.Frame;
import net.wsrooms.api.ProtocolException;
import net.wsrooms.util.UniqueCounter;
import net.wsrooms.util.Util;
import org.java_websocket.WebSocket;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.framing.CloseFrame;

/**
 * Adapts a Java-WebSocket socket to the blocking Connection interface.
 * The library delivers frames through callbacks on its own thread; they
 * are queued here until the room's dispatch loop asks for them.
 */
public class WebSocketConnection implements Connection {

    private static final Logger LOGGER = Logger.getLogger("WSConn");

    private final WebSocket socket;
    private final String identity;
    /* Frames, followed by at most one DisconnectedException as the end
     * marker */
    private final BlockingQueue<Object> inbox;
    private volatile ConnectionState state;

    public WebSocketConnection(WebSocket socket) {
        this.socket = socket;
        this.identity = makeIdentity(socket);
        this.inbox = new LinkedBlockingQueue<Object>();
        this.state = ConnectionState.CONNECTING;
    }

    public String getIdentity() {
        return identity;
    }

    public ConnectionState getState() {
        return state;
    }

    public synchronized void accept() throws ProtocolException {
        if (state != ConnectionState.CONNECTING)
            throw new ProtocolException("Cannot accept " + identity +
                                        " in state " + state);
        if (! socket.isOpen())
            throw new ProtocolException("Socket of " + identity +
                                        " is not open");
        state = ConnectionState.CONNECTED;
    }

    public Frame receive() throws IOException, InterruptedException {
        Object item = inbox.take();
        if (item instanceof Frame) return (Frame) item;
        // Leave the end marker in place for later calls.
        inbox.add(item);
        DisconnectedException exc = (DisconnectedException) item;
        throw new DisconnectedException(exc.getCode(), exc.getReason());
    }

    public void sendText(String text) throws IOException {
        try {
            socket.send(text);
        } catch (WebsocketNotConnectedException exc) {
            throw new IOException(identity + " is not connected", exc);
        }
    }

    public void sendBytes(byte[] data) throws IOException {
        try {
            socket.send(data);
        } catch (WebsocketNotConnectedException exc) {
            throw new IOException(identity + " is not connected", exc);
        }
    }

    public void sendJson(Object value) throws IOException {
        sendText(Util.encodeJSON(value));
    }

    public void close() {
        socket.close(CloseFrame.NORMAL);
        closed(CloseFrame.NORMAL, "Closed locally");
    }

    /**
     * Called by the server when a frame arrived.
     */
    public void received(Frame frame) {
        synchronized (this) {
            if (state == ConnectionState.DISCONNECTED) {
                LOGGER.finer("Dropping " + frame + " for closed " +
                             identity);
                return;
            }
            inbox.add(frame);
        }
    }

    /**
     * Called by the server when the socket closed.
     */
    public synchronized void closed(int code, String reason) {
        if (state == ConnectionState.DISCONNECTED) return;
        state = ConnectionState.DISCONNECTED;
        inbox.add(new DisconnectedException(code, reason));
    }

    public String toString() {
        return "WebSocketConnection[" + identity + ", " + state + "]";
    }

    private static String makeIdentity(WebSocket socket) {
        String id = UniqueCounter.INSTANCE.getString();
        InetSocketAddress addr = socket.getRemoteSocketAddress();
        if (addr == null) return id;
        return addr.getHostString() + ":" + addr.getPort() + "/" + id;
    }

}
