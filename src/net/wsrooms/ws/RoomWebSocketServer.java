package net.wsrooms.ws;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import net.wsrooms.api.Frame;
import net.wsrooms.api.ProtocolException;
import net.wsrooms.api.Room;
import net.wsrooms.room.TimedExecutor;
import net.wsrooms.util.Util;
import org.java_websocket.WebSocket;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;

/**
 * A WebSocket server that routes connections into rooms by URL path.
 * Every accepted socket is served by Room.connect() on a thread of its own.
 */
public class RoomWebSocketServer extends WebSocketServer {

    private static final Logger LOGGER = Logger.getLogger("RoomWSServer");

    private final Map<String, Room> rooms;
    private final RoomRoutes routes;
    private final ExecutorService workers;
    private final CountDownLatch started;

    public RoomWebSocketServer(InetSocketAddress addr) {
        super(addr);
        rooms = Collections.synchronizedMap(
            new LinkedHashMap<String, Room>());
        routes = new RoomRoutes();
        workers = Executors.newCachedThreadPool(
            TimedExecutor.daemonThreads("wsrooms-conn"));
        started = new CountDownLatch(1);
        setReuseAddr(true);
    }
    public RoomWebSocketServer(int port) {
        this(new InetSocketAddress(port));
    }

    public Map<String, Room> getRooms() {
        synchronized (rooms) {
            return new LinkedHashMap<String, Room>(rooms);
        }
    }
    public Room getRoom(String name) {
        return rooms.get(name);
    }
    public void addRoom(Room room) {
        rooms.put(room.getName(), room);
    }

    /**
     * Serve room at exactly the given path.
     */
    public void mount(String path, Room room) {
        addRoom(room);
        routes.mount(path, room.getName());
    }

    /**
     * Map paths matching pattern to the room whose name is replacement,
     * with group references expanded.
     */
    public void route(Pattern pattern, String replacement) {
        routes.add(pattern, replacement);
    }

    /**
     * Find the room for the given request URI, ignoring the query string.
     */
    public Room resolve(String resource) {
        if (resource == null) return null;
        int idx = resource.indexOf('?');
        String path = (idx == -1) ? resource : resource.substring(0, idx);
        String name = routes.resolve(path);
        return (name == null) ? null : rooms.get(name);
    }

    public void onOpen(WebSocket ws, ClientHandshake handshake) {
        String resource = handshake.getResourceDescriptor();
        final Room room = resolve(resource);
        if (room == null) {
            LOGGER.info("No room at " + resource + "; closing " +
                        ws.getRemoteSocketAddress());
            ws.close(CloseFrame.POLICY_VALIDATION, "No such room");
            return;
        }
        final WebSocketConnection conn = new WebSocketConnection(ws);
        ws.setAttachment(conn);
        workers.execute(new Runnable() {
            public void run() {
                try {
                    room.connect(conn);
                } catch (ProtocolException exc) {
                    LOGGER.log(Level.WARNING, "Could not accept " +
                               conn.getIdentity(), exc);
                }
            }
        });
    }

    public void onMessage(WebSocket ws, String message) {
        WebSocketConnection conn = ws.getAttachment();
        if (conn != null) conn.received(Frame.text(message));
    }

    @Override
    public void onMessage(WebSocket ws, ByteBuffer message) {
        WebSocketConnection conn = ws.getAttachment();
        if (conn != null)
            conn.received(Frame.bytes(Util.extractBytes(message)));
    }

    public void onClose(WebSocket ws, int code, String reason,
                        boolean remote) {
        WebSocketConnection conn = ws.getAttachment();
        if (conn != null) conn.closed(code, reason);
    }

    public void onError(WebSocket ws, Exception exc) {
        if (ws == null) {
            LOGGER.log(Level.SEVERE, "Server error", exc);
            return;
        }
        WebSocketConnection conn = ws.getAttachment();
        String who = (conn == null) ? String.valueOf(
            ws.getRemoteSocketAddress()) : conn.getIdentity();
        LOGGER.log(Level.WARNING, "Error on " + who, exc);
    }

    public void onStart() {
        LOGGER.info("Listening on port " + getPort());
        started.countDown();
    }

    /**
     * Wait until the server is accepting connections.
     */
    public boolean awaitStart(long timeout) throws InterruptedException {
        return started.await(timeout, TimeUnit.MILLISECONDS);
    }

    /**
     * Stop accepting, close all sockets, wait for the connection threads
     * to finish their teardown, and dispose of every registered room.
     */
    public void shutdown(int timeout) throws InterruptedException {
        stop(timeout);
        workers.shutdown();
        if (! workers.awaitTermination(timeout, TimeUnit.MILLISECONDS))
            LOGGER.warning("Connection threads still running after " +
                           "shutdown");
        for (Room r : getRooms().values()) r.dispose();
    }

}
