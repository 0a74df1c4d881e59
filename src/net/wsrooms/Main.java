package net.wsrooms;

import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import net.wsrooms.api.Connection;
import net.wsrooms.api.ConnectionHook;
import net.wsrooms.api.MessageHandler;
import net.wsrooms.api.Phase;
import net.wsrooms.api.Room;
import net.wsrooms.room.RoomDistributor;
import net.wsrooms.room.RoomSettings;
import net.wsrooms.room.TimedExecutor;
import net.wsrooms.util.Logging;
import net.wsrooms.util.Util;
import net.wsrooms.util.config.Configuration;
import net.wsrooms.util.config.DynamicConfiguration;
import net.wsrooms.ws.RoomWebSocketServer;

/**
 * Demo server: a chat room at /chat that echoes every text message to all
 * members, and a room at /current_time that receives the time every
 * second.
 */
public class Main implements Runnable {

    public static final String APPNAME = "wsrooms";
    public static final String VERSION = "1.0.0";

    public static final String K_HOST = "wsrooms.host";
    public static final String K_PORT = "wsrooms.port";
    public static final String K_CONFIG = "wsrooms.config";
    public static final String K_LOG_LEVEL = "wsrooms.log.level";

    public static final int DEFAULT_PORT = 8000;
    public static final long TICK_INTERVAL = 1000;
    public static final int SHUTDOWN_TIME = 1000;

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("Main");
    }

    private final Configuration config;
    private RoomWebSocketServer server;
    private ScheduledExecutorService scheduler;

    public Main(Configuration config) {
        this.config = config;
    }

    /**
     * Create the server with its rooms and start the ticker, but do not
     * start listening yet.
     */
    public RoomWebSocketServer setup() {
        String level = config.get(K_LOG_LEVEL);
        if (Util.nonempty(level)) Logging.setLevel(level);
        String host = config.get(K_HOST);
        int port = (int) Util.parseLong(K_PORT, config.get(K_PORT),
                                        DEFAULT_PORT);
        InetSocketAddress addr = (Util.nonempty(host) && ! host.equals("*")) ?
            new InetSocketAddress(host, port) : new InetSocketAddress(port);
        RoomSettings settings = RoomSettings.fromConfiguration(config);
        server = new RoomWebSocketServer(addr);
        server.mount("/chat", makeChatRoom(settings));
        Room time = makeTimeRoom(settings.withBacklogPolicy(
            RoomSettings.BacklogPolicy.DISCARD));
        server.mount("/current_time", time);
        scheduler = Executors.newSingleThreadScheduledExecutor(
            TimedExecutor.daemonThreads("wsrooms-ticker"));
        scheduler.scheduleAtFixedRate(makeTicker(time), TICK_INTERVAL,
                                      TICK_INTERVAL, TimeUnit.MILLISECONDS);
        return server;
    }

    public void shutdown() {
        LOGGER.info("Shutting down");
        if (scheduler != null) scheduler.shutdownNow();
        if (server == null) return;
        try {
            server.shutdown(SHUTDOWN_TIME);
        } catch (InterruptedException exc) {
            for (Room r : server.getRooms().values()) r.dispose();
            Thread.currentThread().interrupt();
        }
    }

    public void run() {
        Logging.captureExceptions(LOGGER);
        LOGGER.info(APPNAME + " " + VERSION);
        setup();
        Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
            public void run() {
                shutdown();
            }
        }, "wsrooms-shutdown"));
        server.run();
    }

    public static Room makeChatRoom(RoomSettings settings) {
        Room room = new RoomDistributor("chat", settings);
        room.onText(new MessageHandler<String>() {
            public void onMessage(Room room, Connection conn,
                                  String message) {
                LOGGER.info(conn.getIdentity() + " just sent '" + message +
                            "'");
                room.pushText(message);
            }
        });
        return announcePresence(room);
    }

    public static Room makeTimeRoom(RoomSettings settings) {
        Room room = new RoomDistributor("current_time", settings);
        room.onText(new MessageHandler<String>() {
            public void onMessage(Room room, Connection conn,
                                  String message) {
                LOGGER.info(conn.getIdentity() + " just sent '" + message +
                            "'");
            }
        });
        return announcePresence(room);
    }

    public static Runnable makeTicker(final Room room) {
        return new Runnable() {
            public void run() {
                room.pushJson(Util.createJSONObject("current_time",
                    System.currentTimeMillis() / 1000.0));
            }
        };
    }

    private static Room announcePresence(Room room) {
        room.onConnect(Phase.AFTER, new ConnectionHook() {
            public void onEvent(Room room, Connection conn) {
                LOGGER.info(conn.getIdentity() + " joined the channel " +
                            room.getName());
            }
        });
        room.onDisconnect(Phase.AFTER, new ConnectionHook() {
            public void onEvent(Room room, Connection conn) {
                LOGGER.info(conn.getIdentity() + " left the channel " +
                            room.getName());
            }
        });
        return room;
    }

    public static Configuration makeConfig() throws IOException {
        DynamicConfiguration ret = DynamicConfiguration.makeDefault();
        String path = ret.get(K_CONFIG);
        if (Util.nonempty(path)) ret.addFile(new File(path));
        return ret;
    }

    public static void main(String[] args) throws IOException {
        new Main(makeConfig()).run();
    }

}
