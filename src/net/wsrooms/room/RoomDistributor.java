package net.wsrooms.room;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.wsrooms.api.Connection;
import net.wsrooms.api.ConnectionHook;
import net.wsrooms.api.HandlerException;
import net.wsrooms.api.MessageHandler;
import net.wsrooms.api.MessageKind;
import net.wsrooms.api.Phase;
import net.wsrooms.api.ProtocolException;
import net.wsrooms.api.Room;
import net.wsrooms.util.config.Configuration;

public class RoomDistributor implements Room {

    private static final Logger LOGGER = Logger.getLogger("RoomDistr");

    private final String name;
    private final RoomSettings settings;
    private final MemberRegistry members;
    private final HandlerRegistry handlers;
    private final TimedExecutor executor;
    private final BroadcastPublisher publisher;
    /* Connections inside connect() that are not registered yet */
    private final Set<Connection> joining;
    /* Accepted connections whose teardown has not started yet */
    private final Set<Connection> active;
    /* Guards registry changes together with publisher start/stop */
    private final Object lock;
    private volatile boolean disposed;

    public RoomDistributor(String name, RoomSettings settings) {
        this.name = name;
        this.settings = settings;
        this.members = new MemberRegistry();
        this.handlers = new HandlerRegistry();
        this.executor = new TimedExecutor("wsrooms-" + name);
        this.publisher = new BroadcastPublisher(name, members, executor,
                                                settings.getSendTimeout());
        this.joining = Collections.newSetFromMap(
            new ConcurrentHashMap<Connection, Boolean>());
        this.active = Collections.newSetFromMap(
            new ConcurrentHashMap<Connection, Boolean>());
        this.lock = new Object();
        publisher.setHook(new BroadcastPublisher.Hook() {
            public void deliveryFailed(Connection conn, Exception exc) {
                evict(conn);
            }
        });
    }
    public RoomDistributor(String name) {
        this(name, RoomSettings.fromConfiguration(Configuration.DEFAULT));
    }

    public String getName() {
        return name;
    }

    public RoomSettings getSettings() {
        return settings;
    }

    public BroadcastPublisher getPublisher() {
        return publisher;
    }

    public void connect(Connection conn) throws ProtocolException {
        if (disposed)
            throw new ProtocolException(name + " is disposed; refusing " +
                                        conn.getIdentity());
        joining.add(conn);
        boolean registered = false;
        try {
            runHook(handlers.getConnectHook(Phase.BEFORE), "Before-connect",
                    conn);
            conn.accept();
            registered = register(conn);
        } finally {
            if (! registered) joining.remove(conn);
        }
        if (! registered) {
            // close() ran while conn was joining.
            closeQuietly(conn);
            throw new ProtocolException(name + " was closed while " +
                                        conn.getIdentity() + " was joining");
        }
        LOGGER.info(conn.getIdentity() + " joined " + name);
        boolean closed = false, interrupted = false;
        try {
            runHook(handlers.getConnectHook(Phase.AFTER), "After-connect",
                    conn);
            new InboundDispatcher(this, conn, handlers, executor,
                                  settings.getHandlerTimeout()).run();
            closed = true;
        } catch (HandlerException exc) {
            LOGGER.log(Level.WARNING, exc.getMessage() + "; closing",
                       exc.getCause());
        } catch (ProtocolException exc) {
            LOGGER.log(Level.WARNING, "Protocol violation on " +
                       conn.getIdentity(), exc);
        } catch (IOException exc) {
            LOGGER.log(Level.INFO, "Connection " + conn.getIdentity() +
                       " failed", exc);
        } catch (InterruptedException exc) {
            LOGGER.info("Interrupted while serving " + conn.getIdentity());
            interrupted = true;
        } catch (RuntimeException exc) {
            LOGGER.log(Level.SEVERE, "Error while serving " +
                       conn.getIdentity(), exc);
        } finally {
            remove(conn, closed);
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    /**
     * Tear down a member.
     * Runs the Before-disconnect hook, closes the connection unless
     * alreadyClosed, removes it from the registry (stopping the publisher
     * if the room became empty), and runs the After-disconnect hook. This
     * happens at most once per connection; further calls are no-ops.
     * The connection is closed and unregistered even if the
     * Before-disconnect hook throws an Error.
     */
    public void remove(Connection conn, boolean alreadyClosed) {
        if (! active.remove(conn)) return;
        try {
            runHook(handlers.getDisconnectHook(Phase.BEFORE),
                    "Before-disconnect", conn);
        } finally {
            try {
                if (! alreadyClosed) closeQuietly(conn);
            } finally {
                synchronized (lock) {
                    members.remove(conn);
                    if (members.isEmpty()) stopPublisher();
                }
            }
        }
        LOGGER.info(conn.getIdentity() + " left " + name);
        runHook(handlers.getDisconnectHook(Phase.AFTER), "After-disconnect",
                conn);
    }

    /**
     * Drop conn from the registry after a failed delivery and close it.
     * No hooks run here; they run when the connection's own dispatch loop
     * notices the close and tears it down.
     */
    protected void evict(Connection conn) {
        boolean removed;
        synchronized (lock) {
            removed = members.remove(conn);
            if (removed && members.isEmpty()) stopPublisher();
        }
        if (! removed) return;
        LOGGER.warning("Evicted " + conn.getIdentity() + " from " + name);
        closeQuietly(conn);
    }

    /**
     * Make conn a member unless close() cleared it from the joining set in
     * the meantime; returns whether it was registered.
     */
    private boolean register(Connection conn) {
        synchronized (lock) {
            if (! joining.remove(conn)) return false;
            if (! publisher.isRunning() && settings.getBacklogPolicy() ==
                    RoomSettings.BacklogPolicy.DISCARD)
                publisher.clearBacklog();
            active.add(conn);
            publisher.start();
            members.add(conn);
            return true;
        }
    }

    private void stopPublisher() {
        if (publisher.stop() && settings.getBacklogPolicy() ==
                RoomSettings.BacklogPolicy.DISCARD)
            publisher.clearBacklog();
    }

    private void runHook(final ConnectionHook hook, String label,
                         final Connection conn) {
        if (hook == null) return;
        try {
            executor.call(new Callable<Void>() {
                public Void call() throws Exception {
                    hook.onEvent(RoomDistributor.this, conn);
                    return null;
                }
            }, settings.getHandlerTimeout());
        } catch (InterruptedException exc) {
            LOGGER.warning(label + " hook for " + conn.getIdentity() +
                           " interrupted");
            Thread.currentThread().interrupt();
        } catch (Exception exc) {
            LOGGER.log(Level.WARNING, label + " hook for " +
                       conn.getIdentity() + " failed", exc);
        }
    }

    private static void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (RuntimeException exc) {
            LOGGER.log(Level.WARNING, "Error while closing " +
                       conn.getIdentity(), exc);
        }
    }

    public void pushText(String message) {
        push(message, MessageKind.TEXT);
    }

    public void pushBytes(byte[] message) {
        push(message, MessageKind.BYTES);
    }

    public void pushJson(Object message) {
        push(message, MessageKind.JSON);
    }

    public void push(Object message, MessageKind kind) {
        publisher.submit(new Broadcast(message, kind));
    }

    public Room onConnect(Phase phase, ConnectionHook hook) {
        handlers.setConnectHook(phase, hook);
        return this;
    }

    public Room onDisconnect(Phase phase, ConnectionHook hook) {
        handlers.setDisconnectHook(phase, hook);
        return this;
    }

    public Room onReceive(MessageKind kind, MessageHandler<Object> handler) {
        handlers.setReceiveHandler(kind, handler);
        return this;
    }

    public Room onText(MessageHandler<String> handler) {
        return onReceive(MessageKind.TEXT, widen(handler, String.class));
    }

    public Room onBytes(MessageHandler<byte[]> handler) {
        return onReceive(MessageKind.BYTES, widen(handler, byte[].class));
    }

    public Room onJson(MessageHandler<Object> handler) {
        return onReceive(MessageKind.JSON, handler);
    }

    private static <T> MessageHandler<Object> widen(
            final MessageHandler<T> handler, final Class<T> cls) {
        if (handler == null) return null;
        return new MessageHandler<Object>() {
            public void onMessage(Room room, Connection conn, Object payload)
                    throws Exception {
                handler.onMessage(room, conn, cls.cast(payload));
            }
        };
    }

    public List<Connection> getMembers() {
        return members.snapshot();
    }

    public int size() {
        return members.size();
    }

    public boolean isPublishing() {
        return publisher.isRunning();
    }

    public int getBacklog() {
        return publisher.getBacklog();
    }

    public void close() {
        LOGGER.info("Closing " + name);
        synchronized (lock) {
            joining.clear();
        }
        for (Connection conn : new ArrayList<Connection>(active)) {
            remove(conn, false);
        }
    }

    public void dispose() {
        disposed = true;
        close();
        executor.shutdown();
        LOGGER.fine("Disposed " + name);
    }

    public boolean isDisposed() {
        return disposed;
    }

    public String toString() {
        return "RoomDistributor[" + name + ", " + size() + " members]";
    }

}
