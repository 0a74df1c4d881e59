package net.wsrooms.room;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.wsrooms.api.Connection;
import net.wsrooms.api.ConnectionState;
import net.wsrooms.api.DecodeException;
import net.wsrooms.api.DisconnectedException;
import net.wsrooms.api.Frame;
import net.wsrooms.api.HandlerException;
import net.wsrooms.api.MessageHandler;
import net.wsrooms.api.MessageKind;
import net.wsrooms.api.ProtocolException;
import net.wsrooms.api.Room;
import net.wsrooms.util.Util;

/**
 * Reads frames from one connection and hands them to the room's handlers,
 * strictly one after another.
 */
public class InboundDispatcher {

    private static final Logger LOGGER = Logger.getLogger("Dispatcher");

    private final Room room;
    private final Connection conn;
    private final HandlerRegistry handlers;
    private final TimedExecutor executor;
    private final long handlerTimeout;

    public InboundDispatcher(Room room, Connection conn,
                             HandlerRegistry handlers, TimedExecutor executor,
                             long handlerTimeout) {
        this.room = room;
        this.conn = conn;
        this.handlers = handlers;
        this.executor = executor;
        this.handlerTimeout = handlerTimeout;
    }

    /**
     * Dispatch frames until the connection ends.
     * Returns normally when the peer disconnected (or the connection was
     * closed locally). A failing handler ends the loop with a
     * HandlerException; a connection that was never accepted with a
     * ProtocolException.
     */
    public void run() throws IOException, InterruptedException {
        for (;;) {
            ConnectionState state = conn.getState();
            if (state == ConnectionState.DISCONNECTED) return;
            if (state != ConnectionState.CONNECTED)
                throw new ProtocolException("Receive before accept on " +
                                            conn.getIdentity());
            Frame frame;
            try {
                frame = conn.receive();
            } catch (DisconnectedException exc) {
                LOGGER.fine(conn.getIdentity() + ": " + exc.getMessage());
                return;
            }
            dispatch(frame);
        }
    }

    /**
     * Resolve the handler for frame and run it.
     * Frames nobody handles and frames that cannot be decoded are dropped.
     */
    public void dispatch(Frame frame) throws InterruptedException {
        MessageKind kind = frame.getKind();
        MessageHandler<Object> handler = handlers.getReceiveHandler(kind);
        Object payload;
        if (handler != null) {
            payload = (kind == MessageKind.TEXT) ? frame.getText() :
                frame.getBytes();
        } else {
            handler = handlers.getReceiveHandler(MessageKind.JSON);
            if (handler == null) {
                LOGGER.finer("No handler for " + frame + " from " +
                             conn.getIdentity());
                return;
            }
            kind = MessageKind.JSON;
            try {
                payload = decode(frame);
            } catch (DecodeException exc) {
                LOGGER.log(Level.WARNING, "Dropping " + frame + " from " +
                           conn.getIdentity() + ": " + exc.getMessage());
                return;
            }
        }
        invoke(handler, kind, payload);
    }

    protected void invoke(final MessageHandler<Object> handler,
                          MessageKind kind, final Object payload)
            throws InterruptedException {
        Callable<Void> task = new Callable<Void>() {
            public Void call() throws Exception {
                handler.onMessage(room, conn, payload);
                return null;
            }
        };
        try {
            executor.call(task, handlerTimeout);
        } catch (InterruptedException exc) {
            throw exc;
        } catch (TimeoutException exc) {
            throw new HandlerException(kind + " handler for " +
                conn.getIdentity() + " timed out after " + handlerTimeout +
                " ms", exc);
        } catch (Exception exc) {
            throw new HandlerException(kind + " handler for " +
                conn.getIdentity() + " failed", exc);
        }
    }

    public static Object decode(Frame frame) throws DecodeException {
        String text = (frame.getKind() == MessageKind.TEXT) ?
            frame.getText() : Util.decodeUTF8(frame.getBytes());
        return Util.decodeJSON(text);
    }

}
