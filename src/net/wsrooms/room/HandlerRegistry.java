package net.wsrooms.room;

import java.util.EnumMap;
import java.util.Map;
import net.wsrooms.api.ConnectionHook;
import net.wsrooms.api.MessageHandler;
import net.wsrooms.api.MessageKind;
import net.wsrooms.api.Phase;

/**
 * Holds at most one hook per (event, phase) and one handler per message
 * kind. Registering again replaces; registering null unregisters.
 */
public class HandlerRegistry {

    private final Map<Phase, ConnectionHook> connectHooks;
    private final Map<Phase, ConnectionHook> disconnectHooks;
    private final Map<MessageKind, MessageHandler<Object>> receiveHandlers;

    public HandlerRegistry() {
        connectHooks = new EnumMap<Phase, ConnectionHook>(Phase.class);
        disconnectHooks = new EnumMap<Phase, ConnectionHook>(Phase.class);
        receiveHandlers = new EnumMap<MessageKind, MessageHandler<Object>>(
            MessageKind.class);
    }

    public synchronized void setConnectHook(Phase phase,
                                            ConnectionHook hook) {
        put(connectHooks, phase, hook);
    }
    public synchronized ConnectionHook getConnectHook(Phase phase) {
        return connectHooks.get(phase);
    }

    public synchronized void setDisconnectHook(Phase phase,
                                               ConnectionHook hook) {
        put(disconnectHooks, phase, hook);
    }
    public synchronized ConnectionHook getDisconnectHook(Phase phase) {
        return disconnectHooks.get(phase);
    }

    public synchronized void setReceiveHandler(MessageKind kind,
            MessageHandler<Object> handler) {
        put(receiveHandlers, kind, handler);
    }
    public synchronized MessageHandler<Object> getReceiveHandler(
            MessageKind kind) {
        return receiveHandlers.get(kind);
    }

    private static <K, V> void put(Map<K, V> map, K key, V value) {
        if (key == null) throw new NullPointerException("key");
        if (value == null) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
    }

}
