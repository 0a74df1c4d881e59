package net.wsrooms.room;

import java.util.Locale;
import net.wsrooms.util.Util;
import net.wsrooms.util.config.Configuration;

/**
 * Tunables of a room.
 * Instances are immutable; the with*() methods return modified copies.
 */
public final class RoomSettings {

    /**
     * What happens to broadcasts that are still queued when a room loses
     * its last member.
     */
    public enum BacklogPolicy {

        /** Keep them; they are delivered to whoever joins next. */
        RETAIN,

        /** Drop them, along with anything pushed while the room is empty. */
        DISCARD;

        public static BacklogPolicy parse(String name) {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }

    }

    public static final String K_HANDLER_TIMEOUT = "wsrooms.handler.timeout";
    public static final String K_SEND_TIMEOUT = "wsrooms.send.timeout";
    public static final String K_BACKLOG = "wsrooms.backlog";

    public static final long DEFAULT_HANDLER_TIMEOUT = 30000;
    public static final long DEFAULT_SEND_TIMEOUT = 10000;

    public static final RoomSettings DEFAULTS = new RoomSettings(
        DEFAULT_HANDLER_TIMEOUT, DEFAULT_SEND_TIMEOUT, BacklogPolicy.RETAIN);

    private final long handlerTimeout;
    private final long sendTimeout;
    private final BacklogPolicy backlogPolicy;

    public RoomSettings(long handlerTimeout, long sendTimeout,
                        BacklogPolicy backlogPolicy) {
        if (handlerTimeout < 0 || sendTimeout < 0)
            throw new IllegalArgumentException("Negative timeout");
        if (backlogPolicy == null)
            throw new NullPointerException("backlogPolicy");
        this.handlerTimeout = handlerTimeout;
        this.sendTimeout = sendTimeout;
        this.backlogPolicy = backlogPolicy;
    }

    /**
     * Milliseconds a handler or hook may run; zero means no limit.
     */
    public long getHandlerTimeout() {
        return handlerTimeout;
    }
    public RoomSettings withHandlerTimeout(long millis) {
        return new RoomSettings(millis, sendTimeout, backlogPolicy);
    }

    /**
     * Milliseconds a single broadcast send may take; zero means no limit.
     */
    public long getSendTimeout() {
        return sendTimeout;
    }
    public RoomSettings withSendTimeout(long millis) {
        return new RoomSettings(handlerTimeout, millis, backlogPolicy);
    }

    public BacklogPolicy getBacklogPolicy() {
        return backlogPolicy;
    }
    public RoomSettings withBacklogPolicy(BacklogPolicy policy) {
        return new RoomSettings(handlerTimeout, sendTimeout, policy);
    }

    public String toString() {
        return "RoomSettings[handlerTimeout=" + handlerTimeout +
            ", sendTimeout=" + sendTimeout + ", backlog=" + backlogPolicy +
            "]";
    }

    public static RoomSettings fromConfiguration(Configuration config) {
        long ht = Util.parseLong(K_HANDLER_TIMEOUT,
            config.get(K_HANDLER_TIMEOUT), DEFAULT_HANDLER_TIMEOUT);
        long st = Util.parseLong(K_SEND_TIMEOUT,
            config.get(K_SEND_TIMEOUT), DEFAULT_SEND_TIMEOUT);
        String bp = config.get(K_BACKLOG);
        BacklogPolicy policy = (Util.nonempty(bp)) ?
            BacklogPolicy.parse(bp) : BacklogPolicy.RETAIN;
        // Out-of-range values are treated like unparseable ones.
        if (ht < 0) ht = DEFAULT_HANDLER_TIMEOUT;
        if (st < 0) st = DEFAULT_SEND_TIMEOUT;
        return new RoomSettings(ht, st, policy);
    }

}
