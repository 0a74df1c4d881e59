package net.wsrooms.api;

/**
 * A lifecycle hook run around a connection joining or leaving a room.
 * See Phase for what membership the hook observes. Exceptions thrown are
 * logged and do not prevent the membership change.
 */
public interface ConnectionHook {

    void onEvent(Room room, Connection conn) throws Exception;

}
