package net.wsrooms.room;

import java.util.ArrayList;
import java.util.List;
import net.wsrooms.api.Connection;

/**
 * The membership list of a room.
 * Readers iterate over snapshots, so concurrent adds and removes never
 * disturb an iteration in progress.
 */
public class MemberRegistry {

    private final List<Connection> members;

    public MemberRegistry() {
        members = new ArrayList<Connection>();
    }

    public synchronized void add(Connection conn) {
        members.add(conn);
    }

    /**
     * Remove conn; returns whether it was present.
     */
    public synchronized boolean remove(Connection conn) {
        return members.remove(conn);
    }

    public synchronized boolean contains(Connection conn) {
        return members.contains(conn);
    }

    public synchronized List<Connection> snapshot() {
        return new ArrayList<Connection>(members);
    }

    public synchronized int size() {
        return members.size();
    }

    public synchronized boolean isEmpty() {
        return members.isEmpty();
    }

}
