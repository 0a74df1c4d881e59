package net.wsrooms.api;

/**
 * The two points around connecting and disconnecting where lifecycle hooks
 * run.
 */
public enum Phase {

    /**
     * Before the membership change.
     * A connecting client is not a member yet; a disconnecting one still is.
     */
    BEFORE,

    /**
     * After the membership change.
     * A connecting client is a member now; a disconnecting one is not
     * anymore.
     */
    AFTER

}
