package net.wsrooms.util;

public class UniqueCounter {

    public static final UniqueCounter INSTANCE = new UniqueCounter();

    private long lastTime;
    private int sequence;

    /**
     * Output format: a long, with the upper 54 bits containing a
     * millisecond-precise UNIX timestamp, and the remaining bits
     * containing a sequence number that is reset every millisecond.
     * Values are strictly increasing as long as less than 1024 are
     * drawn per millisecond; past that, time is borrowed from the next
     * millisecond.
     */
    public synchronized long get() {
        long curTime = System.currentTimeMillis();
        if (curTime > lastTime) {
            lastTime = curTime;
            sequence = 0;
        } else if (++sequence > 0x3FF) {
            lastTime++;
            sequence = 0;
        }
        return lastTime << 10 | sequence;
    }

    public String getString(long v) {
        return String.format("%016x", v);
    }
    public String getString() {
        return getString(get());
    }

}
