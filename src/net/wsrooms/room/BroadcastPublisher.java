package net.wsrooms.room;

import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.wsrooms.api.Connection;

/**
 * Drains a room's outbox and fans each message out to the members.
 * Messages are sent one at a time, in the order they were submitted; each
 * one goes to a snapshot of the members taken just before it is sent out.
 * The draining runs on a worker thread that is started and stopped
 * explicitly; stopping never cuts a message short that is already being
 * sent out, and a restarted worker waits for its stopped predecessor
 * before it touches the outbox.
 */
public class BroadcastPublisher {

    private static final Logger LOGGER = Logger.getLogger("Publisher");

    public interface Hook {

        /**
         * Called (on the worker thread) when sending to conn failed.
         * Delivery to the other members continues afterwards.
         */
        void deliveryFailed(Connection conn, Exception exc);

    }

    private final String name;
    private final MemberRegistry members;
    private final TimedExecutor sender;
    private final long sendTimeout;
    private final BlockingDeque<Broadcast> outbox;
    private final AtomicInteger generation;
    private Hook hook;
    private Worker current;
    private Worker last;

    public BroadcastPublisher(String name, MemberRegistry members,
                              TimedExecutor sender, long sendTimeout) {
        this.name = name;
        this.members = members;
        this.sender = sender;
        this.sendTimeout = sendTimeout;
        this.outbox = new LinkedBlockingDeque<Broadcast>();
        this.generation = new AtomicInteger();
    }

    public void setHook(Hook h) {
        hook = h;
    }

    /**
     * Enqueue msg. Never blocks.
     */
    public void submit(Broadcast msg) {
        outbox.addLast(msg);
    }

    public int getBacklog() {
        return outbox.size();
    }

    public void clearBacklog() {
        outbox.clear();
    }

    /**
     * Start a worker unless one is running; returns whether one was
     * started.
     */
    public synchronized boolean start() {
        if (current != null) return false;
        current = new Worker(last);
        last = null;
        current.start();
        return true;
    }

    /**
     * Stop the running worker, if any; returns whether there was one.
     * This does not wait for the worker to finish.
     */
    public synchronized boolean stop() {
        if (current == null) return false;
        current.cancel();
        last = current;
        current = null;
        return true;
    }

    public synchronized boolean isRunning() {
        return current != null;
    }

    /**
     * Wait until the most recently stopped worker has exited.
     * Returns false if it is still running after timeout milliseconds.
     */
    public boolean awaitStopped(long timeout) throws InterruptedException {
        Worker w;
        synchronized (this) {
            w = last;
        }
        if (w == null) return true;
        w.join(timeout);
        return ! w.isAlive();
    }

    protected void deliver(Broadcast msg) {
        List<Connection> targets = members.snapshot();
        if (targets.isEmpty()) {
            // The room is emptying and we are about to be stopped; leave
            // the message for whoever comes next.
            outbox.addFirst(msg);
            Thread.yield();
            return;
        }
        for (Connection conn : targets) {
            try {
                sender.callUninterruptibly(sendTask(msg, conn),
                                           sendTimeout);
            } catch (Exception exc) {
                LOGGER.log(Level.WARNING, "Could not deliver " + msg +
                           " to " + conn.getIdentity() + " in " + name,
                           exc);
                Hook h = hook;
                if (h != null) h.deliveryFailed(conn, exc);
            }
        }
    }

    private static Callable<Void> sendTask(final Broadcast msg,
                                           final Connection conn) {
        return new Callable<Void>() {
            public Void call() throws Exception {
                msg.sendTo(conn);
                return null;
            }
        };
    }

    private class Worker extends Thread {

        private final Worker predecessor;
        private volatile boolean cancelled;

        public Worker(Worker predecessor) {
            super("wsrooms-publisher-" + name + "-" +
                  generation.incrementAndGet());
            setDaemon(true);
            this.predecessor = predecessor;
        }

        public void cancel() {
            cancelled = true;
            interrupt();
        }

        public void run() {
            LOGGER.fine("Publisher for " + name + " started");
            try {
                if (predecessor != null) predecessor.join();
                while (! cancelled) {
                    deliver(outbox.takeFirst());
                }
            } catch (InterruptedException exc) {
                // Stopped while idle.
            }
            LOGGER.fine("Publisher for " + name + " stopped");
        }

    }

}
