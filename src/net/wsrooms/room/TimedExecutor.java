package net.wsrooms.room;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs calls with a time limit.
 * Limited calls run on a pool of daemon threads while the caller waits; a
 * call that overruns its limit is cancelled (its thread is interrupted)
 * and the caller gets a TimeoutException. A limit of zero runs the call in
 * the calling thread without any limit.
 */
public class TimedExecutor {

    private final ExecutorService executor;

    public TimedExecutor(String name) {
        executor = Executors.newCachedThreadPool(daemonThreads(name));
    }

    /**
     * Run task and return its result.
     * Exceptions thrown by task are rethrown as they are. If the calling
     * thread is interrupted while waiting, the task is cancelled and an
     * InterruptedException is thrown.
     */
    public <T> T call(Callable<T> task, long timeout) throws Exception {
        if (timeout == 0) return task.call();
        Future<T> f = executor.submit(task);
        try {
            return f.get(timeout, TimeUnit.MILLISECONDS);
        } catch (ExecutionException exc) {
            throw unwrap(exc);
        } catch (TimeoutException exc) {
            f.cancel(true);
            throw exc;
        } catch (InterruptedException exc) {
            f.cancel(true);
            throw exc;
        }
    }

    /**
     * As call(), but interrupts of the calling thread do not cut the wait
     * short; the interrupt status is restored before returning.
     */
    public <T> T callUninterruptibly(Callable<T> task, long timeout)
            throws Exception {
        if (timeout == 0) return task.call();
        Future<T> f = executor.submit(task);
        long deadline = System.nanoTime() +
            TimeUnit.MILLISECONDS.toNanos(timeout);
        boolean interrupted = false;
        try {
            for (;;) {
                try {
                    return f.get(deadline - System.nanoTime(),
                                 TimeUnit.NANOSECONDS);
                } catch (InterruptedException exc) {
                    interrupted = true;
                } catch (ExecutionException exc) {
                    throw unwrap(exc);
                } catch (TimeoutException exc) {
                    f.cancel(true);
                    throw exc;
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private static Exception unwrap(ExecutionException exc) {
        Throwable cause = exc.getCause();
        if (cause instanceof Exception) return (Exception) cause;
        if (cause instanceof Error) throw (Error) cause;
        return exc;
    }

    /**
     * Stop accepting new limited calls; running ones finish normally.
     * Calls without a limit still run, in the calling thread.
     */
    public void shutdown() {
        executor.shutdown();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public static ThreadFactory daemonThreads(final String prefix) {
        return new ThreadFactory() {

            private final AtomicInteger counter = new AtomicInteger();

            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + "-" +
                                      counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }

        };
    }

}
