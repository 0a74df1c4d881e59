package net.wsrooms.room;

import java.io.IOException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(10)
public class TimedExecutorTest {

    private final TimedExecutor executor = new TimedExecutor("timed-test");

    @Test
    public void zeroTimeoutRunsInTheCallingThread() throws Exception {
        Thread caller = Thread.currentThread();

        assertSame(caller, executor.call(() -> Thread.currentThread(), 0));
    }

    @Test
    public void taskExceptionsComeBackUnwrapped() {
        final IOException cause = new IOException("nope");

        IOException exc = assertThrows(IOException.class,
            () -> executor.call(() -> {
                throw cause;
            }, 1000));
        assertSame(cause, exc);
    }

    @Test
    public void overrunningTasksAreCancelled() throws Exception {
        final AtomicBoolean interrupted = new AtomicBoolean();

        assertThrows(TimeoutException.class, () -> executor.call(() -> {
            try {
                Thread.sleep(60000);
            } catch (InterruptedException exc) {
                interrupted.set(true);
            }
            return null;
        }, 50));
        TestSupport.awaitCondition("interrupt", interrupted::get);
    }

    @Test
    public void uninterruptibleCallsFinishDespiteInterrupts()
            throws Exception {
        final AtomicReference<Object> result = new AtomicReference<>();
        final AtomicBoolean flagKept = new AtomicBoolean();
        Thread t = new Thread(() -> {
            Thread.currentThread().interrupt();
            try {
                result.set(executor.callUninterruptibly(() -> {
                    Thread.sleep(50);
                    return "done";
                }, 5000));
            } catch (Exception exc) {
                result.set(exc);
            }
            flagKept.set(Thread.currentThread().isInterrupted());
        });
        t.start();
        t.join();

        assertEquals("done", result.get());
        assertTrue(flagKept.get());
    }

    @Test
    public void shutdownRejectsLimitedCallsOnly() throws Exception {
        TimedExecutor ex = new TimedExecutor("timed-shutdown");
        assertEquals("before", ex.call(() -> "before", 1000));

        ex.shutdown();

        assertTrue(ex.isShutdown());
        assertThrows(RejectedExecutionException.class,
                     () -> ex.call(() -> "late", 1000));
        assertEquals("inline", ex.call(() -> "inline", 0));
    }

}
