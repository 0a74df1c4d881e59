package net.wsrooms.api;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Adapters between the synchronous and asynchronous handler flavors.
 */
public final class Handlers {

    private Handlers() {}

    /**
     * Wrap an asynchronous message handler into one that blocks until the
     * returned stage completes.
     * A failed stage is rethrown with its original cause; a null stage
     * counts as already completed.
     */
    public static <T> MessageHandler<T> await(
            final AsyncMessageHandler<T> handler) {
        return new MessageHandler<T>() {
            public void onMessage(Room room, Connection conn, T payload)
                    throws Exception {
                join(handler.onMessage(room, conn, payload));
            }
        };
    }

    /**
     * Wrap an asynchronous hook into one that blocks until the returned
     * stage completes.
     */
    public static ConnectionHook await(final AsyncConnectionHook hook) {
        return new ConnectionHook() {
            public void onEvent(Room room, Connection conn) throws Exception {
                join(hook.onEvent(room, conn));
            }
        };
    }

    private static void join(CompletionStage<?> stage) throws Exception {
        if (stage == null) return;
        try {
            stage.toCompletableFuture().get();
        } catch (ExecutionException exc) {
            Throwable cause = exc.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw exc;
        }
    }

}
