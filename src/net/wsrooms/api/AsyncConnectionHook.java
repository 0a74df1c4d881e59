package net.wsrooms.api;

import java.util.concurrent.CompletionStage;

/**
 * A ConnectionHook variant that completes asynchronously.
 * Use Handlers.await() to register one.
 */
public interface AsyncConnectionHook {

    CompletionStage<?> onEvent(Room room, Connection conn) throws Exception;

}
