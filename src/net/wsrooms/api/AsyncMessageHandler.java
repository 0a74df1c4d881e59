package net.wsrooms.api;

import java.util.concurrent.CompletionStage;

/**
 * A MessageHandler variant that completes asynchronously.
 * Use Handlers.await() to register one; the room waits for the returned
 * stage before reading the next frame.
 */
public interface AsyncMessageHandler<T> {

    CompletionStage<?> onMessage(Room room, Connection conn, T payload)
        throws Exception;

}
