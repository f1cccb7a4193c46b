package org.abstractica.sessionsync.impl.transport;

import java.util.concurrent.CompletableFuture;

/**
 * An open WebSocket.
 *
 * <p>Callers must not start a write before the previous one has completed.</p>
 */
public interface WebSocketChannel
{
    /**
     * Sends a text frame.
     *
     * @param text the frame content
     * @return completes when the frame is written
     */
    CompletableFuture<Void> sendText(String text);

    /**
     * Sends a ping control frame.
     *
     * @return completes when the ping is written
     */
    CompletableFuture<Void> sendPing();

    /**
     * Closes the socket with a normal close code. Idempotent.
     */
    void close();
}
