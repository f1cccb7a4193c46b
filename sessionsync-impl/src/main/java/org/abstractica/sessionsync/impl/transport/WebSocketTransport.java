package org.abstractica.sessionsync.impl.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens WebSocket channels.
 *
 * <p>Transport handles the physical socket without any knowledge of the
 * message envelope, heartbeats or reconnection. It simply moves text frames
 * between the client and the server.</p>
 */
public interface WebSocketTransport
{
    /**
     * Opens a socket.
     *
     * <p>The listener is called from a transport thread and must not block.
     * The returned future fails with a
     * {@link org.abstractica.sessionsync.RealtimeException} when the
     * handshake does not succeed.</p>
     *
     * @param uri      the {@code ws} or {@code wss} URL
     * @param headers  handshake headers
     * @param timeout  handshake timeout
     * @param listener receives frames and close events
     * @return completes with the open channel
     */
    CompletableFuture<WebSocketChannel> open(
            URI uri,
            Map<String, String> headers,
            Duration timeout,
            FrameListener listener
    );
}
