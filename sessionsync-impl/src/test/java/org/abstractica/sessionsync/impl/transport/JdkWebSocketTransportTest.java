package org.abstractica.sessionsync.impl.transport;

import org.abstractica.sessionsync.RealtimeException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JdkWebSocketTransport} that need no server.
 */
class JdkWebSocketTransportTest
{
    private static final FrameListener IGNORING_LISTENER = new FrameListener()
    {
        @Override
        public void onText(String text) {}

        @Override
        public void onBinary(byte[] data) {}

        @Override
        public void onPong() {}

        @Override
        public void onClosed(int statusCode, String reason) {}

        @Override
        public void onError(Throwable error) {}
    };

    @Test
    void restrictedHeaderFailsOpen()
    {
        JdkWebSocketTransport transport = new JdkWebSocketTransport();

        CompletableFuture<WebSocketChannel> opening = transport.open(
                URI.create("ws://localhost:8000/session/ws/"),
                Map.of("Sec-WebSocket-Key", "forged"),
                Duration.ofSeconds(1),
                IGNORING_LISTENER);

        ExecutionException error = assertThrows(ExecutionException.class, () -> opening.get(1, TimeUnit.SECONDS));
        assertInstanceOf(RealtimeException.ConnectionFailed.class, error.getCause());
    }
}
