package org.abstractica.sessionsync.impl.transport;

import org.abstractica.sessionsync.RealtimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket transport backed by {@link java.net.http.WebSocket}.
 *
 * <p>Fragmented messages are reassembled before they reach the
 * {@link FrameListener}. Handshake rejections with HTTP 401 or 403 fail
 * with {@link RealtimeException.Unauthorized}; handshake timeouts fail
 * with a {@link TimeoutException}.</p>
 */
public class JdkWebSocketTransport implements WebSocketTransport
{
    private static final Logger LOG = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final HttpClient httpClient;

    /**
     * Creates a transport with its own HTTP client.
     */
    public JdkWebSocketTransport()
    {
        this(HttpClient.newHttpClient());
    }

    /**
     * Creates a transport sharing an existing HTTP client.
     *
     * @param httpClient the client used for handshakes
     */
    public JdkWebSocketTransport(HttpClient httpClient)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public CompletableFuture<WebSocketChannel> open(
            URI uri,
            Map<String, String> headers,
            Duration timeout,
            FrameListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(listener, "listener");

        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(timeout);
        try
        {
            headers.forEach(builder::header);
        }
        catch (IllegalArgumentException e)
        {
            return CompletableFuture.failedFuture(mapOpenFailure(e));
        }

        LOG.debug("Opening WebSocket {}", uri);

        return builder.buildAsync(uri, new ListenerAdapter(listener))
                .handle((webSocket, error) ->
                {
                    if (error != null)
                    {
                        throw new CompletionException(mapOpenFailure(unwrap(error)));
                    }
                    return (WebSocketChannel) new JdkChannel(webSocket);
                });
    }

    private static Throwable mapOpenFailure(Throwable error)
    {
        if (error instanceof WebSocketHandshakeException handshake)
        {
            int status = handshake.getResponse().statusCode();
            if (status == 401 || status == 403)
            {
                return new RealtimeException.Unauthorized("handshake rejected with HTTP " + status);
            }
            return new RealtimeException.ConnectionFailed("handshake rejected with HTTP " + status, handshake);
        }
        if (error instanceof IllegalArgumentException)
        {
            // the client refuses reserved handshake headers such as Sec-WebSocket-Key
            return new RealtimeException.ConnectionFailed("illegal handshake request: " + error.getMessage(), error);
        }
        if (error instanceof HttpTimeoutException)
        {
            TimeoutException timeout = new TimeoutException(error.getMessage());
            timeout.initCause(error);
            return timeout;
        }
        return error;
    }

    private static Throwable unwrap(Throwable error)
    {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null)
        {
            current = current.getCause();
        }
        return current;
    }

    // ========== Channel ==========

    private static final class JdkChannel implements WebSocketChannel
    {
        private final WebSocket webSocket;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        JdkChannel(WebSocket webSocket)
        {
            this.webSocket = webSocket;
        }

        @Override
        public CompletableFuture<Void> sendText(String text)
        {
            return webSocket.sendText(text, true).thenApply(ws -> null);
        }

        @Override
        public CompletableFuture<Void> sendPing()
        {
            return webSocket.sendPing(ByteBuffer.allocate(0)).thenApply(ws -> null);
        }

        @Override
        public void close()
        {
            if (!closed.compareAndSet(false, true))
            {
                return;
            }
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "")
                    .orTimeout(5, TimeUnit.SECONDS)
                    .whenComplete((ws, error) ->
                    {
                        if (error != null)
                        {
                            LOG.debug("Close handshake failed, aborting: {}", error.toString());
                            webSocket.abort();
                        }
                    });
        }
    }

    // ========== Listener ==========

    private static final class ListenerAdapter implements WebSocket.Listener
    {
        private final FrameListener listener;
        private final StringBuilder text = new StringBuilder();
        private ByteBuffer binary = ByteBuffer.allocate(0);

        ListenerAdapter(FrameListener listener)
        {
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last)
        {
            text.append(data);
            if (last)
            {
                String frame = text.toString();
                text.setLength(0);
                listener.onText(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last)
        {
            ByteBuffer merged = ByteBuffer.allocate(binary.remaining() + data.remaining());
            merged.put(binary).put(data).flip();
            binary = merged;
            if (last)
            {
                byte[] frame = new byte[binary.remaining()];
                binary.get(frame);
                binary = ByteBuffer.allocate(0);
                listener.onBinary(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message)
        {
            listener.onPong();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason)
        {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error)
        {
            listener.onError(error);
        }
    }
}
