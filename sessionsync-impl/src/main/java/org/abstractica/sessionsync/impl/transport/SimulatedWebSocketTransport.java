package org.abstractica.sessionsync.impl.transport;

import org.abstractica.sessionsync.RealtimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport for testing connection behavior.
 *
 * <p>Plays the server side of every socket it opens: tests can script
 * handshake failures, push frames to the client, drop the socket or close
 * it from the server, and inspect what the client wrote.</p>
 *
 * <p>Opens complete synchronously unless the transport is set to hang.</p>
 */
public class SimulatedWebSocketTransport implements WebSocketTransport
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedWebSocketTransport.class);

    private final Object lock = new Object();
    private final Deque<Throwable> scriptedFailures = new ArrayDeque<>();
    private final AtomicInteger openCount = new AtomicInteger(0);

    private Throwable permanentFailure;
    private boolean hangOpens;
    private URI lastUri;
    private Map<String, String> lastHeaders = Map.of();
    private SimulatedChannel currentChannel;

    // ========== Scripting ==========

    /**
     * Makes the next open attempt fail with the given error.
     *
     * <p>Calls queue up: each open consumes one scripted failure.</p>
     *
     * @param error the handshake failure
     */
    public void failNextOpen(Throwable error)
    {
        Objects.requireNonNull(error, "error");
        synchronized (lock)
        {
            scriptedFailures.addLast(error);
        }
    }

    /**
     * Makes every open attempt fail until cleared with {@code null}.
     *
     * @param error the handshake failure, or null to accept opens again
     */
    public void failAllOpens(Throwable error)
    {
        synchronized (lock)
        {
            permanentFailure = error;
        }
    }

    /**
     * Makes open attempts never complete, simulating an unresponsive server.
     *
     * @param hang true to hang opens
     */
    public void setHangOpens(boolean hang)
    {
        synchronized (lock)
        {
            hangOpens = hang;
        }
    }

    // ========== Inspection ==========

    /**
     * Returns how many open attempts were made.
     *
     * @return the attempt count
     */
    public int getOpenCount()
    {
        return openCount.get();
    }

    /**
     * Returns the URL of the last open attempt.
     *
     * @return the URL, or null if none
     */
    public URI getLastUri()
    {
        synchronized (lock)
        {
            return lastUri;
        }
    }

    /**
     * Returns the handshake headers of the last open attempt.
     *
     * @return the headers
     */
    public Map<String, String> getLastHeaders()
    {
        synchronized (lock)
        {
            return lastHeaders;
        }
    }

    /**
     * Returns the most recently opened channel.
     *
     * @return the channel, or null if none was opened
     */
    public SimulatedChannel getCurrentChannel()
    {
        synchronized (lock)
        {
            return currentChannel;
        }
    }

    // ========== Server Side ==========

    /**
     * Delivers a text frame to the client on the current channel.
     *
     * @param text the frame content
     */
    public void pushText(String text)
    {
        requireOpenChannel().listener.onText(text);
    }

    /**
     * Delivers a binary frame to the client on the current channel.
     *
     * @param data the frame content
     */
    public void pushBinary(byte[] data)
    {
        requireOpenChannel().listener.onBinary(data);
    }

    /**
     * Fails the current channel as if the network dropped.
     *
     * @param error the failure reported to the client
     */
    public void drop(Throwable error)
    {
        SimulatedChannel channel = requireOpenChannel();
        channel.closed.set(true);
        channel.listener.onError(error);
    }

    /**
     * Closes the current channel from the server.
     *
     * @param statusCode the close code
     * @param reason     the close reason
     */
    public void closeFromServer(int statusCode, String reason)
    {
        SimulatedChannel channel = requireOpenChannel();
        channel.closed.set(true);
        channel.listener.onClosed(statusCode, reason);
    }

    private SimulatedChannel requireOpenChannel()
    {
        SimulatedChannel channel = getCurrentChannel();
        if (channel == null || channel.isClosed())
        {
            throw new IllegalStateException("No open channel");
        }
        return channel;
    }

    // ========== WebSocketTransport ==========

    @Override
    public CompletableFuture<WebSocketChannel> open(
            URI uri,
            Map<String, String> headers,
            Duration timeout,
            FrameListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(listener, "listener");

        int attempt = openCount.incrementAndGet();
        Throwable failure;
        boolean hang;
        synchronized (lock)
        {
            lastUri = uri;
            lastHeaders = Map.copyOf(headers);
            failure = scriptedFailures.isEmpty() ? permanentFailure : scriptedFailures.pollFirst();
            hang = hangOpens;
        }

        LOG.debug("Simulated open #{} to {}", attempt, uri);

        if (hang)
        {
            return new CompletableFuture<>();
        }
        if (failure != null)
        {
            return CompletableFuture.failedFuture(failure);
        }

        SimulatedChannel channel = new SimulatedChannel(listener);
        synchronized (lock)
        {
            currentChannel = channel;
        }
        return CompletableFuture.completedFuture(channel);
    }

    // ========== Channel ==========

    /**
     * Client end of a simulated socket.
     */
    public static final class SimulatedChannel implements WebSocketChannel
    {
        private final FrameListener listener;
        private final List<String> sentFrames = new ArrayList<>();
        private final AtomicInteger pingCount = new AtomicInteger(0);
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile boolean failSends;
        private volatile boolean failPings;
        private volatile boolean withholdPongs;

        SimulatedChannel(FrameListener listener)
        {
            this.listener = listener;
        }

        @Override
        public CompletableFuture<Void> sendText(String text)
        {
            if (closed.get() || failSends)
            {
                return CompletableFuture.failedFuture(
                        new RealtimeException.ConnectionFailed("simulated write failure"));
            }
            synchronized (sentFrames)
            {
                sentFrames.add(text);
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> sendPing()
        {
            if (closed.get() || failPings)
            {
                return CompletableFuture.failedFuture(
                        new RealtimeException.ConnectionFailed("simulated ping failure"));
            }
            pingCount.incrementAndGet();
            if (!withholdPongs)
            {
                listener.onPong();
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close()
        {
            closed.set(true);
        }

        /**
         * Returns the text frames written by the client, oldest first.
         *
         * @return a copy of the written frames
         */
        public List<String> getSentFrames()
        {
            synchronized (sentFrames)
            {
                return List.copyOf(sentFrames);
            }
        }

        /**
         * Returns the number of pings written by the client.
         *
         * @return the ping count
         */
        public int getPingCount()
        {
            return pingCount.get();
        }

        public boolean isClosed()
        {
            return closed.get();
        }

        public void setFailSends(boolean failSends)
        {
            this.failSends = failSends;
        }

        public void setFailPings(boolean failPings)
        {
            this.failPings = failPings;
        }

        /**
         * Keeps accepting pings without answering them, like a peer that went away.
         *
         * @param withholdPongs true to stop answering
         */
        public void setWithholdPongs(boolean withholdPongs)
        {
            this.withholdPongs = withholdPongs;
        }
    }
}
