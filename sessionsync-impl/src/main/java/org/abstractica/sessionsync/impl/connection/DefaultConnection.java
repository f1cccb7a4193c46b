package org.abstractica.sessionsync.impl.connection;

import org.abstractica.sessionsync.ChannelConfig;
import org.abstractica.sessionsync.Connection;
import org.abstractica.sessionsync.ConnectionState;
import org.abstractica.sessionsync.CredentialProvider;
import org.abstractica.sessionsync.MessageType;
import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.RealtimeException;
import org.abstractica.sessionsync.impl.codec.EnvelopeCodec;
import org.abstractica.sessionsync.impl.transport.FrameListener;
import org.abstractica.sessionsync.impl.transport.WebSocketChannel;
import org.abstractica.sessionsync.impl.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default implementation of the Connection interface.
 *
 * <p>All mutable connection state is owned by one single-threaded executor.
 * Transport callbacks, heartbeat ticks and reconnect timers hop onto that
 * executor before touching state, so transitions are never interleaved.
 * Every socket attempt carries an epoch number; callbacks from an older
 * attempt are ignored.</p>
 */
public class DefaultConnection implements Connection
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultConnection.class);

    /** Policy violation; the server rejected the credentials. */
    static final int CLOSE_POLICY_VIOLATION = 1008;

    private final ChannelConfig config;
    private final WebSocketTransport transport;
    private final CredentialProvider credentials;
    private final EnvelopeCodec codec;
    private final String id;

    private final ScheduledThreadPoolExecutor executor;
    private final Sinks.Many<ConnectionState> stateSink;
    private final Sinks.Many<String> frameSink;

    // Connection state, written on the executor thread only
    private volatile ConnectionState state;
    private volatile boolean closed;
    private int reconnectAttempts;
    private boolean manualDisconnect;
    private long epoch;
    private URI baseUrl;
    private WebSocketChannel channel;
    private ScheduledFuture<?> heartbeatTask;
    private boolean awaitingPong;
    private ScheduledFuture<?> reconnectTask;
    private CompletableFuture<Void> pendingConnect;
    private CompletableFuture<Void> outboundTail;
    private volatile Thread ownerThread;

    /**
     * Creates a connection for one channel.
     *
     * @param config      the channel settings
     * @param transport   opens the physical socket
     * @param credentials supplies the bearer token
     * @param codec       the envelope codec
     */
    public DefaultConnection(
            ChannelConfig config,
            WebSocketTransport transport,
            CredentialProvider credentials,
            EnvelopeCodec codec
    )
    {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.id = config.id();

        this.executor = new ScheduledThreadPoolExecutor(1, runnable ->
        {
            Thread thread = new Thread(runnable, "channel-" + id);
            thread.setDaemon(true);
            ownerThread = thread;
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);

        this.stateSink = Sinks.many().replay().latest();
        this.frameSink = Sinks.many().multicast().directBestEffort();

        this.state = ConnectionState.DISCONNECTED;
        this.stateSink.tryEmitNext(state);
        this.outboundTail = CompletableFuture.completedFuture(null);
    }

    // ========== Connection Interface ==========

    @Override
    public ChannelConfig getConfig()
    {
        return config;
    }

    @Override
    public CompletableFuture<Void> connect(URI baseUrl)
    {
        Objects.requireNonNull(baseUrl, "baseUrl");

        CompletableFuture<Void> result = new CompletableFuture<>();
        execute(() ->
        {
            if (state instanceof ConnectionState.Connecting || state instanceof ConnectionState.Connected)
            {
                result.complete(null);
                return;
            }

            manualDisconnect = false;
            reconnectAttempts = 0;
            this.baseUrl = baseUrl;
            cancelReconnect();

            pendingConnect = result;
            openSocket();
        }, result);
        return result;
    }

    @Override
    public void disconnect()
    {
        runAndWait(() ->
        {
            boolean wasIdle = state instanceof ConnectionState.Disconnected && channel == null
                    && reconnectTask == null && pendingConnect == null;

            manualDisconnect = true;
            epoch++;
            cancelReconnect();
            stopHeartbeat();
            failPending(new RealtimeException.Disconnected(id));
            closeChannel();
            setState(ConnectionState.DISCONNECTED);

            if (!wasIdle)
            {
                LOG.info("[{}] Disconnected", id);
            }
        });
    }

    @Override
    public CompletableFuture<Void> send(ProtocolMessage message)
    {
        Objects.requireNonNull(message, "message");

        if (!state.isConnected())
        {
            return CompletableFuture.failedFuture(new RealtimeException.Disconnected(id));
        }

        String text;
        try
        {
            text = codec.encode(message);
        }
        catch (RealtimeException e)
        {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        execute(() ->
        {
            if (!state.isConnected() || channel == null)
            {
                result.completeExceptionally(new RealtimeException.Disconnected(id));
                return;
            }
            WebSocketChannel target = channel;
            LOG.debug("[{}] Sending {} {}", id, message.type().getWireName(), message.id());
            enqueueWrite(() -> target.sendText(text)).whenComplete((ignored, error) ->
            {
                if (error != null)
                {
                    result.completeExceptionally(new RealtimeException.ConnectionFailed(
                            "write failed: " + describe(unwrap(error)), unwrap(error)));
                }
                else
                {
                    result.complete(null);
                }
            });
        }, result);
        return result;
    }

    @Override
    public Flux<ProtocolMessage> subscribe(MessageType type)
    {
        Objects.requireNonNull(type, "type");
        return messages().filter(message -> message.type() == type);
    }

    @Override
    public Flux<ProtocolMessage> messages()
    {
        return frameSink.asFlux().handle((text, sink) ->
        {
            try
            {
                sink.next(codec.decode(text));
            }
            catch (RealtimeException.Decoding e)
            {
                LOG.warn("[{}] Dropping undecodable frame: {}", id, e.getMessage());
            }
        });
    }

    @Override
    public ConnectionState getState()
    {
        return state;
    }

    @Override
    public Flux<ConnectionState> observeState()
    {
        return stateSink.asFlux();
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        disconnect();
        closed = true;
        runAndWait(() ->
        {
            stateSink.tryEmitComplete();
            frameSink.tryEmitComplete();
        });
        executor.shutdown();
        LOG.debug("[{}] Closed", id);
    }

    // ========== Connecting ==========

    private void openSocket()
    {
        URI uri;
        try
        {
            uri = WebSocketUrls.build(baseUrl, config.endpoint());
        }
        catch (RealtimeException.InvalidUrl e)
        {
            LOG.error("[{}] {}", id, e.getMessage());
            setState(ConnectionState.failed(e));
            failPending(e);
            return;
        }

        setState(ConnectionState.CONNECTING);
        long attemptEpoch = ++epoch;

        LOG.info("[{}] Connecting to {}", id, uri);

        CompletableFuture<WebSocketChannel> opening;
        try
        {
            opening = transport.open(uri, handshakeHeaders(), config.connectTimeout(), new ChannelListener(attemptEpoch));
        }
        catch (RuntimeException e)
        {
            opening = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<WebSocketChannel> attempt = opening;
        attempt.copy()
                .orTimeout(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((opened, error) ->
                        executeQuietly(() -> onOpenResult(attemptEpoch, attempt, opened, error)));
    }

    private Map<String, String> handshakeHeaders()
    {
        Map<String, String> headers = new LinkedHashMap<>();
        if (config.requiresAuth())
        {
            Optional<String> token = credentials.currentToken();
            if (token.isPresent())
            {
                headers.put("Authorization", "Bearer " + token.get());
            }
            else
            {
                LOG.warn("[{}] No token available for authenticated channel", id);
            }
        }
        headers.putAll(config.extraHeaders());
        return headers;
    }

    private void onOpenResult(
            long attemptEpoch,
            CompletableFuture<WebSocketChannel> attempt,
            WebSocketChannel opened,
            Throwable error)
    {
        if (attemptEpoch != epoch || manualDisconnect || closed)
        {
            if (opened != null)
            {
                opened.close();
            }
            LOG.debug("[{}] Ignoring stale connect result", id);
            return;
        }

        if (error != null)
        {
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException)
            {
                // the socket may still open after we gave up on it
                attempt.thenAccept(WebSocketChannel::close);
            }
            handleFailure(toRealtimeException(cause));
            return;
        }

        channel = opened;
        outboundTail = CompletableFuture.completedFuture(null);
        reconnectAttempts = 0;
        setState(ConnectionState.CONNECTED);
        startHeartbeat();

        LOG.info("[{}] Connected", id);

        if (pendingConnect != null)
        {
            CompletableFuture<Void> pending = pendingConnect;
            pendingConnect = null;
            pending.complete(null);
        }
    }

    // ========== Failure Handling ==========

    private void handleFailure(RealtimeException failure)
    {
        epoch++;
        stopHeartbeat();
        closeChannel();
        failPending(failure);

        if (manualDisconnect)
        {
            return;
        }

        LOG.warn("[{}] Connection failed: {}", id, failure.getMessage());
        setState(ConnectionState.failed(failure));

        if (failure.isAuthFailure())
        {
            LOG.error("[{}] Authentication failed, not reconnecting", id);
            return;
        }
        if (!config.autoReconnect())
        {
            return;
        }

        if (reconnectAttempts < config.maxReconnectAttempts())
        {
            scheduleReconnect();
        }
        else
        {
            LOG.error("[{}] Giving up after {} reconnect attempts", id, reconnectAttempts);
            setState(new ConnectionState.Failed(
                    "Maximum reconnect attempts reached (" + config.maxReconnectAttempts() + ")"));
        }
    }

    private void scheduleReconnect()
    {
        reconnectAttempts++;
        setState(ConnectionState.RECONNECTING);

        LOG.info("[{}] Reconnecting in {} ms (attempt {}/{})",
                id, config.reconnectDelay().toMillis(), reconnectAttempts, config.maxReconnectAttempts());

        reconnectTask = executor.schedule(guarded(() ->
        {
            reconnectTask = null;
            if (manualDisconnect || closed)
            {
                return;
            }
            openSocket();
        }), config.reconnectDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelReconnect()
    {
        if (reconnectTask != null)
        {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void failPending(RealtimeException failure)
    {
        if (pendingConnect != null)
        {
            CompletableFuture<Void> pending = pendingConnect;
            pendingConnect = null;
            pending.completeExceptionally(failure);
        }
    }

    private RealtimeException toRealtimeException(Throwable cause)
    {
        if (cause instanceof RealtimeException realtime)
        {
            return realtime;
        }
        if (cause instanceof TimeoutException)
        {
            return new RealtimeException.Timeout(id);
        }
        return new RealtimeException.ConnectionFailed(describe(cause), cause);
    }

    // ========== Heartbeat ==========

    private void startHeartbeat()
    {
        stopHeartbeat();
        awaitingPong = false;
        long intervalMs = config.heartbeatInterval().toMillis();
        long heartbeatEpoch = epoch;
        heartbeatTask = executor.scheduleAtFixedRate(guarded(() -> sendHeartbeat(heartbeatEpoch)),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat()
    {
        if (heartbeatTask != null)
        {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    private void sendHeartbeat(long heartbeatEpoch)
    {
        if (heartbeatEpoch != epoch || channel == null)
        {
            return;
        }
        if (awaitingPong)
        {
            LOG.warn("[{}] No pong since the previous ping", id);
            handleFailure(new RealtimeException.ConnectionFailed("heartbeat failed: no pong received"));
            return;
        }
        awaitingPong = true;
        WebSocketChannel target = channel;
        LOG.debug("[{}] Ping", id);
        enqueueWrite(target::sendPing).whenComplete((ignored, error) ->
        {
            if (error != null)
            {
                executeQuietly(() ->
                {
                    if (heartbeatEpoch == epoch)
                    {
                        Throwable cause = unwrap(error);
                        handleFailure(new RealtimeException.ConnectionFailed(
                                "heartbeat failed: " + describe(cause), cause));
                    }
                });
            }
        });
    }

    // ========== Outbound ==========

    /**
     * Chains a write after the previous one so the transport only sees one
     * write at a time. A failed write does not block the ones after it.
     */
    private CompletableFuture<Void> enqueueWrite(WriteOperation operation)
    {
        CompletableFuture<Void> write = outboundTail
                .handle((ignored, error) -> null)
                .thenCompose(ignored -> operation.write());
        outboundTail = write;
        return write;
    }

    @FunctionalInterface
    private interface WriteOperation
    {
        CompletableFuture<Void> write();
    }

    private void closeChannel()
    {
        if (channel != null)
        {
            WebSocketChannel toClose = channel;
            channel = null;
            try
            {
                toClose.close();
            }
            catch (RuntimeException e)
            {
                LOG.debug("[{}] Error closing socket: {}", id, e.toString());
            }
        }
    }

    // ========== Inbound ==========

    /**
     * Receives transport events for one socket attempt.
     */
    private final class ChannelListener implements FrameListener
    {
        private final long listenerEpoch;

        ChannelListener(long listenerEpoch)
        {
            this.listenerEpoch = listenerEpoch;
        }

        @Override
        public void onText(String text)
        {
            executeQuietly(() -> deliver(text));
        }

        @Override
        public void onBinary(byte[] data)
        {
            String text = new String(data, StandardCharsets.UTF_8);
            executeQuietly(() -> deliver(text));
        }

        @Override
        public void onPong()
        {
            executeQuietly(() ->
            {
                if (isCurrent())
                {
                    awaitingPong = false;
                }
            });
        }

        @Override
        public void onClosed(int statusCode, String reason)
        {
            executeQuietly(() ->
            {
                if (!isCurrent())
                {
                    return;
                }
                LOG.info("[{}] Closed by server: {} {}", id, statusCode, reason);
                handleFailure(closeFailure(statusCode, reason));
            });
        }

        @Override
        public void onError(Throwable error)
        {
            executeQuietly(() ->
            {
                if (!isCurrent())
                {
                    return;
                }
                handleFailure(new RealtimeException.ConnectionFailed("receive failed: " + describe(error), error));
            });
        }

        private void deliver(String text)
        {
            if (!isCurrent())
            {
                return;
            }
            LOG.debug("[{}] Received frame ({} chars)", id, text.length());
            frameSink.tryEmitNext(text);
        }

        private boolean isCurrent()
        {
            return listenerEpoch == epoch && channel != null;
        }
    }

    private static RealtimeException closeFailure(int statusCode, String reason)
    {
        String details = reason == null || reason.isEmpty() ? "code " + statusCode : reason;
        if (statusCode == CLOSE_POLICY_VIOLATION)
        {
            return new RealtimeException.Unauthorized(details);
        }
        if (statusCode >= 4000 && statusCode < 5000)
        {
            return new RealtimeException.ServerError(details);
        }
        return new RealtimeException.ConnectionFailed("closed by server (" + details + ")");
    }

    // ========== State ==========

    private void setState(ConnectionState newState)
    {
        if (newState.equals(state))
        {
            return;
        }
        LOG.debug("[{}] State {} -> {}", id, state, newState);
        state = newState;
        stateSink.tryEmitNext(newState);
    }

    // ========== Executor Helpers ==========

    private void execute(Runnable task, CompletableFuture<?> onRejected)
    {
        try
        {
            executor.execute(guarded(task));
        }
        catch (RejectedExecutionException e)
        {
            onRejected.completeExceptionally(new RealtimeException.Disconnected(id));
        }
    }

    private void executeQuietly(Runnable task)
    {
        try
        {
            executor.execute(guarded(task));
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("[{}] Dropping event after close", id);
        }
    }

    private void runAndWait(Runnable task)
    {
        if (executor.isShutdown())
        {
            return;
        }
        if (Thread.currentThread() == ownerThread)
        {
            task.run();
            return;
        }
        try
        {
            executor.submit(guarded(task)).get();
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("[{}] Executor already shut down", id);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        catch (ExecutionException e)
        {
            LOG.error("[{}] Task failed", id, e.getCause());
        }
    }

    private Runnable guarded(Runnable task)
    {
        return () ->
        {
            try
            {
                task.run();
            }
            catch (RuntimeException e)
            {
                LOG.error("[{}] Unexpected error", id, e);
            }
        };
    }

    private static Throwable unwrap(Throwable error)
    {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null)
        {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error)
    {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
