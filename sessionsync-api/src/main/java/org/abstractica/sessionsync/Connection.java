package org.abstractica.sessionsync;

import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * One physical WebSocket for one channel.
 *
 * <p>A connection owns its lifecycle: it opens the socket, sends heartbeats,
 * and reconnects after unexpected drops according to its
 * {@link ChannelConfig}. It never inspects session semantics; inbound frames
 * are only decoded as far as the {@link ProtocolMessage} envelope.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * connection.subscribe(MessageType.SESSION_SYNC)
 *     .subscribe(message -> store.applySync(...));
 *
 * connection.connect(URI.create("https://api.example.com")).join();
 * connection.send(ProtocolMessage.create(MessageType.SYNC_REQUEST, sessionId, Map.of(), 0, null));
 * }</pre>
 */
public interface Connection extends AutoCloseable
{
    /**
     * Returns the settings this connection was built from.
     *
     * @return the channel config
     */
    ChannelConfig getConfig();

    /**
     * Opens the socket.
     *
     * <p>Completes immediately if already connecting or connected. On
     * failure the state becomes {@link ConnectionState.Failed}, the future
     * completes exceptionally with a {@link RealtimeException}, and the
     * reconnect policy takes over.</p>
     *
     * @param baseUrl the server base URL ({@code http}, {@code https}, {@code ws} or {@code wss})
     * @return completes when the socket is open
     */
    CompletableFuture<Void> connect(URI baseUrl);

    /**
     * Closes the socket and cancels any pending reconnect.
     *
     * <p>Idempotent. Suppresses automatic reconnection until the next
     * explicit {@link #connect}.</p>
     */
    void disconnect();

    /**
     * Sends a message.
     *
     * <p>Sends from concurrent callers are written one at a time.</p>
     *
     * @param message the message to send
     * @return completes when the frame is written; fails with
     *         {@link RealtimeException.Disconnected} when not connected
     */
    CompletableFuture<Void> send(ProtocolMessage message);

    /**
     * Returns decoded inbound messages of one type.
     *
     * <p>Undecodable frames are logged and skipped; they never terminate
     * the stream.</p>
     *
     * @param type the message type to receive
     * @return a live stream of matching messages
     */
    Flux<ProtocolMessage> subscribe(MessageType type);

    /**
     * Returns all decoded inbound messages.
     *
     * @return a live stream of messages
     */
    Flux<ProtocolMessage> messages();

    /**
     * Returns the current state.
     *
     * @return the connection state
     */
    ConnectionState getState();

    /**
     * Returns true if the socket is open.
     *
     * @return true when connected
     */
    default boolean isConnected()
    {
        return getState().isConnected();
    }

    /**
     * Observes state transitions, starting with the current state.
     *
     * @return a live stream of states
     */
    Flux<ConnectionState> observeState();

    /**
     * Observes connected/disconnected status, starting with the current status.
     *
     * @return a live stream of distinct connected flags
     */
    default Flux<Boolean> observeConnected()
    {
        return observeState().map(ConnectionState::isConnected).distinctUntilChanged();
    }

    /**
     * Disconnects and releases threads. The connection cannot be reused.
     */
    @Override
    void close();
}
