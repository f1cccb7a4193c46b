package org.abstractica.sessionsync;

import reactor.core.publisher.Flux;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Routes operations to the connection registered under a channel id.
 *
 * <p>Lookups for an unregistered id fail with
 * {@link RealtimeException.ChannelNotFound}, except the observation methods,
 * which fall back to a disconnected status.</p>
 */
public interface ConnectionRegistry extends AutoCloseable
{
    /**
     * Registers a channel. Does nothing, with a warning, if the id is taken.
     *
     * @param config the channel settings
     */
    void addConnection(ChannelConfig config);

    /**
     * Disconnects and unregisters a channel.
     *
     * @param channelId the channel id
     */
    void removeConnection(String channelId);

    /**
     * Returns the connection for a channel.
     *
     * @param channelId the channel id
     * @return the connection, or empty if not registered
     */
    Optional<Connection> getConnection(String channelId);

    /**
     * Connects one channel.
     *
     * @param channelId the channel id
     * @return completes when connected
     */
    CompletableFuture<Void> connect(String channelId);

    /**
     * Connects every registered channel independently.
     *
     * <p>A failure on one channel is logged and does not affect the others.</p>
     *
     * @return completes when every attempt has finished
     */
    CompletableFuture<Void> connectAll();

    /**
     * Disconnects one channel.
     *
     * @param channelId the channel id
     */
    void disconnect(String channelId);

    /**
     * Disconnects every registered channel.
     */
    void disconnectAll();

    /**
     * Sends a message on a channel.
     *
     * @param message   the message
     * @param channelId the channel id
     * @return completes when written
     */
    CompletableFuture<Void> send(ProtocolMessage message, String channelId);

    /**
     * Subscribes to one message type on a channel.
     *
     * @param type      the message type
     * @param channelId the channel id
     * @return a live stream of matching messages
     */
    Flux<ProtocolMessage> subscribe(MessageType type, String channelId);

    /**
     * Subscribes to every message on a channel.
     *
     * @param channelId the channel id
     * @return a live stream of messages
     */
    Flux<ProtocolMessage> messages(String channelId);

    /**
     * Returns true if the channel is registered and connected.
     *
     * @param channelId the channel id
     * @return the connected flag
     */
    boolean isConnected(String channelId);

    /**
     * Returns the state of a channel, or disconnected if unknown.
     *
     * @param channelId the channel id
     * @return the connection state
     */
    ConnectionState getConnectionState(String channelId);

    /**
     * Returns a snapshot of every channel's state.
     *
     * @return states keyed by channel id
     */
    Map<String, ConnectionState> getConnectionStates();

    /**
     * Observes a channel's state; a single disconnected state if unknown.
     *
     * @param channelId the channel id
     * @return a live stream of states
     */
    Flux<ConnectionState> observeConnectionState(String channelId);

    /**
     * Observes a channel's connected flag; a single {@code false} if unknown.
     *
     * @param channelId the channel id
     * @return a live stream of connected flags
     */
    Flux<Boolean> observeConnectionStatus(String channelId);

    /**
     * Reopens every connected channel that requires authentication,
     * so that a refreshed token is presented.
     *
     * @return completes when every reconnect attempt has finished
     */
    CompletableFuture<Void> reconnectAuthenticated();

    /**
     * Disconnects and closes every channel.
     */
    @Override
    void close();
}
