package org.abstractica.sessionsync.impl.connection;

import org.abstractica.sessionsync.ChannelConfig;
import org.abstractica.sessionsync.Connection;
import org.abstractica.sessionsync.ConnectionRegistry;
import org.abstractica.sessionsync.ConnectionState;
import org.abstractica.sessionsync.CredentialProvider;
import org.abstractica.sessionsync.MessageType;
import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.RealtimeException;
import org.abstractica.sessionsync.impl.codec.EnvelopeCodec;
import org.abstractica.sessionsync.impl.transport.JdkWebSocketTransport;
import org.abstractica.sessionsync.impl.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of the ConnectionRegistry interface.
 *
 * <p>Channels are independent: each {@link DefaultConnection} has its own
 * thread, and the registry holds no lock while calling into them.</p>
 */
public class DefaultConnectionRegistry implements ConnectionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultConnectionRegistry.class);

    private final URI baseUrl;
    private final CredentialProvider credentials;
    private final WebSocketTransport transport;
    private final EnvelopeCodec codec;
    private final Map<String, Connection> connections;

    /**
     * Creates a registry.
     *
     * @param baseUrl     the server base URL shared by all channels
     * @param credentials supplies bearer tokens
     * @param transport   opens sockets
     */
    public DefaultConnectionRegistry(URI baseUrl, CredentialProvider credentials, WebSocketTransport transport)
    {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = new EnvelopeCodec();
        this.connections = new ConcurrentHashMap<>();
    }

    /**
     * Creates a builder.
     *
     * @return a new builder
     */
    public static Builder builder()
    {
        return new Builder();
    }

    // ========== Registration ==========

    @Override
    public void addConnection(ChannelConfig config)
    {
        Objects.requireNonNull(config, "config");

        AtomicBoolean created = new AtomicBoolean(false);
        connections.computeIfAbsent(config.id(), id ->
        {
            created.set(true);
            return new DefaultConnection(config, transport, credentials, codec);
        });
        if (!created.get())
        {
            LOG.warn("[{}] Connection already registered, ignoring", config.id());
            return;
        }
        LOG.info("[{}] Registered channel {}", config.id(), config.endpoint());
    }

    @Override
    public void removeConnection(String channelId)
    {
        Objects.requireNonNull(channelId, "channelId");

        Connection removed = connections.remove(channelId);
        if (removed == null)
        {
            LOG.warn("[{}] No connection to remove", channelId);
            return;
        }
        removed.close();
        LOG.info("[{}] Removed channel", channelId);
    }

    @Override
    public Optional<Connection> getConnection(String channelId)
    {
        Objects.requireNonNull(channelId, "channelId");
        return Optional.ofNullable(connections.get(channelId));
    }

    // ========== Lifecycle ==========

    @Override
    public CompletableFuture<Void> connect(String channelId)
    {
        Connection connection;
        try
        {
            connection = require(channelId);
        }
        catch (RealtimeException.ChannelNotFound e)
        {
            return CompletableFuture.failedFuture(e);
        }
        return connection.connect(baseUrl);
    }

    @Override
    public CompletableFuture<Void> connectAll()
    {
        List<CompletableFuture<Void>> attempts = new ArrayList<>();
        for (Connection connection : connections.values())
        {
            String id = connection.getConfig().id();
            attempts.add(connection.connect(baseUrl).exceptionally(error ->
            {
                LOG.warn("[{}] Connect failed: {}", id, error.getMessage());
                return null;
            }));
        }
        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0]));
    }

    @Override
    public void disconnect(String channelId)
    {
        require(channelId).disconnect();
    }

    @Override
    public void disconnectAll()
    {
        for (Connection connection : connections.values())
        {
            connection.disconnect();
        }
    }

    @Override
    public CompletableFuture<Void> reconnectAuthenticated()
    {
        List<CompletableFuture<Void>> attempts = new ArrayList<>();
        for (Connection connection : connections.values())
        {
            ChannelConfig config = connection.getConfig();
            if (!config.requiresAuth() || !connection.isConnected())
            {
                continue;
            }
            LOG.info("[{}] Reconnecting with refreshed credentials", config.id());
            connection.disconnect();
            attempts.add(connection.connect(baseUrl).exceptionally(error ->
            {
                LOG.warn("[{}] Reconnect failed: {}", config.id(), error.getMessage());
                return null;
            }));
        }
        return CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0]));
    }

    @Override
    public void close()
    {
        for (String id : List.copyOf(connections.keySet()))
        {
            Connection connection = connections.remove(id);
            if (connection != null)
            {
                connection.close();
            }
        }
    }

    // ========== Messaging ==========

    @Override
    public CompletableFuture<Void> send(ProtocolMessage message, String channelId)
    {
        Objects.requireNonNull(message, "message");
        Connection connection;
        try
        {
            connection = require(channelId);
        }
        catch (RealtimeException.ChannelNotFound e)
        {
            return CompletableFuture.failedFuture(e);
        }
        return connection.send(message);
    }

    @Override
    public Flux<ProtocolMessage> subscribe(MessageType type, String channelId)
    {
        return require(channelId).subscribe(type);
    }

    @Override
    public Flux<ProtocolMessage> messages(String channelId)
    {
        return require(channelId).messages();
    }

    // ========== Observation ==========

    @Override
    public boolean isConnected(String channelId)
    {
        return getConnection(channelId).map(Connection::isConnected).orElse(false);
    }

    @Override
    public ConnectionState getConnectionState(String channelId)
    {
        return getConnection(channelId).map(Connection::getState).orElse(ConnectionState.DISCONNECTED);
    }

    @Override
    public Map<String, ConnectionState> getConnectionStates()
    {
        Map<String, ConnectionState> states = new LinkedHashMap<>();
        connections.forEach((id, connection) -> states.put(id, connection.getState()));
        return Map.copyOf(states);
    }

    @Override
    public Flux<ConnectionState> observeConnectionState(String channelId)
    {
        return getConnection(channelId)
                .map(Connection::observeState)
                .orElseGet(() -> Flux.just(ConnectionState.DISCONNECTED));
    }

    @Override
    public Flux<Boolean> observeConnectionStatus(String channelId)
    {
        return getConnection(channelId)
                .map(Connection::observeConnected)
                .orElseGet(() -> Flux.just(false));
    }

    private Connection require(String channelId)
    {
        Objects.requireNonNull(channelId, "channelId");
        Connection connection = connections.get(channelId);
        if (connection == null)
        {
            throw new RealtimeException.ChannelNotFound(channelId);
        }
        return connection;
    }

    // ========== Builder ==========

    /**
     * Builder for DefaultConnectionRegistry.
     */
    public static class Builder
    {
        private URI baseUrl;
        private CredentialProvider credentials = CredentialProvider.anonymous();
        private WebSocketTransport transport; // Defaults to JdkWebSocketTransport
        private final List<ChannelConfig> channels = new ArrayList<>();

        public Builder baseUrl(URI baseUrl)
        {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        public Builder baseUrl(String baseUrl)
        {
            Objects.requireNonNull(baseUrl, "baseUrl");
            return baseUrl(URI.create(baseUrl));
        }

        public Builder credentials(CredentialProvider credentials)
        {
            this.credentials = Objects.requireNonNull(credentials, "credentials");
            return this;
        }

        /**
         * Sets the transport used to open sockets.
         *
         * <p>If not set, {@link JdkWebSocketTransport} is used. Use
         * {@link org.abstractica.sessionsync.impl.transport.SimulatedWebSocketTransport}
         * for testing.</p>
         *
         * @param transport the transport
         * @return this builder
         */
        public Builder transport(WebSocketTransport transport)
        {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        /**
         * Registers a channel when the registry is built.
         *
         * @param config the channel settings
         * @return this builder
         */
        public Builder channel(ChannelConfig config)
        {
            channels.add(Objects.requireNonNull(config, "config"));
            return this;
        }

        public DefaultConnectionRegistry build()
        {
            if (baseUrl == null)
            {
                throw new IllegalStateException("Base URL must be specified");
            }

            WebSocketTransport selected = (transport != null) ? transport : new JdkWebSocketTransport();
            DefaultConnectionRegistry registry = new DefaultConnectionRegistry(baseUrl, credentials, selected);
            channels.forEach(registry::addConnection);
            return registry;
        }
    }
}
