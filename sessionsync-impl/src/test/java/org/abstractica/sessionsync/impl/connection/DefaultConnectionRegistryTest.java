package org.abstractica.sessionsync.impl.connection;

import org.abstractica.sessionsync.ChannelConfig;
import org.abstractica.sessionsync.ConnectionState;
import org.abstractica.sessionsync.MessageType;
import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.RealtimeException;
import org.abstractica.sessionsync.impl.transport.SimulatedWebSocketTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultConnectionRegistry}.
 */
class DefaultConnectionRegistryTest
{
    private SimulatedWebSocketTransport transport;
    private AtomicReference<String> token;
    private DefaultConnectionRegistry registry;

    @BeforeEach
    void setUp()
    {
        transport = new SimulatedWebSocketTransport();
        token = new AtomicReference<>("token-1");
        registry = DefaultConnectionRegistry.builder()
                .baseUrl("https://api.example.com")
                .credentials(() -> Optional.ofNullable(token.get()))
                .transport(transport)
                .channel(channel("session", true))
                .build();
    }

    @AfterEach
    void tearDown()
    {
        registry.close();
    }

    private static ChannelConfig channel(String id, boolean requiresAuth)
    {
        return ChannelConfig.builder(id, "/" + id + "/ws/")
                .requiresAuth(requiresAuth)
                .reconnectDelay(Duration.ofMillis(50))
                .build();
    }

    // ========== Registration ==========

    @Test
    void builderRegistersChannels()
    {
        assertTrue(registry.getConnection("session").isPresent());
        assertEquals(Map.of("session", ConnectionState.DISCONNECTED), registry.getConnectionStates());
    }

    @Test
    void duplicateRegistrationKeepsFirst()
    {
        ChannelConfig replacement = ChannelConfig.builder("session", "/other/ws/").build();

        registry.addConnection(replacement);

        assertEquals("/session/ws/", registry.getConnection("session").orElseThrow().getConfig().endpoint());
    }

    @Test
    void removeClosesConnection() throws Exception
    {
        registry.connect("session").get(1, TimeUnit.SECONDS);
        SimulatedWebSocketTransport.SimulatedChannel channel = transport.getCurrentChannel();

        registry.removeConnection("session");

        assertTrue(registry.getConnection("session").isEmpty());
        assertTrue(channel.isClosed());
    }

    @Test
    void builderRequiresBaseUrl()
    {
        assertThrows(IllegalStateException.class, () -> DefaultConnectionRegistry.builder().build());
    }

    // ========== Routing ==========

    @Test
    void connectBuildsChannelUrl() throws Exception
    {
        registry.connect("session").get(1, TimeUnit.SECONDS);

        assertTrue(registry.isConnected("session"));
        assertEquals("wss://api.example.com/session/ws/", transport.getLastUri().toString());
    }

    @Test
    void unknownChannelFailsFast()
    {
        ExecutionException connectError = assertThrows(ExecutionException.class,
                () -> registry.connect("chat").get(1, TimeUnit.SECONDS));
        assertInstanceOf(RealtimeException.ChannelNotFound.class, connectError.getCause());

        ProtocolMessage message = ProtocolMessage.create(MessageType.SYNC_REQUEST, null, Map.of(), 0, null);
        ExecutionException sendError = assertThrows(ExecutionException.class,
                () -> registry.send(message, "chat").get(1, TimeUnit.SECONDS));
        assertInstanceOf(RealtimeException.ChannelNotFound.class, sendError.getCause());

        assertThrows(RealtimeException.ChannelNotFound.class, () -> registry.messages("chat"));
        assertThrows(RealtimeException.ChannelNotFound.class, () -> registry.subscribe(MessageType.SET_ADD, "chat"));
        assertThrows(RealtimeException.ChannelNotFound.class, () -> registry.disconnect("chat"));
    }

    @Test
    void unknownChannelObservesDisconnected()
    {
        assertFalse(registry.isConnected("chat"));
        assertEquals(ConnectionState.DISCONNECTED, registry.getConnectionState("chat"));
        assertEquals(ConnectionState.DISCONNECTED,
                registry.observeConnectionState("chat").blockFirst(Duration.ofSeconds(1)));
        assertEquals(Boolean.FALSE, registry.observeConnectionStatus("chat").blockFirst(Duration.ofSeconds(1)));
    }

    // ========== Bulk Operations ==========

    @Test
    void connectAllIsolatesFailures() throws Exception
    {
        registry.close();
        registry = DefaultConnectionRegistry.builder()
                .baseUrl("https://api.example.com")
                .transport(transport)
                .channel(ChannelConfig.builder("session", "/session/ws/").autoReconnect(false).build())
                .channel(ChannelConfig.builder("chat", "/chat/ws/").autoReconnect(false).build())
                .build();
        transport.failNextOpen(new RealtimeException.ConnectionFailed("refused"));

        registry.connectAll().get(1, TimeUnit.SECONDS);

        long connected = registry.getConnectionStates().values().stream()
                .filter(ConnectionState::isConnected)
                .count();
        assertEquals(1, connected);
        assertEquals(2, transport.getOpenCount());
    }

    @Test
    void reconnectAuthenticatedPresentsFreshToken() throws Exception
    {
        registry.addConnection(channel("public", false));
        registry.connectAll().get(1, TimeUnit.SECONDS);
        assertEquals(2, transport.getOpenCount());

        token.set("token-2");
        registry.reconnectAuthenticated().get(1, TimeUnit.SECONDS);

        assertEquals(3, transport.getOpenCount());
        assertEquals("Bearer token-2", transport.getLastHeaders().get("Authorization"));
        assertTrue(registry.isConnected("session"));
        assertTrue(registry.isConnected("public"));
    }

    @Test
    void disconnectAllStopsEveryChannel() throws Exception
    {
        registry.addConnection(channel("public", false));
        registry.connectAll().get(1, TimeUnit.SECONDS);

        registry.disconnectAll();

        assertFalse(registry.isConnected("session"));
        assertFalse(registry.isConnected("public"));
    }

    @Test
    void statusStreamFollowsConnection() throws Exception
    {
        Boolean first = registry.observeConnectionStatus("session").blockFirst(Duration.ofSeconds(1));
        registry.connect("session").get(1, TimeUnit.SECONDS);
        Boolean afterConnect = registry.observeConnectionStatus("session").blockFirst(Duration.ofSeconds(1));

        assertEquals(Boolean.FALSE, first);
        assertEquals(Boolean.TRUE, afterConnect);
    }
}
