package org.abstractica.sessionsync.impl.integration;

import org.abstractica.sessionsync.ChannelConfig;
import org.abstractica.sessionsync.MessageType;
import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.impl.codec.EnvelopeCodec;
import org.abstractica.sessionsync.impl.connection.DefaultConnectionRegistry;
import org.abstractica.sessionsync.impl.session.SessionProtocolHandler;
import org.abstractica.sessionsync.impl.session.SessionStateStore;
import org.abstractica.sessionsync.impl.session.SessionSyncClient;
import org.abstractica.sessionsync.impl.transport.SimulatedWebSocketTransport;
import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.ExerciseItemType;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.ParticipantCursor;
import org.abstractica.sessionsync.model.SessionState;
import org.abstractica.sessionsync.model.SetMetrics;
import org.abstractica.sessionsync.model.SetType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of a client editing a shared session through the
 * registry, store and protocol handler, against a simulated server.
 */
class SessionSyncEndToEndTest
{
    private static final String SESSION_ID = "session-1";

    private final EnvelopeCodec envelopes = new EnvelopeCodec();

    private SimulatedWebSocketTransport transport;
    private DefaultConnectionRegistry registry;
    private SessionStateStore store;
    private SessionSyncClient client;

    @BeforeEach
    void setUp() throws Exception
    {
        transport = new SimulatedWebSocketTransport();
        registry = DefaultConnectionRegistry.builder()
                .baseUrl("https://api.example.com")
                .credentials(() -> Optional.of("token-1"))
                .transport(transport)
                .channel(ChannelConfig.builder(ChannelConfig.EXERCISE_SESSION, "/session/ws/")
                        .maxReconnectAttempts(3)
                        .reconnectDelay(Duration.ofMillis(50))
                        .build())
                .build();
        store = new SessionStateStore();
        client = new SessionSyncClient(registry, ChannelConfig.EXERCISE_SESSION, store,
                new SessionProtocolHandler(store));

        client.start().get(1, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown()
    {
        client.close();
        registry.close();
        store.close();
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean())
        {
            if (System.nanoTime() > deadline)
            {
                fail("Timed out waiting for condition");
            }
            Thread.sleep(10);
        }
    }

    private List<ProtocolMessage> sentMessages()
    {
        return transport.getCurrentChannel().getSentFrames().stream()
                .map(envelopes::decode)
                .toList();
    }

    private List<MessageType> sentTypes()
    {
        return sentMessages().stream().map(ProtocolMessage::type).toList();
    }

    private void serverSyncsEmptySession() throws Exception
    {
        transport.pushText("""
                {"type":"session_sync","session_id":"session-1",
                 "payload":{"state":{"session_id":"session-1","account_id":"alice","version":0,"items":[]}}}
                """);
        waitFor(() -> store.getState().isPresent());
    }

    private static ExerciseItem benchPress()
    {
        return new ExerciseItem("e1", 0, List.of(), ExerciseItemType.SINGLE, 90, List.of(), List.of(
                new ExerciseSet("s1", 1, SetType.WORKING, false, SetMetrics.EMPTY),
                new ExerciseSet("s2", 2, SetType.WORKING, false, SetMetrics.EMPTY)));
    }

    // ========== Scenarios ==========

    @Test
    void joinSyncAddAndToggle() throws Exception
    {
        client.join(SESSION_ID).get(1, TimeUnit.SECONDS);
        serverSyncsEmptySession();

        SessionState added = client.addExercise(benchPress()).get(1, TimeUnit.SECONDS).orElseThrow();
        assertEquals(1, added.findItem("e1").orElseThrow().order());
        assertEquals(1, added.version());

        SessionState toggled = client.toggleSetComplete("e1", "s1").get(1, TimeUnit.SECONDS).orElseThrow();
        assertTrue(toggled.findItem("e1").orElseThrow().findSet("s1").orElseThrow().complete());
        assertEquals(2, toggled.version());

        assertEquals(List.of(
                MessageType.SESSION_JOIN,
                MessageType.EXERCISE_ADD,
                MessageType.SET_ADD,
                MessageType.SET_ADD,
                MessageType.SET_UPDATE), sentTypes());

        ProtocolMessage update = sentMessages().get(4);
        assertEquals(SESSION_ID, update.sessionId());
        assertEquals(2, update.version());
        assertEquals(Map.of("complete", true), update.payload().get("updates"));
    }

    @Test
    void remoteEditsReachLocalState() throws Exception
    {
        serverSyncsEmptySession();
        client.addExercise(benchPress()).get(1, TimeUnit.SECONDS);

        transport.pushText("""
                {"type":"set_complete","session_id":"session-1","account_id":"bob",
                 "payload":{"exercise_id":"e1","set_id":"s2"}}
                """);

        waitFor(() -> store.getState().orElseThrow()
                .findItem("e1").orElseThrow().findSet("s2").orElseThrow().complete());
    }

    @Test
    void reorderSendsTwoMoves() throws Exception
    {
        serverSyncsEmptySession();
        client.addExercise(benchPress()).get(1, TimeUnit.SECONDS);

        SessionState reordered = client.reorderSet("e1", "s1", "s2").get(1, TimeUnit.SECONDS).orElseThrow();

        List<ExerciseSet> sets = reordered.findItem("e1").orElseThrow().sets();
        assertEquals("s2", sets.get(0).id());
        assertEquals(1, sets.get(0).order());

        List<ProtocolMessage> sent = sentMessages();
        ProtocolMessage first = sent.get(sent.size() - 2);
        ProtocolMessage second = sent.get(sent.size() - 1);
        assertEquals(MessageType.SET_REORDER, first.type());
        assertEquals(Map.of("exercise_id", "e1", "set_id", "s1", "new_index", 1), first.payload());
        assertEquals(Map.of("exercise_id", "e1", "set_id", "s2", "new_index", 0), second.payload());
    }

    @Test
    void metricsUpdateReplacesWholeRecord() throws Exception
    {
        serverSyncsEmptySession();
        client.addExercise(benchPress()).get(1, TimeUnit.SECONDS);

        SetMetrics metrics = new SetMetrics(8, null, null, null);
        SessionState updated = client.updateMetrics("e1", "s2", metrics).get(1, TimeUnit.SECONDS).orElseThrow();

        assertEquals(metrics, updated.findItem("e1").orElseThrow().findSet("s2").orElseThrow().metrics());
        assertEquals(SetMetrics.EMPTY, updated.findItem("e1").orElseThrow().findSet("s1").orElseThrow().metrics());

        ProtocolMessage sent = sentMessages().get(sentMessages().size() - 1);
        assertEquals(MessageType.SET_UPDATE, sent.type());
        assertEquals(Map.of("metrics", Map.of("reps", 8)), sent.payload().get("updates"));
    }

    @Test
    void cursorMoveIsShared() throws Exception
    {
        serverSyncsEmptySession();
        client.addExercise(benchPress()).get(1, TimeUnit.SECONDS);

        client.moveCursor(new ParticipantCursor("e1", "s2")).get(1, TimeUnit.SECONDS);

        ProtocolMessage sent = sentMessages().get(sentMessages().size() - 1);
        assertEquals(MessageType.CURSOR_MOVE, sent.type());
        assertEquals(SESSION_ID, sent.sessionId());
    }

    @Test
    void reconnectRequestsFullSync() throws Exception
    {
        serverSyncsEmptySession();
        SimulatedWebSocketTransport.SimulatedChannel first = transport.getCurrentChannel();

        transport.drop(new IOException("connection reset"));

        waitFor(() -> transport.getCurrentChannel() != first
                && sentTypes().contains(MessageType.SYNC_REQUEST));
        assertEquals(SESSION_ID, sentMessages().get(0).sessionId());
    }

    @Test
    void offlineEditsStayLocal() throws Exception
    {
        serverSyncsEmptySession();
        client.addExercise(benchPress()).get(1, TimeUnit.SECONDS);
        registry.disconnect(ChannelConfig.EXERCISE_SESSION);

        Optional<SessionState> toggled = client.toggleSetComplete("e1", "s2").get(1, TimeUnit.SECONDS);

        assertTrue(toggled.isPresent());
        assertTrue(store.getState().orElseThrow().findItem("e1").orElseThrow().findSet("s2").orElseThrow().complete());
    }

    @Test
    void restartAfterCloseDispatchesAgain() throws Exception
    {
        client.close();
        client.start().get(1, TimeUnit.SECONDS);

        serverSyncsEmptySession();

        assertEquals(SESSION_ID, store.getSessionId().orElseThrow());
    }

    @Test
    void leaveDropsSession() throws Exception
    {
        serverSyncsEmptySession();

        client.leave().get(1, TimeUnit.SECONDS);

        assertTrue(store.getState().isEmpty());
        assertEquals(MessageType.SESSION_LEAVE, sentTypes().get(sentTypes().size() - 1));
    }
}
