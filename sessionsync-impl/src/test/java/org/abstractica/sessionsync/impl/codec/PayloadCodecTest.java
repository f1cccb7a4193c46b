package org.abstractica.sessionsync.impl.codec;

import org.abstractica.sessionsync.MessageType;
import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.RealtimeException;
import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.ParticipantCursor;
import org.abstractica.sessionsync.model.SessionState;
import org.abstractica.sessionsync.model.SessionStatus;
import org.abstractica.sessionsync.model.SetType;
import org.abstractica.sessionsync.model.WeightUnit;
import org.abstractica.sessionsync.payload.SessionPayload;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PayloadCodec}.
 */
class PayloadCodecTest
{
    private final EnvelopeCodec envelopes = new EnvelopeCodec();
    private final PayloadCodec codec = new PayloadCodec();

    private SessionPayload decode(String envelope)
    {
        return codec.decode(envelopes.decode(envelope));
    }

    // ========== Decoding ==========

    @Test
    void decodesSetUpdatePatch()
    {
        SessionPayload payload = decode("""
                {"type":"set_update","payload":{"exercise_id":"e1","set_id":"s1","updates":{"complete":true}}}
                """);

        SessionPayload.SetUpdate update = assertInstanceOf(SessionPayload.SetUpdate.class, payload);
        assertEquals("e1", update.exerciseId());
        assertEquals("s1", update.setId());
        assertEquals(Boolean.TRUE, update.updates().complete());
        assertNull(update.updates().metrics());
    }

    @Test
    void decodesSessionSyncState()
    {
        SessionPayload payload = decode("""
                {"type":"session_sync","payload":{"state":{
                  "session_id":"session-1","account_id":"alice","version":3,
                  "items":[{"id":"e1","order":1,"type":"single","rest":90,
                            "meta":[{"internal_id":"bench","name":"Bench press","type":"weight_reps"}],
                            "sets":[{"id":"s1","order":1,"type":"warmup","complete":false,
                                     "metrics":{"reps":8,"weight":{"value":60,"unit":"kg"},"duration":{"value":45}}}]}]}}}
                """);

        SessionState state = assertInstanceOf(SessionPayload.SessionSync.class, payload).state();
        assertEquals("session-1", state.sessionId());
        assertEquals(3, state.version());

        ExerciseItem item = state.items().get(0);
        assertEquals(90, item.rest());
        assertEquals("Bench press", item.meta().get(0).name());

        ExerciseSet set = item.sets().get(0);
        assertEquals(SetType.WARMUP, set.type());
        assertEquals(8, set.metrics().reps());
        assertEquals(60.0, set.metrics().weight().value());
        assertEquals(WeightUnit.KILOGRAM, set.metrics().weight().unit());
        assertEquals(45, set.metrics().duration().seconds());
    }

    @Test
    void decodesSyncResponseDocument()
    {
        SessionPayload payload = decode("""
                {"type":"sync_response","payload":{"version":2,
                  "session":{"id":"session-1","name":"Leg day","status":"active","owner_id":"alice",
                             "participants":[{"id":"alice","color":"#FF6B6B"}],
                             "created_at":"2024-05-01T10:00:00.000000+00:00","updated_at":"2024-05-01T10:05:00Z"},
                  "state":{"session_id":"session-1","account_id":"alice","version":2,"items":[]}}}
                """);

        SessionPayload.SyncResponse response = assertInstanceOf(SessionPayload.SyncResponse.class, payload);
        assertEquals(SessionStatus.ACTIVE, response.session().status());
        assertEquals("#FF6B6B", response.session().participants().get(0).color());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), response.session().createdAt());
        assertTrue(response.participantStates().isEmpty());
    }

    @Test
    void decodesSupersetWireName()
    {
        SessionPayload payload = decode("""
                {"type":"set_add","payload":{"exercise_id":"e1","set":{"id":"s9","order":2,"type":"super"}}}
                """);

        assertEquals(SetType.SUPERSET, assertInstanceOf(SessionPayload.SetAdd.class, payload).set().type());
    }

    @Test
    void ignoresExtraKeysOnPayloads()
    {
        SessionPayload payload = decode("""
                {"type":"session_join","payload":{"session_id":"session-1","display_name":"Alice"}}
                """);

        assertEquals("session-1", assertInstanceOf(SessionPayload.SessionJoin.class, payload).sessionId());
    }

    @Test
    void decodesEmptySyncRequest()
    {
        assertInstanceOf(SessionPayload.SyncRequest.class, decode("{\"type\":\"sync_request\"}"));
    }

    // ========== Validation ==========

    @Test
    void rejectsUnknownPatchKeys()
    {
        assertThrows(RealtimeException.Decoding.class, () -> decode("""
                {"type":"set_update","payload":{"exercise_id":"e1","set_id":"s1","updates":{"colour":"red"}}}
                """));
    }

    @Test
    void rejectsEmptyPatch()
    {
        assertThrows(RealtimeException.Decoding.class, () -> decode("""
                {"type":"exercise_update","payload":{"exercise_id":"e1","updates":{}}}
                """));
    }

    @Test
    void rejectsMissingRequiredId()
    {
        RealtimeException.Decoding error = assertThrows(RealtimeException.Decoding.class,
                () -> decode("{\"type\":\"exercise_delete\",\"payload\":{}}"));
        assertTrue(error.getMessage().contains("exercise_delete"));
    }

    @Test
    void rejectsOverlongId()
    {
        String longId = "x".repeat(SessionPayload.MAX_ID_LENGTH + 1);
        assertThrows(RealtimeException.Decoding.class,
                () -> decode("{\"type\":\"session_join\",\"payload\":{\"session_id\":\"" + longId + "\"}}"));
    }

    @Test
    void rejectsNegativeIndex()
    {
        assertThrows(RealtimeException.Decoding.class, () -> decode("""
                {"type":"exercise_reorder","payload":{"exercise_id":"e1","new_index":-1}}
                """));
    }

    // ========== Encoding ==========

    @Test
    void encodesWireNames()
    {
        Map<String, Object> payload = codec.encode(new SessionPayload.SetReorder("e1", "s2", 0));

        assertEquals(Map.of("exercise_id", "e1", "set_id", "s2", "new_index", 0), payload);
    }

    @Test
    void encodesPatchWithoutNulls()
    {
        Map<String, Object> payload = codec.encode(
                new SessionPayload.SetUpdate("e1", "s1", SessionPayload.SetChanges.complete(true)));

        assertEquals(Map.of("complete", true), payload.get("updates"));
    }

    @Test
    void mapsPayloadTypes()
    {
        assertEquals(MessageType.SYNC_REQUEST, codec.typeOf(new SessionPayload.SyncRequest()));
        assertEquals(MessageType.CURSOR_MOVE, codec.typeOf(new SessionPayload.CursorMove(
                new ParticipantCursor("e1", "s1"))));
    }

    @Test
    void encodedPayloadDecodesAgain()
    {
        SessionPayload.SetDelete original = new SessionPayload.SetDelete("e1", "s1");
        ProtocolMessage message = ProtocolMessage.create(
                codec.typeOf(original), "session-1", codec.encode(original), 1, null);

        assertEquals(original, codec.decode(message));
    }
}
