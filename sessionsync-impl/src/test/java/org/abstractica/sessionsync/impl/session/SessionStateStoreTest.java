package org.abstractica.sessionsync.impl.session;

import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.Participant;
import org.abstractica.sessionsync.model.SessionDocument;
import org.abstractica.sessionsync.model.SessionState;
import org.abstractica.sessionsync.model.SessionStatus;
import org.abstractica.sessionsync.payload.SessionPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.abstractica.sessionsync.impl.session.SessionReconcilerTest.exercise;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SessionStateStore}.
 */
class SessionStateStoreTest
{
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private SessionStateStore store;

    @BeforeEach
    void setUp()
    {
        store = new SessionStateStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown()
    {
        store.close();
    }

    private static SessionState snapshot(long version, ExerciseItem... items)
    {
        return new SessionState("session-1", "alice", version, List.of(items));
    }

    // ========== Lifecycle ==========

    @Test
    void emptyStoreIgnoresMutations() throws Exception
    {
        assertTrue(store.toggleSetComplete("e1", "s1").get(1, TimeUnit.SECONDS).isEmpty());
        assertTrue(store.participantJoined("bob").get(1, TimeUnit.SECONDS).isEmpty());
        assertTrue(store.getState().isEmpty());
        assertTrue(store.getSessionId().isEmpty());
    }

    @Test
    void offlineSessionIsOwnedDraft() throws Exception
    {
        SessionDocument created = store.createOfflineSession("alice", "Morning run").get(1, TimeUnit.SECONDS);

        assertEquals(SessionStatus.DRAFT, created.status());
        assertEquals("alice", created.ownerId());
        assertEquals(1, created.participants().size());
        assertEquals(ParticipantColors.PALETTE.get(0), created.participants().get(0).color());
        assertEquals(NOW, created.createdAt());

        SessionState state = store.getState().orElseThrow();
        assertEquals(created.id(), state.sessionId());
        assertEquals(0, state.version());
        assertTrue(state.items().isEmpty());
        assertEquals(Optional.of(created.id()), store.getSessionId());
    }

    @Test
    void clearDropsSession() throws Exception
    {
        AtomicReference<SessionState> lastState = new AtomicReference<>();
        store.createOfflineSession("alice", "Morning run").get(1, TimeUnit.SECONDS);
        store.onStateChanged((previous, current) -> lastState.set(previous));

        store.clear().get(1, TimeUnit.SECONDS);

        assertTrue(store.getDocument().isEmpty());
        assertTrue(store.getState().isEmpty());
        assertNotNull(lastState.get(), "Listener should see the dropped state as previous");
    }

    // ========== Versions ==========

    @Test
    void localChangeAfterSyncIncrementsVersion() throws Exception
    {
        store.applySync(snapshot(10, exercise("e1", 1, "s1"))).get(1, TimeUnit.SECONDS);

        SessionState updated = store.toggleSetComplete("e1", "s1").get(1, TimeUnit.SECONDS).orElseThrow();

        assertEquals(11, updated.version());
        assertEquals(updated, store.getState().orElseThrow());
    }

    @Test
    void laterSyncReplacesLocalChanges() throws Exception
    {
        store.applySync(snapshot(10, exercise("e1", 1, "s1"))).get(1, TimeUnit.SECONDS);
        store.toggleSetComplete("e1", "s1").get(1, TimeUnit.SECONDS);

        SessionState authoritative = snapshot(20, exercise("e2", 1));
        store.applySync(authoritative).get(1, TimeUnit.SECONDS);

        assertEquals(authoritative, store.getState().orElseThrow());
    }

    @Test
    void reorderAndRenumberIsOneChange() throws Exception
    {
        store.applySync(snapshot(1, exercise("e1", 1, "s1", "s2", "s3"))).get(1, TimeUnit.SECONDS);

        SessionState updated = store.reorderAndRenumberSets("e1", "s1", "s3").get(1, TimeUnit.SECONDS).orElseThrow();

        List<ExerciseSet> sets = updated.findItem("e1").orElseThrow().sets();
        assertEquals(List.of("s3", "s2", "s1"), sets.stream().map(ExerciseSet::id).toList());
        assertEquals(List.of(1, 2, 3), sets.stream().map(ExerciseSet::order).toList());
        assertEquals(2, updated.version());
    }

    @Test
    void negativeMoveIndexIsRejected() throws Exception
    {
        store.applySync(snapshot(3, exercise("e1", 1, "s1", "s2"))).get(1, TimeUnit.SECONDS);

        assertThrows(IllegalArgumentException.class, () -> store.moveSet("e1", "s2", -1));
        assertThrows(IllegalArgumentException.class, () -> store.moveExercise("e1", -1));

        assertEquals(snapshot(3, exercise("e1", 1, "s1", "s2")), store.getState().orElseThrow());
        assertTrue(store.moveSet("e1", "s2", 0).get(1, TimeUnit.SECONDS).isPresent());
    }

    @Test
    void syncForAnotherSessionDropsOfflineDocument() throws Exception
    {
        store.createOfflineSession("alice", "Morning run").get(1, TimeUnit.SECONDS);

        store.applySync(snapshot(5)).get(1, TimeUnit.SECONDS);

        assertTrue(store.getDocument().isEmpty());
        assertEquals("session-1", store.getSessionId().orElseThrow());
        assertEquals(5, store.getState().orElseThrow().version());
    }

    @Test
    void concurrentEditsAreSerialized() throws Exception
    {
        store.applySync(snapshot(0)).get(1, TimeUnit.SECONDS);

        List<CompletableFuture<?>> edits = new ArrayList<>();
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++)
        {
            int thread = t;
            threads.add(new Thread(() ->
            {
                for (int i = 0; i < 25; i++)
                {
                    CompletableFuture<?> edit = store.addExercise(exercise("e" + thread + "-" + i, 0));
                    synchronized (edits)
                    {
                        edits.add(edit);
                    }
                }
            }));
        }
        threads.forEach(Thread::start);
        for (Thread thread : threads)
        {
            thread.join();
        }
        CompletableFuture.allOf(edits.toArray(new CompletableFuture[0])).get(2, TimeUnit.SECONDS);

        SessionState state = store.getState().orElseThrow();
        assertEquals(100, state.version());
        assertEquals(100, state.items().stream().map(ExerciseItem::order).distinct().count());
    }

    // ========== Listeners ==========

    @Test
    void listenersSeePreviousAndCurrent() throws Exception
    {
        AtomicReference<SessionState> seenPrevious = new AtomicReference<>();
        AtomicReference<SessionState> seenCurrent = new AtomicReference<>();
        store.applySync(snapshot(3, exercise("e1", 1, "s1"))).get(1, TimeUnit.SECONDS);
        store.onStateChanged((previous, current) ->
        {
            seenPrevious.set(previous);
            seenCurrent.set(current);
        });

        store.completeSet("e1", "s1").get(1, TimeUnit.SECONDS);

        assertEquals(3, seenPrevious.get().version());
        assertEquals(4, seenCurrent.get().version());
    }

    @Test
    void failingListenerDoesNotBlockOthers() throws Exception
    {
        AtomicInteger calls = new AtomicInteger();
        store.onStateChanged((previous, current) ->
        {
            throw new IllegalStateException("listener bug");
        });
        store.onStateChanged((previous, current) -> calls.incrementAndGet());

        store.applySync(snapshot(1)).get(1, TimeUnit.SECONDS);

        assertEquals(1, calls.get());
    }

    @Test
    void statusReportsAreRecorded() throws Exception
    {
        AtomicReference<SessionPayload.SessionUpdate> reported = new AtomicReference<>();
        store.onStatusReport(reported::set);
        SessionPayload.SessionUpdate update =
                new SessionPayload.SessionUpdate("session-1", null, null, "session not found", "not_found");

        store.applyStatus(update).get(1, TimeUnit.SECONDS);

        assertEquals(update, reported.get());
        assertEquals(Optional.of(update), store.getLastStatus());
    }

    @Test
    void participantsFollowJoinsAndLeaves() throws Exception
    {
        store.createOfflineSession("alice", "Morning run").get(1, TimeUnit.SECONDS);

        store.participantJoined("bob").get(1, TimeUnit.SECONDS);
        SessionDocument afterJoin = store.getDocument().orElseThrow();
        store.participantLeft("alice").get(1, TimeUnit.SECONDS);

        assertEquals(ParticipantColors.PALETTE.get(1), afterJoin.findParticipant("bob").orElseThrow().color());
        assertEquals(List.of("bob"), store.getDocument().orElseThrow().participants().stream()
                .map(Participant::id).toList());
    }

    @Test
    void closedStoreRejectsMutations()
    {
        store.close();

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> store.applySync(snapshot(1)).get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }
}
