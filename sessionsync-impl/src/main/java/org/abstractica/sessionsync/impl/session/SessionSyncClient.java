package org.abstractica.sessionsync.impl.session;

import org.abstractica.sessionsync.ConnectionRegistry;
import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.ParticipantCursor;
import org.abstractica.sessionsync.model.SessionState;
import org.abstractica.sessionsync.model.SetMetrics;
import org.abstractica.sessionsync.payload.SessionPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for the UI: edits the session locally and shares the edits.
 *
 * <p>Every edit is applied to the {@link SessionStateStore} first and shown
 * immediately, then sent on the session channel. When the channel is down
 * the edit stays applied locally and the failure is only logged; the next
 * full sync from the server settles any divergence.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * SessionSyncClient client = new SessionSyncClient(registry, ChannelConfig.EXERCISE_SESSION, store, handler);
 * client.start().join();
 * client.join(sessionId);
 * client.toggleSetComplete(exerciseId, setId);
 * }</pre>
 */
public class SessionSyncClient implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionSyncClient.class);

    private final ConnectionRegistry registry;
    private final String channelId;
    private final SessionStateStore store;
    private final SessionProtocolHandler handler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean connectedOnce = new AtomicBoolean(false);
    private Disposable inbound;
    private Disposable statusWatch;

    public SessionSyncClient(
            ConnectionRegistry registry,
            String channelId,
            SessionStateStore store,
            SessionProtocolHandler handler
    )
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.channelId = Objects.requireNonNull(channelId, "channelId");
        this.store = Objects.requireNonNull(store, "store");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    // ========== Lifecycle ==========

    /**
     * Starts dispatching inbound messages and connects the session channel.
     *
     * <p>After every reconnect a full snapshot is requested.</p>
     *
     * @return completes when the channel is connected
     * @throws org.abstractica.sessionsync.RealtimeException.ChannelNotFound if the channel is not registered
     */
    public synchronized CompletableFuture<Void> start()
    {
        if (!started.compareAndSet(false, true))
        {
            return registry.connect(channelId);
        }

        inbound = handler.attach(registry.messages(channelId));
        statusWatch = registry.observeConnectionStatus(channelId)
                .filter(connected -> connected)
                .subscribe(connected ->
                {
                    if (!connectedOnce.compareAndSet(false, true) && store.getSessionId().isPresent())
                    {
                        LOG.info("[{}] Reconnected, requesting sync", channelId);
                        requestSync();
                    }
                });

        return registry.connect(channelId);
    }

    /**
     * Stops dispatching. The registry and the store stay open, and
     * {@link #start()} may be called again.
     */
    @Override
    public synchronized void close()
    {
        if (inbound != null)
        {
            inbound.dispose();
            inbound = null;
        }
        if (statusWatch != null)
        {
            statusWatch.dispose();
            statusWatch = null;
        }
        started.set(false);
    }

    // ========== Session Membership ==========

    /**
     * Announces this participant in a session.
     *
     * @param sessionId the session
     * @return completes when the announcement was written or dropped
     */
    public CompletableFuture<Void> join(String sessionId)
    {
        Objects.requireNonNull(sessionId, "sessionId");
        return send(new SessionPayload.SessionJoin(sessionId), sessionId, currentVersion());
    }

    /**
     * Announces leaving the active session and drops it locally.
     *
     * @return completes when the session was dropped
     */
    public CompletableFuture<Void> leave()
    {
        Optional<String> sessionId = store.getSessionId();
        if (sessionId.isEmpty())
        {
            return CompletableFuture.completedFuture(null);
        }
        return send(new SessionPayload.SessionLeave(sessionId.get()), sessionId.get(), currentVersion())
                .thenCompose(ignored -> store.clear());
    }

    /**
     * Asks the server for a full snapshot.
     *
     * @return completes when the request was written or dropped
     */
    public CompletableFuture<Void> requestSync()
    {
        return send(new SessionPayload.SyncRequest(), store.getSessionId().orElse(null), currentVersion());
    }

    /**
     * Moves this participant's cursor and shares it.
     *
     * @param cursor the new focus
     * @return completes when the move was written or dropped
     */
    public CompletableFuture<Void> moveCursor(ParticipantCursor cursor)
    {
        Objects.requireNonNull(cursor, "cursor");
        Optional<SessionState> state = store.getState();
        if (state.isEmpty())
        {
            return CompletableFuture.completedFuture(null);
        }
        return store.cursorMoved(state.get().accountId(), cursor)
                .thenCompose(ignored -> send(new SessionPayload.CursorMove(cursor),
                        state.get().sessionId(), currentVersion()));
    }

    // ========== Edits ==========

    public CompletableFuture<Optional<SessionState>> toggleSetComplete(String exerciseId, String setId)
    {
        return store.toggleSetComplete(exerciseId, setId).thenCompose(changed -> share(changed, updated ->
        {
            boolean complete = findSet(updated, exerciseId, setId).map(ExerciseSet::complete).orElse(false);
            return List.of(new SessionPayload.SetUpdate(exerciseId, setId, SessionPayload.SetChanges.complete(complete)));
        }));
    }

    /**
     * Exchanges two sets and renumbers the exercise's sets.
     */
    public CompletableFuture<Optional<SessionState>> reorderSet(String exerciseId, String fromSetId, String toSetId)
    {
        CompletableFuture<Optional<SessionState>> reordered =
                store.reorderAndRenumberSets(exerciseId, fromSetId, toSetId);
        return reordered.thenCompose(changed -> share(changed, updated -> List.of(
                new SessionPayload.SetReorder(exerciseId, fromSetId, indexOf(updated, exerciseId, fromSetId)),
                new SessionPayload.SetReorder(exerciseId, toSetId, indexOf(updated, exerciseId, toSetId)))));
    }

    public CompletableFuture<Optional<SessionState>> updateMetrics(String exerciseId, String setId, SetMetrics metrics)
    {
        return store.updateMetrics(exerciseId, setId, metrics).thenCompose(changed -> share(changed, updated ->
                List.of(new SessionPayload.SetUpdate(exerciseId, setId, SessionPayload.SetChanges.metrics(metrics)))));
    }

    /**
     * Appends an exercise, then shares it followed by its sets.
     */
    public CompletableFuture<Optional<SessionState>> addExercise(ExerciseItem exercise)
    {
        Objects.requireNonNull(exercise, "exercise");
        return store.addExercise(exercise).thenCompose(changed -> share(changed, updated ->
        {
            List<SessionPayload> payloads = new ArrayList<>();
            payloads.add(new SessionPayload.ExerciseAdd(new SessionPayload.ExerciseData(
                    exercise.id(), exercise.type(), exercise.rest(), exercise.meta(), exercise.participants())));
            for (ExerciseSet set : exercise.sets())
            {
                payloads.add(new SessionPayload.SetAdd(exercise.id(), set));
            }
            return payloads;
        }));
    }

    public CompletableFuture<Optional<SessionState>> deleteExercise(String exerciseId)
    {
        return store.deleteExercise(exerciseId).thenCompose(changed -> share(changed, updated ->
                List.of(new SessionPayload.ExerciseDelete(exerciseId))));
    }

    public CompletableFuture<Optional<SessionState>> addSet(String exerciseId, ExerciseSet set)
    {
        return store.addSet(exerciseId, set).thenCompose(changed -> share(changed, updated ->
                List.of(new SessionPayload.SetAdd(exerciseId, set))));
    }

    public CompletableFuture<Optional<SessionState>> deleteSet(String exerciseId, String setId)
    {
        return store.deleteSet(exerciseId, setId).thenCompose(changed -> share(changed, updated ->
                List.of(new SessionPayload.SetDelete(exerciseId, setId))));
    }

    // ========== Sending ==========

    @FunctionalInterface
    private interface PayloadFactory
    {
        List<SessionPayload> create(SessionState updated);
    }

    private CompletableFuture<Optional<SessionState>> share(Optional<SessionState> changed, PayloadFactory factory)
    {
        if (changed.isEmpty())
        {
            return CompletableFuture.completedFuture(changed);
        }
        SessionState updated = changed.get();
        CompletableFuture<Void> sent = CompletableFuture.completedFuture(null);
        for (SessionPayload payload : factory.create(updated))
        {
            sent = sent.thenCompose(ignored -> send(payload, updated.sessionId(), updated.version()));
        }
        return sent.thenApply(ignored -> changed);
    }

    private CompletableFuture<Void> send(SessionPayload payload, String sessionId, long version)
    {
        ProtocolMessage message = handler.encode(payload, sessionId, version, null);
        return registry.send(message, channelId).handle((ignored, error) ->
        {
            if (error != null)
            {
                LOG.warn("[{}] Could not send {}, keeping local change: {}",
                        channelId, message.type().getWireName(), error.getMessage());
            }
            return null;
        });
    }

    private long currentVersion()
    {
        return store.getState().map(SessionState::version).orElse(0L);
    }

    private static Optional<ExerciseSet> findSet(SessionState state, String exerciseId, String setId)
    {
        return state.findItem(exerciseId).flatMap(item -> item.findSet(setId));
    }

    private static int indexOf(SessionState state, String exerciseId, String setId)
    {
        List<ExerciseSet> sets = state.findItem(exerciseId).map(ExerciseItem::sets).orElse(List.of());
        for (int i = 0; i < sets.size(); i++)
        {
            if (sets.get(i).id().equals(setId))
            {
                return i;
            }
        }
        return 0;
    }
}
