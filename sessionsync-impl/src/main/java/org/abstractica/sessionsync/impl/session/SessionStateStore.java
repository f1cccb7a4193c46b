package org.abstractica.sessionsync.impl.session;

import org.abstractica.sessionsync.handlers.ChangeListener;
import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.Participant;
import org.abstractica.sessionsync.model.ParticipantCursor;
import org.abstractica.sessionsync.model.SessionDocument;
import org.abstractica.sessionsync.model.SessionState;
import org.abstractica.sessionsync.model.SessionStatus;
import org.abstractica.sessionsync.model.SetMetrics;
import org.abstractica.sessionsync.payload.SessionPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * The single in-process copy of the active session.
 *
 * <p>All mutations run one at a time on the store's own thread, in the order
 * they were submitted, so local edits and inbound protocol events are applied
 * in arrival order. Readers get immutable snapshots and may read from any
 * thread. Listeners are notified on the store thread after each change.</p>
 *
 * <p>Mutations on an absent session or an absent exercise or set change
 * nothing; their futures complete with an empty result.</p>
 */
public class SessionStateStore implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionStateStore.class);

    private final ExecutorService executor;
    private final Clock clock;

    private final List<ChangeListener<SessionState>> stateListeners;
    private final List<ChangeListener<SessionDocument>> sessionListeners;
    private final List<Consumer<SessionPayload.SessionUpdate>> statusListeners;

    private volatile SessionDocument document;
    private volatile SessionState state;
    private volatile SessionPayload.SessionUpdate lastStatus;

    public SessionStateStore()
    {
        this(Clock.systemUTC());
    }

    public SessionStateStore(Clock clock)
    {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Executors.newSingleThreadExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, "session-store");
            thread.setDaemon(true);
            return thread;
        });
        this.stateListeners = new CopyOnWriteArrayList<>();
        this.sessionListeners = new CopyOnWriteArrayList<>();
        this.statusListeners = new CopyOnWriteArrayList<>();
    }

    // ========== Snapshots ==========

    public Optional<SessionDocument> getDocument()
    {
        return Optional.ofNullable(document);
    }

    public Optional<SessionState> getState()
    {
        return Optional.ofNullable(state);
    }

    /**
     * Returns the latest status report from the server.
     *
     * @return the last {@code session_update}, or empty if none arrived
     */
    public Optional<SessionPayload.SessionUpdate> getLastStatus()
    {
        return Optional.ofNullable(lastStatus);
    }

    /**
     * Returns the id of the active session, from the document or the state.
     *
     * @return the session id, or empty if no session is loaded
     */
    public Optional<String> getSessionId()
    {
        SessionDocument currentDocument = document;
        if (currentDocument != null)
        {
            return Optional.of(currentDocument.id());
        }
        SessionState currentState = state;
        return currentState != null ? Optional.of(currentState.sessionId()) : Optional.empty();
    }

    // ========== Listeners ==========

    public void onStateChanged(ChangeListener<SessionState> listener)
    {
        stateListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void onSessionChanged(ChangeListener<SessionDocument> listener)
    {
        sessionListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void onStatusReport(Consumer<SessionPayload.SessionUpdate> listener)
    {
        statusListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ========== Session Lifecycle ==========

    /**
     * Replaces the session document and state, for example after fetching them over HTTP.
     *
     * @param newDocument the document
     * @param newState    the state
     * @return completes when applied
     */
    public CompletableFuture<Void> load(SessionDocument newDocument, SessionState newState)
    {
        Objects.requireNonNull(newDocument, "newDocument");
        Objects.requireNonNull(newState, "newState");
        return submit(() ->
        {
            replaceDocument(newDocument);
            replaceState(newState);
            LOG.info("Loaded session {} at version {}", newDocument.id(), newState.version());
            return null;
        });
    }

    /**
     * Synthesizes a draft session owned by one account, for use without a server.
     *
     * @param accountId the owner
     * @param name      the session name
     * @return completes with the new document
     */
    public CompletableFuture<SessionDocument> createOfflineSession(String accountId, String name)
    {
        Objects.requireNonNull(accountId, "accountId");
        return submit(() ->
        {
            Instant now = clock.instant();
            String sessionId = UUID.randomUUID().toString();
            SessionDocument created = new SessionDocument(
                    sessionId,
                    name,
                    SessionStatus.DRAFT,
                    accountId,
                    List.of(new Participant(accountId, ParticipantColors.nextColor(List.of()), null)),
                    List.of(),
                    now,
                    now
            );
            replaceDocument(created);
            replaceState(SessionState.empty(sessionId, accountId));
            LOG.info("Created offline session {}", sessionId);
            return created;
        });
    }

    /**
     * Drops the session, for example when the user leaves or signs out.
     *
     * @return completes when cleared
     */
    public CompletableFuture<Void> clear()
    {
        return submit(() ->
        {
            replaceDocument(null);
            replaceState(null);
            lastStatus = null;
            LOG.info("Session cleared");
            return null;
        });
    }

    // ========== Server Snapshots ==========

    /**
     * Replaces the state wholesale with a server snapshot. The last sync wins.
     * A loaded document of a different session is dropped.
     *
     * @param snapshot the authoritative state
     * @return completes when applied
     */
    public CompletableFuture<Void> applySync(SessionState snapshot)
    {
        Objects.requireNonNull(snapshot, "snapshot");
        return submit(() ->
        {
            SessionDocument currentDocument = document;
            if (currentDocument != null && !currentDocument.id().equals(snapshot.sessionId()))
            {
                LOG.info("Sync for session {} replaces session {}", snapshot.sessionId(), currentDocument.id());
                replaceDocument(null);
            }
            replaceState(snapshot);
            LOG.info("Applied sync for session {} at version {}", snapshot.sessionId(), snapshot.version());
            return null;
        });
    }

    /**
     * Replaces both document and state with a server snapshot.
     *
     * @param snapshotDocument the authoritative document
     * @param snapshotState    the authoritative state
     * @return completes when applied
     */
    public CompletableFuture<Void> applySyncResponse(SessionDocument snapshotDocument, SessionState snapshotState)
    {
        Objects.requireNonNull(snapshotDocument, "snapshotDocument");
        Objects.requireNonNull(snapshotState, "snapshotState");
        return submit(() ->
        {
            replaceDocument(snapshotDocument);
            replaceState(snapshotState);
            LOG.info("Applied sync response for session {} at version {}",
                    snapshotDocument.id(), snapshotState.version());
            return null;
        });
    }

    /**
     * Records a server status report.
     *
     * @param status the report
     * @return completes when recorded
     */
    public CompletableFuture<Void> applyStatus(SessionPayload.SessionUpdate status)
    {
        Objects.requireNonNull(status, "status");
        return submit(() ->
        {
            lastStatus = status;
            if (status.error() != null)
            {
                LOG.warn("Session {} reported error: {} ({})", status.sessionId(), status.error(), status.errorType());
            }
            for (Consumer<SessionPayload.SessionUpdate> listener : statusListeners)
            {
                safeCallback(() -> listener.accept(status));
            }
            return null;
        });
    }

    // ========== Exercise Mutations ==========

    public CompletableFuture<Optional<SessionState>> toggleSetComplete(String exerciseId, String setId)
    {
        return mutateState(s -> SessionReconciler.toggleSetComplete(s, exerciseId, setId));
    }

    public CompletableFuture<Optional<SessionState>> completeSet(String exerciseId, String setId)
    {
        return mutateState(s -> SessionReconciler.completeSet(s, exerciseId, setId));
    }

    public CompletableFuture<Optional<SessionState>> reorderSet(String exerciseId, String fromSetId, String toSetId)
    {
        return mutateState(s -> SessionReconciler.reorderSet(s, exerciseId, fromSetId, toSetId));
    }

    /**
     * Exchanges two sets and renumbers the exercise's sets as one change.
     *
     * @return completes with the new state, or empty if nothing changed
     */
    public CompletableFuture<Optional<SessionState>> reorderAndRenumberSets(
            String exerciseId,
            String fromSetId,
            String toSetId)
    {
        return mutateState(s ->
        {
            SessionState reordered = SessionReconciler.reorderSet(s, exerciseId, fromSetId, toSetId);
            if (reordered == s)
            {
                return s;
            }
            return SessionReconciler.renumberSets(reordered, exerciseId).withVersion(s.version() + 1);
        });
    }

    public CompletableFuture<Optional<SessionState>> moveSet(String exerciseId, String setId, int newIndex)
    {
        requireIndex(newIndex);
        return mutateState(s -> SessionReconciler.moveSet(s, exerciseId, setId, newIndex));
    }

    public CompletableFuture<Optional<SessionState>> renumberSets(String exerciseId)
    {
        return mutateState(s -> SessionReconciler.renumberSets(s, exerciseId));
    }

    public CompletableFuture<Optional<SessionState>> updateMetrics(String exerciseId, String setId, SetMetrics metrics)
    {
        Objects.requireNonNull(metrics, "metrics");
        return mutateState(s -> SessionReconciler.updateMetrics(s, exerciseId, setId, metrics));
    }

    public CompletableFuture<Optional<SessionState>> updateSet(
            String exerciseId,
            String setId,
            SessionPayload.SetChanges changes)
    {
        Objects.requireNonNull(changes, "changes");
        return mutateState(s -> SessionReconciler.updateSet(s, exerciseId, setId, changes));
    }

    public CompletableFuture<Optional<SessionState>> addSet(String exerciseId, ExerciseSet set)
    {
        Objects.requireNonNull(set, "set");
        return mutateState(s -> SessionReconciler.addSet(s, exerciseId, set));
    }

    public CompletableFuture<Optional<SessionState>> deleteSet(String exerciseId, String setId)
    {
        return mutateState(s -> SessionReconciler.deleteSet(s, exerciseId, setId));
    }

    /**
     * Appends an exercise; its order becomes the new item count.
     *
     * @param exercise the exercise
     * @return completes with the new state, or empty if no session is loaded
     */
    public CompletableFuture<Optional<SessionState>> addExercise(ExerciseItem exercise)
    {
        Objects.requireNonNull(exercise, "exercise");
        return mutateState(s -> SessionReconciler.addExercise(s, exercise));
    }

    public CompletableFuture<Optional<SessionState>> addExercise(SessionPayload.ExerciseData exercise)
    {
        Objects.requireNonNull(exercise, "exercise");
        return mutateState(s -> SessionReconciler.addExercise(s, exercise));
    }

    public CompletableFuture<Optional<SessionState>> updateExercise(
            String exerciseId,
            SessionPayload.ExerciseChanges changes)
    {
        Objects.requireNonNull(changes, "changes");
        return mutateState(s -> SessionReconciler.updateExercise(s, exerciseId, changes));
    }

    public CompletableFuture<Optional<SessionState>> deleteExercise(String exerciseId)
    {
        return mutateState(s -> SessionReconciler.deleteExercise(s, exerciseId));
    }

    public CompletableFuture<Optional<SessionState>> moveExercise(String exerciseId, int newIndex)
    {
        requireIndex(newIndex);
        return mutateState(s -> SessionReconciler.moveExercise(s, exerciseId, newIndex));
    }

    // ========== Participant Mutations ==========

    public CompletableFuture<Optional<SessionDocument>> participantJoined(String accountId)
    {
        Objects.requireNonNull(accountId, "accountId");
        return mutateDocument(d -> SessionReconciler.participantJoined(d, accountId, clock.instant()));
    }

    public CompletableFuture<Optional<SessionDocument>> participantLeft(String accountId)
    {
        Objects.requireNonNull(accountId, "accountId");
        return mutateDocument(d -> SessionReconciler.participantLeft(d, accountId, clock.instant()));
    }

    public CompletableFuture<Optional<SessionDocument>> cursorMoved(String accountId, ParticipantCursor cursor)
    {
        Objects.requireNonNull(accountId, "accountId");
        return mutateDocument(d -> SessionReconciler.cursorMoved(d, accountId, cursor, clock.instant()));
    }

    // ========== Internals ==========

    private static void requireIndex(int newIndex)
    {
        if (newIndex < 0)
        {
            throw new IllegalArgumentException("newIndex must be >= 0: " + newIndex);
        }
    }

    private CompletableFuture<Optional<SessionState>> mutateState(UnaryOperator<SessionState> change)
    {
        return submit(() ->
        {
            SessionState current = state;
            if (current == null)
            {
                LOG.debug("No session state loaded, ignoring mutation");
                return Optional.empty();
            }
            SessionState updated = change.apply(current);
            if (updated == current)
            {
                return Optional.empty();
            }
            replaceState(updated);
            return Optional.of(updated);
        });
    }

    private CompletableFuture<Optional<SessionDocument>> mutateDocument(UnaryOperator<SessionDocument> change)
    {
        return submit(() ->
        {
            SessionDocument current = document;
            if (current == null)
            {
                LOG.debug("No session document loaded, ignoring mutation");
                return Optional.empty();
            }
            SessionDocument updated = change.apply(current);
            if (updated == current)
            {
                return Optional.empty();
            }
            replaceDocument(updated);
            return Optional.of(updated);
        });
    }

    private void replaceState(SessionState updated)
    {
        SessionState previous = state;
        state = updated;
        for (ChangeListener<SessionState> listener : stateListeners)
        {
            safeCallback(() -> listener.onChange(previous, updated));
        }
    }

    private void replaceDocument(SessionDocument updated)
    {
        SessionDocument previous = document;
        document = updated;
        for (ChangeListener<SessionDocument> listener : sessionListeners)
        {
            safeCallback(() -> listener.onChange(previous, updated));
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task)
    {
        try
        {
            return CompletableFuture.supplyAsync(task, executor);
        }
        catch (RejectedExecutionException e)
        {
            return CompletableFuture.failedFuture(new IllegalStateException("Session store is closed", e));
        }
    }

    private void safeCallback(Runnable callback)
    {
        try
        {
            callback.run();
        }
        catch (Exception e)
        {
            LOG.error("Listener error", e);
        }
    }

    @Override
    public void close()
    {
        executor.shutdown();
    }
}
