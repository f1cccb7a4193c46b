package org.abstractica.sessionsync.impl.session;

import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.RealtimeException;
import org.abstractica.sessionsync.handlers.MessageErrorHandler;
import org.abstractica.sessionsync.impl.codec.PayloadCodec;
import org.abstractica.sessionsync.payload.SessionPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Translates between protocol messages and session store mutations.
 *
 * <p>Inbound messages are decoded into their typed payload and applied to
 * the {@link SessionStateStore}. A message that cannot be decoded is logged,
 * reported to the error handler and dropped; it never ends the inbound
 * stream. Discrete events addressed to a different session than the loaded
 * one are ignored; full snapshots are always applied.</p>
 */
public class SessionProtocolHandler
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionProtocolHandler.class);

    private final SessionStateStore store;
    private final PayloadCodec codec;
    private volatile MessageErrorHandler errorHandler;

    public SessionProtocolHandler(SessionStateStore store)
    {
        this(store, new PayloadCodec());
    }

    public SessionProtocolHandler(SessionStateStore store, PayloadCodec codec)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Sets the handler told about inbound messages that could not be applied.
     *
     * @param handler the handler, or null to only log
     */
    public void onError(MessageErrorHandler handler)
    {
        this.errorHandler = handler;
    }

    // ========== Inbound ==========

    /**
     * Dispatches every message of a stream until the returned handle is disposed.
     *
     * @param messages the inbound messages of the session channel
     * @return the subscription
     */
    public Disposable attach(Flux<ProtocolMessage> messages)
    {
        Objects.requireNonNull(messages, "messages");
        return messages.subscribe(
                this::dispatch,
                error -> LOG.error("Inbound message stream failed", error),
                () -> LOG.debug("Inbound message stream completed"));
    }

    /**
     * Decodes one message and applies it to the store.
     *
     * @param message the inbound message
     */
    public void dispatch(ProtocolMessage message)
    {
        Objects.requireNonNull(message, "message");

        SessionPayload payload;
        try
        {
            payload = codec.decode(message);
        }
        catch (RealtimeException.Decoding e)
        {
            LOG.warn("Dropping {} message {}: {}", message.type().getWireName(), message.id(), e.getMessage());
            reportError(message, e);
            return;
        }

        Optional<String> activeSession = store.getSessionId();
        if (!isSnapshot(payload) && message.sessionId() != null && activeSession.isPresent()
                && !activeSession.get().equals(message.sessionId()))
        {
            LOG.debug("Ignoring {} for session {}, active session is {}",
                    message.type().getWireName(), message.sessionId(), activeSession.get());
            return;
        }

        LOG.debug("Applying {} {}", message.type().getWireName(), message.id());
        try
        {
            apply(message, payload);
        }
        catch (RuntimeException e)
        {
            LOG.error("Failed to apply {} message {}", message.type().getWireName(), message.id(), e);
            reportError(message, e);
        }
    }

    private void apply(ProtocolMessage message, SessionPayload payload)
    {
        if (payload instanceof SessionPayload.SessionJoin)
        {
            requireAccount(message).ifPresent(accountId ->
            {
                LOG.info("Participant {} joined", accountId);
                store.participantJoined(accountId);
            });
        }
        else if (payload instanceof SessionPayload.SessionLeave)
        {
            requireAccount(message).ifPresent(accountId ->
            {
                LOG.info("Participant {} left", accountId);
                store.participantLeft(accountId);
            });
        }
        else if (payload instanceof SessionPayload.SessionUpdate update)
        {
            store.applyStatus(update);
        }
        else if (payload instanceof SessionPayload.SessionSync sync)
        {
            store.applySync(sync.state());
        }
        else if (payload instanceof SessionPayload.SyncResponse response)
        {
            store.applySyncResponse(response.session(), response.state());
        }
        else if (payload instanceof SessionPayload.ExerciseAdd add)
        {
            store.addExercise(add.exercise());
        }
        else if (payload instanceof SessionPayload.ExerciseUpdate update)
        {
            store.updateExercise(update.exerciseId(), update.updates());
        }
        else if (payload instanceof SessionPayload.ExerciseDelete delete)
        {
            store.deleteExercise(delete.exerciseId());
        }
        else if (payload instanceof SessionPayload.ExerciseReorder reorder)
        {
            store.moveExercise(reorder.exerciseId(), reorder.newIndex());
        }
        else if (payload instanceof SessionPayload.SetAdd add)
        {
            store.addSet(add.exerciseId(), add.set());
        }
        else if (payload instanceof SessionPayload.SetUpdate update)
        {
            store.updateSet(update.exerciseId(), update.setId(), update.updates());
        }
        else if (payload instanceof SessionPayload.SetDelete delete)
        {
            store.deleteSet(delete.exerciseId(), delete.setId());
        }
        else if (payload instanceof SessionPayload.SetComplete complete)
        {
            store.completeSet(complete.exerciseId(), complete.setId());
        }
        else if (payload instanceof SessionPayload.SetReorder reorder)
        {
            store.moveSet(reorder.exerciseId(), reorder.setId(), reorder.newIndex());
        }
        else if (payload instanceof SessionPayload.CursorMove move)
        {
            requireAccount(message).ifPresent(accountId -> store.cursorMoved(accountId, move.cursor()));
        }
        else if (payload instanceof SessionPayload.SyncRequest)
        {
            LOG.debug("Ignoring sync_request from server");
        }
    }

    // full snapshots replace whatever session is loaded
    private static boolean isSnapshot(SessionPayload payload)
    {
        return payload instanceof SessionPayload.SessionSync || payload instanceof SessionPayload.SyncResponse;
    }

    private Optional<String> requireAccount(ProtocolMessage message)
    {
        if (message.accountId() == null)
        {
            LOG.warn("Dropping {} message {}: no account_id", message.type().getWireName(), message.id());
            return Optional.empty();
        }
        return Optional.of(message.accountId());
    }

    private void reportError(ProtocolMessage message, Exception exception)
    {
        MessageErrorHandler handler = errorHandler;
        if (handler == null)
        {
            return;
        }
        try
        {
            handler.handle(message, exception);
        }
        catch (Exception e)
        {
            LOG.error("Error handler failed", e);
        }
    }

    // ========== Outbound ==========

    /**
     * Wraps a payload in a new envelope with a fresh id and the current time.
     *
     * @param payload       the payload
     * @param sessionId     the session, may be null
     * @param version       the sender's state version
     * @param correlationId the correlation id, may be null
     * @return the message
     */
    public ProtocolMessage encode(SessionPayload payload, String sessionId, long version, String correlationId)
    {
        Objects.requireNonNull(payload, "payload");
        return new ProtocolMessage(
                UUID.randomUUID().toString(),
                codec.typeOf(payload),
                sessionId,
                null,
                codec.encode(payload),
                Instant.now(),
                version,
                correlationId
        );
    }
}
