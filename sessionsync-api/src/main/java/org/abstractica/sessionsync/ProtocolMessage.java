package org.abstractica.sessionsync;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Envelope exchanged over a channel.
 *
 * <p>The payload is an untyped mapping whose shape depends on {@link #type()};
 * typed payloads are produced at the session protocol boundary.</p>
 *
 * @param id            unique message id
 * @param type          the operation
 * @param sessionId     routing hint, may be null
 * @param accountId     the account the event refers to, set by the server, may be null
 * @param payload       operation-specific data
 * @param timestamp     creation instant
 * @param version       ordering metadata, meaning defined per type
 * @param correlationId ties a response to a request, may be null
 */
public record ProtocolMessage(
        String id,
        MessageType type,
        String sessionId,
        String accountId,
        Map<String, Object> payload,
        Instant timestamp,
        long version,
        String correlationId
)
{
    public ProtocolMessage
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        if (id == null || id.isEmpty())
        {
            id = UUID.randomUUID().toString();
        }
        // JSON payloads may carry explicit nulls, so Map.copyOf is not usable here
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Creates a message with a fresh id and the current time.
     *
     * @param type          the operation
     * @param sessionId     the session, may be null
     * @param payload       operation-specific data
     * @param version       the sender's state version
     * @param correlationId the correlation id, may be null
     * @return the new message
     */
    public static ProtocolMessage create(
            MessageType type,
            String sessionId,
            Map<String, Object> payload,
            long version,
            String correlationId)
    {
        return new ProtocolMessage(
                UUID.randomUUID().toString(),
                type,
                sessionId,
                null,
                payload,
                Instant.now(),
                version,
                correlationId
        );
    }

    public Optional<String> getSessionId()
    {
        return Optional.ofNullable(sessionId);
    }

    public Optional<String> getAccountId()
    {
        return Optional.ofNullable(accountId);
    }

    public Optional<String> getCorrelationId()
    {
        return Optional.ofNullable(correlationId);
    }
}
