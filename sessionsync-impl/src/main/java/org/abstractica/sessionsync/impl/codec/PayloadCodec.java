package org.abstractica.sessionsync.impl.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.abstractica.sessionsync.MessageType;
import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.RealtimeException;
import org.abstractica.sessionsync.payload.SessionPayload;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between untyped envelope payloads and {@link SessionPayload} records.
 *
 * <p>Each message type is registered with exactly one payload class, and the
 * registry works in both directions.</p>
 */
public final class PayloadCodec
{
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Map<MessageType, Class<? extends SessionPayload>> typeToClass;
    private final Map<Class<? extends SessionPayload>, MessageType> classToType;

    public PayloadCodec()
    {
        this(JsonMapping.newObjectMapper());
    }

    public PayloadCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.typeToClass = new EnumMap<>(MessageType.class);
        this.classToType = new HashMap<>();

        register(MessageType.SESSION_JOIN, SessionPayload.SessionJoin.class);
        register(MessageType.SESSION_LEAVE, SessionPayload.SessionLeave.class);
        register(MessageType.SESSION_UPDATE, SessionPayload.SessionUpdate.class);
        register(MessageType.SESSION_SYNC, SessionPayload.SessionSync.class);
        register(MessageType.EXERCISE_ADD, SessionPayload.ExerciseAdd.class);
        register(MessageType.EXERCISE_UPDATE, SessionPayload.ExerciseUpdate.class);
        register(MessageType.EXERCISE_DELETE, SessionPayload.ExerciseDelete.class);
        register(MessageType.EXERCISE_REORDER, SessionPayload.ExerciseReorder.class);
        register(MessageType.SET_ADD, SessionPayload.SetAdd.class);
        register(MessageType.SET_UPDATE, SessionPayload.SetUpdate.class);
        register(MessageType.SET_DELETE, SessionPayload.SetDelete.class);
        register(MessageType.SET_COMPLETE, SessionPayload.SetComplete.class);
        register(MessageType.SET_REORDER, SessionPayload.SetReorder.class);
        register(MessageType.CURSOR_MOVE, SessionPayload.CursorMove.class);
        register(MessageType.SYNC_REQUEST, SessionPayload.SyncRequest.class);
        register(MessageType.SYNC_RESPONSE, SessionPayload.SyncResponse.class);
    }

    private void register(MessageType type, Class<? extends SessionPayload> payloadClass)
    {
        typeToClass.put(type, payloadClass);
        classToType.put(payloadClass, type);
    }

    /**
     * Returns the message type a payload is sent as.
     *
     * @param payload the payload
     * @return the message type
     */
    public MessageType typeOf(SessionPayload payload)
    {
        Objects.requireNonNull(payload, "payload");
        MessageType type = classToType.get(payload.getClass());
        if (type == null)
        {
            throw new IllegalArgumentException("Unregistered payload: " + payload.getClass().getName());
        }
        return type;
    }

    /**
     * Decodes the payload of a message into its typed record.
     *
     * @param message the message
     * @return the typed payload
     * @throws RealtimeException.Decoding if the payload does not match the schema of its type
     */
    public SessionPayload decode(ProtocolMessage message)
    {
        Objects.requireNonNull(message, "message");

        Class<? extends SessionPayload> payloadClass = typeToClass.get(message.type());
        if (payloadClass == null)
        {
            throw new RealtimeException.Decoding("no payload schema for " + message.type().getWireName());
        }

        try
        {
            return mapper.convertValue(message.payload(), payloadClass);
        }
        catch (IllegalArgumentException e)
        {
            throw new RealtimeException.Decoding(
                    "invalid " + message.type().getWireName() + " payload: " + rootMessage(e), e);
        }
    }

    /**
     * Encodes a typed payload into the untyped envelope form.
     *
     * @param payload the payload
     * @return the payload mapping
     * @throws RealtimeException.Encoding if the payload cannot be converted
     */
    public Map<String, Object> encode(SessionPayload payload)
    {
        Objects.requireNonNull(payload, "payload");
        try
        {
            return mapper.convertValue(payload, MAP_TYPE);
        }
        catch (IllegalArgumentException e)
        {
            throw new RealtimeException.Encoding(e);
        }
    }

    private static String rootMessage(Throwable e)
    {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root)
        {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
