package org.abstractica.sessionsync.impl.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.sessionsync.MessageType;
import org.abstractica.sessionsync.ProtocolMessage;
import org.abstractica.sessionsync.RealtimeException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes and decodes {@link ProtocolMessage} envelopes as JSON text frames.
 *
 * <p>Wire format:</p>
 * <pre>
 * {
 *   "id": "uuid",
 *   "type": "session_join",
 *   "session_id": "optional",
 *   "account_id": "optional, set by the server",
 *   "payload": { ... },
 *   "timestamp": "ISO-8601",
 *   "version": 0,
 *   "correlation_id": "optional"
 * }
 * </pre>
 *
 * <p>Unknown envelope fields are ignored. {@code author_id} is read as
 * {@code account_id}.</p>
 */
public final class EnvelopeCodec
{
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public EnvelopeCodec()
    {
        this(JsonMapping.newObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    // ========== Encoding ==========

    /**
     * Encodes a message to JSON text.
     *
     * @param message the message
     * @return the JSON text
     * @throws RealtimeException.Encoding if the payload cannot be serialized
     */
    public String encode(ProtocolMessage message)
    {
        Objects.requireNonNull(message, "message");

        try
        {
            ObjectNode root = mapper.createObjectNode();
            root.put("id", message.id());
            root.put("type", message.type().getWireName());
            if (message.sessionId() != null)
            {
                root.put("session_id", message.sessionId());
            }
            if (message.accountId() != null)
            {
                root.put("account_id", message.accountId());
            }
            root.set("payload", mapper.valueToTree(message.payload()));
            root.put("timestamp", TimestampParser.format(message.timestamp()));
            root.put("version", message.version());
            if (message.correlationId() != null)
            {
                root.put("correlation_id", message.correlationId());
            }
            return mapper.writeValueAsString(root);
        }
        catch (JsonProcessingException | IllegalArgumentException e)
        {
            throw new RealtimeException.Encoding(e);
        }
    }

    // ========== Decoding ==========

    /**
     * Decodes JSON text to a message.
     *
     * @param text the JSON text
     * @return the message
     * @throws RealtimeException.Decoding if the text is not a valid envelope
     */
    public ProtocolMessage decode(String text)
    {
        Objects.requireNonNull(text, "text");

        JsonNode root;
        try
        {
            root = mapper.readTree(text);
        }
        catch (JsonProcessingException e)
        {
            throw new RealtimeException.Decoding("malformed JSON", e);
        }

        if (root == null || !root.isObject())
        {
            throw new RealtimeException.Decoding("envelope is not a JSON object");
        }

        String typeName = requiredText(root, "type");
        MessageType type = MessageType.fromWireName(typeName)
                .orElseThrow(() -> new RealtimeException.Decoding("unknown message type: " + typeName));

        JsonNode payloadNode = root.path("payload");
        Map<String, Object> payload;
        if (payloadNode.isMissingNode() || payloadNode.isNull())
        {
            payload = Map.of();
        }
        else if (payloadNode.isObject())
        {
            payload = mapper.convertValue(payloadNode, MAP_TYPE);
        }
        else
        {
            throw new RealtimeException.Decoding("payload is not a JSON object");
        }

        JsonNode versionNode = root.path("version");
        if (!versionNode.isMissingNode() && !versionNode.isNull() && !versionNode.isIntegralNumber())
        {
            throw new RealtimeException.Decoding("version is not an integer");
        }

        String accountId = optionalText(root, "account_id");
        if (accountId == null)
        {
            accountId = optionalText(root, "author_id");
        }

        return new ProtocolMessage(
                optionalText(root, "id"),
                type,
                optionalText(root, "session_id"),
                accountId,
                payload,
                timestamp(root),
                versionNode.asLong(0),
                optionalText(root, "correlation_id")
        );
    }

    private static Instant timestamp(JsonNode root)
    {
        String text = optionalText(root, "timestamp");
        if (text == null)
        {
            return Instant.now();
        }
        try
        {
            return TimestampParser.parse(text);
        }
        catch (DateTimeParseException e)
        {
            throw new RealtimeException.Decoding("unsupported timestamp: " + text, e);
        }
    }

    private static String requiredText(JsonNode root, String field)
    {
        String value = optionalText(root, field);
        if (value == null)
        {
            throw new RealtimeException.Decoding("missing field: " + field);
        }
        return value;
    }

    private static String optionalText(JsonNode root, String field)
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull())
        {
            return null;
        }
        if (!node.isTextual())
        {
            throw new RealtimeException.Decoding("field is not a string: " + field);
        }
        return node.asText();
    }
}
