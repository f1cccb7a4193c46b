package org.abstractica.sessionsync.impl.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Jackson configuration shared by the envelope and payload codecs.
 */
public final class JsonMapping
{
    private JsonMapping() {}

    /**
     * Creates a mapper configured for the session protocol.
     *
     * <p>Instants are written as ISO-8601 UTC strings and read with
     * {@link TimestampParser}. Unknown properties fail unless a type opts out.</p>
     *
     * @return a new mapper
     */
    public static ObjectMapper newObjectMapper()
    {
        SimpleModule timestamps = new SimpleModule("session-timestamps");
        timestamps.addSerializer(Instant.class, new InstantSerializer());
        timestamps.addDeserializer(Instant.class, new InstantDeserializer());

        return new ObjectMapper()
                .registerModule(timestamps)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    private static final class InstantSerializer extends JsonSerializer<Instant>
    {
        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider serializers) throws IOException
        {
            gen.writeString(TimestampParser.format(value));
        }
    }

    private static final class InstantDeserializer extends JsonDeserializer<Instant>
    {
        @Override
        public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException
        {
            if (parser.currentToken() != JsonToken.VALUE_STRING)
            {
                return (Instant) context.handleUnexpectedToken(Instant.class, parser);
            }
            String text = parser.getText();
            try
            {
                return TimestampParser.parse(text);
            }
            catch (DateTimeParseException e)
            {
                return (Instant) context.handleWeirdStringValue(Instant.class, text, "Unsupported timestamp format");
            }
        }
    }
}
