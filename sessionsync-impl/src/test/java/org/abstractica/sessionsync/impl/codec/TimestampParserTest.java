package org.abstractica.sessionsync.impl.codec;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TimestampParser}.
 */
class TimestampParserTest
{
    @Test
    void fractionalSecondsWithOffset()
    {
        assertEquals(Instant.parse("2024-05-01T10:15:30.123456Z"),
                TimestampParser.parse("2024-05-01T10:15:30.123456+00:00"));
    }

    @Test
    void wholeSecondsWithOffset()
    {
        assertEquals(Instant.parse("2024-05-01T08:15:30Z"),
                TimestampParser.parse("2024-05-01T10:15:30+02:00"));
    }

    @Test
    void literalZ()
    {
        assertEquals(Instant.parse("2024-05-01T10:15:30Z"), TimestampParser.parse("2024-05-01T10:15:30Z"));
        assertEquals(Instant.parse("2024-05-01T10:15:30.500Z"), TimestampParser.parse("2024-05-01T10:15:30.5Z"));
    }

    @Test
    void noZoneIsUtc()
    {
        assertEquals(Instant.parse("2024-05-01T10:15:30.123Z"), TimestampParser.parse("2024-05-01T10:15:30.123"));
    }

    @Test
    void rejectsGarbage()
    {
        assertThrows(DateTimeParseException.class, () -> TimestampParser.parse("yesterday"));
        assertThrows(DateTimeParseException.class, () -> TimestampParser.parse("2024-13-01T10:15:30Z"));
    }

    @Test
    void formatsAsUtc()
    {
        assertEquals("2024-05-01T10:15:30.123Z", TimestampParser.format(Instant.parse("2024-05-01T10:15:30.123Z")));
    }
}
