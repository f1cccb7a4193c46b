package org.abstractica.sessionsync.impl.codec;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses the ISO-8601 variants found in server payloads.
 *
 * <p>Formats are tried in order:</p>
 * <ol>
 *   <li>fractional seconds with offset: {@code 2024-05-01T10:15:30.123456+00:00}</li>
 *   <li>whole seconds with offset: {@code 2024-05-01T10:15:30+02:00}</li>
 *   <li>UTC with a literal {@code Z}: {@code 2024-05-01T10:15:30Z}</li>
 *   <li>no zone, read as UTC: {@code 2024-05-01T10:15:30.123}</li>
 * </ol>
 */
public final class TimestampParser
{
    private TimestampParser() {}

    private static final DateTimeFormatter FRACTIONAL_WITH_OFFSET = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .appendOffsetId()
            .toFormatter();

    private static final DateTimeFormatter SECONDS_WITH_OFFSET = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .appendOffsetId()
            .toFormatter();

    private static final DateTimeFormatter UTC_WITH_Z = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendLiteral('Z')
            .toFormatter();

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
            FRACTIONAL_WITH_OFFSET,
            SECONDS_WITH_OFFSET
    );

    /**
     * Parses a timestamp.
     *
     * @param text the timestamp text
     * @return the instant
     * @throws DateTimeParseException if no supported format matches
     */
    public static Instant parse(String text)
    {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();

        for (DateTimeFormatter format : OFFSET_FORMATS)
        {
            Optional<Instant> parsed = tryParse(trimmed, format, true);
            if (parsed.isPresent())
            {
                return parsed.get();
            }
        }

        return tryParse(trimmed, UTC_WITH_Z, false)
                .orElseGet(() -> LocalDateTime.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        .toInstant(ZoneOffset.UTC));
    }

    private static Optional<Instant> tryParse(String text, DateTimeFormatter format, boolean withOffset)
    {
        try
        {
            Instant instant = withOffset
                    ? OffsetDateTime.parse(text, format).toInstant()
                    : LocalDateTime.parse(text, format).toInstant(ZoneOffset.UTC);
            return Optional.of(instant);
        }
        catch (DateTimeParseException e)
        {
            return Optional.empty();
        }
    }

    /**
     * Formats an instant as ISO-8601 UTC.
     *
     * @param instant the instant
     * @return the text, e.g. {@code 2024-05-01T10:15:30.123Z}
     */
    public static String format(Instant instant)
    {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
