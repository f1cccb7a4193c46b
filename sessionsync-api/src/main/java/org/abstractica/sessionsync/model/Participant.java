package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A member of a shared session.
 *
 * @param id     account id, unique within the session
 * @param color  display colour, e.g. {@code #4ECDC4}
 * @param cursor current focus, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Participant(String id, String color, ParticipantCursor cursor)
{
    public Participant
    {
        Objects.requireNonNull(id, "id");
    }

    public Participant withCursor(ParticipantCursor newCursor)
    {
        return new Participant(id, color, newCursor);
    }
}
