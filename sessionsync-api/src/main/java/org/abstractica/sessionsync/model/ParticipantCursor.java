package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The exercise and set a participant is looking at.
 *
 * @param exerciseId    the focused exercise
 * @param exerciseSetId the focused set
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParticipantCursor(
        @JsonProperty("exercise_id") String exerciseId,
        @JsonProperty("exercise_set_id") String exerciseSetId
)
{
}
