package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalogue entry describing an exercise within a session item.
 *
 * @param internalId catalogue id of the exercise
 * @param name       display name
 * @param type       which metrics the exercise records
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExerciseMeta(
        @JsonProperty("internal_id") String internalId,
        String name,
        ExerciseType type
)
{
}
