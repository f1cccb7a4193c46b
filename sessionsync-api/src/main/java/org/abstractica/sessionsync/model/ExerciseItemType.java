package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single exercise, or a compound of several performed together.
 */
public enum ExerciseItemType
{
    @JsonProperty("single")
    SINGLE,

    @JsonProperty("compound")
    COMPOUND
}
