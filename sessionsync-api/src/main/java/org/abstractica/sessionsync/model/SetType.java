package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kind of set within an exercise.
 */
public enum SetType
{
    @JsonProperty("warmup")
    WARMUP,

    @JsonProperty("working")
    WORKING,

    @JsonProperty("drop")
    DROP,

    @JsonProperty("super")
    @JsonAlias("superset")
    SUPERSET,

    @JsonProperty("failure")
    FAILURE
}
