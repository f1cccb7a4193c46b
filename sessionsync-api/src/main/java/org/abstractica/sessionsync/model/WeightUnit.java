package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum WeightUnit
{
    @JsonProperty("kg")
    KILOGRAM,

    @JsonProperty("lb")
    POUND
}
