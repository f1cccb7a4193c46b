package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A duration in whole seconds.
 *
 * @param seconds the number of seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ElapsedTime(@JsonProperty("value") int seconds)
{
}
