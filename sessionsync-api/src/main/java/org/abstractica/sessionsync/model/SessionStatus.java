package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle status of a shared session.
 */
public enum SessionStatus
{
    @JsonProperty("draft")
    DRAFT,

    @JsonProperty("active")
    ACTIVE,

    @JsonProperty("complete")
    COMPLETE
}
