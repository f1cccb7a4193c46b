package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A pending invitation to a session.
 *
 * @param invitedBy account that sent the invitation
 * @param invited   account that was invited
 * @param expires   expiry, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Invitation(
        @JsonProperty("invited_by") String invitedBy,
        String invited,
        Instant expires
)
{
}
