package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A shared exercise session and its membership.
 *
 * @param id           session id
 * @param name         display name, may be null
 * @param status       lifecycle status
 * @param ownerId      account that created the session
 * @param participants members, unique by id
 * @param invitations  pending invitations
 * @param createdAt    creation time
 * @param updatedAt    last modification time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionDocument(
        String id,
        String name,
        SessionStatus status,
        @JsonProperty("owner_id") String ownerId,
        List<Participant> participants,
        List<Invitation> invitations,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
)
{
    public SessionDocument
    {
        Objects.requireNonNull(id, "id");
        status = status == null ? SessionStatus.DRAFT : status;
        participants = participants == null ? List.of() : List.copyOf(participants);
        invitations = invitations == null ? List.of() : List.copyOf(invitations);
    }

    /**
     * Finds a participant by account id.
     *
     * @param accountId the account id
     * @return the participant, or empty if not a member
     */
    public Optional<Participant> findParticipant(String accountId)
    {
        return participants.stream().filter(p -> p.id().equals(accountId)).findFirst();
    }

    public SessionDocument withParticipants(List<Participant> newParticipants, Instant now)
    {
        return new SessionDocument(id, name, status, ownerId, newParticipants, invitations, createdAt, now);
    }
}
