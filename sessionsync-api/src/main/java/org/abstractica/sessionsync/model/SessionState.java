package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One participant's exercise plan and progress within a session.
 *
 * @param sessionId the session
 * @param accountId the participant owning this state
 * @param version   incremented on every committed or confirmed change
 * @param items     the exercises
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionState(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("account_id") String accountId,
        long version,
        List<ExerciseItem> items
)
{
    public SessionState
    {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(accountId, "accountId");
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Creates an empty version-0 state.
     *
     * @param sessionId the session
     * @param accountId the participant
     * @return the empty state
     */
    public static SessionState empty(String sessionId, String accountId)
    {
        return new SessionState(sessionId, accountId, 0, List.of());
    }

    /**
     * Finds an exercise by id.
     *
     * @param exerciseId the exercise id
     * @return the exercise, or empty if absent
     */
    public Optional<ExerciseItem> findItem(String exerciseId)
    {
        return items.stream().filter(i -> i.id().equals(exerciseId)).findFirst();
    }

    public SessionState withVersion(long newVersion)
    {
        return new SessionState(sessionId, accountId, newVersion, items);
    }

    public SessionState withItems(List<ExerciseItem> newItems)
    {
        return new SessionState(sessionId, accountId, version, newItems);
    }
}
