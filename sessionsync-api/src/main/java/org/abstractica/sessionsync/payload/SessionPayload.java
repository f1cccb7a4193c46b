package org.abstractica.sessionsync.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.abstractica.sessionsync.model.ExerciseItemType;
import org.abstractica.sessionsync.model.ExerciseMeta;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.ParticipantCursor;
import org.abstractica.sessionsync.model.SessionDocument;
import org.abstractica.sessionsync.model.SessionState;
import org.abstractica.sessionsync.model.SetMetrics;
import org.abstractica.sessionsync.model.SetType;

import java.util.List;
import java.util.Objects;

/**
 * Typed payloads of the exercise session protocol.
 *
 * <p>Each {@link org.abstractica.sessionsync.MessageType} has exactly one
 * payload record. Payloads are validated on construction, so a decoded
 * payload is always well formed. Extra keys added by the server are
 * ignored; update patches only accept their known keys.</p>
 */
public sealed interface SessionPayload permits
        SessionPayload.SessionJoin,
        SessionPayload.SessionLeave,
        SessionPayload.SessionUpdate,
        SessionPayload.SessionSync,
        SessionPayload.ExerciseAdd,
        SessionPayload.ExerciseUpdate,
        SessionPayload.ExerciseDelete,
        SessionPayload.ExerciseReorder,
        SessionPayload.SetAdd,
        SessionPayload.SetUpdate,
        SessionPayload.SetDelete,
        SessionPayload.SetComplete,
        SessionPayload.SetReorder,
        SessionPayload.CursorMove,
        SessionPayload.SyncRequest,
        SessionPayload.SyncResponse
{
    int MAX_ID_LENGTH = 100;

    /**
     * A participant joined the session.
     *
     * @param sessionId the session
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SessionJoin(@JsonProperty("session_id") String sessionId) implements SessionPayload
    {
        public SessionJoin
        {
            requireId(sessionId, "session_id");
        }
    }

    /**
     * A participant left the session.
     *
     * @param sessionId the session
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SessionLeave(@JsonProperty("session_id") String sessionId) implements SessionPayload
    {
        public SessionLeave
        {
            requireId(sessionId, "session_id");
        }
    }

    /**
     * Server status report for the session connection.
     *
     * @param sessionId    the session
     * @param status       status text such as {@code connected}, may be null
     * @param connectionId server-side connection id, may be null
     * @param error        error text, may be null
     * @param errorType    error category, may be null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SessionUpdate(
            @JsonProperty("session_id") String sessionId,
            String status,
            @JsonProperty("connection_id") String connectionId,
            String error,
            @JsonProperty("error_type") String errorType
    ) implements SessionPayload
    {
        public SessionUpdate
        {
            requireId(sessionId, "session_id");
        }
    }

    /**
     * Full state snapshot; replaces local state.
     *
     * @param state the authoritative state
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SessionSync(SessionState state) implements SessionPayload
    {
        public SessionSync
        {
            Objects.requireNonNull(state, "state");
        }
    }

    /**
     * An exercise was added.
     *
     * @param exercise the new exercise
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExerciseAdd(ExerciseData exercise) implements SessionPayload
    {
        public ExerciseAdd
        {
            Objects.requireNonNull(exercise, "exercise");
        }
    }

    /**
     * Fields of an exercise were changed.
     *
     * @param exerciseId the exercise
     * @param updates    the changed fields
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExerciseUpdate(
            @JsonProperty("exercise_id") String exerciseId,
            ExerciseChanges updates
    ) implements SessionPayload
    {
        public ExerciseUpdate
        {
            requireId(exerciseId, "exercise_id");
            Objects.requireNonNull(updates, "updates");
            if (updates.isEmpty())
            {
                throw new IllegalArgumentException("updates must not be empty");
            }
        }
    }

    /**
     * An exercise was removed.
     *
     * @param exerciseId the exercise
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExerciseDelete(@JsonProperty("exercise_id") String exerciseId) implements SessionPayload
    {
        public ExerciseDelete
        {
            requireId(exerciseId, "exercise_id");
        }
    }

    /**
     * An exercise was moved.
     *
     * @param exerciseId the exercise
     * @param newIndex   zero-based target position
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExerciseReorder(
            @JsonProperty("exercise_id") String exerciseId,
            @JsonProperty("new_index") int newIndex
    ) implements SessionPayload
    {
        public ExerciseReorder
        {
            requireId(exerciseId, "exercise_id");
            requireIndex(newIndex);
        }
    }

    /**
     * A set was added to an exercise.
     *
     * @param exerciseId the exercise
     * @param set        the new set
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SetAdd(@JsonProperty("exercise_id") String exerciseId, ExerciseSet set) implements SessionPayload
    {
        public SetAdd
        {
            requireId(exerciseId, "exercise_id");
            Objects.requireNonNull(set, "set");
        }
    }

    /**
     * Fields of a set were changed.
     *
     * @param exerciseId the exercise
     * @param setId      the set
     * @param updates    the changed fields
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SetUpdate(
            @JsonProperty("exercise_id") String exerciseId,
            @JsonProperty("set_id") String setId,
            SetChanges updates
    ) implements SessionPayload
    {
        public SetUpdate
        {
            requireId(exerciseId, "exercise_id");
            requireId(setId, "set_id");
            Objects.requireNonNull(updates, "updates");
            if (updates.isEmpty())
            {
                throw new IllegalArgumentException("updates must not be empty");
            }
        }
    }

    /**
     * A set was removed.
     *
     * @param exerciseId the exercise
     * @param setId      the set
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SetDelete(
            @JsonProperty("exercise_id") String exerciseId,
            @JsonProperty("set_id") String setId
    ) implements SessionPayload
    {
        public SetDelete
        {
            requireId(exerciseId, "exercise_id");
            requireId(setId, "set_id");
        }
    }

    /**
     * A set was marked complete.
     *
     * @param exerciseId the exercise
     * @param setId      the set
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SetComplete(
            @JsonProperty("exercise_id") String exerciseId,
            @JsonProperty("set_id") String setId
    ) implements SessionPayload
    {
        public SetComplete
        {
            requireId(exerciseId, "exercise_id");
            requireId(setId, "set_id");
        }
    }

    /**
     * A set was moved within its exercise.
     *
     * @param exerciseId the exercise
     * @param setId      the set
     * @param newIndex   zero-based target position
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SetReorder(
            @JsonProperty("exercise_id") String exerciseId,
            @JsonProperty("set_id") String setId,
            @JsonProperty("new_index") int newIndex
    ) implements SessionPayload
    {
        public SetReorder
        {
            requireId(exerciseId, "exercise_id");
            requireId(setId, "set_id");
            requireIndex(newIndex);
        }
    }

    /**
     * A participant moved their focus.
     *
     * @param cursor the new focus
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CursorMove(ParticipantCursor cursor) implements SessionPayload
    {
        public CursorMove
        {
            Objects.requireNonNull(cursor, "cursor");
        }
    }

    /**
     * Asks the server for a full snapshot.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SyncRequest() implements SessionPayload
    {
    }

    /**
     * Full snapshot of the session and the caller's state.
     *
     * @param session           the session document
     * @param state             the caller's state
     * @param participantStates other participants' states
     * @param version           snapshot version
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SyncResponse(
            SessionDocument session,
            SessionState state,
            @JsonProperty("participant_states") List<SessionState> participantStates,
            long version
    ) implements SessionPayload
    {
        public SyncResponse
        {
            Objects.requireNonNull(session, "session");
            Objects.requireNonNull(state, "state");
            participantStates = participantStates == null ? List.of() : List.copyOf(participantStates);
            if (version < 0)
            {
                throw new IllegalArgumentException("version must be >= 0: " + version);
            }
        }
    }

    // ========== Nested data ==========

    /**
     * Exercise carried by {@link ExerciseAdd}.
     *
     * @param id           exercise id, may be null when the server assigns it
     * @param type         single or compound
     * @param rest         rest between sets in seconds, negative or null when unset
     * @param meta         catalogue entries
     * @param participants accounts performing the exercise, may be null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ExerciseData(
            String id,
            ExerciseItemType type,
            Integer rest,
            List<ExerciseMeta> meta,
            List<String> participants
    )
    {
        public ExerciseData
        {
            Objects.requireNonNull(type, "type");
            meta = meta == null ? List.of() : List.copyOf(meta);
        }
    }

    /**
     * Changed exercise fields; null means unchanged.
     *
     * @param type         new type
     * @param rest         new rest
     * @param meta         new catalogue entries
     * @param participants new participants
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ExerciseChanges(
            ExerciseItemType type,
            Integer rest,
            List<ExerciseMeta> meta,
            List<String> participants
    )
    {
        boolean isEmpty()
        {
            return type == null && rest == null && meta == null && participants == null;
        }
    }

    /**
     * Changed set fields; null means unchanged.
     *
     * @param type     new type
     * @param complete new completion flag
     * @param metrics  new metrics, replacing the old ones
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SetChanges(SetType type, Boolean complete, SetMetrics metrics)
    {
        public static SetChanges complete(boolean complete)
        {
            return new SetChanges(null, complete, null);
        }

        public static SetChanges metrics(SetMetrics metrics)
        {
            return new SetChanges(null, null, Objects.requireNonNull(metrics, "metrics"));
        }

        boolean isEmpty()
        {
            return type == null && complete == null && metrics == null;
        }
    }

    // ========== Validation ==========

    private static void requireId(String value, String name)
    {
        if (value == null || value.isEmpty())
        {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.length() > MAX_ID_LENGTH)
        {
            throw new IllegalArgumentException(name + " exceeds " + MAX_ID_LENGTH + " characters");
        }
    }

    private static void requireIndex(int index)
    {
        if (index < 0)
        {
            throw new IllegalArgumentException("new_index must be >= 0: " + index);
        }
    }
}
