package org.abstractica.sessionsync.impl.session;

import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.Participant;
import org.abstractica.sessionsync.model.ParticipantCursor;
import org.abstractica.sessionsync.model.SessionDocument;
import org.abstractica.sessionsync.model.SessionState;
import org.abstractica.sessionsync.model.SetMetrics;
import org.abstractica.sessionsync.payload.SessionPayload;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Reconciliation rules for session documents and states.
 *
 * <p>Pure functions over the immutable model: each returns the updated value,
 * or the same instance when the change does not apply (an absent exercise or
 * set, a duplicate join). Every change to the exercise list increments the
 * state version by one; full syncs are not handled here because they simply
 * replace the state.</p>
 */
public final class SessionReconciler
{
    private SessionReconciler() {}

    // ========== Sets ==========

    /**
     * Flips the completion flag of a set.
     */
    public static SessionState toggleSetComplete(SessionState state, String exerciseId, String setId)
    {
        return mapSet(state, exerciseId, setId, set -> set.withComplete(!set.complete()));
    }

    /**
     * Marks a set complete.
     */
    public static SessionState completeSet(SessionState state, String exerciseId, String setId)
    {
        return mapSet(state, exerciseId, setId, set -> set.withComplete(true));
    }

    /**
     * Replaces the metrics of a set wholesale.
     */
    public static SessionState updateMetrics(SessionState state, String exerciseId, String setId, SetMetrics metrics)
    {
        Objects.requireNonNull(metrics, "metrics");
        return mapSet(state, exerciseId, setId, set -> set.withMetrics(metrics));
    }

    /**
     * Applies a set patch; null fields are left unchanged.
     */
    public static SessionState updateSet(
            SessionState state,
            String exerciseId,
            String setId,
            SessionPayload.SetChanges changes)
    {
        Objects.requireNonNull(changes, "changes");
        return mapSet(state, exerciseId, setId, set ->
        {
            ExerciseSet updated = set;
            if (changes.type() != null)
            {
                updated = updated.withType(changes.type());
            }
            if (changes.complete() != null)
            {
                updated = updated.withComplete(changes.complete());
            }
            if (changes.metrics() != null)
            {
                updated = updated.withMetrics(changes.metrics());
            }
            return updated;
        });
    }

    /**
     * Exchanges the list positions of two sets.
     *
     * <p>The set {@code fromSetId} takes the slot of {@code toSetId} and the
     * other way round; for neighbouring sets this is the same as removing the
     * set and reinserting it at the target position. Order fields are not
     * touched; see {@link #renumberSets}.</p>
     */
    public static SessionState reorderSet(SessionState state, String exerciseId, String fromSetId, String toSetId)
    {
        if (Objects.equals(fromSetId, toSetId))
        {
            return state;
        }
        return mapItem(state, exerciseId, item ->
        {
            List<ExerciseSet> sets = new ArrayList<>(item.sets());
            int from = indexOfSet(sets, fromSetId);
            int to = indexOfSet(sets, toSetId);
            if (from < 0 || to < 0)
            {
                return item;
            }
            ExerciseSet moved = sets.get(from);
            sets.set(from, sets.get(to));
            sets.set(to, moved);
            return item.withSets(sets);
        });
    }

    /**
     * Moves a set to a zero-based position and renumbers the sets.
     *
     * <p>An index past the end moves the set to the end.</p>
     */
    public static SessionState moveSet(SessionState state, String exerciseId, String setId, int newIndex)
    {
        return mapItem(state, exerciseId, item ->
        {
            List<ExerciseSet> sets = new ArrayList<>(item.sets());
            int from = indexOfSet(sets, setId);
            if (from < 0)
            {
                return item;
            }
            ExerciseSet moved = sets.remove(from);
            sets.add(Math.min(newIndex, sets.size()), moved);
            return item.withSets(renumbered(sets));
        });
    }

    /**
     * Reassigns set order fields as 1..N by list position.
     */
    public static SessionState renumberSets(SessionState state, String exerciseId)
    {
        return mapItem(state, exerciseId, item -> item.withSets(renumbered(item.sets())));
    }

    /**
     * Appends a set to an exercise.
     */
    public static SessionState addSet(SessionState state, String exerciseId, ExerciseSet set)
    {
        Objects.requireNonNull(set, "set");
        return mapItem(state, exerciseId, item ->
        {
            List<ExerciseSet> sets = new ArrayList<>(item.sets());
            sets.add(set);
            return item.withSets(sets);
        });
    }

    /**
     * Removes a set from an exercise.
     */
    public static SessionState deleteSet(SessionState state, String exerciseId, String setId)
    {
        return mapItem(state, exerciseId, item ->
        {
            List<ExerciseSet> sets = new ArrayList<>(item.sets());
            sets.removeIf(set -> set.id().equals(setId));
            return item.withSets(sets);
        });
    }

    // ========== Exercises ==========

    /**
     * Appends an exercise with {@code order} set to the new item count.
     *
     * <p>Ids are not checked for duplicates.</p>
     */
    public static SessionState addExercise(SessionState state, ExerciseItem exercise)
    {
        Objects.requireNonNull(exercise, "exercise");
        List<ExerciseItem> items = new ArrayList<>(state.items());
        items.add(exercise.withOrder(items.size() + 1));
        return state.withItems(items).withVersion(state.version() + 1);
    }

    /**
     * Appends an exercise received from the server; it starts without sets.
     */
    public static SessionState addExercise(SessionState state, SessionPayload.ExerciseData data)
    {
        Objects.requireNonNull(data, "data");
        String id = data.id() != null ? data.id() : UUID.randomUUID().toString();
        ExerciseItem item = new ExerciseItem(
                id, 0, data.participants(), data.type(), data.rest(), data.meta(), List.of());
        return addExercise(state, item);
    }

    /**
     * Applies an exercise patch; null fields are left unchanged.
     */
    public static SessionState updateExercise(
            SessionState state,
            String exerciseId,
            SessionPayload.ExerciseChanges changes)
    {
        Objects.requireNonNull(changes, "changes");
        return mapItem(state, exerciseId, item ->
        {
            ExerciseItem updated = item;
            if (changes.type() != null)
            {
                updated = updated.withType(changes.type());
            }
            if (changes.rest() != null)
            {
                updated = updated.withRest(changes.rest());
            }
            if (changes.meta() != null)
            {
                updated = updated.withMeta(changes.meta());
            }
            if (changes.participants() != null)
            {
                updated = updated.withParticipants(changes.participants());
            }
            return updated;
        });
    }

    /**
     * Removes an exercise. Remaining order fields are kept.
     */
    public static SessionState deleteExercise(SessionState state, String exerciseId)
    {
        if (state.findItem(exerciseId).isEmpty())
        {
            return state;
        }
        List<ExerciseItem> items = new ArrayList<>(state.items());
        items.removeIf(item -> item.id().equals(exerciseId));
        return state.withItems(items).withVersion(state.version() + 1);
    }

    /**
     * Moves an exercise to a zero-based position and renumbers the exercises.
     */
    public static SessionState moveExercise(SessionState state, String exerciseId, int newIndex)
    {
        List<ExerciseItem> items = new ArrayList<>(state.items());
        int from = -1;
        for (int i = 0; i < items.size(); i++)
        {
            if (items.get(i).id().equals(exerciseId))
            {
                from = i;
                break;
            }
        }
        if (from < 0)
        {
            return state;
        }

        ExerciseItem moved = items.remove(from);
        items.add(Math.min(newIndex, items.size()), moved);
        List<ExerciseItem> renumbered = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++)
        {
            renumbered.add(items.get(i).withOrder(i + 1));
        }
        if (renumbered.equals(state.items()))
        {
            return state;
        }
        return state.withItems(renumbered).withVersion(state.version() + 1);
    }

    // ========== Participants ==========

    /**
     * Adds a participant with the next free color. Duplicate joins are ignored.
     */
    public static SessionDocument participantJoined(SessionDocument document, String accountId, Instant now)
    {
        Objects.requireNonNull(accountId, "accountId");
        if (document.findParticipant(accountId).isPresent())
        {
            return document;
        }
        List<Participant> participants = new ArrayList<>(document.participants());
        participants.add(new Participant(accountId, ParticipantColors.nextColor(participants), null));
        return document.withParticipants(participants, now);
    }

    /**
     * Removes a participant. Unknown ids are ignored.
     */
    public static SessionDocument participantLeft(SessionDocument document, String accountId, Instant now)
    {
        if (document.findParticipant(accountId).isEmpty())
        {
            return document;
        }
        List<Participant> participants = new ArrayList<>(document.participants());
        participants.removeIf(participant -> participant.id().equals(accountId));
        return document.withParticipants(participants, now);
    }

    /**
     * Moves a participant's cursor. Unknown ids are ignored.
     */
    public static SessionDocument cursorMoved(
            SessionDocument document,
            String accountId,
            ParticipantCursor cursor,
            Instant now)
    {
        Optional<Participant> participant = document.findParticipant(accountId);
        if (participant.isEmpty() || Objects.equals(participant.get().cursor(), cursor))
        {
            return document;
        }
        List<Participant> participants = new ArrayList<>(document.participants().size());
        for (Participant p : document.participants())
        {
            participants.add(p.id().equals(accountId) ? p.withCursor(cursor) : p);
        }
        return document.withParticipants(participants, now);
    }

    // ========== Helpers ==========

    private static SessionState mapItem(SessionState state, String exerciseId, UnaryOperator<ExerciseItem> change)
    {
        Objects.requireNonNull(state, "state");
        List<ExerciseItem> items = new ArrayList<>(state.items().size());
        boolean changed = false;
        for (ExerciseItem item : state.items())
        {
            if (!changed && item.id().equals(exerciseId))
            {
                ExerciseItem updated = change.apply(item);
                changed = !updated.equals(item);
                items.add(updated);
            }
            else
            {
                items.add(item);
            }
        }
        if (!changed)
        {
            return state;
        }
        return state.withItems(items).withVersion(state.version() + 1);
    }

    private static SessionState mapSet(
            SessionState state,
            String exerciseId,
            String setId,
            UnaryOperator<ExerciseSet> change)
    {
        return mapItem(state, exerciseId, item ->
        {
            List<ExerciseSet> sets = new ArrayList<>(item.sets().size());
            for (ExerciseSet set : item.sets())
            {
                sets.add(set.id().equals(setId) ? change.apply(set) : set);
            }
            return item.withSets(sets);
        });
    }

    private static int indexOfSet(List<ExerciseSet> sets, String setId)
    {
        for (int i = 0; i < sets.size(); i++)
        {
            if (sets.get(i).id().equals(setId))
            {
                return i;
            }
        }
        return -1;
    }

    private static List<ExerciseSet> renumbered(List<ExerciseSet> sets)
    {
        List<ExerciseSet> result = new ArrayList<>(sets.size());
        for (int i = 0; i < sets.size(); i++)
        {
            result.add(sets.get(i).withOrder(i + 1));
        }
        return result;
    }
}
