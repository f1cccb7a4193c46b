package org.abstractica.sessionsync.impl.session;

import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.ExerciseSet;
import org.abstractica.sessionsync.model.SessionState;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only walk over a session state in {@code order} sequence.
 */
public class SessionNavigator
{
    private final SessionState state;

    public SessionNavigator(SessionState state)
    {
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * A set together with the exercise it belongs to.
     *
     * @param exercise the exercise
     * @param set      the set
     */
    public record Position(ExerciseItem exercise, ExerciseSet set) {}

    /**
     * Completed and total set counts.
     *
     * @param completed sets marked complete
     * @param total     all sets
     */
    public record Progress(int completed, int total) {}

    public List<ExerciseItem> sortedExercises()
    {
        return state.items().stream()
                .sorted(Comparator.comparingInt(ExerciseItem::order))
                .toList();
    }

    public static List<ExerciseSet> sortedSets(ExerciseItem exercise)
    {
        return exercise.sets().stream()
                .sorted(Comparator.comparingInt(ExerciseSet::order))
                .toList();
    }

    /**
     * Returns true if the exercise has no incomplete set. An exercise without sets counts as complete.
     */
    public static boolean isComplete(ExerciseItem exercise)
    {
        return exercise.sets().stream().allMatch(ExerciseSet::complete);
    }

    public boolean isSessionComplete()
    {
        return state.items().stream().allMatch(SessionNavigator::isComplete);
    }

    public static Optional<ExerciseSet> nextIncompleteSet(ExerciseItem exercise)
    {
        return sortedSets(exercise).stream()
                .filter(set -> !set.complete())
                .findFirst();
    }

    /**
     * Finds the first incomplete set of the first incomplete exercise.
     *
     * @return the position, or empty when everything is complete
     */
    public Optional<Position> nextIncomplete()
    {
        for (ExerciseItem exercise : sortedExercises())
        {
            Optional<ExerciseSet> set = nextIncompleteSet(exercise);
            if (set.isPresent())
            {
                return Optional.of(new Position(exercise, set.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Counts completed sets across all exercises.
     *
     * @return the progress
     */
    public Progress progress()
    {
        int done = 0;
        int total = 0;
        for (ExerciseItem exercise : state.items())
        {
            for (ExerciseSet set : exercise.sets())
            {
                total++;
                if (set.complete())
                {
                    done++;
                }
            }
        }
        return new Progress(done, total);
    }
}
