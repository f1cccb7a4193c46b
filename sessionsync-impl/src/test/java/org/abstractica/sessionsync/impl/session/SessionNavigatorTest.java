package org.abstractica.sessionsync.impl.session;

import org.abstractica.sessionsync.model.ExerciseItem;
import org.abstractica.sessionsync.model.SessionState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.abstractica.sessionsync.impl.session.SessionReconcilerTest.exercise;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SessionNavigator}.
 */
class SessionNavigatorTest
{
    private static SessionState state(ExerciseItem... items)
    {
        return new SessionState("session-1", "alice", 1, List.of(items));
    }

    @Test
    void exercisesFollowOrderField()
    {
        SessionNavigator navigator = new SessionNavigator(state(exercise("b", 2), exercise("a", 1)));

        assertEquals(List.of("a", "b"), navigator.sortedExercises().stream().map(ExerciseItem::id).toList());
    }

    @Test
    void nextIncompleteSkipsFinishedWork()
    {
        SessionState initial = state(exercise("e1", 1, "s1"), exercise("e2", 2, "s1", "s2"));
        SessionState progressed = SessionReconciler.completeSet(
                SessionReconciler.completeSet(initial, "e1", "s1"), "e2", "s1");

        SessionNavigator.Position next = new SessionNavigator(progressed).nextIncomplete().orElseThrow();

        assertEquals("e2", next.exercise().id());
        assertEquals("s2", next.set().id());
        assertEquals(new SessionNavigator.Progress(2, 3), new SessionNavigator(progressed).progress());
    }

    @Test
    void sessionCompleteWhenAllSetsDone()
    {
        SessionState done = SessionReconciler.completeSet(state(exercise("e1", 1, "s1"), exercise("e2", 2)), "e1", "s1");
        SessionNavigator navigator = new SessionNavigator(done);

        assertTrue(navigator.isSessionComplete());
        assertTrue(navigator.nextIncomplete().isEmpty());
        assertTrue(SessionNavigator.isComplete(exercise("empty", 1)));
    }
}
