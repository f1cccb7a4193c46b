package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Recorded values for one set.
 *
 * <p>Every field is independently optional; which ones apply depends on the
 * exercise's {@link ExerciseType}.</p>
 *
 * @param reps     repetitions, may be null
 * @param weight   load, may be null
 * @param distance distance covered, may be null
 * @param duration time under work, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SetMetrics(Integer reps, Weight weight, Distance distance, ElapsedTime duration)
{
    public static final SetMetrics EMPTY = new SetMetrics(null, null, null, null);

    /**
     * Returns true if no value is recorded.
     *
     * @return true when every field is null
     */
    public boolean hasNoValues()
    {
        return reps == null && weight == null && distance == null && duration == null;
    }
}
