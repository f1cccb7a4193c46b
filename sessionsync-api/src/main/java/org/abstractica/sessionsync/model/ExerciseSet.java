package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * One set of an exercise.
 *
 * @param id       unique set id
 * @param order    display order, 1-based
 * @param type     kind of set
 * @param complete whether the set is done
 * @param metrics  recorded values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExerciseSet(String id, int order, SetType type, boolean complete, SetMetrics metrics)
{
    public ExerciseSet
    {
        Objects.requireNonNull(id, "id");
        if (type == null)
        {
            type = SetType.WORKING;
        }
        if (metrics == null)
        {
            metrics = SetMetrics.EMPTY;
        }
    }

    public ExerciseSet withOrder(int newOrder)
    {
        return new ExerciseSet(id, newOrder, type, complete, metrics);
    }

    public ExerciseSet withType(SetType newType)
    {
        return new ExerciseSet(id, order, newType, complete, metrics);
    }

    public ExerciseSet withComplete(boolean newComplete)
    {
        return new ExerciseSet(id, order, type, newComplete, metrics);
    }

    public ExerciseSet withMetrics(SetMetrics newMetrics)
    {
        return new ExerciseSet(id, order, type, complete, newMetrics);
    }
}
