package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Which metrics an exercise records.
 */
public enum ExerciseType
{
    @JsonProperty("weight_reps")
    WEIGHT_REPS(true, true, false, false),

    @JsonProperty("weight_time")
    WEIGHT_TIME(false, true, false, true),

    @JsonProperty("distance_time")
    DISTANCE_TIME(false, false, true, true),

    @JsonProperty("reps")
    REPS(true, false, false, false),

    @JsonProperty("time")
    TIME(false, false, false, true),

    @JsonProperty("distance")
    DISTANCE(false, false, true, false);

    private final boolean reps;
    private final boolean weight;
    private final boolean distance;
    private final boolean duration;

    ExerciseType(boolean reps, boolean weight, boolean distance, boolean duration)
    {
        this.reps = reps;
        this.weight = weight;
        this.distance = distance;
        this.duration = duration;
    }

    public boolean recordsReps()
    {
        return reps;
    }

    public boolean recordsWeight()
    {
        return weight;
    }

    public boolean recordsDistance()
    {
        return distance;
    }

    public boolean recordsDuration()
    {
        return duration;
    }
}
