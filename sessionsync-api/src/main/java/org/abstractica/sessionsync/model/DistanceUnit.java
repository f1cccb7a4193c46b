package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DistanceUnit
{
    @JsonProperty("m")
    METER(1.0),

    @JsonProperty("km")
    KILOMETER(1_000.0),

    @JsonProperty("mi")
    MILE(1_609.34),

    @JsonProperty("yd")
    YARD(0.9144);

    private final double meters;

    DistanceUnit(double meters)
    {
        this.meters = meters;
    }

    /**
     * Returns the length of one unit in metres.
     *
     * @return metres per unit
     */
    public double getMeters()
    {
        return meters;
    }
}
