package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A distance with its unit. The unit defaults to metres.
 *
 * @param value the amount
 * @param unit  the unit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Distance(double value, DistanceUnit unit)
{
    public Distance
    {
        if (unit == null)
        {
            unit = DistanceUnit.METER;
        }
    }

    public double toMeters()
    {
        return value * unit.getMeters();
    }
}
