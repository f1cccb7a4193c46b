package org.abstractica.sessionsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A weight with its unit.
 *
 * @param value the amount
 * @param unit  the unit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Weight(double value, WeightUnit unit)
{
    public static final double KILOGRAMS_PER_POUND = 0.453592;

    public Weight
    {
        Objects.requireNonNull(unit, "unit");
    }

    public double toKilograms()
    {
        return unit == WeightUnit.POUND ? value * KILOGRAMS_PER_POUND : value;
    }

    public double toPounds()
    {
        return unit == WeightUnit.KILOGRAM ? value / KILOGRAMS_PER_POUND : value;
    }
}
