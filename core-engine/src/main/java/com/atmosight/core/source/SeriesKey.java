package com.atmosight.core.source;

import com.atmosight.core.model.GeoPoint;
import com.atmosight.core.model.Variable;

import java.util.Objects;

/**
 * Identifies one fetched daily series: location, variable and the inclusive
 * range of calendar years requested.
 *
 * @since 1.0.0
 */
public final class SeriesKey {

    private final GeoPoint location;
    private final Variable variable;
    private final int startYear;
    private final int endYear;

    public SeriesKey(GeoPoint location, Variable variable, int startYear, int endYear) {
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        if (startYear > endYear) {
            throw new IllegalArgumentException("startYear " + startYear + " is after endYear " + endYear);
        }
        this.startYear = startYear;
        this.endYear = endYear;
    }

    public GeoPoint getLocation() {
        return location;
    }

    public Variable getVariable() {
        return variable;
    }

    public int getStartYear() {
        return startYear;
    }

    public int getEndYear() {
        return endYear;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return startYear == that.startYear
                && endYear == that.endYear
                && location.equals(that.location)
                && variable == that.variable;
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, variable, startYear, endYear);
    }

    @Override
    public String toString() {
        return variable.getCode() + "@" + location + "[" + startYear + ".." + endYear + "]";
    }
}
