package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * The representative value of one year for the target calendar day.
 *
 * @since 1.0.0
 */
public final class ClimatologicalSample {

    private final int year;
    private final double value;

    /** Number of valid daily values averaged into {@link #value}. */
    private final int observationCount;

    @JsonCreator
    public ClimatologicalSample(@JsonProperty("year") int year,
                                @JsonProperty("value") double value,
                                @JsonProperty("observationCount") int observationCount) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Sample value must be finite for year " + year + ", got: " + value);
        }
        if (observationCount < 1) {
            throw new IllegalArgumentException("observationCount must be >= 1, got: " + observationCount);
        }
        this.year = year;
        this.value = value;
        this.observationCount = observationCount;
    }

    public static ClimatologicalSample of(int year, double value) {
        return new ClimatologicalSample(year, value, 1);
    }

    public int getYear() {
        return year;
    }

    public double getValue() {
        return value;
    }

    public int getObservationCount() {
        return observationCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClimatologicalSample that))
            return false;
        return year == that.year
                && Double.compare(value, that.value) == 0
                && observationCount == that.observationCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, value, observationCount);
    }

    @Override
    public String toString() {
        return year + "=" + value;
    }
}
