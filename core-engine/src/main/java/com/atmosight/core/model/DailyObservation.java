package com.atmosight.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A validated daily observation: either a finite value or an explicit
 * missing marker. Missing values are never represented as zero.
 *
 * @since 1.0.0
 */
public final class DailyObservation {

    private final LocalDate date;
    private final Double value;

    private DailyObservation(LocalDate date, Double value) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not finite
     */
    public static DailyObservation of(LocalDate date, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Observation value must be finite, got: " + value);
        }
        return new DailyObservation(date, value);
    }

    public static DailyObservation missing(LocalDate date) {
        return new DailyObservation(date, null);
    }

    public LocalDate getDate() {
        return date;
    }

    public boolean isMissing() {
        return value == null;
    }

    /**
     * @return the observed value
     * @throws IllegalStateException if this observation is missing
     */
    public double getValue() {
        if (value == null) {
            throw new IllegalStateException("Observation on " + date + " is missing");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DailyObservation that))
            return false;
        return date.equals(that.date) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, value);
    }

    @Override
    public String toString() {
        return date + "=" + (value == null ? "missing" : value);
    }
}
