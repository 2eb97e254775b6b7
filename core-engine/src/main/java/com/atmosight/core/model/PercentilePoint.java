package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One row of a percentile table: the value below which {@code percentile}
 * percent of the fitted distribution lies.
 *
 * @since 1.0.0
 */
public final class PercentilePoint {

    private final double percentile;
    private final double value;

    @JsonCreator
    public PercentilePoint(@JsonProperty("percentile") double percentile,
                           @JsonProperty("value") double value) {
        if (!(percentile > 0 && percentile < 100)) {
            throw new IllegalArgumentException("percentile must be in (0, 100), got: " + percentile);
        }
        this.percentile = percentile;
        this.value = value;
    }

    public double getPercentile() {
        return percentile;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PercentilePoint that))
            return false;
        return Double.compare(percentile, that.percentile) == 0 && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(percentile, value);
    }

    @Override
    public String toString() {
        return "p" + percentile + "=" + value;
    }
}
