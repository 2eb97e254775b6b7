package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.MonthDay;
import java.util.Objects;

/**
 * One user question: how does {@code variable} behave at {@code location}
 * on {@code targetDay}, optionally widened by {@code windowDays} either side.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code location}, {@code variable} and
 * {@code targetDay} are required; {@code windowDays} defaults to 0.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClimateQuery {

    /** Widest window that keeps the windows of consecutive years disjoint. */
    public static final int MAX_WINDOW_DAYS = 182;

    private final String locationName;
    private final GeoPoint location;
    private final Variable variable;
    private final MonthDay targetDay;
    private final int windowDays;

    @JsonCreator
    public ClimateQuery(@JsonProperty("locationName") String locationName,
                        @JsonProperty("location") GeoPoint location,
                        @JsonProperty("variable") Variable variable,
                        @JsonProperty("targetDay") MonthDay targetDay,
                        @JsonProperty("windowDays") int windowDays) {
        this.locationName = locationName;
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.targetDay = Objects.requireNonNull(targetDay, "targetDay must not be null");
        if (windowDays < 0 || windowDays > MAX_WINDOW_DAYS) {
            throw new IllegalArgumentException(
                    "windowDays must be in [0, " + MAX_WINDOW_DAYS + "], got: " + windowDays);
        }
        this.windowDays = windowDays;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ClimateQuery}.
     */
    public static class Builder {
        private String locationName;
        private GeoPoint location;
        private Variable variable;
        private MonthDay targetDay;
        private int windowDays;

        public Builder locationName(String locationName) {
            this.locationName = locationName;
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder location(double latitude, double longitude) {
            this.location = new GeoPoint(latitude, longitude);
            return this;
        }

        public Builder variable(Variable variable) {
            this.variable = variable;
            return this;
        }

        public Builder targetDay(MonthDay targetDay) {
            this.targetDay = targetDay;
            return this;
        }

        public Builder targetDay(int month, int day) {
            this.targetDay = MonthDay.of(month, day);
            return this;
        }

        public Builder windowDays(int windowDays) {
            this.windowDays = windowDays;
            return this;
        }

        /**
         * @return a new {@link ClimateQuery}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if {@code windowDays} is out of range
         */
        public ClimateQuery build() {
            return new ClimateQuery(locationName, location, variable, targetDay, windowDays);
        }
    }

    public String getLocationName() {
        return locationName;
    }

    public GeoPoint getLocation() {
        return location;
    }

    public Variable getVariable() {
        return variable;
    }

    public MonthDay getTargetDay() {
        return targetDay;
    }

    public int getWindowDays() {
        return windowDays;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClimateQuery that))
            return false;
        return windowDays == that.windowDays
                && Objects.equals(locationName, that.locationName)
                && location.equals(that.location)
                && variable == that.variable
                && targetDay.equals(that.targetDay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locationName, location, variable, targetDay, windowDays);
    }

    @Override
    public String toString() {
        return "ClimateQuery{" +
                "locationName='" + locationName + '\'' +
                ", location=" + location +
                ", variable=" + variable +
                ", targetDay=" + targetDay +
                ", windowDays=" + windowDays +
                '}';
    }
}
