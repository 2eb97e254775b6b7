package com.atmosight.core.model;

import java.util.Objects;

/**
 * A daily record exactly as the data source delivered it, before any
 * validation.
 *
 * <p>
 * The date is kept as text so that an unparsable date can be reported by the
 * normalizer instead of failing inside the data source. A {@code null} value
 * marks an explicitly missing observation.
 * </p>
 *
 * @since 1.0.0
 */
public final class RawRecord {

    private final String rawDate;
    private final Double rawValue;
    private final Variable variable;

    public RawRecord(String rawDate, Double rawValue, Variable variable) {
        this.rawDate = rawDate;
        this.rawValue = rawValue;
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
    }

    public String getRawDate() {
        return rawDate;
    }

    /** @return the raw value, or {@code null} when the source marked it missing */
    public Double getRawValue() {
        return rawValue;
    }

    public Variable getVariable() {
        return variable;
    }

    @Override
    public String toString() {
        return "RawRecord{" + rawDate + "=" + rawValue + ", " + variable + '}';
    }
}
