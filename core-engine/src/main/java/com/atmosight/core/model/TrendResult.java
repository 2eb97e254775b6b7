package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Least-squares line of sample value against calendar year.
 *
 * <p>
 * {@code slope} is expressed in {@link #getUnitsPerYear() units per year}.
 * {@code fittedValues} are aligned with the samples of the originating
 * {@link SampleSet}, whose fingerprint is kept in {@code sampleFingerprint}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(value = { "direction", "sampleSize" }, allowGetters = true)
public final class TrendResult {

    private final double slope;
    private final double intercept;
    private final String unitsPerYear;
    private final double rSquared;
    private final double rmse;
    private final List<Double> fittedValues;
    private final String sampleFingerprint;

    @JsonCreator
    public TrendResult(@JsonProperty("slope") double slope,
                       @JsonProperty("intercept") double intercept,
                       @JsonProperty("unitsPerYear") String unitsPerYear,
                       @JsonProperty("rSquared") double rSquared,
                       @JsonProperty("rmse") double rmse,
                       @JsonProperty("fittedValues") List<Double> fittedValues,
                       @JsonProperty("sampleFingerprint") String sampleFingerprint) {
        this.slope = slope;
        this.intercept = intercept;
        this.unitsPerYear = unitsPerYear;
        this.rSquared = rSquared;
        this.rmse = rmse;
        this.fittedValues = List.copyOf(Objects.requireNonNull(fittedValues, "fittedValues must not be null"));
        this.sampleFingerprint = Objects.requireNonNull(sampleFingerprint, "sampleFingerprint must not be null");
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    /** @return unit of the slope, e.g. {@code °C/year} */
    public String getUnitsPerYear() {
        return unitsPerYear;
    }

    /** @return coefficient of determination of the fit */
    @JsonProperty("rSquared")
    public double getRSquared() {
        return rSquared;
    }

    /** @return root-mean-square residual, {@code sqrt(SSE / n)} */
    public double getRmse() {
        return rmse;
    }

    public List<Double> getFittedValues() {
        return fittedValues;
    }

    public String getSampleFingerprint() {
        return sampleFingerprint;
    }

    public int getSampleSize() {
        return fittedValues.size();
    }

    public TrendDirection getDirection() {
        return TrendDirection.ofSlope(slope);
    }

    /** @return the fitted value for {@code year} */
    public double predict(int year) {
        return intercept + slope * year;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendResult that))
            return false;
        return Double.compare(slope, that.slope) == 0
                && Double.compare(intercept, that.intercept) == 0
                && Double.compare(rSquared, that.rSquared) == 0
                && Double.compare(rmse, that.rmse) == 0
                && Objects.equals(unitsPerYear, that.unitsPerYear)
                && fittedValues.equals(that.fittedValues)
                && sampleFingerprint.equals(that.sampleFingerprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slope, intercept, unitsPerYear, rSquared, rmse, fittedValues, sampleFingerprint);
    }

    @Override
    public String toString() {
        return "TrendResult{" +
                "slope=" + slope +
                ", intercept=" + intercept +
                ", unitsPerYear='" + unitsPerYear + '\'' +
                ", rSquared=" + rSquared +
                ", rmse=" + rmse +
                '}';
    }
}
