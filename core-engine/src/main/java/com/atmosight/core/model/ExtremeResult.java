package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Variability summary and extreme-event probability of a {@link SampleSet}.
 *
 * <p>
 * {@code stdDev} is the sample standard deviation (n&minus;1 denominator).
 * {@code threshold} is {@code mean + sigmaFactor * stdDev}; a year is
 * extreme when its value is greater than or equal to it.
 * {@code exceedanceProbability} is the empirical share of extreme years and
 * {@code theoreticalExceedanceProbability} is {@code 1 - CDF(threshold)}
 * under the fitted distribution, or {@code null} when no distribution was
 * supplied.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExtremeResult {

    private final double mean;
    private final double stdDev;
    private final double sigmaFactor;
    private final double threshold;
    private final int exceedanceCount;
    private final int sampleSize;
    private final double exceedanceProbability;
    private final Double theoreticalExceedanceProbability;
    private final double minimum;
    private final double maximum;
    private final String sampleFingerprint;

    @JsonCreator
    public ExtremeResult(@JsonProperty("mean") double mean,
                         @JsonProperty("stdDev") double stdDev,
                         @JsonProperty("sigmaFactor") double sigmaFactor,
                         @JsonProperty("threshold") double threshold,
                         @JsonProperty("exceedanceCount") int exceedanceCount,
                         @JsonProperty("sampleSize") int sampleSize,
                         @JsonProperty("exceedanceProbability") double exceedanceProbability,
                         @JsonProperty("theoreticalExceedanceProbability") Double theoreticalExceedanceProbability,
                         @JsonProperty("minimum") double minimum,
                         @JsonProperty("maximum") double maximum,
                         @JsonProperty("sampleFingerprint") String sampleFingerprint) {
        if (exceedanceCount < 0 || exceedanceCount > sampleSize) {
            throw new IllegalArgumentException("exceedanceCount must be in [0, " + sampleSize
                    + "], got: " + exceedanceCount);
        }
        this.mean = mean;
        this.stdDev = stdDev;
        this.sigmaFactor = sigmaFactor;
        this.threshold = threshold;
        this.exceedanceCount = exceedanceCount;
        this.sampleSize = sampleSize;
        this.exceedanceProbability = exceedanceProbability;
        this.theoreticalExceedanceProbability = theoreticalExceedanceProbability;
        this.minimum = minimum;
        this.maximum = maximum;
        this.sampleFingerprint = Objects.requireNonNull(sampleFingerprint, "sampleFingerprint must not be null");
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getSigmaFactor() {
        return sigmaFactor;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getExceedanceCount() {
        return exceedanceCount;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getExceedanceProbability() {
        return exceedanceProbability;
    }

    /** @return the model-based probability, or {@code null} if none was computed */
    public Double getTheoreticalExceedanceProbability() {
        return theoreticalExceedanceProbability;
    }

    @JsonIgnore
    public OptionalDouble theoreticalExceedance() {
        return theoreticalExceedanceProbability == null
                ? OptionalDouble.empty()
                : OptionalDouble.of(theoreticalExceedanceProbability);
    }

    public double getMinimum() {
        return minimum;
    }

    public double getMaximum() {
        return maximum;
    }

    public String getSampleFingerprint() {
        return sampleFingerprint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExtremeResult that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(sigmaFactor, that.sigmaFactor) == 0
                && Double.compare(threshold, that.threshold) == 0
                && exceedanceCount == that.exceedanceCount
                && sampleSize == that.sampleSize
                && Double.compare(exceedanceProbability, that.exceedanceProbability) == 0
                && Objects.equals(theoreticalExceedanceProbability, that.theoreticalExceedanceProbability)
                && Double.compare(minimum, that.minimum) == 0
                && Double.compare(maximum, that.maximum) == 0
                && sampleFingerprint.equals(that.sampleFingerprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev, sigmaFactor, threshold, exceedanceCount, sampleSize,
                exceedanceProbability, theoreticalExceedanceProbability, minimum, maximum, sampleFingerprint);
    }

    @Override
    public String toString() {
        return "ExtremeResult{" +
                "mean=" + mean +
                ", stdDev=" + stdDev +
                ", threshold=" + threshold +
                ", exceedance=" + exceedanceCount + "/" + sampleSize +
                ", theoretical=" + theoreticalExceedanceProbability +
                '}';
    }
}
