package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parametric distribution fitted to a {@link SampleSet}, with its
 * percentile table.
 *
 * <p>
 * Parameter names depend on the family: {@code mean}/{@code stdDev} for
 * normal, {@code scale}/{@code shape} (log-space mean and standard
 * deviation) for log-normal, {@code shape}/{@code scale} for gamma.
 * </p>
 *
 * @since 1.0.0
 */
public final class DistributionResult {

    private final DistributionFamily family;
    private final String estimator;
    private final Map<String, Double> parameters;
    private final List<PercentilePoint> percentiles;
    private final String sampleFingerprint;

    @JsonCreator
    public DistributionResult(@JsonProperty("family") DistributionFamily family,
                              @JsonProperty("estimator") String estimator,
                              @JsonProperty("parameters") Map<String, Double> parameters,
                              @JsonProperty("percentiles") List<PercentilePoint> percentiles,
                              @JsonProperty("sampleFingerprint") String sampleFingerprint) {
        this.family = Objects.requireNonNull(family, "family must not be null");
        this.estimator = estimator;
        this.parameters = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(parameters, "parameters must not be null")));
        this.percentiles = List.copyOf(Objects.requireNonNull(percentiles, "percentiles must not be null"));
        this.sampleFingerprint = Objects.requireNonNull(sampleFingerprint, "sampleFingerprint must not be null");
    }

    public DistributionFamily getFamily() {
        return family;
    }

    /** @return name of the parameter estimator, e.g. {@code method-of-moments} */
    public String getEstimator() {
        return estimator;
    }

    /** @return unmodifiable, insertion-ordered parameter map */
    public Map<String, Double> getParameters() {
        return parameters;
    }

    public List<PercentilePoint> getPercentiles() {
        return percentiles;
    }

    public String getSampleFingerprint() {
        return sampleFingerprint;
    }

    /**
     * @throws IllegalArgumentException if the family has no such parameter
     */
    public double parameter(String name) {
        Double value = parameters.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No parameter '" + name + "' for family " + family
                    + "; available: " + parameters.keySet());
        }
        return value;
    }

    /**
     * Look up a percentile from the table.
     *
     * @param percentile e.g. {@code 90}
     * @return the tabulated value
     * @throws IllegalArgumentException if the table has no such row
     */
    public double percentile(double percentile) {
        for (PercentilePoint point : percentiles) {
            if (Double.compare(point.getPercentile(), percentile) == 0) {
                return point.getValue();
            }
        }
        throw new IllegalArgumentException("Percentile " + percentile + " not in table " + percentiles);
    }

    /**
     * Uncertainty band between two tabulated percentiles, e.g. p10..p90.
     *
     * @return {@code [lowerValue, upperValue]}
     */
    public double[] band(double lowerPercentile, double upperPercentile) {
        if (lowerPercentile >= upperPercentile) {
            throw new IllegalArgumentException("lower percentile must be below upper percentile");
        }
        return new double[] { percentile(lowerPercentile), percentile(upperPercentile) };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DistributionResult that))
            return false;
        return family == that.family
                && Objects.equals(estimator, that.estimator)
                && parameters.equals(that.parameters)
                && percentiles.equals(that.percentiles)
                && sampleFingerprint.equals(that.sampleFingerprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, estimator, parameters, percentiles, sampleFingerprint);
    }

    @Override
    public String toString() {
        return "DistributionResult{" +
                "family=" + family +
                ", parameters=" + parameters +
                ", percentiles=" + percentiles +
                '}';
    }
}
