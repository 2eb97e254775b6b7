package com.atmosight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Everything the presentation layer needs for one query: the query itself,
 * the samples (for plotting raw points) and the three derived results.
 *
 * <p>
 * Instances are produced by
 * {@link com.atmosight.core.analysis.InsightAggregator}, which guarantees
 * that all parts derive from the same {@link SampleSet}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisResult {

    private final ClimateQuery query;
    private final SampleSet sampleSet;
    private final TrendResult trend;
    private final ExtremeResult extreme;
    private final DistributionResult distribution;

    @JsonCreator
    public AnalysisResult(@JsonProperty("query") ClimateQuery query,
                          @JsonProperty("sampleSet") SampleSet sampleSet,
                          @JsonProperty("trend") TrendResult trend,
                          @JsonProperty("extreme") ExtremeResult extreme,
                          @JsonProperty("distribution") DistributionResult distribution) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.sampleSet = Objects.requireNonNull(sampleSet, "sampleSet must not be null");
        this.trend = Objects.requireNonNull(trend, "trend must not be null");
        this.extreme = Objects.requireNonNull(extreme, "extreme must not be null");
        this.distribution = Objects.requireNonNull(distribution, "distribution must not be null");
    }

    public ClimateQuery getQuery() {
        return query;
    }

    public SampleSet getSampleSet() {
        return sampleSet;
    }

    public TrendResult getTrend() {
        return trend;
    }

    public ExtremeResult getExtreme() {
        return extreme;
    }

    public DistributionResult getDistribution() {
        return distribution;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisResult that))
            return false;
        return query.equals(that.query)
                && sampleSet.equals(that.sampleSet)
                && trend.equals(that.trend)
                && extreme.equals(that.extreme)
                && distribution.equals(that.distribution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, sampleSet, trend, extreme, distribution);
    }

    @Override
    public String toString() {
        return "AnalysisResult{" +
                "query=" + query +
                ", sampleSet=" + sampleSet +
                ", trend=" + trend +
                ", extreme=" + extreme +
                ", distribution=" + distribution +
                '}';
    }
}
