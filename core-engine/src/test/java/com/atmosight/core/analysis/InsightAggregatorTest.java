package com.atmosight.core.analysis;

import com.atmosight.core.SyntheticData;
import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.InconsistentResultException;
import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.DistributionResult;
import com.atmosight.core.model.ExtremeResult;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.TrendResult;
import com.atmosight.core.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InsightAggregator}.
 */
class InsightAggregatorTest {

    private static final SampleSet SAMPLES =
            SyntheticData.samples(Variable.TEMPERATURE, 11, 14, 9, 13, 12, 10, 15, 8, 12, 11);
    private static final SampleSet OTHER =
            SyntheticData.samples(Variable.TEMPERATURE, 11, 14, 9, 13, 12, 10, 15, 8, 12, 12);

    private final InsightAggregator aggregator = new InsightAggregator();
    private final DistributionModeler modeler = new DistributionModeler(new AnalysisConfig());
    private final ExtremeEventEstimator extremes = new ExtremeEventEstimator(2.0);
    private final TrendEstimator trends = new TrendEstimator();

    @Test
    @DisplayName("Should bundle results derived from one sample set")
    void shouldAggregateConsistentResults() {
        DistributionResult distribution = modeler.fitDistribution(SAMPLES);
        TrendResult trend = trends.fit(SAMPLES);
        ExtremeResult extreme = extremes.estimate(SAMPLES, distribution);

        AnalysisResult result = aggregator.aggregate(query(Variable.TEMPERATURE), SAMPLES, trend, extreme, distribution);

        assertThat(result.getSampleSet()).isSameAs(SAMPLES);
        assertThat(result.getTrend()).isSameAs(trend);
        assertThat(result.getExtreme()).isSameAs(extreme);
        assertThat(result.getDistribution()).isSameAs(distribution);
    }

    @Test
    @DisplayName("Should reject a trend fitted to other samples")
    void shouldRejectForeignTrend() {
        DistributionResult distribution = modeler.fitDistribution(SAMPLES);
        ExtremeResult extreme = extremes.estimate(SAMPLES, distribution);
        TrendResult foreign = trends.fit(OTHER);

        assertThatThrownBy(() -> aggregator.aggregate(query(Variable.TEMPERATURE), SAMPLES, foreign, extreme, distribution))
                .isInstanceOf(InconsistentResultException.class)
                .hasMessageContaining("trend was fitted to other samples")
                .satisfies(e -> assertThat(((InconsistentResultException) e).getStage())
                        .isEqualTo(AnalysisStage.AGGREGATE));
    }

    @Test
    @DisplayName("Should list every inconsistency at once")
    void shouldCollectAllInconsistencies() {
        DistributionResult distribution = modeler.fitDistribution(OTHER);
        ExtremeResult extreme = extremes.estimate(OTHER);
        TrendResult trend = trends.fit(SAMPLES);

        assertThatThrownBy(() -> aggregator.aggregate(query(Variable.PRECIPITATION), SAMPLES, trend, extreme, distribution))
                .isInstanceOf(InconsistentResultException.class)
                .hasMessageContaining("query asks for PRECIPITATION")
                .hasMessageContaining("extreme estimate")
                .hasMessageContaining("distribution was fitted");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ClimateQuery query(Variable variable) {
        return ClimateQuery.builder()
                .locationName("Faisalabad")
                .location(31.42, 73.08)
                .variable(variable)
                .targetDay(7, 15)
                .build();
    }
}
