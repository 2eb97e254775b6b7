package com.atmosight.core.analysis;

import com.atmosight.core.SyntheticData;
import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.error.DegenerateFitException;
import com.atmosight.core.error.InconsistentResultException;
import com.atmosight.core.model.DistributionFamily;
import com.atmosight.core.model.DistributionResult;
import com.atmosight.core.model.ExtremeResult;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ExtremeEventEstimator}.
 */
class ExtremeEventEstimatorTest {

    private final ExtremeEventEstimator estimator = new ExtremeEventEstimator(2.0);

    @Test
    @DisplayName("Should place the threshold at mean plus two sample standard deviations")
    void shouldComputeThreshold() {
        SampleSet samples = SyntheticData.samples(Variable.TEMPERATURE, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);

        ExtremeResult result = estimator.estimate(samples);

        double sampleStdDev = Math.sqrt(82.5 / 9);
        assertThat(result.getMean()).isCloseTo(5.5, within(1e-12));
        assertThat(result.getStdDev()).isCloseTo(sampleStdDev, within(1e-12));
        assertThat(result.getThreshold()).isCloseTo(result.getMean() + 2 * result.getStdDev(), within(1e-9));
        assertThat(result.getExceedanceCount()).isZero();
        assertThat(result.getMinimum()).isEqualTo(1.0);
        assertThat(result.getMaximum()).isEqualTo(10.0);
        assertThat(result.theoreticalExceedance()).isEmpty();
    }

    @Test
    @DisplayName("Should count the empirical share of years at or above the threshold")
    void shouldCountExceedances() {
        SampleSet samples = SyntheticData.samples(Variable.PRECIPITATION, 0, 0, 0, 0, 0, 0, 0, 0, 0, 10);

        ExtremeResult result = estimator.estimate(samples);

        assertThat(result.getThreshold()).isCloseTo(1 + 2 * Math.sqrt(10), within(1e-9));
        assertThat(result.getExceedanceCount()).isEqualTo(1);
        assertThat(result.getSampleSize()).isEqualTo(10);
        assertThat(result.getExceedanceProbability()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Should take the sigma factor from configuration")
    void shouldUseConfiguredSigmaFactor() {
        AnalysisConfig config = new AnalysisConfig();
        config.setSigmaFactor(1.0);
        SampleSet samples = SyntheticData.samples(Variable.TEMPERATURE, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);

        ExtremeResult result = new ExtremeEventEstimator(config).estimate(samples);

        assertThat(result.getSigmaFactor()).isEqualTo(1.0);
        assertThat(result.getExceedanceCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should add the theoretical tail probability of a fitted distribution")
    void shouldAddTheoreticalProbability() {
        SampleSet samples = SyntheticData.samples(Variable.TEMPERATURE, 11, 14, 9, 13, 12, 10, 15, 8, 12, 11);
        DistributionResult normal = new DistributionModeler(new AnalysisConfig())
                .fitDistribution(samples, DistributionFamily.NORMAL);

        ExtremeResult result = estimator.estimate(samples, normal);

        // 1 - Phi(2)
        assertThat(result.getTheoreticalExceedanceProbability()).isCloseTo(0.022750131948179, within(1e-9));
    }

    @Test
    @DisplayName("Should reject a distribution fitted to other samples")
    void shouldRejectForeignDistribution() {
        SampleSet samples = SyntheticData.samples(Variable.TEMPERATURE, 1, 2, 3, 4, 5);
        SampleSet other = SyntheticData.samples(Variable.TEMPERATURE, 1, 2, 3, 4, 6);
        DistributionResult foreign = new DistributionModeler(new AnalysisConfig()).fitDistribution(other);

        assertThatThrownBy(() -> estimator.estimate(samples, foreign))
                .isInstanceOf(InconsistentResultException.class)
                .hasMessageContaining("different sample set");
    }

    @Test
    @DisplayName("Should refuse zero-variance samples")
    void shouldRejectZeroVariance() {
        SampleSet flat = SyntheticData.samples(Variable.TEMPERATURE, 5, 5, 5, 5, 5);

        assertThatThrownBy(() -> estimator.estimate(flat))
                .isInstanceOf(DegenerateFitException.class)
                .hasMessageContaining("zero variance");
    }

    @Test
    @DisplayName("Should refuse a single sample")
    void shouldRejectSingleSample() {
        assertThatThrownBy(() -> estimator.estimate(SyntheticData.samples(Variable.TEMPERATURE, 5)))
                .isInstanceOf(DegenerateFitException.class);
    }

    @Test
    @DisplayName("Should reject a non-positive sigma factor")
    void shouldRejectInvalidSigmaFactor() {
        assertThatThrownBy(() -> new ExtremeEventEstimator(0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
