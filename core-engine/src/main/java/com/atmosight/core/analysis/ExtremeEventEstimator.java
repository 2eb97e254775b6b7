package com.atmosight.core.analysis;

import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.distribution.DistributionFitters;
import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.DegenerateFitException;
import com.atmosight.core.error.InconsistentResultException;
import com.atmosight.core.model.DistributionResult;
import com.atmosight.core.model.ExtremeResult;
import com.atmosight.core.model.SampleSet;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Mean-plus-k-sigma extreme threshold and its exceedance probability.
 *
 * <p>
 * The standard deviation is the sample estimate with the n&minus;1
 * denominator. A year is extreme when its value is greater than or equal
 * to {@code mean + sigmaFactor * stdDev}; the empirical probability is the
 * share of such years. When a fitted distribution of the same samples is
 * supplied, {@code 1 - CDF(threshold)} is reported alongside it.
 * </p>
 *
 * @since 1.0.0
 */
public class ExtremeEventEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ExtremeEventEstimator.class);

    private final double sigmaFactor;

    public ExtremeEventEstimator(AnalysisConfig config) {
        this(Objects.requireNonNull(config, "AnalysisConfig must not be null").getSigmaFactor());
    }

    /**
     * @param sigmaFactor standard deviations above the mean marking an extreme
     * @throws IllegalArgumentException if {@code sigmaFactor} is not positive
     */
    public ExtremeEventEstimator(double sigmaFactor) {
        if (!(sigmaFactor > 0) || Double.isInfinite(sigmaFactor)) {
            throw new IllegalArgumentException("sigmaFactor must be a positive number, got: " + sigmaFactor);
        }
        this.sigmaFactor = sigmaFactor;
    }

    /**
     * Empirical estimate only.
     *
     * @throws DegenerateFitException if the samples have zero variance
     */
    public ExtremeResult estimate(SampleSet sampleSet) {
        return estimate(sampleSet, null);
    }

    /**
     * @param sampleSet    yearly samples
     * @param distribution distribution fitted to the same samples, or {@code null}
     * @return threshold and exceedance probabilities
     * @throws DegenerateFitException       if the samples have zero variance
     * @throws InconsistentResultException  if {@code distribution} was fitted to other samples
     */
    public ExtremeResult estimate(SampleSet sampleSet, DistributionResult distribution) {
        Objects.requireNonNull(sampleSet, "sampleSet must not be null");
        if (distribution != null && !sampleSet.sameSamplesAs(distribution.getSampleFingerprint())) {
            throw new InconsistentResultException(AnalysisStage.EXTREME,
                    "Distribution was fitted to a different sample set ("
                            + distribution.getSampleFingerprint() + " vs " + sampleSet.getFingerprint() + ")");
        }

        double[] values = sampleSet.values();
        if (values.length < 2) {
            throw new DegenerateFitException(AnalysisStage.EXTREME,
                    "Standard deviation needs at least 2 samples, got " + values.length);
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double mean = stats.getMean();
        double stdDev = stats.getStandardDeviation();
        if (!(stdDev > 0)) {
            throw new DegenerateFitException(AnalysisStage.EXTREME,
                    "All " + values.length + " samples equal " + values[0]
                            + "; exceedance probability is undefined for zero variance");
        }

        double threshold = mean + sigmaFactor * stdDev;
        int exceedances = 0;
        for (double v : values) {
            if (v >= threshold) {
                exceedances++;
            }
        }

        Double theoretical = null;
        if (distribution != null) {
            RealDistribution model = DistributionFitters.forFamily(distribution.getFamily())
                    .toDistribution(distribution.getParameters());
            theoretical = 1.0 - model.cumulativeProbability(threshold);
        }

        ExtremeResult result = new ExtremeResult(mean, stdDev, sigmaFactor, threshold,
                exceedances, values.length, (double) exceedances / values.length, theoretical,
                stats.getMin(), stats.getMax(), sampleSet.getFingerprint());
        LOG.debug("Estimated {}", result);
        return result;
    }
}
