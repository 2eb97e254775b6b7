package com.atmosight.core.distribution;

import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.DegenerateFitException;
import com.atmosight.core.error.DistributionFitException;
import com.atmosight.core.model.DistributionFamily;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Map;

/**
 * Mean and n&minus;1 variance shared by the moment-based fitters.
 *
 * <p>
 * Fewer than two values or zero variance leave every family undefined, so
 * both raise {@link DegenerateFitException} rather than a family mismatch.
 * </p>
 */
final class Moments {

    final double mean;
    final double variance;

    private Moments(double mean, double variance) {
        this.mean = mean;
        this.variance = variance;
    }

    static Moments of(double[] values, DistributionFamily family) {
        if (values.length < 2) {
            throw new DegenerateFitException(AnalysisStage.DISTRIBUTION,
                    family + " fit needs at least 2 values, got " + values.length);
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double variance = stats.getVariance();
        if (!(variance > 0)) {
            throw new DegenerateFitException(AnalysisStage.DISTRIBUTION,
                    family + " fit is undefined for zero-variance data (all " + values.length
                            + " values equal " + values[0] + ")");
        }
        return new Moments(stats.getMean(), variance);
    }

    static double require(Map<String, Double> parameters, String name, DistributionFamily family) {
        Double value = parameters.get(name);
        if (value == null || !Double.isFinite(value)) {
            throw new DistributionFitException(AnalysisStage.DISTRIBUTION,
                    family + " parameter '" + name + "' missing or not finite in " + parameters);
        }
        return value;
    }
}
