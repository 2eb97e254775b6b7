package com.atmosight.core.distribution;

import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.DistributionFitException;
import com.atmosight.core.model.DistributionFamily;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Log-normal fit by matching the sample mean {@code m} and variance
 * {@code s²}:
 *
 * <pre>
 * shape² = ln(1 + s² / m²)
 * scale  = ln(m) - shape² / 2
 * </pre>
 *
 * <p>
 * {@code scale} and {@code shape} are the mean and standard deviation of
 * the underlying normal, as in Commons Math. Every value must be strictly
 * positive.
 * </p>
 */
public class LogNormalFitter implements DistributionFitter {

    @Override
    public DistributionFamily family() {
        return DistributionFamily.LOG_NORMAL;
    }

    @Override
    public Map<String, Double> fit(double[] values) {
        for (double v : values) {
            if (!(v > 0)) {
                throw new DistributionFitException(AnalysisStage.DISTRIBUTION,
                        "LOG_NORMAL requires strictly positive values but found " + v
                                + "; choose GAMMA for data containing zeros or NORMAL for signed data");
            }
        }
        Moments moments = Moments.of(values, family());
        double shapeSquared = Math.log1p(moments.variance / (moments.mean * moments.mean));

        Map<String, Double> params = new LinkedHashMap<>();
        params.put("scale", Math.log(moments.mean) - shapeSquared / 2);
        params.put("shape", Math.sqrt(shapeSquared));
        return params;
    }

    @Override
    public RealDistribution toDistribution(Map<String, Double> parameters) {
        double scale = Moments.require(parameters, "scale", family());
        double shape = Moments.require(parameters, "shape", family());
        try {
            return new LogNormalDistribution(scale, shape);
        } catch (MathIllegalArgumentException e) {
            throw new DistributionFitException(AnalysisStage.DISTRIBUTION,
                    "Invalid log-normal parameters " + parameters + ": " + e.getMessage(), e);
        }
    }
}
