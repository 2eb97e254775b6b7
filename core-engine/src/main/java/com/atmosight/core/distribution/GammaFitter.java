package com.atmosight.core.distribution;

import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.DistributionFitException;
import com.atmosight.core.model.DistributionFamily;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gamma fit by the method of moments: {@code shape = m² / s²},
 * {@code scale = s² / m}.
 *
 * <p>
 * Values must be non-negative with a positive mean, which admits dry days
 * in a rainfall record.
 * </p>
 */
public class GammaFitter implements DistributionFitter {

    @Override
    public DistributionFamily family() {
        return DistributionFamily.GAMMA;
    }

    @Override
    public Map<String, Double> fit(double[] values) {
        for (double v : values) {
            if (v < 0) {
                throw new DistributionFitException(AnalysisStage.DISTRIBUTION,
                        "GAMMA requires non-negative values but found " + v + "; choose NORMAL for signed data");
            }
        }
        Moments moments = Moments.of(values, family());
        if (!(moments.mean > 0)) {
            throw new DistributionFitException(AnalysisStage.DISTRIBUTION,
                    "GAMMA requires a positive mean, got " + moments.mean + "; choose NORMAL instead");
        }

        Map<String, Double> params = new LinkedHashMap<>();
        params.put("shape", moments.mean * moments.mean / moments.variance);
        params.put("scale", moments.variance / moments.mean);
        return params;
    }

    @Override
    public RealDistribution toDistribution(Map<String, Double> parameters) {
        double shape = Moments.require(parameters, "shape", family());
        double scale = Moments.require(parameters, "scale", family());
        try {
            return new GammaDistribution(shape, scale);
        } catch (MathIllegalArgumentException e) {
            throw new DistributionFitException(AnalysisStage.DISTRIBUTION,
                    "Invalid gamma parameters " + parameters + ": " + e.getMessage(), e);
        }
    }
}
