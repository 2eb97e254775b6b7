package com.atmosight.core.distribution;

import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.DistributionFitException;
import com.atmosight.core.model.DistributionFamily;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normal fit: {@code mean} and {@code stdDev} are the sample moments.
 */
public class NormalFitter implements DistributionFitter {

    @Override
    public DistributionFamily family() {
        return DistributionFamily.NORMAL;
    }

    @Override
    public Map<String, Double> fit(double[] values) {
        Moments moments = Moments.of(values, family());
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("mean", moments.mean);
        params.put("stdDev", Math.sqrt(moments.variance));
        return params;
    }

    @Override
    public RealDistribution toDistribution(Map<String, Double> parameters) {
        double mean = Moments.require(parameters, "mean", family());
        double stdDev = Moments.require(parameters, "stdDev", family());
        try {
            return new NormalDistribution(mean, stdDev);
        } catch (MathIllegalArgumentException e) {
            throw new DistributionFitException(AnalysisStage.DISTRIBUTION,
                    "Invalid normal parameters " + parameters + ": " + e.getMessage(), e);
        }
    }
}
