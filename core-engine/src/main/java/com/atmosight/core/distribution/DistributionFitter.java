package com.atmosight.core.distribution;

import com.atmosight.core.model.DistributionFamily;
import org.apache.commons.math3.distribution.RealDistribution;

import java.util.Map;

/**
 * Contract for fitting one {@link DistributionFamily} to sample values.
 *
 * <p>
 * Implementations are stateless and thread-safe. Every implementation uses
 * the method of moments with the n&minus;1 sample variance, so the fitted
 * spread always agrees with the standard deviation reported by the extreme
 * event estimator.
 * </p>
 */
public interface DistributionFitter {

    /** Name of the estimator, recorded in every fitted result. */
    String ESTIMATOR = "method-of-moments";

    DistributionFamily family();

    /**
     * Estimate the family's parameters.
     *
     * @param values at least two sample values
     * @return insertion-ordered parameter map
     * @throws com.atmosight.core.error.DistributionFitException if the values
     *         fall outside the family's domain
     * @throws com.atmosight.core.error.DegenerateFitException if there are
     *         fewer than two values or they have zero variance
     */
    Map<String, Double> fit(double[] values);

    /**
     * Instantiate the distribution described by {@code parameters}.
     *
     * @throws com.atmosight.core.error.DistributionFitException if the
     *         parameters are missing or out of range
     */
    RealDistribution toDistribution(Map<String, Double> parameters);
}
