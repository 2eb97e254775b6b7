package com.atmosight.core.analysis;

import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.distribution.DistributionFitter;
import com.atmosight.core.distribution.DistributionFitters;
import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.DistributionFitException;
import com.atmosight.core.model.DistributionFamily;
import com.atmosight.core.model.DistributionResult;
import com.atmosight.core.model.PercentilePoint;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.Variable;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fits a parametric distribution to a {@link SampleSet} and tabulates its
 * percentiles.
 *
 * <p>
 * The family is either chosen by the caller or resolved from the sample
 * set's variable through {@link AnalysisConfig#familyFor(Variable)}.
 * Parameters are method-of-moments estimates; see
 * {@link com.atmosight.core.distribution.DistributionFitter}.
 * </p>
 *
 * @since 1.0.0
 */
public class DistributionModeler {

    private static final Logger LOG = LoggerFactory.getLogger(DistributionModeler.class);

    private final AnalysisConfig config;
    private final double[] percentiles;

    public DistributionModeler(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.percentiles = config.percentileLevels();
    }

    /**
     * Fit the family configured for the sample set's variable.
     */
    public DistributionResult fitDistribution(SampleSet sampleSet) {
        Objects.requireNonNull(sampleSet, "sampleSet must not be null");
        return fitDistribution(sampleSet, defaultFamily(sampleSet.getVariable()));
    }

    /**
     * @param sampleSet yearly samples
     * @param family    family to fit
     * @return fitted parameters and percentile table
     * @throws DistributionFitException if the family cannot describe the samples
     * @throws com.atmosight.core.error.DegenerateFitException if the samples have zero variance
     */
    public DistributionResult fitDistribution(SampleSet sampleSet, DistributionFamily family) {
        Objects.requireNonNull(sampleSet, "sampleSet must not be null");
        Objects.requireNonNull(family, "family must not be null");

        DistributionFitter fitter = DistributionFitters.forFamily(family);
        Map<String, Double> parameters = fitter.fit(sampleSet.values());
        RealDistribution model = fitter.toDistribution(parameters);

        List<PercentilePoint> table = new ArrayList<>(percentiles.length);
        for (double p : percentiles) {
            try {
                table.add(new PercentilePoint(p, model.inverseCumulativeProbability(p / 100.0)));
            } catch (MathIllegalArgumentException e) {
                throw new DistributionFitException(AnalysisStage.DISTRIBUTION,
                        "Cannot evaluate p" + p + " of fitted " + family + " " + parameters, e);
            }
        }

        DistributionResult result = new DistributionResult(family, DistributionFitter.ESTIMATOR,
                parameters, table, sampleSet.getFingerprint());
        LOG.debug("Fitted {}", result);
        return result;
    }

    /** @return the family used for {@code variable} when the caller names none */
    public DistributionFamily defaultFamily(Variable variable) {
        return config.familyFor(variable);
    }
}
