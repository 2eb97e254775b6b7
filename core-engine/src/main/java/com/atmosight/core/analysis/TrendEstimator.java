package com.atmosight.core.analysis;

import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.DegenerateFitException;
import com.atmosight.core.model.ClimatologicalSample;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.TrendResult;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordinary least-squares trend of sample value against calendar year.
 *
 * <p>
 * The year itself is the regressor, not the sample index, so gaps in the
 * record do not distort the slope. Samples are fed in year order (the
 * {@link SampleSet} invariant), which makes the result bit-for-bit
 * reproducible for equal inputs.
 * </p>
 *
 * <p>
 * {@code rSquared} is reported as 1.0 when every sample has the same value:
 * the flat line then fits exactly.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(TrendEstimator.class);

    /**
     * @param sampleSet yearly samples
     * @return the fitted trend
     * @throws DegenerateFitException if fewer than two distinct years are present
     */
    public TrendResult fit(SampleSet sampleSet) {
        Objects.requireNonNull(sampleSet, "sampleSet must not be null");
        if (sampleSet.size() < 2) {
            throw new DegenerateFitException(AnalysisStage.TREND,
                    "Trend needs at least 2 distinct years, got " + sampleSet.size());
        }

        SimpleRegression regression = new SimpleRegression();
        for (ClimatologicalSample sample : sampleSet.getSamples()) {
            regression.addData(sample.getYear(), sample.getValue());
        }

        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
            throw new DegenerateFitException(AnalysisStage.TREND,
                    "Regression over years " + sampleSet.firstYear() + ".." + sampleSet.lastYear()
                            + " has no unique solution");
        }

        int n = sampleSet.size();
        double sse = regression.getSumSquaredErrors();
        double rSquared = regression.getTotalSumSquares() > 0 ? regression.getRSquare() : 1.0;
        double rmse = Math.sqrt(sse / n);

        List<Double> fitted = new ArrayList<>(n);
        for (ClimatologicalSample sample : sampleSet.getSamples()) {
            fitted.add(regression.predict(sample.getYear()));
        }

        TrendResult result = new TrendResult(slope, intercept,
                sampleSet.getVariable().getUnit() + "/year",
                rSquared, rmse, fitted, sampleSet.getFingerprint());
        LOG.debug("Fitted {}", result);
        return result;
    }
}
