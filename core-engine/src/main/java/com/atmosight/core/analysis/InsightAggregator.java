package com.atmosight.core.analysis;

import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.InconsistentResultException;
import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.DistributionResult;
import com.atmosight.core.model.ExtremeResult;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.TrendResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Packages the stage outputs into one {@link AnalysisResult}, after checking
 * that they all describe the same {@link SampleSet} and the queried
 * variable. Computes nothing of its own.
 *
 * @since 1.0.0
 */
public class InsightAggregator {

    /**
     * @throws InconsistentResultException if any input was derived from other samples
     */
    public AnalysisResult aggregate(ClimateQuery query, SampleSet sampleSet, TrendResult trend,
                                    ExtremeResult extreme, DistributionResult distribution) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(sampleSet, "sampleSet must not be null");
        Objects.requireNonNull(trend, "trend must not be null");
        Objects.requireNonNull(extreme, "extreme must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");

        List<String> errors = new ArrayList<>();
        if (query.getVariable() != sampleSet.getVariable()) {
            errors.add("query asks for " + query.getVariable() + " but samples are " + sampleSet.getVariable());
        }
        if (!sampleSet.sameSamplesAs(trend.getSampleFingerprint()) || trend.getSampleSize() != sampleSet.size()) {
            errors.add("trend was fitted to other samples");
        }
        if (!sampleSet.sameSamplesAs(extreme.getSampleFingerprint()) || extreme.getSampleSize() != sampleSet.size()) {
            errors.add("extreme estimate was computed from other samples");
        }
        if (!sampleSet.sameSamplesAs(distribution.getSampleFingerprint())) {
            errors.add("distribution was fitted to other samples");
        }

        if (!errors.isEmpty()) {
            throw new InconsistentResultException(AnalysisStage.AGGREGATE,
                    "Inconsistent analysis inputs: " + String.join("; ", errors));
        }
        return new AnalysisResult(query, sampleSet, trend, extreme, distribution);
    }
}
