package com.atmosight.core.analysis;

import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.ClimatologyException;
import com.atmosight.core.error.InconsistentResultException;
import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.DistributionFamily;
import com.atmosight.core.model.DistributionResult;
import com.atmosight.core.model.ExtremeResult;
import com.atmosight.core.model.RawRecord;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.TimeSeries;
import com.atmosight.core.model.TrendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the full pipeline for one {@link ClimateQuery}.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   raw records
 *     → TimeSeriesNormalizer
 *     → DayOfYearSelector
 *     → DistributionModeler, TrendEstimator, ExtremeEventEstimator (same SampleSet)
 *     → InsightAggregator
 *     → AnalysisResult
 * </pre>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The analyzer and its stages hold only immutable configuration, so a single
 * instance may answer any number of queries concurrently.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * Stage failures propagate as {@link ClimatologyException}s carrying the
 * stage and the query. Nothing is retried or swallowed.
 * </p>
 *
 * @since 1.0.0
 */
public class ClimatologyAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ClimatologyAnalyzer.class);

    private final TimeSeriesNormalizer normalizer;
    private final DayOfYearSelector selector;
    private final TrendEstimator trendEstimator;
    private final ExtremeEventEstimator extremeEstimator;
    private final DistributionModeler distributionModeler;
    private final InsightAggregator aggregator;

    public ClimatologyAnalyzer(AnalysisConfig config) {
        this(new TimeSeriesNormalizer(config),
                new DayOfYearSelector(config),
                new TrendEstimator(),
                new ExtremeEventEstimator(config),
                new DistributionModeler(config),
                new InsightAggregator());
    }

    public ClimatologyAnalyzer(TimeSeriesNormalizer normalizer,
                               DayOfYearSelector selector,
                               TrendEstimator trendEstimator,
                               ExtremeEventEstimator extremeEstimator,
                               DistributionModeler distributionModeler,
                               InsightAggregator aggregator) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.trendEstimator = Objects.requireNonNull(trendEstimator, "trendEstimator must not be null");
        this.extremeEstimator = Objects.requireNonNull(extremeEstimator, "extremeEstimator must not be null");
        this.distributionModeler = Objects.requireNonNull(distributionModeler, "distributionModeler must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    }

    /**
     * Normalize {@code records} and analyse them.
     */
    public AnalysisResult analyze(ClimateQuery query, List<RawRecord> records, double missingSentinel) {
        Objects.requireNonNull(query, "query must not be null");
        TimeSeries series;
        try {
            series = normalizer.normalize(records, missingSentinel);
        } catch (ClimatologyException e) {
            throw e.withQuery(query);
        }
        return analyze(query, series);
    }

    /**
     * Analyse an already normalized series with the variable's default family.
     */
    public AnalysisResult analyze(ClimateQuery query, TimeSeries series) {
        Objects.requireNonNull(query, "query must not be null");
        return analyze(query, series, distributionModeler.defaultFamily(query.getVariable()));
    }

    /**
     * @param query  the question being answered
     * @param series normalized series of {@code query.getVariable()}
     * @param family distribution family to fit
     * @return the aggregated result
     * @throws ClimatologyException if any stage fails; the query is attached
     */
    public AnalysisResult analyze(ClimateQuery query, TimeSeries series, DistributionFamily family) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(family, "family must not be null");

        try {
            if (series.getVariable() != query.getVariable()) {
                throw new InconsistentResultException(AnalysisStage.SELECT,
                        "Series holds " + series.getVariable() + " but the query asks for " + query.getVariable());
            }

            SampleSet samples = selector.select(series, query.getTargetDay(), query.getWindowDays());
            DistributionResult distribution = distributionModeler.fitDistribution(samples, family);
            TrendResult trend = trendEstimator.fit(samples);
            ExtremeResult extreme = extremeEstimator.estimate(samples, distribution);

            AnalysisResult result = aggregator.aggregate(query, samples, trend, extreme, distribution);
            LOG.info("Analysed {} {} on {} over {} years: slope={} {}, P(extreme)={}",
                    query.getLocationName(), query.getVariable(), query.getTargetDay(), samples.size(),
                    trend.getSlope(), trend.getUnitsPerYear(), extreme.getExceedanceProbability());
            return result;
        } catch (ClimatologyException e) {
            LOG.debug("Analysis failed at stage {}: {}", e.getStage(), e.getMessage());
            throw e.withQuery(query);
        }
    }
}
