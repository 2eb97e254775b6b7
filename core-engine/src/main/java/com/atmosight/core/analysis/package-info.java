/**
 * The climatology pipeline stages and the analyzer that chains them.
 *
 * <ul>
 * <li>{@link com.atmosight.core.analysis.TimeSeriesNormalizer}: raw records
 * to validated series</li>
 * <li>{@link com.atmosight.core.analysis.DayOfYearSelector}: one sample per
 * year for a calendar day</li>
 * <li>{@link com.atmosight.core.analysis.TrendEstimator}: OLS trend over
 * years</li>
 * <li>{@link com.atmosight.core.analysis.ExtremeEventEstimator}: mean + kσ
 * threshold and exceedance probability</li>
 * <li>{@link com.atmosight.core.analysis.DistributionModeler}: parametric
 * fit and percentiles</li>
 * <li>{@link com.atmosight.core.analysis.InsightAggregator}: consistency
 * check and packaging</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.atmosight.core.analysis;
