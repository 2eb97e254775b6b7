/**
 * Immutable data model of the climatology pipeline.
 *
 * <p>
 * Raw input ({@link com.atmosight.core.model.RawRecord}) is validated into a
 * {@link com.atmosight.core.model.TimeSeries}, reduced to one
 * {@link com.atmosight.core.model.ClimatologicalSample} per year in a
 * {@link com.atmosight.core.model.SampleSet}, and summarised by
 * {@link com.atmosight.core.model.TrendResult},
 * {@link com.atmosight.core.model.ExtremeResult} and
 * {@link com.atmosight.core.model.DistributionResult}, which
 * {@link com.atmosight.core.model.AnalysisResult} packages together.
 * </p>
 *
 * <p>
 * Result types carry Jackson creator annotations so a presentation layer can
 * serialize and restore them without losing numeric precision.
 * </p>
 *
 * @since 1.0.0
 */
package com.atmosight.core.model;
