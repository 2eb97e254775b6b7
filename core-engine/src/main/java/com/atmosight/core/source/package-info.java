/**
 * Boundary to the external data-fetch collaborator.
 *
 * <p>
 * {@link com.atmosight.core.source.ClimateDataSource} is implemented outside
 * the core; {@link com.atmosight.core.source.SeriesProvider} turns its raw
 * responses into cached, normalized series.
 * </p>
 *
 * @since 1.0.0
 */
package com.atmosight.core.source;
