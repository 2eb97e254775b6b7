/**
 * Moment-based fitters for the supported distribution families.
 *
 * <p>
 * All fitters implement
 * {@link com.atmosight.core.distribution.DistributionFitter} and are
 * obtained through
 * {@link com.atmosight.core.distribution.DistributionFitters}. They return
 * Commons Math {@code RealDistribution} instances for percentile and
 * exceedance computations.
 * </p>
 *
 * @since 1.0.0
 */
package com.atmosight.core.distribution;
