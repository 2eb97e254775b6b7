package com.atmosight.core.source;

import com.atmosight.core.analysis.TimeSeriesNormalizer;
import com.atmosight.core.cache.SeriesCache;
import com.atmosight.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Fetches, normalizes and caches series.
 *
 * <p>
 * Only successfully normalized series are cached; a fetch or validation
 * failure propagates to the caller and leaves the cache untouched.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesProvider {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesProvider.class);

    private final ClimateDataSource dataSource;
    private final TimeSeriesNormalizer normalizer;
    private final SeriesCache cache;

    public SeriesProvider(ClimateDataSource dataSource, TimeSeriesNormalizer normalizer, SeriesCache cache) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /**
     * @return the normalized series for {@code key}, from cache when present
     * @throws IOException if the data source fails
     * @throws com.atmosight.core.error.ClimatologyException if the records are invalid
     */
    public TimeSeries series(SeriesKey key) throws IOException {
        Objects.requireNonNull(key, "key must not be null");
        try {
            return cache.getOrLoad(key, this::load);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private TimeSeries load(SeriesKey key) {
        LOG.info("Fetching series {}", key);
        SeriesResponse response;
        try {
            response = dataSource.fetch(key);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to fetch series " + key, e);
        }
        return normalizer.normalize(response.getRecords(), response.getMissingSentinel());
    }
}
