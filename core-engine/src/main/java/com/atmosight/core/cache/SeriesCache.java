package com.atmosight.core.cache;

import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.model.TimeSeries;
import com.atmosight.core.source.SeriesKey;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Bounded cache of normalized series keyed by location, variable and year
 * range.
 *
 * <p>
 * Instances are created and owned by the caller, which decides their
 * lifetime and when to invalidate them. There is no shared global instance.
 * Backed by Caffeine, so it is safe for concurrent use.
 * </p>
 *
 * @since 1.0.0
 */
public class SeriesCache {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesCache.class);

    private final Cache<SeriesKey, TimeSeries> cache;

    public SeriesCache(AnalysisConfig config) {
        this(Objects.requireNonNull(config, "AnalysisConfig must not be null").getCacheMaximumSize());
    }

    /**
     * @param maximumSize most series kept before eviction
     */
    public SeriesCache(long maximumSize) {
        if (maximumSize < 1) {
            throw new IllegalArgumentException("maximumSize must be >= 1, got: " + maximumSize);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * Return the cached series, computing and storing it with {@code loader}
     * on a miss. Exceptions thrown by the loader propagate and nothing is
     * stored.
     */
    public TimeSeries getOrLoad(SeriesKey key, Function<SeriesKey, TimeSeries> loader) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(loader, "loader must not be null");
        return cache.get(key, loader);
    }

    public Optional<TimeSeries> getIfPresent(SeriesKey key) {
        return Optional.ofNullable(cache.getIfPresent(Objects.requireNonNull(key, "key must not be null")));
    }

    public void put(SeriesKey key, TimeSeries series) {
        cache.put(Objects.requireNonNull(key, "key must not be null"),
                Objects.requireNonNull(series, "series must not be null"));
    }

    public void invalidate(SeriesKey key) {
        LOG.debug("Invalidating cached series {}", key);
        cache.invalidate(Objects.requireNonNull(key, "key must not be null"));
    }

    public void invalidateAll() {
        LOG.debug("Invalidating all {} cached series", cache.estimatedSize());
        cache.invalidateAll();
    }

    /** @return number of cached series after pending maintenance */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /** @return hit count since creation */
    public long hitCount() {
        return cache.stats().hitCount();
    }
}
