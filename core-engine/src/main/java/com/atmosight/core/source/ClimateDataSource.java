package com.atmosight.core.source;

import java.io.IOException;

/**
 * Supplier of raw daily records for one location and variable.
 *
 * <p>
 * This is the only place the pipeline touches I/O. Implementations may
 * block; the analysis itself never does.
 * </p>
 */
@FunctionalInterface
public interface ClimateDataSource {

    /**
     * @param key location, variable and year range to fetch
     * @return the raw records and missing-value sentinel
     * @throws IOException if the records cannot be obtained
     */
    SeriesResponse fetch(SeriesKey key) throws IOException;
}
