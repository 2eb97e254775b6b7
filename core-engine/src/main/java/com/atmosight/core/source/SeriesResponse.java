package com.atmosight.core.source;

import com.atmosight.core.model.RawRecord;

import java.util.List;
import java.util.Objects;

/**
 * What a {@link ClimateDataSource} returns: the raw records plus the value
 * the provider uses for missing data.
 *
 * @since 1.0.0
 */
public final class SeriesResponse {

    private final List<RawRecord> records;
    private final double missingSentinel;

    public SeriesResponse(List<RawRecord> records, double missingSentinel) {
        this.records = List.copyOf(Objects.requireNonNull(records, "records must not be null"));
        this.missingSentinel = missingSentinel;
    }

    public List<RawRecord> getRecords() {
        return records;
    }

    public double getMissingSentinel() {
        return missingSentinel;
    }

    @Override
    public String toString() {
        return "SeriesResponse{records=" + records.size() + ", missingSentinel=" + missingSentinel + '}';
    }
}
