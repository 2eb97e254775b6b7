package com.atmosight.app;

import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.ClimatologicalSample;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CSV table of the yearly samples behind a result, one row per year with
 * the trend line's fitted value alongside.
 *
 * <pre>
 * year,value,observations,fitted
 * 1991,30.12,1,29.87
 * </pre>
 */
public class HistoricalValuesCsv {

    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema = mapper.schemaFor(Row.class).withHeader();

    /**
     * @return one row per sample, in year order
     */
    public List<Row> rows(AnalysisResult result) {
        Objects.requireNonNull(result, "result must not be null");
        List<ClimatologicalSample> samples = result.getSampleSet().getSamples();
        List<Double> fitted = result.getTrend().getFittedValues();

        List<Row> rows = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            ClimatologicalSample sample = samples.get(i);
            rows.add(new Row(sample.getYear(), sample.getValue(), sample.getObservationCount(), fitted.get(i)));
        }
        return rows;
    }

    public String write(AnalysisResult result) throws IOException {
        return write(rows(result));
    }

    public String write(List<Row> rows) throws IOException {
        return mapper.writer(schema).writeValueAsString(Objects.requireNonNull(rows, "rows must not be null"));
    }

    public List<Row> read(String csv) throws IOException {
        Objects.requireNonNull(csv, "csv must not be null");
        try (MappingIterator<Row> it = mapper.readerFor(Row.class).with(schema).readValues(csv)) {
            return it.readAll();
        }
    }

    /**
     * One line of the table.
     */
    @JsonPropertyOrder({"year", "value", "observations", "fitted"})
    public static final class Row {

        private final int year;
        private final double value;
        private final int observations;
        private final double fitted;

        @JsonCreator
        public Row(@JsonProperty("year") int year,
                   @JsonProperty("value") double value,
                   @JsonProperty("observations") int observations,
                   @JsonProperty("fitted") double fitted) {
            this.year = year;
            this.value = value;
            this.observations = observations;
            this.fitted = fitted;
        }

        public int getYear() {
            return year;
        }

        public double getValue() {
            return value;
        }

        public int getObservations() {
            return observations;
        }

        public double getFitted() {
            return fitted;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Row that))
                return false;
            return year == that.year
                    && Double.compare(value, that.value) == 0
                    && observations == that.observations
                    && Double.compare(fitted, that.fitted) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(year, value, observations, fitted);
        }

        @Override
        public String toString() {
            return "Row{year=" + year + ", value=" + value + ", observations=" + observations
                    + ", fitted=" + fitted + '}';
        }
    }
}
