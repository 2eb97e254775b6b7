package com.atmosight.core.analysis;

import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.InsufficientDataException;
import com.atmosight.core.error.MalformedRecordException;
import com.atmosight.core.model.DailyObservation;
import com.atmosight.core.model.RawRecord;
import com.atmosight.core.model.TimeSeries;
import com.atmosight.core.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validates raw records into a {@link TimeSeries}.
 *
 * <h3>Classification</h3>
 * <p>
 * Every record is exactly one of:
 * </p>
 * <ul>
 * <li><b>valid</b>: parsable date and finite value that is not the sentinel</li>
 * <li><b>missing</b>: {@code null} value, or a value equal to the sentinel;
 * kept in the series as an explicit marker</li>
 * <li><b>malformed</b>: unparsable date, non-finite value, or a variable
 * that differs from the first record's; rejects the whole series</li>
 * </ul>
 *
 * <p>
 * Dates may be ISO ({@code 2020-01-31}) or basic ({@code 20200131}). Input
 * order does not matter. A date repeated with the same observation is
 * collapsed; repeated with a different one it is malformed.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesNormalizer.class);

    private final int minimumValidPoints;

    public TimeSeriesNormalizer(AnalysisConfig config) {
        this(Objects.requireNonNull(config, "AnalysisConfig must not be null").getMinimumValidPoints());
    }

    /**
     * @param minimumValidPoints fewest valid values a series may hold
     * @throws IllegalArgumentException if {@code minimumValidPoints < 1}
     */
    public TimeSeriesNormalizer(int minimumValidPoints) {
        if (minimumValidPoints < 1) {
            throw new IllegalArgumentException("minimumValidPoints must be >= 1, got: " + minimumValidPoints);
        }
        this.minimumValidPoints = minimumValidPoints;
    }

    /**
     * @param records         raw records of a single variable, in any order
     * @param missingSentinel value the source uses for "no data" (e.g. -999);
     *                        {@code NaN} marks NaN values as missing
     * @return the validated, date-ordered series
     * @throws MalformedRecordException  if any record is malformed
     * @throws InsufficientDataException if fewer than the minimum valid values remain
     */
    public TimeSeries normalize(List<RawRecord> records, double missingSentinel) {
        Objects.requireNonNull(records, "records must not be null");
        if (records.isEmpty()) {
            throw new InsufficientDataException(AnalysisStage.NORMALIZE,
                    "No records supplied; at least " + minimumValidPoints + " valid values required");
        }

        Variable variable = Objects.requireNonNull(records.get(0), "record at index 0 is null").getVariable();
        Map<LocalDate, DailyObservation> byDate = new HashMap<>();
        int missing = 0;
        int collapsed = 0;

        for (int i = 0; i < records.size(); i++) {
            RawRecord record = Objects.requireNonNull(records.get(i), "record at index " + i + " is null");
            if (record.getVariable() != variable) {
                throw new MalformedRecordException(AnalysisStage.NORMALIZE,
                        "Record " + i + " has variable " + record.getVariable()
                                + " but the series is " + variable);
            }

            LocalDate date = parseDate(record.getRawDate(), i);
            DailyObservation observation = classify(date, record.getRawValue(), missingSentinel, i);
            if (observation.isMissing()) {
                missing++;
            }

            DailyObservation previous = byDate.putIfAbsent(date, observation);
            if (previous != null) {
                if (!previous.equals(observation)) {
                    throw new MalformedRecordException(AnalysisStage.NORMALIZE,
                            "Conflicting duplicate records for " + date + ": " + previous + " vs " + observation);
                }
                collapsed++;
            }
        }

        TimeSeries series = new TimeSeries(variable, byDate.values());
        if (missing > 0) {
            LOG.warn("{} of {} {} records are missing (sentinel {})", missing, records.size(), variable, missingSentinel);
        }
        if (collapsed > 0) {
            LOG.debug("Collapsed {} identical duplicate record(s)", collapsed);
        }

        if (series.getValidCount() < minimumValidPoints) {
            throw new InsufficientDataException(AnalysisStage.NORMALIZE,
                    "Only " + series.getValidCount() + " valid " + variable + " values; at least "
                            + minimumValidPoints + " required");
        }

        LOG.debug("Normalized {}", series);
        return series;
    }

    private static LocalDate parseDate(String rawDate, int index) {
        if (rawDate == null || rawDate.isBlank()) {
            throw new MalformedRecordException(AnalysisStage.NORMALIZE, "Record " + index + " has no date");
        }
        String text = rawDate.trim();
        DateTimeFormatter format = text.length() == 8
                ? DateTimeFormatter.BASIC_ISO_DATE
                : DateTimeFormatter.ISO_LOCAL_DATE;
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException(AnalysisStage.NORMALIZE,
                    "Record " + index + " has unparsable date '" + rawDate + "'", e);
        }
    }

    private static DailyObservation classify(LocalDate date, Double rawValue, double sentinel, int index) {
        if (rawValue == null || isSentinel(rawValue, sentinel)) {
            return DailyObservation.missing(date);
        }
        if (!Double.isFinite(rawValue)) {
            throw new MalformedRecordException(AnalysisStage.NORMALIZE,
                    "Record " + index + " on " + date + " has non-finite value " + rawValue);
        }
        return DailyObservation.of(date, rawValue);
    }

    private static boolean isSentinel(double value, double sentinel) {
        return Double.isNaN(sentinel) ? Double.isNaN(value) : value == sentinel;
    }
}
