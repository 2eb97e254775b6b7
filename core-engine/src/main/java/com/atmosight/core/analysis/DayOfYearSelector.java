package com.atmosight.core.analysis;

import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.InsufficientDataException;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.ClimatologicalSample;
import com.atmosight.core.model.DailyObservation;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reduces a daily series to one sample per year for a target calendar day.
 *
 * <h3>Window</h3>
 * <p>
 * For each year present in the series the window is the anchor date
 * (that year's occurrence of the target day) plus and minus
 * {@code windowDays}, using calendar arithmetic. A window around January 1
 * therefore reaches into the previous December, and those December values
 * count towards the January year.
 * </p>
 *
 * <h3>Aggregation</h3>
 * <p>
 * The sample is the arithmetic mean of the valid values inside the window,
 * summed in date order. Years without a valid value are omitted, never
 * filled.
 * </p>
 *
 * <h3>February 29</h3>
 * <p>
 * In non-leap years the anchor falls back to February 28 when
 * {@code windowDays > 0}. With {@code windowDays == 0} those years are
 * omitted, since the exact day does not exist.
 * </p>
 *
 * @since 1.0.0
 */
public class DayOfYearSelector {

    private static final Logger LOG = LoggerFactory.getLogger(DayOfYearSelector.class);

    private final int minimumYears;

    public DayOfYearSelector(AnalysisConfig config) {
        this(Objects.requireNonNull(config, "AnalysisConfig must not be null").getMinimumYears());
    }

    /**
     * @param minimumYears fewest yearly samples accepted
     * @throws IllegalArgumentException if {@code minimumYears < 1}
     */
    public DayOfYearSelector(int minimumYears) {
        if (minimumYears < 1) {
            throw new IllegalArgumentException("minimumYears must be >= 1, got: " + minimumYears);
        }
        this.minimumYears = minimumYears;
    }

    /**
     * @param series     validated daily series
     * @param month      target month, 1-12
     * @param day        target day of month
     * @param windowDays days either side of the target, in [0, 182]
     * @return one sample per year with data in its window
     * @throws IllegalArgumentException  if the day or window is invalid
     * @throws InsufficientDataException if fewer than the minimum years have data
     */
    public SampleSet select(TimeSeries series, int month, int day, int windowDays) {
        MonthDay target;
        try {
            target = MonthDay.of(month, day);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid target day: month=" + month + ", day=" + day, e);
        }
        return select(series, target, windowDays);
    }

    /**
     * @see #select(TimeSeries, int, int, int)
     */
    public SampleSet select(TimeSeries series, MonthDay target, int windowDays) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (windowDays < 0 || windowDays > ClimateQuery.MAX_WINDOW_DAYS) {
            throw new IllegalArgumentException("windowDays must be in [0, " + ClimateQuery.MAX_WINDOW_DAYS
                    + "], got: " + windowDays);
        }

        List<ClimatologicalSample> samples = new ArrayList<>();
        for (int year : series.years()) {
            Optional<LocalDate> anchor = anchor(year, target, windowDays);
            if (anchor.isEmpty()) {
                LOG.trace("{} does not exist in {} - skipping", target, year);
                continue;
            }

            double sum = 0;
            int count = 0;
            for (DailyObservation observation : series.between(
                    anchor.get().minusDays(windowDays), anchor.get().plusDays(windowDays))) {
                if (!observation.isMissing()) {
                    sum += observation.getValue();
                    count++;
                }
            }

            if (count == 0) {
                LOG.debug("No valid {} value within {} ±{} days of {} - year omitted",
                        series.getVariable(), target, windowDays, year);
                continue;
            }
            samples.add(new ClimatologicalSample(year, sum / count, count));
        }

        if (samples.size() < minimumYears) {
            throw new InsufficientDataException(AnalysisStage.SELECT,
                    "Only " + samples.size() + " year(s) have valid " + series.getVariable()
                            + " data within " + windowDays + " day(s) of " + target
                            + "; at least " + minimumYears + " required");
        }

        SampleSet sampleSet = new SampleSet(series.getVariable(), samples);
        LOG.debug("Selected {} for {} ±{} days", sampleSet, target, windowDays);
        return sampleSet;
    }

    static Optional<LocalDate> anchor(int year, MonthDay target, int windowDays) {
        if (target.isValidYear(year)) {
            return Optional.of(target.atYear(year));
        }
        // only Feb 29 in a non-leap year gets here
        if (windowDays > 0) {
            return Optional.of(LocalDate.of(year, Month.FEBRUARY, 28));
        }
        return Optional.empty();
    }
}
