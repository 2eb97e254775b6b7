package com.atmosight.core.analysis;

import com.atmosight.core.SyntheticData;
import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.InsufficientDataException;
import com.atmosight.core.model.ClimatologicalSample;
import com.atmosight.core.model.RawRecord;
import com.atmosight.core.model.SampleSet;
import com.atmosight.core.model.TimeSeries;
import com.atmosight.core.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DayOfYearSelector}.
 */
class DayOfYearSelectorTest {

    @Test
    @DisplayName("Should pick the exact calendar day of every year when window is zero")
    void shouldSelectExactDay() {
        TimeSeries series = dailySeries(2000, 2011);

        SampleSet samples = new DayOfYearSelector(10).select(series, 7, 15, 0);

        assertThat(samples.size()).isEqualTo(12);
        assertThat(samples.firstYear()).isEqualTo(2000);
        assertThat(samples.lastYear()).isEqualTo(2011);
        for (ClimatologicalSample sample : samples.getSamples()) {
            assertThat(sample.getValue()).isEqualTo(valueOn(LocalDate.of(sample.getYear(), 7, 15)));
            assertThat(sample.getObservationCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should omit a year whose target day is missing rather than fill it")
    void shouldOmitMissingYear() {
        Map<LocalDate, Double> values = new LinkedHashMap<>();
        for (int year = 2000; year <= 2004; year++) {
            values.put(LocalDate.of(year, 7, 14), 1.0);
            values.put(LocalDate.of(year, 7, 15), year == 2002 ? null : 5.0);
            values.put(LocalDate.of(year, 7, 16), 9.0);
        }
        TimeSeries series = SyntheticData.series(Variable.TEMPERATURE, values);

        SampleSet samples = new DayOfYearSelector(3).select(series, 7, 15, 0);

        assertThat(samples.years()).containsExactly(2000, 2001, 2003, 2004);
        assertThat(samples.values()).containsOnly(5.0);
    }

    @Test
    @DisplayName("Should average valid values within the window and skip missing ones")
    void shouldAverageWindow() {
        Map<LocalDate, Double> values = new LinkedHashMap<>();
        values.put(LocalDate.of(2005, 3, 9), 100.0);
        values.put(LocalDate.of(2005, 3, 10), 2.0);
        values.put(LocalDate.of(2005, 3, 11), null);
        values.put(LocalDate.of(2005, 3, 12), 4.0);
        values.put(LocalDate.of(2005, 3, 14), 100.0);

        SampleSet samples = new DayOfYearSelector(1).select(series(values), 3, 11, 1);

        ClimatologicalSample only = samples.getSamples().get(0);
        assertThat(only.getValue()).isEqualTo(3.0);
        assertThat(only.getObservationCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should let a window around Jan 1 reach into the previous year")
    void shouldWrapIntoPreviousYear() {
        Map<LocalDate, Double> values = new LinkedHashMap<>();
        values.put(LocalDate.of(1999, 12, 28), 1000.0);
        values.put(LocalDate.of(1999, 12, 29), 10.0);
        values.put(LocalDate.of(1999, 12, 31), 20.0);
        values.put(LocalDate.of(2000, 1, 1), 30.0);
        values.put(LocalDate.of(2000, 1, 4), 40.0);
        values.put(LocalDate.of(2000, 1, 5), 1000.0);

        SampleSet samples = new DayOfYearSelector(1).select(series(values), 1, 1, 3);

        assertThat(samples.years()).containsExactly(2000);
        assertThat(samples.getSamples().get(0).getValue()).isEqualTo(25.0);
        assertThat(samples.getSamples().get(0).getObservationCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should let a window around Dec 31 reach into the following year")
    void shouldWrapIntoFollowingYear() {
        Map<LocalDate, Double> values = new LinkedHashMap<>();
        values.put(LocalDate.of(2000, 12, 30), 5.0);
        values.put(LocalDate.of(2001, 1, 2), 7.0);
        values.put(LocalDate.of(2001, 1, 4), 1000.0);

        SampleSet samples = new DayOfYearSelector(1).select(series(values), 12, 31, 3);

        assertThat(samples.years()).containsExactly(2000);
        assertThat(samples.values()[0]).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Should skip Feb 29 in non-leap years with a zero window")
    void shouldSkipLeapDayWithoutWindow() {
        TimeSeries series = dailySeries(2000, 2004);

        SampleSet samples = new DayOfYearSelector(1).select(series, 2, 29, 0);

        assertThat(samples.years()).containsExactly(2000, 2004);
    }

    @Test
    @DisplayName("Should anchor Feb 29 to Feb 28 in non-leap years when a window is set")
    void shouldAnchorLeapDayToFeb28() {
        TimeSeries series = dailySeries(2000, 2003);

        SampleSet samples = new DayOfYearSelector(1).select(series, 2, 29, 1);

        assertThat(samples.years()).containsExactly(2000, 2001, 2002, 2003);
        double expected2001 = (valueOn(LocalDate.of(2001, 2, 27))
                + valueOn(LocalDate.of(2001, 2, 28))
                + valueOn(LocalDate.of(2001, 3, 1))) / 3;
        assertThat(samples.getSamples().get(1).getValue()).isCloseTo(expected2001, within(1e-12));
        assertThat(DayOfYearSelector.anchor(2001, MonthDay.of(2, 29), 0)).isEmpty();
        assertThat(DayOfYearSelector.anchor(2001, MonthDay.of(2, 29), 2)).contains(LocalDate.of(2001, 2, 28));
    }

    @Test
    @DisplayName("Should fail when fewer years than the minimum have data")
    void shouldRequireMinimumYears() {
        TimeSeries series = dailySeries(2000, 2004);

        assertThatThrownBy(() -> new DayOfYearSelector(10).select(series, 6, 1, 0))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("Only 5 year(s)")
                .satisfies(e -> assertThat(((InsufficientDataException) e).getStage())
                        .isEqualTo(AnalysisStage.SELECT));
    }

    @Test
    @DisplayName("Should reject an out-of-range window or an impossible day")
    void shouldRejectInvalidArguments() {
        TimeSeries series = dailySeries(2000, 2001);
        DayOfYearSelector selector = new DayOfYearSelector(1);

        assertThatThrownBy(() -> selector.select(series, 1, 1, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.select(series, 1, 1, 183))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.select(series, 2, 30, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid target day");
    }

    @Test
    @DisplayName("Should produce identical samples from records in any order")
    void shouldBeOrderIndependent() {
        List<RawRecord> records = SyntheticData.dailyRecords(Variable.TEMPERATURE, 2000, 2011, DayOfYearSelectorTest::valueOn);
        List<RawRecord> shuffled = new ArrayList<>(records);
        Collections.shuffle(shuffled, new Random(7));
        TimeSeriesNormalizer normalizer = new TimeSeriesNormalizer(10);
        DayOfYearSelector selector = new DayOfYearSelector(10);

        SampleSet fromOrdered = selector.select(normalizer.normalize(records, -999), 4, 20, 5);
        SampleSet fromShuffled = selector.select(normalizer.normalize(shuffled, -999), 4, 20, 5);

        assertThat(fromShuffled).isEqualTo(fromOrdered);
        assertThat(fromShuffled.getFingerprint()).isEqualTo(fromOrdered.getFingerprint());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double valueOn(LocalDate date) {
        return date.getYear() + date.getDayOfYear() / 1000.0;
    }

    private static TimeSeries dailySeries(int fromYear, int toYear) {
        Map<LocalDate, Double> values = new LinkedHashMap<>();
        for (LocalDate d = LocalDate.of(fromYear, 1, 1); d.getYear() <= toYear; d = d.plusDays(1)) {
            values.put(d, valueOn(d));
        }
        return series(values);
    }

    private static TimeSeries series(Map<LocalDate, Double> values) {
        return SyntheticData.series(Variable.TEMPERATURE, values);
    }
}
