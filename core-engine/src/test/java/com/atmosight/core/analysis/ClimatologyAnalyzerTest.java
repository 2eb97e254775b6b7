package com.atmosight.core.analysis;

import com.atmosight.core.SyntheticData;
import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.error.AnalysisStage;
import com.atmosight.core.error.ClimatologyException;
import com.atmosight.core.error.DegenerateFitException;
import com.atmosight.core.error.InconsistentResultException;
import com.atmosight.core.error.InsufficientDataException;
import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.DistributionFamily;
import com.atmosight.core.model.RawRecord;
import com.atmosight.core.model.TimeSeries;
import com.atmosight.core.model.TrendDirection;
import com.atmosight.core.model.Variable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests for {@link ClimatologyAnalyzer}.
 */
class ClimatologyAnalyzerTest {

    private static TimeSeries series;

    private final ClimatologyAnalyzer analyzer = new ClimatologyAnalyzer(new AnalysisConfig());

    @BeforeAll
    static void buildSeries() {
        series = SyntheticData.trendingTemperature(1991, 2020, 42L);
    }

    @Test
    @DisplayName("Should produce a consistent result for a trending series")
    void shouldAnalyseTrendingSeries() {
        ClimateQuery query = query(7, 15, 3);

        AnalysisResult result = analyzer.analyze(query, series);

        assertThat(result.getQuery()).isEqualTo(query);
        assertThat(result.getSampleSet().size()).isEqualTo(30);
        assertThat(result.getTrend().getSlope()).isCloseTo(0.5, within(0.15));
        assertThat(result.getTrend().getDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.getDistribution().getFamily()).isEqualTo(DistributionFamily.NORMAL);
        assertThat(result.getExtreme().theoreticalExceedance()).isPresent();

        String fingerprint = result.getSampleSet().getFingerprint();
        assertThat(result.getTrend().getSampleFingerprint()).isEqualTo(fingerprint);
        assertThat(result.getExtreme().getSampleFingerprint()).isEqualTo(fingerprint);
        assertThat(result.getDistribution().getSampleFingerprint()).isEqualTo(fingerprint);
    }

    @Test
    @DisplayName("Should normalize raw records before analysing them")
    void shouldAnalyseRawRecords() {
        List<RawRecord> records = SyntheticData.dailyRecords(Variable.TEMPERATURE, 2001, 2012,
                d -> d.getMonthValue() == 3 && d.getDayOfMonth() == 1 && d.getYear() == 2005
                        ? -999.0
                        : 20 + d.getYear() - 2000 + (d.getDayOfMonth() % 3));

        AnalysisResult result = analyzer.analyze(query(3, 1, 0), records, -999.0);

        assertThat(result.getSampleSet().years()).hasSize(11).doesNotContain(2005);
        assertThat(result.getTrend().getSlope()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should honour an explicit distribution family")
    void shouldUseRequestedFamily() {
        AnalysisResult result = analyzer.analyze(query(1, 20, 0), series, DistributionFamily.LOG_NORMAL);

        assertThat(result.getDistribution().getFamily()).isEqualTo(DistributionFamily.LOG_NORMAL);
    }

    @Test
    @DisplayName("Should attach the query to a failure")
    void shouldAttachQueryToFailure() {
        TimeSeries shortSeries = SyntheticData.trendingTemperature(2015, 2019, 1L);
        ClimateQuery query = query(6, 1, 0);

        assertThatThrownBy(() -> analyzer.analyze(query, shortSeries))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("Faisalabad")
                .satisfies(e -> {
                    ClimatologyException ce = (ClimatologyException) e;
                    assertThat(ce.getStage()).isEqualTo(AnalysisStage.SELECT);
                    assertThat(ce.getQuery()).isEqualTo(query);
                });
    }

    @Test
    @DisplayName("Should report a series that never varies as a degenerate fit")
    void shouldReportConstantSeriesAsDegenerate() {
        List<RawRecord> records = SyntheticData.dailyRecords(Variable.TEMPERATURE, 1991, 2020, d -> 5.0);
        ClimateQuery query = query(7, 15, 0);

        assertThatThrownBy(() -> analyzer.analyze(query, records, -999.0))
                .isInstanceOf(DegenerateFitException.class)
                .hasMessageContaining("zero-variance")
                .satisfies(e -> assertThat(((ClimatologyException) e).getStage())
                        .isEqualTo(AnalysisStage.DISTRIBUTION));
    }

    @Test
    @DisplayName("Should reject a series of another variable")
    void shouldRejectVariableMismatch() {
        ClimateQuery rainQuery = ClimateQuery.builder()
                .locationName("Faisalabad")
                .location(31.42, 73.08)
                .variable(Variable.PRECIPITATION)
                .targetDay(7, 15)
                .build();

        assertThatThrownBy(() -> analyzer.analyze(rainQuery, series))
                .isInstanceOf(InconsistentResultException.class)
                .hasMessageContaining("TEMPERATURE");
    }

    @Test
    @DisplayName("Should give the same answers when queries run concurrently")
    void shouldBeSafeUnderConcurrency() throws Exception {
        List<ClimateQuery> queries = new ArrayList<>();
        for (int month = 1; month <= 12; month++) {
            queries.add(query(month, 10, month % 4));
        }
        List<AnalysisResult> sequential = new ArrayList<>();
        for (ClimateQuery q : queries) {
            sequential.add(analyzer.analyze(q, series));
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<AnalysisResult>> tasks = new ArrayList<>();
            for (ClimateQuery q : queries) {
                tasks.add(() -> analyzer.analyze(q, series));
            }
            List<Future<AnalysisResult>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                assertThat(futures.get(i).get()).isEqualTo(sequential.get(i));
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    @DisplayName("Should keep its input series untouched")
    void shouldNotMutateInput() {
        int before = series.size();
        LocalDate first = series.getObservations().get(0).getDate();

        analyzer.analyze(query(9, 1, 5), series);

        assertThat(series.size()).isEqualTo(before);
        assertThat(series.getObservations().get(0).getDate()).isEqualTo(first);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ClimateQuery query(int month, int day, int windowDays) {
        return ClimateQuery.builder()
                .locationName("Faisalabad")
                .location(31.42, 73.08)
                .variable(Variable.TEMPERATURE)
                .targetDay(month, day)
                .windowDays(windowDays)
                .build();
    }
}
