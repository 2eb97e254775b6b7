package com.atmosight.app;

import com.atmosight.core.analysis.ClimatologyAnalyzer;
import com.atmosight.core.analysis.TimeSeriesNormalizer;
import com.atmosight.core.cache.SeriesCache;
import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.config.AnalysisConfigLoader;
import com.atmosight.core.error.ClimatologyException;
import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.DistributionFamily;
import com.atmosight.core.model.TimeSeries;
import com.atmosight.core.source.SeriesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Main entry point for an AtmoSight run.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   POWER response file
 *     → PowerResponseReader → RawRecords
 *     → TimeSeriesNormalizer (cached per location, variable and years)
 *     → ClimatologyAnalyzer (select, distribution, trend, extremes)
 *     → InsightNarrative (logged)
 *     → ExportBundle (historical_data.csv + analysis.json)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * The run is described by {@link AppConfig} environment variables; the
 * analysis thresholds by {@code analysis.yml}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AtmoSightApp {

    private static final Logger LOG = LoggerFactory.getLogger(AtmoSightApp.class);

    static final int EXIT_ANALYSIS_FAILED = 2;
    static final int EXIT_IO_FAILED = 3;

    private AtmoSightApp() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) {
        int status;
        try {
            // 1. Load configuration
            AppConfig config = AppConfig.fromEnvironment();
            LOG.info("Starting AtmoSight with config: {}", config);
            status = run(config, loadAnalysisConfig(config));
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run one analysis and write its bundle.
     *
     * @return process exit status, 0 on success
     */
    static int run(AppConfig config, AnalysisConfig analysisConfig) {
        ClimateQuery query = config.toQuery(analysisConfig);
        try {
            Path bundle = analyze(config, analysisConfig, query);
            LOG.info("Analysis complete: {}", bundle);
            return 0;
        } catch (ClimatologyException e) {
            LOG.error("Analysis failed at stage {} for {}: {}", e.getStage(), e.getQuery(), e.getMessage());
            return EXIT_ANALYSIS_FAILED;
        } catch (IOException e) {
            LOG.error("I/O failure while analysing {}: {}", query, e.getMessage(), e);
            return EXIT_IO_FAILED;
        }
    }

    /**
     * @return the written bundle
     */
    static Path analyze(AppConfig config, AnalysisConfig analysisConfig, ClimateQuery query) throws IOException {
        // 2. Wire the data source behind the series cache
        SeriesProvider provider = new SeriesProvider(
                new PowerFileDataSource(config.getInputPath(), new PowerResponseReader()),
                new TimeSeriesNormalizer(analysisConfig),
                new SeriesCache(analysisConfig));

        // 3. Analyse
        ClimatologyAnalyzer analyzer = new ClimatologyAnalyzer(analysisConfig);
        TimeSeries series;
        try {
            series = provider.series(config.toSeriesKey());
        } catch (ClimatologyException e) {
            throw e.withQuery(query);
        }
        DistributionFamily family = config.getFamily().orElse(analysisConfig.familyFor(query.getVariable()));
        AnalysisResult result = analyzer.analyze(query, series, family);

        // 4. Report
        InsightNarrative narrative = new InsightNarrative(config.getVolatilityThreshold());
        LOG.info("\n{}", narrative.render(result));

        // 5. Export
        ExportBundle bundle = new ExportBundle(new HistoricalValuesCsv(), new AnalysisResultCodec());
        return bundle.write(result, config.getOutputDir().resolve(ExportBundle.fileName(result)));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnalysisConfig loadAnalysisConfig(AppConfig config) {
        String path = config.getAnalysisConfigPath();
        if (path != null && !path.isBlank()) {
            return AnalysisConfigLoader.fromFile(path);
        }
        return AnalysisConfigLoader.load();
    }
}
