package com.atmosight.app;

import com.atmosight.core.config.AnalysisConfig;
import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.DistributionFamily;
import com.atmosight.core.model.GeoPoint;
import com.atmosight.core.model.Variable;
import com.atmosight.core.source.SeriesKey;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable configuration for one AtmoSight run.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * a run is fully described by a shell environment or Docker {@code -e}
 * flags. The analysis thresholds themselves live in {@code analysis.yml};
 * see {@link com.atmosight.core.config.AnalysisConfigLoader}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AppConfig {

    public static final String ENV_INPUT = "ATMOSIGHT_INPUT";
    public static final String ENV_OUTPUT_DIR = "ATMOSIGHT_OUTPUT_DIR";
    public static final String ENV_LOCATION = "ATMOSIGHT_LOCATION";
    public static final String ENV_LATITUDE = "ATMOSIGHT_LATITUDE";
    public static final String ENV_LONGITUDE = "ATMOSIGHT_LONGITUDE";
    public static final String ENV_VARIABLE = "ATMOSIGHT_VARIABLE";
    public static final String ENV_TARGET_DAY = "ATMOSIGHT_TARGET_DAY";
    public static final String ENV_WINDOW_DAYS = "ATMOSIGHT_WINDOW_DAYS";
    public static final String ENV_FAMILY = "ATMOSIGHT_FAMILY";
    public static final String ENV_START_YEAR = "ATMOSIGHT_START_YEAR";
    public static final String ENV_END_YEAR = "ATMOSIGHT_END_YEAR";
    public static final String ENV_VOLATILITY_THRESHOLD = "ATMOSIGHT_VOLATILITY_THRESHOLD";
    public static final String ENV_CONFIG_PATH = "ATMOSIGHT_CONFIG_PATH";

    static final DateTimeFormatter TARGET_DAY_FORMAT = DateTimeFormatter.ofPattern("MM-dd");

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final Path inputPath;
    private final Path outputDir;
    private final String analysisConfigPath;

    // ---------------------------------------------------------------
    // Query
    // ---------------------------------------------------------------
    private final String locationName;
    private final double latitude;
    private final double longitude;
    private final Variable variable;
    private final MonthDay targetDay;
    private final Integer windowDays;
    private final DistributionFamily family;
    private final int startYear;
    private final int endYear;

    // ---------------------------------------------------------------
    // Narrative
    // ---------------------------------------------------------------
    private final double volatilityThreshold;

    private AppConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputDir = b.outputDir;
        this.analysisConfigPath = b.analysisConfigPath;
        this.locationName = b.locationName;
        this.latitude = b.latitude;
        this.longitude = b.longitude;
        this.variable = b.variable;
        this.targetDay = b.targetDay;
        this.windowDays = b.windowDays;
        this.family = b.family;
        this.startYear = b.startYear;
        this.endYear = b.endYear;
        this.volatilityThreshold = b.volatilityThreshold;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link AppConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static AppConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static AppConfig fromEnvironment(Map<String, String> env) {
        Builder builder = new Builder();
        try {
            builder.inputPath(Path.of(env(env, ENV_INPUT, Builder.DEFAULT_INPUT)))
                    .outputDir(Path.of(env(env, ENV_OUTPUT_DIR, Builder.DEFAULT_OUTPUT_DIR)))
                    .analysisConfigPath(env(env, ENV_CONFIG_PATH, ""))
                    .locationName(env(env, ENV_LOCATION, Builder.DEFAULT_LOCATION))
                    .latitude(Double.parseDouble(env(env, ENV_LATITUDE, String.valueOf(Builder.DEFAULT_LATITUDE))))
                    .longitude(Double.parseDouble(env(env, ENV_LONGITUDE, String.valueOf(Builder.DEFAULT_LONGITUDE))))
                    .variable(Variable.parse(env(env, ENV_VARIABLE, Variable.TEMPERATURE.name())))
                    .startYear(Integer.parseInt(env(env, ENV_START_YEAR, String.valueOf(Builder.DEFAULT_START_YEAR))))
                    .endYear(Integer.parseInt(env(env, ENV_END_YEAR, String.valueOf(LocalDate.now().getYear()))))
                    .volatilityThreshold(Double.parseDouble(
                            env(env, ENV_VOLATILITY_THRESHOLD, String.valueOf(Builder.DEFAULT_VOLATILITY_THRESHOLD))));

            String targetDay = env(env, ENV_TARGET_DAY, "");
            if (!targetDay.isEmpty()) {
                builder.targetDay(MonthDay.parse(targetDay, TARGET_DAY_FORMAT));
            }
            String windowDays = env(env, ENV_WINDOW_DAYS, "");
            if (!windowDays.isEmpty()) {
                builder.windowDays(Integer.parseInt(windowDays));
            }
            String family = env(env, ENV_FAMILY, "");
            if (!family.isEmpty()) {
                builder.family(DistributionFamily.valueOf(family.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
            }
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    ENV_TARGET_DAY + " must be formatted MM-dd, got: '" + e.getParsedString() + "'", e);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @param analysisConfig supplies the window when none was configured here
     * @return the query this run answers
     */
    public ClimateQuery toQuery(AnalysisConfig analysisConfig) {
        int window = windowDays != null ? windowDays : analysisConfig.getDefaultWindowDays();
        return ClimateQuery.builder()
                .locationName(locationName)
                .location(latitude, longitude)
                .variable(variable)
                .targetDay(targetDay)
                .windowDays(window)
                .build();
    }

    public SeriesKey toSeriesKey() {
        return new SeriesKey(new GeoPoint(latitude, longitude), variable, startYear, endYear);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getInputPath() {
        return inputPath;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getAnalysisConfigPath() {
        return analysisConfigPath;
    }

    public String getLocationName() {
        return locationName;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public Variable getVariable() {
        return variable;
    }

    public MonthDay getTargetDay() {
        return targetDay;
    }

    /** @return the configured window, empty to use the analysis default */
    public Optional<Integer> getWindowDays() {
        return Optional.ofNullable(windowDays);
    }

    /** @return the configured family, empty to use the variable's default */
    public Optional<DistributionFamily> getFamily() {
        return Optional.ofNullable(family);
    }

    public int getStartYear() {
        return startYear;
    }

    public int getEndYear() {
        return endYear;
    }

    public double getVolatilityThreshold() {
        return volatilityThreshold;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AppConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (coordinates on the globe, window in [0, 182], start year not
     * after end year, volatility threshold in [0, 1]).
     * </p>
     */
    public static class Builder {
        static final String DEFAULT_INPUT = "power.json";
        static final String DEFAULT_OUTPUT_DIR = "atmosight-out";
        static final String DEFAULT_LOCATION = "Faisalabad";
        static final double DEFAULT_LATITUDE = 31.4187;
        static final double DEFAULT_LONGITUDE = 73.0791;
        static final int DEFAULT_START_YEAR = 1991;
        static final double DEFAULT_VOLATILITY_THRESHOLD = 0.15;

        private Path inputPath = Path.of(DEFAULT_INPUT);
        private Path outputDir = Path.of(DEFAULT_OUTPUT_DIR);
        private String analysisConfigPath = "";
        private String locationName = DEFAULT_LOCATION;
        private double latitude = DEFAULT_LATITUDE;
        private double longitude = DEFAULT_LONGITUDE;
        private Variable variable = Variable.TEMPERATURE;
        private MonthDay targetDay = MonthDay.now();
        private Integer windowDays;
        private DistributionFamily family;
        private int startYear = DEFAULT_START_YEAR;
        private int endYear = LocalDate.now().getYear();
        private double volatilityThreshold = DEFAULT_VOLATILITY_THRESHOLD;

        public Builder inputPath(Path v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputDir(Path v) {
            this.outputDir = v;
            return this;
        }

        public Builder analysisConfigPath(String v) {
            this.analysisConfigPath = v;
            return this;
        }

        public Builder locationName(String v) {
            this.locationName = v;
            return this;
        }

        public Builder latitude(double v) {
            this.latitude = v;
            return this;
        }

        public Builder longitude(double v) {
            this.longitude = v;
            return this;
        }

        public Builder variable(Variable v) {
            this.variable = v;
            return this;
        }

        public Builder targetDay(MonthDay v) {
            this.targetDay = v;
            return this;
        }

        public Builder windowDays(Integer v) {
            this.windowDays = v;
            return this;
        }

        public Builder family(DistributionFamily v) {
            this.family = v;
            return this;
        }

        public Builder startYear(int v) {
            this.startYear = v;
            return this;
        }

        public Builder endYear(int v) {
            this.endYear = v;
            return this;
        }

        public Builder volatilityThreshold(double v) {
            this.volatilityThreshold = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AppConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AppConfig build() {
            Objects.requireNonNull(inputPath, "inputPath required");
            Objects.requireNonNull(outputDir, "outputDir required");
            Objects.requireNonNull(variable, "variable required");
            Objects.requireNonNull(targetDay, "targetDay required");
            requireNonBlank(locationName, "locationName");
            if (analysisConfigPath == null) {
                analysisConfigPath = "";
            }

            if (latitude < -90 || latitude > 90) {
                throw new IllegalArgumentException("latitude must be in [-90, 90], got: " + latitude);
            }
            if (longitude < -180 || longitude > 180) {
                throw new IllegalArgumentException("longitude must be in [-180, 180], got: " + longitude);
            }
            if (windowDays != null && (windowDays < 0 || windowDays > ClimateQuery.MAX_WINDOW_DAYS)) {
                throw new IllegalArgumentException(
                        "windowDays must be in [0, " + ClimateQuery.MAX_WINDOW_DAYS + "], got: " + windowDays);
            }
            if (startYear > endYear) {
                throw new IllegalArgumentException(
                        "startYear " + startYear + " must not be after endYear " + endYear);
            }
            if (!(volatilityThreshold >= 0 && volatilityThreshold <= 1)) {
                throw new IllegalArgumentException(
                        "volatilityThreshold must be in [0, 1], got: " + volatilityThreshold);
            }

            return new AppConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "inputPath=" + inputPath +
                ", outputDir=" + outputDir +
                ", locationName='" + locationName + '\'' +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                ", variable=" + variable +
                ", targetDay=" + targetDay +
                ", windowDays=" + windowDays +
                ", family=" + family +
                ", years=" + startYear + ".." + endYear +
                ", volatilityThreshold=" + volatilityThreshold +
                '}';
    }
}
