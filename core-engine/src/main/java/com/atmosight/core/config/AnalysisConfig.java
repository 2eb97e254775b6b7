package com.atmosight.core.config;

import com.atmosight.core.model.ClimateQuery;
import com.atmosight.core.model.DistributionFamily;
import com.atmosight.core.model.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tunable constants of the analysis pipeline.
 *
 * <p>
 * Expected YAML structure (every key optional; defaults shown):
 * </p>
 *
 * <pre>
 * minimumValidPoints: 10
 * minimumYears: 10
 * defaultWindowDays: 0
 * sigmaFactor: 2.0
 * percentiles: [10.0, 25.0, 50.0, 75.0, 90.0]
 * cacheMaximumSize: 64
 * variables:
 *   - variable: precipitation
 *     family: gamma
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. A default-constructed instance is
 * valid as is.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig {

    /** Fewest valid daily values a normalized series may hold. */
    private int minimumValidPoints = 10;

    /** Fewest yearly samples for downstream statistics to be meaningful. */
    private int minimumYears = 10;

    /** Window used when a caller does not choose one. */
    private int defaultWindowDays = 0;

    /** Number of standard deviations above the mean that marks an extreme. */
    private double sigmaFactor = 2.0;

    /** Percentiles tabulated by the distribution modeler, each in (0, 100). */
    private List<Double> percentiles = new ArrayList<>(List.of(10.0, 25.0, 50.0, 75.0, 90.0));

    /** Upper bound on normalized series kept by the series cache. */
    private long cacheMaximumSize = 64;

    private List<VariableSettings> variables = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting, collecting all errors before failing.
     *
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (minimumValidPoints < 1) {
            errors.add("'minimumValidPoints' must be >= 1, got: " + minimumValidPoints);
        }
        if (minimumYears < 2) {
            errors.add("'minimumYears' must be >= 2, got: " + minimumYears);
        }
        if (defaultWindowDays < 0 || defaultWindowDays > ClimateQuery.MAX_WINDOW_DAYS) {
            errors.add("'defaultWindowDays' must be in [0, " + ClimateQuery.MAX_WINDOW_DAYS
                    + "], got: " + defaultWindowDays);
        }
        if (!(sigmaFactor > 0) || Double.isInfinite(sigmaFactor)) {
            errors.add("'sigmaFactor' must be a positive number, got: " + sigmaFactor);
        }
        if (percentiles == null || percentiles.isEmpty()) {
            errors.add("'percentiles' must not be empty");
        } else {
            for (Double p : percentiles) {
                if (p == null || !(p > 0 && p < 100)) {
                    errors.add("percentile must be in (0, 100), got: " + p);
                }
            }
        }
        if (cacheMaximumSize < 1) {
            errors.add("'cacheMaximumSize' must be >= 1, got: " + cacheMaximumSize);
        }

        List<Variable> seen = new ArrayList<>();
        for (int i = 0; i < variables.size(); i++) {
            VariableSettings settings = Objects.requireNonNull(variables.get(i),
                    "Variable settings at index " + i + " is null");
            try {
                settings.validate();
                Variable variable = settings.resolveVariable();
                if (seen.contains(variable)) {
                    errors.add("Duplicate settings for variable " + variable);
                }
                seen.add(variable);
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Distribution family to use for {@code variable}: the configured
     * override if any, otherwise {@link Variable#getDefaultFamily()}.
     */
    public DistributionFamily familyFor(Variable variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        for (VariableSettings settings : variables) {
            if (settings.resolveVariable() == variable) {
                return settings.resolveFamily();
            }
        }
        return variable.getDefaultFamily();
    }

    /** @return percentiles as a primitive array, in configured order */
    public double[] percentileLevels() {
        return percentiles.stream().mapToDouble(Double::doubleValue).toArray();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public int getMinimumValidPoints() {
        return minimumValidPoints;
    }

    public void setMinimumValidPoints(int minimumValidPoints) {
        this.minimumValidPoints = minimumValidPoints;
    }

    public int getMinimumYears() {
        return minimumYears;
    }

    public void setMinimumYears(int minimumYears) {
        this.minimumYears = minimumYears;
    }

    public int getDefaultWindowDays() {
        return defaultWindowDays;
    }

    public void setDefaultWindowDays(int defaultWindowDays) {
        this.defaultWindowDays = defaultWindowDays;
    }

    public double getSigmaFactor() {
        return sigmaFactor;
    }

    public void setSigmaFactor(double sigmaFactor) {
        this.sigmaFactor = sigmaFactor;
    }

    public List<Double> getPercentiles() {
        return Collections.unmodifiableList(percentiles);
    }

    public void setPercentiles(List<Double> percentiles) {
        this.percentiles = percentiles != null ? new ArrayList<>(percentiles) : new ArrayList<>();
    }

    public long getCacheMaximumSize() {
        return cacheMaximumSize;
    }

    public void setCacheMaximumSize(long cacheMaximumSize) {
        this.cacheMaximumSize = cacheMaximumSize;
    }

    public List<VariableSettings> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public void setVariables(List<VariableSettings> variables) {
        this.variables = variables != null ? new ArrayList<>(variables) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "minimumValidPoints=" + minimumValidPoints +
                ", minimumYears=" + minimumYears +
                ", defaultWindowDays=" + defaultWindowDays +
                ", sigmaFactor=" + sigmaFactor +
                ", percentiles=" + percentiles +
                ", cacheMaximumSize=" + cacheMaximumSize +
                ", variables=" + variables +
                '}';
    }
}
