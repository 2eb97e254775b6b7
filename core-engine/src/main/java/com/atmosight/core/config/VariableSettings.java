package com.atmosight.core.config;

import com.atmosight.core.model.DistributionFamily;
import com.atmosight.core.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-variable override loaded from configuration.
 *
 * <pre>
 * variables:
 *   - variable: precipitation
 *     family: log_normal
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after deserialization; it checks that both names
 * resolve.
 * </p>
 *
 * @since 1.0.0
 */
public class VariableSettings {

    /** Variable name or POWER code, e.g. "precipitation" or "PRECTOTCORR". */
    private String variable;

    /** Distribution family name: "normal", "log_normal" or "gamma". */
    private String family;

    public VariableSettings() {
    }

    public VariableSettings(String variable, String family) {
        this.variable = variable;
        this.family = family;
    }

    /**
     * @throws IllegalStateException if a field is missing or unknown
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (variable == null || variable.isBlank()) {
            errors.add("Variable settings require 'variable'");
        } else {
            try {
                Variable.parse(variable);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (family == null || family.isBlank()) {
            errors.add("Settings for '" + variable + "' require 'family'");
        } else {
            try {
                parseFamily(family);
            } catch (IllegalArgumentException e) {
                errors.add("Unknown distribution family: '" + family
                        + "'. Supported: normal, log_normal, gamma");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid VariableSettings: " + String.join("; ", errors));
        }
    }

    public Variable resolveVariable() {
        return Variable.parse(variable);
    }

    public DistributionFamily resolveFamily() {
        return parseFamily(family);
    }

    private static DistributionFamily parseFamily(String value) {
        return DistributionFamily.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    public String getVariable() {
        return variable;
    }

    public void setVariable(String variable) {
        this.variable = variable;
    }

    public String getFamily() {
        return family;
    }

    public void setFamily(String family) {
        this.family = family;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof VariableSettings that))
            return false;
        return Objects.equals(variable, that.variable) && Objects.equals(family, that.family);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, family);
    }

    @Override
    public String toString() {
        return "VariableSettings{variable='" + variable + "', family='" + family + "'}";
    }
}
