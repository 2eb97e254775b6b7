package com.atmosight.core.error;

/**
 * Pipeline stage at which a {@link ClimatologyException} was raised.
 *
 * @since 1.0.0
 */
public enum AnalysisStage {

    NORMALIZE("normalize"),
    SELECT("select"),
    TREND("trend"),
    EXTREME("extreme"),
    DISTRIBUTION("distribution"),
    AGGREGATE("aggregate");

    private final String label;

    AnalysisStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
