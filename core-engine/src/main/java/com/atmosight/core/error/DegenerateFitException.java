package com.atmosight.core.error;

/**
 * Raised when no model can describe the samples: too few distinct years or
 * values, or values with zero variance.
 *
 * @since 1.0.0
 */
public class DegenerateFitException extends ClimatologyException {

    private static final long serialVersionUID = 1L;

    public DegenerateFitException(AnalysisStage stage, String message) {
        super(stage, message);
    }

    public DegenerateFitException(AnalysisStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
