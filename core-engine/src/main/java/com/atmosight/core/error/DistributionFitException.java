package com.atmosight.core.error;

/**
 * Raised when the requested distribution family cannot describe the data,
 * for example log-normal requested for a record containing zeros.
 *
 * @since 1.0.0
 */
public class DistributionFitException extends ClimatologyException {

    private static final long serialVersionUID = 1L;

    public DistributionFitException(AnalysisStage stage, String message) {
        super(stage, message);
    }

    public DistributionFitException(AnalysisStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
