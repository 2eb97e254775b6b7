package com.atmosight.core.error;

/**
 * Raised when too little valid history remains for a statistic to be
 * meaningful. The pipeline never pads the record with fabricated values.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends ClimatologyException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(AnalysisStage stage, String message) {
        super(stage, message);
    }

    public InsufficientDataException(AnalysisStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
