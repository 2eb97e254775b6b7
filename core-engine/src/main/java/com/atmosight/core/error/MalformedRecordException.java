package com.atmosight.core.error;

/**
 * Raised when raw input cannot be parsed into a valid time series: an unparsable
 * date, a non-finite value, a foreign variable or a duplicated date with
 * conflicting values.
 *
 * @since 1.0.0
 */
public class MalformedRecordException extends ClimatologyException {

    private static final long serialVersionUID = 1L;

    public MalformedRecordException(AnalysisStage stage, String message) {
        super(stage, message);
    }

    public MalformedRecordException(AnalysisStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
