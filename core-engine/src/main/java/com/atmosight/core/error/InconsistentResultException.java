package com.atmosight.core.error;

/**
 * Raised when results handed to a consumer were not derived from the same
 * {@link com.atmosight.core.model.SampleSet}. This always indicates a caller bug.
 *
 * @since 1.0.0
 */
public class InconsistentResultException extends ClimatologyException {

    private static final long serialVersionUID = 1L;

    public InconsistentResultException(AnalysisStage stage, String message) {
        super(stage, message);
    }

    public InconsistentResultException(AnalysisStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
