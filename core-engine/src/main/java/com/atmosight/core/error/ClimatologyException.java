package com.atmosight.core.error;

import com.atmosight.core.model.ClimateQuery;

import java.util.Objects;

/**
 * Root of all failures raised by the climatology pipeline.
 *
 * <p>
 * Every failure is a deterministic function of the input data, so none of
 * these exceptions is retried. Each carries the {@link AnalysisStage} that
 * raised it and, once the analyzer has attached it, the {@link ClimateQuery}
 * that was being answered.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class ClimatologyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AnalysisStage stage;

    /** Query being answered; attached at most once by the analyzer. */
    private transient ClimateQuery query;

    protected ClimatologyException(AnalysisStage stage, String message) {
        super(message);
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
    }

    protected ClimatologyException(AnalysisStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
    }

    public AnalysisStage getStage() {
        return stage;
    }

    /**
     * @return the query this failure belongs to, or {@code null} if the
     *         component was called outside the analyzer
     */
    public ClimateQuery getQuery() {
        return query;
    }

    /**
     * Attach the query being answered. A query already attached is kept.
     *
     * @param query the query; must not be {@code null}
     * @return this exception, for rethrowing
     */
    public ClimatologyException withQuery(ClimateQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        if (this.query == null) {
            this.query = query;
        }
        return this;
    }

    @Override
    public String getMessage() {
        String base = "[" + stage.getLabel() + "] " + super.getMessage();
        return query == null ? base : base + " (query: " + query + ")";
    }
}
