package com.atmosight.core.model;

/**
 * Parametric families the distribution modeler can fit.
 *
 * @since 1.0.0
 */
public enum DistributionFamily {

    /** Symmetric; suits temperature-like variables. */
    NORMAL,

    /** Right-skewed; requires strictly positive values. */
    LOG_NORMAL,

    /** Right-skewed; tolerates zeros, e.g. dry days in a rainfall record. */
    GAMMA
}
