/**
 * Configuration loading and validation for the analysis pipeline.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.atmosight.core.config.AnalysisConfigLoader} into an
 * {@link com.atmosight.core.config.AnalysisConfig}; validation runs right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.atmosight.core.config;
