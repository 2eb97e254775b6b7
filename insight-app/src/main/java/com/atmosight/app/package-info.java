/**
 * Command-line shell around the core engine: reads a saved NASA POWER
 * response, runs one climatological analysis and writes the CSV/JSON
 * export bundle.
 *
 * <p>
 * Entry point: {@link com.atmosight.app.AtmoSightApp}. Configuration:
 * {@link com.atmosight.app.AppConfig}.
 * </p>
 */
package com.atmosight.app;
