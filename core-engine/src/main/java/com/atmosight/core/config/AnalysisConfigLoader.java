package com.atmosight.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link AnalysisConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 * All three open a stream and hand it to {@link #fromStream(InputStream, String)}.
 *
 * <p>
 * Every entry point validates after parsing so that a bad setting
 * fails at startup rather than in the middle of an analysis.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ATMOSIGHT_CONFIG_PATH";

    /** Classpath resource used when nothing else is configured. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private AnalysisConfigLoader() {
        // utility class
    }

    /**
     * Load using automatic resolution: {@code ATMOSIGHT_CONFIG_PATH} if set
     * and the file exists, otherwise {@value #DEFAULT_RESOURCE} on the
     * classpath.
     *
     * @return parsed and validated configuration
     */
    public static AnalysisConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading analysis config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading analysis config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Config file not found: " + path);
        }
        return open("config file " + path, () -> Files.newInputStream(file));
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        URL url = AnalysisConfigLoader.class.getClassLoader().getResource(resource);
        if (url == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        return open("classpath resource " + resource, url::openStream);
    }

    /**
     * Parse and validate YAML from an already open stream. The stream is not
     * closed.
     *
     * @param is     YAML document; must not be {@code null}
     * @param source description used in error messages
     * @return parsed and validated configuration
     * @throws IllegalStateException if parsing or validation fails
     */
    public static AnalysisConfig fromStream(InputStream is, String source) {
        Objects.requireNonNull(is, "Config stream must not be null");
        return parseAndValidate(is, source);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface StreamOpener {
        InputStream open() throws IOException;
    }

    private static AnalysisConfig open(String source, StreamOpener opener) {
        try (InputStream is = opener.open()) {
            return parseAndValidate(is, source);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + source, e);
        }
    }

    private static AnalysisConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisConfig.class, options));

        AnalysisConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analysis configuration in " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Analysis configuration in {} is empty, using defaults", source);
            config = new AnalysisConfig();
        }
        config.validate();

        LOG.info("Loaded {} from {}", config, source);
        return config;
    }
}
