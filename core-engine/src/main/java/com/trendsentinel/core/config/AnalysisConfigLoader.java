package com.trendsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link AnalysisConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <p>
 * {@link #load()} reads the file named by the environment variable
 * {@value #ENV_CONFIG_PATH} when it points to an existing file, and falls
 * back to the classpath resource {@value #DEFAULT_RESOURCE} otherwise.
 * {@link #fromFile(String)} and {@link #fromClasspath(String)} load one
 * explicit source.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method validates the parsed settings so that a bad
 * threshold or quorum fails before any series is analysed.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "TREND_SENTINEL_CONFIG";

    /** Classpath resource used when no override is present. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private AnalysisConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws ConfigurationException if validation fails
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
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ConfigurationException   if validation fails
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ConfigurationException   if validation fails
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalysisConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisSettings.class, options));

        AnalysisSettings settings;
        try {
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed analysis config in " + source + ": " + e.getMessage(), e);
        }

        if (settings == null) {
            LOG.warn("Analysis config {} is empty; using defaults", source);
            settings = new AnalysisSettings();
        }

        AnalysisConfig config = settings.toConfig();
        LOG.info("Loaded analysis config from {}: {}", source, config);
        return config;
    }
}
