package com.loglens.core.config;

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
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link LogLensConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #load(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*}/{@code from*} method calls
 * {@link LogLensConfig#validate()} after parsing, so a bad file stops the
 * application before any event is processed.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the config location. */
    public static final String ENV_CONFIG_PATH = "LOGLENS_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "loglens.yml";

    private ConfigLoader() {
        // utility class
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Load using the environment variable, falling back to the classpath default.
     */
    public static LogLensConfig load() {
        return load(null);
    }

    /**
     * Load using the full resolution order.
     *
     * @param explicitPath file used when the environment variable is unset;
     *                     may be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigurationException if parsing or validation fails
     */
    public static LogLensConfig load(String explicitPath) {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading LogLens config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (explicitPath != null && !explicitPath.isBlank()) {
            LOG.info("Loading LogLens config from: {}", explicitPath);
            return fromFile(explicitPath);
        }
        LOG.info("Loading LogLens config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws ConfigurationException   if reading, parsing or validation fails
     */
    public static LogLensConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigurationException   if reading, parsing or validation fails
     */
    public static LogLensConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse YAML text directly.
     *
     * @throws ConfigurationException if parsing or validation fails
     */
    public static LogLensConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "YAML text must not be null");
        try (Reader reader = new StringReader(yaml)) {
            return parseAndValidate(reader, "<string>");
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read YAML text", e);
        }
    }

    // -------------------------------------------------------------------------
    // Internal
    // -------------------------------------------------------------------------

    private static LogLensConfig parseAndValidate(InputStream is, String origin) {
        LogLensConfig config;
        try {
            config = newYaml().load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in " + origin + ": " + e.getMessage(), e);
        }
        return validated(config, origin);
    }

    private static LogLensConfig parseAndValidate(Reader reader, String origin) {
        LogLensConfig config;
        try {
            config = newYaml().load(reader);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in " + origin + ": " + e.getMessage(), e);
        }
        return validated(config, origin);
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(LogLensConfig.class, options));
    }

    private static LogLensConfig validated(LogLensConfig config, String origin) {
        if (config == null) {
            LOG.warn("Empty LogLens configuration in {}", origin);
            config = new LogLensConfig();
        }
        config.validate();
        LOG.info("Loaded {} metric(s) and {} anomaly rule(s) from {}",
                config.getMetrics().size(), config.getAnomalies().size(), origin);
        return config;
    }
}
