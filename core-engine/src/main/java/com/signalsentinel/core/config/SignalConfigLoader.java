package com.signalsentinel.core.config;

import com.signalsentinel.core.exception.InvalidConfigurationException;
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
 * Loads and validates {@link SignalDetectionConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link SignalDetectionConfig#validate()}
 * after parsing so that a batch is never scored with weights that do not form
 * a convex combination or with negative thresholds.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SignalConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "SIGNAL_CONFIG_PATH";

    /** Classpath resource used when no override is given. */
    public static final String DEFAULT_RESOURCE = "signal-detection.yml";

    private SignalConfigLoader() {
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code SIGNAL_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@code signal-detection.yml} on the
     * classpath.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     * @throws InvalidConfigurationException if validation fails
     */
    public static SignalDetectionConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading signal detection config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading signal detection config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException          if {@code path} is {@code null}
     * @throws IllegalArgumentException      if the file does not exist
     * @throws IllegalStateException         if reading fails
     * @throws InvalidConfigurationException if parsing or validation fails
     */
    public static SignalDetectionConfig fromFile(String path) {
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
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException          if {@code resource} is {@code null}
     * @throws IllegalArgumentException      if the resource does not exist
     * @throws IllegalStateException         if reading fails
     * @throws InvalidConfigurationException if parsing or validation fails
     */
    public static SignalDetectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SignalConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static SignalDetectionConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SignalDetectionConfig.class, options));

        SignalDetectionConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new InvalidConfigurationException("Malformed signal detection config in " + source
                    + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Signal detection config {} is empty; using defaults", source);
            config = SignalDetectionConfig.defaults();
        }

        // Fail fast before any batch is scored
        config.validate();

        LOG.info("Loaded signal detection config from {}: {}", source, config);
        return config;
    }
}
