package fr.lapetina.steering.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * YAML configuration loader.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Explicit reload, keeping the current configuration when the new one is invalid
 * - Listener notification on changes
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "steering.yaml";

    private final AtomicReference<SteeringConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(SteeringConfig.class, loaderOptions));
    }

    public ConfigLoader() {
        this(DEFAULT_RESOURCE);
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public SteeringConfig load() {
        return publish(loadFromPath());
    }

    private SteeringConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads configuration from an input stream.
     */
    public SteeringConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private SteeringConfig parse(InputStream inputStream, String source) {
        SteeringConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source, e);
        }
        if (config == null) {
            // empty document
            config = new SteeringConfig();
        }
        validate(config, source);
        return config;
    }

    private static void validate(SteeringConfig config, String source) {
        try {
            config.getCircuitBreaker().toBreakerConfig();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid circuitBreaker section in " + source + ": " + e.getMessage(), e);
        }
        if (config.getCircuitBreaker().getBulkheadMaxConcurrent() < 0) {
            throw new ConfigurationException("circuitBreaker.bulkheadMaxConcurrent must be >= 0 in " + source);
        }
        if (config.getLoadBalancer().getAlgorithm() == null) {
            throw new ConfigurationException("loadBalancer.algorithm is required in " + source);
        }
    }

    private SteeringConfig publish(SteeringConfig config) {
        SteeringConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Returns the current configuration.
     */
    public SteeringConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Forces a configuration reload.
     */
    public SteeringConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.warn("Failed to reload configuration, keeping current: {}", e.getMessage());
            return currentConfig.get();
        }
    }

    /**
     * Adds a listener for configuration changes.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(SteeringConfig oldConfig, SteeringConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    /**
     * Creates a default configuration.
     */
    public static SteeringConfig createDefault() {
        return new SteeringConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
