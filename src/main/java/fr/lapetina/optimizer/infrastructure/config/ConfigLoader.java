package fr.lapetina.optimizer.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link OptimizerConfig} from YAML and keeps it current.
 *
 * <p>The path is tried on the file system first, then as a classpath resource. Every
 * candidate goes through {@link ConfigValidator} before it replaces the current
 * configuration, so listeners only ever see valid configurations. File-based
 * configurations can be polled for changes with {@link #startWatching()}.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<OptimizerConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(OptimizerConfig.class, new LoaderOptions()));
    }

    /**
     * Loads and validates the configuration.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if the file is missing, unparsable or invalid
     */
    public OptimizerConfig load() {
        return apply(loadFromPath());
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public OptimizerConfig loadFromStream(InputStream inputStream) {
        return apply(parse(inputStream, "stream"));
    }

    private OptimizerConfig apply(OptimizerConfig config) {
        ConfigValidator.validate(config);
        OptimizerConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private OptimizerConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

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

    private OptimizerConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private OptimizerConfig parse(InputStream is, String source) {
        try {
            OptimizerConfig config = yaml.load(is);
            return config != null ? config : new OptimizerConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the last configuration that loaded and validated, or null before the first load.
     */
    public OptimizerConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Polls the file's modification time once a second and reloads when it moves forward.
     * Does nothing when the configuration came from the classpath.
     */
    public void startWatching() {
        startWatching(Duration.ofSeconds(1));
    }

    public synchronized void startWatching(Duration pollInterval) {
        if (watchExecutor != null) {
            return;
        }
        if (!Files.isRegularFile(configPath)) {
            log.info("Config file not on file system, hot reload disabled: path={}", configPath);
            return;
        }

        watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = pollInterval.toMillis();
        watchExecutor.scheduleWithFixedDelay(this::reloadIfModified, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Configuration hot-reload enabled: path={}, pollIntervalMs={}", configPath, intervalMs);
    }

    private void reloadIfModified() {
        try {
            long modified = Files.getLastModifiedTime(configPath).toMillis();
            if (modified > lastModified) {
                log.info("Configuration file changed, reloading: path={}", configPath);
                reload();
            }
        } catch (NoSuchFileException e) {
            log.warn("Configuration file disappeared, keeping current: path={}", configPath);
        } catch (Exception e) {
            log.error("Error checking configuration file: path={}", configPath, e);
        }
    }

    /**
     * Loads the configuration again. On any failure the current configuration stays in place.
     */
    public OptimizerConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Configuration reload rejected, keeping current: {}", e.getMessage());
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(OptimizerConfig oldConfig, OptimizerConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Config change listener failed: listener={}", listener, e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (watchExecutor == null) {
            return;
        }
        watchExecutor.shutdown();
        try {
            if (!watchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                watchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            watchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        watchExecutor = null;
    }

    /**
     * Raised when a configuration cannot be read, parsed or validated.
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
