package fr.lapetina.aperture.infrastructure.config;

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
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the aperture configuration and keeps it current.
 *
 * The path is tried on the file system first, then on the classpath. A parsed
 * document goes through {@link ApertureConfigValidator} before it replaces the
 * installed configuration, so listeners and {@link ConfigApertureSettings}
 * only ever observe a configuration that passed validation. When the
 * configuration comes from a file, {@link #startWatching()} polls its
 * modification time and reloads on change; a reload that fails leaves the
 * installed configuration in place.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final Path configPath;
    private final Yaml yaml;
    private final AtomicReference<ApertureConfig> installed = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile FileTime lastRead;
    private ScheduledExecutorService poller;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(ApertureConfig.class, new LoaderOptions()));
    }

    /**
     * Reads, validates and installs the configuration.
     *
     * @throws ConfigurationException if the configuration cannot be found, parsed or validated
     */
    public ApertureConfig load() {
        if (Files.isRegularFile(configPath)) {
            return install(readFile(), configPath.toString());
        }
        String resource = classpathResource();
        return install(readClasspath(resource), "classpath:" + resource);
    }

    /**
     * Parses, validates and installs a configuration read from {@code inputStream}.
     */
    public ApertureConfig loadFromStream(InputStream inputStream) {
        return install(parse(inputStream, "stream"), "stream");
    }

    /**
     * Loads again from the configured path. On failure the installed
     * configuration is kept and returned.
     */
    public ApertureConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Configuration reload rejected, keeping installed configuration: {}", e.getMessage());
            return installed.get();
        }
    }

    public ApertureConfig getCurrentConfig() {
        return installed.get();
    }

    private ApertureConfig install(ApertureConfig candidate, String source) {
        ApertureConfig config = ApertureConfigValidator.validate(candidate, source);
        ApertureConfig previous = installed.getAndSet(config);
        log.info("Configuration installed from {}: label={}, nodes={}",
                source, config.getLabel(), config.getNodes().size());
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (Exception e) {
                log.error("Config change listener failed", e);
            }
        }
        return config;
    }

    private ApertureConfig readFile() {
        try (InputStream in = Files.newInputStream(configPath)) {
            lastRead = Files.getLastModifiedTime(configPath);
            return parse(in, configPath.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + configPath, e);
        }
    }

    private ApertureConfig readClasspath(String resource) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration not found on file system or classpath: " + configPath);
            }
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read classpath configuration " + resource, e);
        }
    }

    private String classpathResource() {
        String resource = configPath.toString().replace('\\', '/');
        return resource.startsWith("/") ? resource.substring(1) : resource;
    }

    private ApertureConfig parse(InputStream in, String source) {
        try {
            ApertureConfig config = yaml.load(in);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source, e);
        }
    }

    /**
     * Polls the configuration file once per second and reloads it when its
     * modification time changes. Does nothing for a classpath configuration.
     */
    public void startWatching() {
        startWatching(DEFAULT_POLL_INTERVAL);
    }

    public synchronized void startWatching(Duration interval) {
        if (poller != null) {
            return;
        }
        if (!Files.isRegularFile(configPath)) {
            log.warn("Configuration is not a file, hot reload disabled: {}", configPath);
            return;
        }
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        poller.scheduleWithFixedDelay(this::reloadIfModified,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Configuration hot reload enabled: path={}, interval={}", configPath, interval);
    }

    void reloadIfModified() {
        try {
            FileTime modified = Files.getLastModifiedTime(configPath);
            if (!modified.equals(lastRead)) {
                log.info("Configuration file modified, reloading: {}", configPath);
                reload();
            }
        } catch (IOException e) {
            log.warn("Cannot stat configuration file {}: {}", configPath, e.getMessage());
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        if (poller == null) {
            return;
        }
        poller.shutdown();
        try {
            if (!poller.awaitTermination(5, TimeUnit.SECONDS)) {
                poller.shutdownNow();
            }
        } catch (InterruptedException e) {
            poller.shutdownNow();
            Thread.currentThread().interrupt();
        }
        poller = null;
    }

    /**
     * Configuration with every default value and no nodes.
     */
    public static ApertureConfig createDefault() {
        return new ApertureConfig();
    }

    /**
     * Raised when the configuration cannot be found, parsed or validated.
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
