package fr.lapetina.aperture;

import fr.lapetina.aperture.domain.aperture.ApertureController;
import fr.lapetina.aperture.domain.aperture.LoadBand;
import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.strategy.Coordinate;
import fr.lapetina.aperture.domain.strategy.ProcessCoordinate;
import fr.lapetina.aperture.infrastructure.config.ApertureConfig;
import fr.lapetina.aperture.infrastructure.config.ConfigApertureSettings;
import fr.lapetina.aperture.infrastructure.config.ConfigLoader;
import fr.lapetina.aperture.infrastructure.health.NodeHealthChecker;
import fr.lapetina.aperture.infrastructure.health.NodeRegistry;
import fr.lapetina.aperture.infrastructure.health.RebuildScheduler;
import fr.lapetina.aperture.infrastructure.metrics.ApertureMetrics;
import fr.lapetina.aperture.infrastructure.net.SocketConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating a fully-wired aperture controller from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BalancerFactory factory = BalancerFactory.create("config.yaml").start()) {
 *     ApertureNode node = factory.getController().pick();
 *     // dispatch to node...
 * }
 * }</pre>
 */
public class BalancerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BalancerFactory.class);

    private final ConfigLoader configLoader;
    private final ApertureConfig config;
    private final ExecutorService connectExecutor;
    private final NodeRegistry nodeRegistry;
    private final ApertureMetrics metrics;
    private final ApertureController controller;
    private final NodeHealthChecker healthChecker;
    private final RebuildScheduler rebuildScheduler;
    private final LoadBand loadBand;

    protected BalancerFactory(String configPath) {
        log.info("Initializing BalancerFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        initializeCoordinate(config.getCoordinate());

        this.connectExecutor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "aperture-connect");
            t.setDaemon(true);
            return t;
        });

        this.metrics = new ApertureMetrics(config.getMetrics().getPrefix());

        // Settings are read from the loader on every rebuild, so reloads apply
        this.controller = ApertureController.builder()
                .settings(new ConfigApertureSettings(configLoader))
                .label(config.getLabel())
                .build();
        if (config.getMetrics().isEnabled()) {
            controller.addListener(metrics);
            metrics.registerStatus(controller::status);
        }

        // Every registry change rebuilds from the full pool
        this.nodeRegistry = new NodeRegistry();
        nodeRegistry.addListener(event -> controller.update(nodeRegistry.getAllNodes()));
        nodeRegistry.replaceAll(toNodes(config));

        ApertureConfig.HealthConfig health = config.getHealth();
        this.healthChecker = new NodeHealthChecker(
                nodeRegistry,
                Duration.ofMillis(health.getIntervalMs()),
                Duration.ofMillis(health.getConnectTimeoutMs()),
                health.getBusyThreshold(),
                health.getClosedThreshold()
        );

        this.rebuildScheduler = new RebuildScheduler(
                controller, Duration.ofMillis(config.getRebuild().getPollIntervalMs()));

        ApertureConfig.LoadBandConfig band = config.getLoadBand();
        this.loadBand = band.isEnabled()
                ? new LoadBand(controller, band.getLowLoad(), band.getHighLoad(), band.getSmoothing())
                : null;

        configLoader.addListener(this::onConfigChanged);

        log.info("BalancerFactory initialized with {} nodes", nodeRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static BalancerFactory create(String configPath) {
        return new BalancerFactory(configPath);
    }

    /**
     * Starts the health checker, the rebuild poller and configuration watching.
     */
    public BalancerFactory start() {
        healthChecker.start();
        rebuildScheduler.start();
        configLoader.startWatching();
        log.info("Balancer started");
        return this;
    }

    public ApertureController getController() {
        return controller;
    }

    public NodeRegistry getNodeRegistry() {
        return nodeRegistry;
    }

    public ApertureMetrics getMetrics() {
        return metrics;
    }

    /**
     * Returns the load band, or empty if disabled in configuration.
     */
    public Optional<LoadBand> getLoadBand() {
        return Optional.ofNullable(loadBand);
    }

    public ApertureConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private static void initializeCoordinate(ApertureConfig.CoordinateConfig coordinate) {
        if (coordinate != null && coordinate.isConfigured()) {
            ProcessCoordinate.initialize(new Coordinate(coordinate.getInstanceId(), coordinate.getTotalInstances()));
        }
    }

    private List<ApertureNode> toNodes(ApertureConfig source) {
        Duration connectTimeout = Duration.ofMillis(source.getHealth().getConnectTimeoutMs());
        return source.getNodes().stream()
                .map(nodeConfig -> ApertureNode.builder()
                        .factory(new SocketConnectionFactory(nodeConfig.getAddress(), connectTimeout, connectExecutor))
                        .build())
                .toList();
    }

    private void onConfigChanged(ApertureConfig oldConfig, ApertureConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        ApertureConfig.CoordinateConfig before = oldConfig != null ? oldConfig.getCoordinate() : null;
        ApertureConfig.CoordinateConfig after = newConfig.getCoordinate();
        if (before != null && after != null
                && (before.getInstanceId() != after.getInstanceId()
                || before.getTotalInstances() != after.getTotalInstances())) {
            log.warn("Coordinate changes require a restart, keeping current coordinate: {}",
                    ProcessCoordinate.current().orElse(null));
        }

        // Existing addresses keep their nodes; the REPLACED event rebuilds with the new settings
        nodeRegistry.replaceAll(toNodes(newConfig));
    }

    @Override
    public void close() {
        rebuildScheduler.close();
        healthChecker.close();
        configLoader.close();
        metrics.close();
        connectExecutor.shutdown();
        try {
            if (!connectExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                connectExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            connectExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("BalancerFactory closed");
    }
}
