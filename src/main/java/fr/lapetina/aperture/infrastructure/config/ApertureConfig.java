package fr.lapetina.aperture.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the aperture balancer.
 * Designed to be populated from YAML.
 */
public class ApertureConfig {

    private String label = "default";
    private ApertureSection aperture = new ApertureSection();
    private CoordinateConfig coordinate = new CoordinateConfig();
    private LoadBandConfig loadBand = new LoadBandConfig();
    private RebuildConfig rebuild = new RebuildConfig();
    private HealthConfig health = new HealthConfig();
    private AdminConfig admin = new AdminConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private List<NodeConfig> nodes = new ArrayList<>();

    // Getters and Setters
    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public ApertureSection getAperture() { return aperture; }
    public void setAperture(ApertureSection aperture) { this.aperture = aperture; }

    public CoordinateConfig getCoordinate() { return coordinate; }
    public void setCoordinate(CoordinateConfig coordinate) { this.coordinate = coordinate; }

    public LoadBandConfig getLoadBand() { return loadBand; }
    public void setLoadBand(LoadBandConfig loadBand) { this.loadBand = loadBand; }

    public RebuildConfig getRebuild() { return rebuild; }
    public void setRebuild(RebuildConfig rebuild) { this.rebuild = rebuild; }

    public HealthConfig getHealth() { return health; }
    public void setHealth(HealthConfig health) { this.health = health; }

    public AdminConfig getAdmin() { return admin; }
    public void setAdmin(AdminConfig admin) { this.admin = admin; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<NodeConfig> getNodes() { return nodes; }
    public void setNodes(List<NodeConfig> nodes) { this.nodes = nodes; }

    /**
     * Aperture sizing and strategy flags. Read on every rebuild.
     */
    public static class ApertureSection {
        private int minAperture = 1;
        private int initAperture = 3;
        private boolean dapertureActive = false;
        private boolean eagerConnections = true;

        public int getMinAperture() { return minAperture; }
        public void setMinAperture(int minAperture) { this.minAperture = minAperture; }

        public int getInitAperture() { return initAperture; }
        public void setInitAperture(int initAperture) { this.initAperture = initAperture; }

        public boolean isDapertureActive() { return dapertureActive; }
        public void setDapertureActive(boolean dapertureActive) { this.dapertureActive = dapertureActive; }

        public boolean isEagerConnections() { return eagerConnections; }
        public void setEagerConnections(boolean eagerConnections) { this.eagerConnections = eagerConnections; }
    }

    /**
     * Position of this process on the shared ring. {@code totalInstances: 0}
     * means no coordinate.
     */
    public static class CoordinateConfig {
        private int instanceId = 0;
        private int totalInstances = 0;

        public int getInstanceId() { return instanceId; }
        public void setInstanceId(int instanceId) { this.instanceId = instanceId; }

        public int getTotalInstances() { return totalInstances; }
        public void setTotalInstances(int totalInstances) { this.totalInstances = totalInstances; }

        public boolean isConfigured() {
            return totalInstances > 0;
        }
    }

    /**
     * Load band thresholds, in outstanding requests per windowed node.
     */
    public static class LoadBandConfig {
        private boolean enabled = true;
        private double lowLoad = 0.5;
        private double highLoad = 2.0;
        private double smoothing = 0.2;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getLowLoad() { return lowLoad; }
        public void setLowLoad(double lowLoad) { this.lowLoad = lowLoad; }

        public double getHighLoad() { return highLoad; }
        public void setHighLoad(double highLoad) { this.highLoad = highLoad; }

        public double getSmoothing() { return smoothing; }
        public void setSmoothing(double smoothing) { this.smoothing = smoothing; }
    }

    /**
     * Rebuild polling configuration.
     */
    public static class RebuildConfig {
        private long pollIntervalMs = 1000;

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    /**
     * Health probe configuration.
     */
    public static class HealthConfig {
        private long intervalMs = 5000;
        private long connectTimeoutMs = 1000;
        private int busyThreshold = 1;
        private int closedThreshold = 3;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public int getBusyThreshold() { return busyThreshold; }
        public void setBusyThreshold(int busyThreshold) { this.busyThreshold = busyThreshold; }

        public int getClosedThreshold() { return closedThreshold; }
        public void setClosedThreshold(int closedThreshold) { this.closedThreshold = closedThreshold; }
    }

    /**
     * Admin HTTP server configuration.
     */
    public static class AdminConfig {
        private int port = 9990;
        private int backlog = 50;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "aperture";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * Statically resolved backend node.
     */
    public static class NodeConfig {
        private String address;

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }
    }
}
