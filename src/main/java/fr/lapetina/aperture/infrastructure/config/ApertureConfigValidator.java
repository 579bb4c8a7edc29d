package fr.lapetina.aperture.infrastructure.config;

import com.google.common.net.HostAndPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a parsed {@link ApertureConfig} before it is installed.
 *
 * Every problem is collected and reported in a single
 * {@link ConfigLoader.ConfigurationException}, so a rejected reload leaves the
 * installed configuration untouched. Aperture sizes are the exception: the
 * controller reads a minimum below 1 as 1 and an initial aperture below the
 * minimum as the minimum, so those only produce a warning.
 */
final class ApertureConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(ApertureConfigValidator.class);

    private final List<String> problems = new ArrayList<>();

    private ApertureConfigValidator() {
    }

    static ApertureConfig validate(ApertureConfig config, String source) {
        ApertureConfigValidator validator = new ApertureConfigValidator();
        validator.check(config);
        if (!validator.problems.isEmpty()) {
            throw new ConfigLoader.ConfigurationException(
                    "Invalid configuration in " + source + ": " + String.join("; ", validator.problems));
        }
        return config;
    }

    private void check(ApertureConfig config) {
        if (config.getLabel() == null || config.getLabel().isBlank()) {
            problems.add("label must not be blank");
        }
        checkAperture(config.getAperture());
        checkCoordinate(config.getCoordinate());
        checkLoadBand(config.getLoadBand());
        checkRebuild(config.getRebuild());
        checkHealth(config.getHealth());
        checkAdmin(config.getAdmin());
        checkMetrics(config.getMetrics());
        checkNodes(config.getNodes());
    }

    private boolean present(Object section, String name) {
        if (section == null) {
            problems.add("section '" + name + "' must not be empty");
            return false;
        }
        return true;
    }

    private void checkAperture(ApertureConfig.ApertureSection aperture) {
        if (!present(aperture, "aperture")) {
            return;
        }
        if (aperture.getMinAperture() < 1) {
            log.warn("aperture.minAperture={} is below 1, the controller will use 1", aperture.getMinAperture());
        }
        if (aperture.getInitAperture() < aperture.getMinAperture()) {
            log.warn("aperture.initAperture={} is below minAperture={}, the controller will start at the minimum",
                    aperture.getInitAperture(), aperture.getMinAperture());
        }
    }

    private void checkCoordinate(ApertureConfig.CoordinateConfig coordinate) {
        if (!present(coordinate, "coordinate")) {
            return;
        }
        if (coordinate.getTotalInstances() < 0) {
            problems.add("coordinate.totalInstances must be >= 0, got " + coordinate.getTotalInstances());
        } else if (coordinate.isConfigured()
                && (coordinate.getInstanceId() < 0 || coordinate.getInstanceId() >= coordinate.getTotalInstances())) {
            problems.add("coordinate.instanceId must be in [0, " + coordinate.getTotalInstances()
                    + "), got " + coordinate.getInstanceId());
        }
    }

    private void checkLoadBand(ApertureConfig.LoadBandConfig band) {
        if (!present(band, "loadBand") || !band.isEnabled()) {
            return;
        }
        if (band.getLowLoad() < 0 || band.getHighLoad() <= band.getLowLoad()) {
            problems.add("loadBand requires 0 <= lowLoad < highLoad, got ["
                    + band.getLowLoad() + ", " + band.getHighLoad() + "]");
        }
        if (band.getSmoothing() <= 0 || band.getSmoothing() > 1) {
            problems.add("loadBand.smoothing must be in (0, 1], got " + band.getSmoothing());
        }
    }

    private void checkRebuild(ApertureConfig.RebuildConfig rebuild) {
        if (present(rebuild, "rebuild") && rebuild.getPollIntervalMs() <= 0) {
            problems.add("rebuild.pollIntervalMs must be positive, got " + rebuild.getPollIntervalMs());
        }
    }

    private void checkHealth(ApertureConfig.HealthConfig health) {
        if (!present(health, "health")) {
            return;
        }
        if (health.getIntervalMs() <= 0) {
            problems.add("health.intervalMs must be positive, got " + health.getIntervalMs());
        }
        if (health.getConnectTimeoutMs() <= 0) {
            problems.add("health.connectTimeoutMs must be positive, got " + health.getConnectTimeoutMs());
        }
        if (health.getBusyThreshold() < 1 || health.getClosedThreshold() < health.getBusyThreshold()) {
            problems.add("health requires 1 <= busyThreshold <= closedThreshold, got "
                    + health.getBusyThreshold() + "/" + health.getClosedThreshold());
        }
    }

    private void checkAdmin(ApertureConfig.AdminConfig admin) {
        if (!present(admin, "admin")) {
            return;
        }
        if (admin.getPort() < 0 || admin.getPort() > 65535) {
            problems.add("admin.port must be in [0, 65535], got " + admin.getPort());
        }
        if (admin.getBacklog() < 0) {
            problems.add("admin.backlog must be >= 0, got " + admin.getBacklog());
        }
    }

    private void checkMetrics(ApertureConfig.MetricsConfig metrics) {
        if (present(metrics, "metrics") && (metrics.getPrefix() == null || metrics.getPrefix().isBlank())) {
            problems.add("metrics.prefix must not be blank");
        }
    }

    private void checkNodes(List<ApertureConfig.NodeConfig> nodes) {
        if (!present(nodes, "nodes")) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            ApertureConfig.NodeConfig node = nodes.get(i);
            String address = node != null ? node.getAddress() : null;
            if (address == null || address.isBlank()) {
                problems.add("nodes[" + i + "] has no address");
                continue;
            }
            if (!hasHostAndPort(address)) {
                problems.add("nodes[" + i + "] address must be host:port, got '" + address + "'");
            } else if (!seen.add(address)) {
                problems.add("nodes[" + i + "] duplicates address '" + address + "'");
            }
        }
    }

    private static boolean hasHostAndPort(String address) {
        try {
            HostAndPort parsed = HostAndPort.fromString(address);
            return parsed.hasPort() && !parsed.getHost().isEmpty();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
