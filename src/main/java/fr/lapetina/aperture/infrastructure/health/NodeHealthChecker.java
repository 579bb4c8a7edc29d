package fr.lapetina.aperture.infrastructure.health;

import fr.lapetina.aperture.domain.model.ApertureNode;
import fr.lapetina.aperture.domain.model.NodeStatus;
import fr.lapetina.aperture.infrastructure.net.SocketConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background TCP prober for registered nodes.
 *
 * Periodically connects to each node backed by a {@link SocketConnectionFactory}
 * and maps consecutive failures to a status: OPEN on success, BUSY from
 * {@code busyThreshold} failures, CLOSED from {@code closedThreshold}. Status
 * changes are announced through the {@link NodeRegistry}, which is what
 * triggers rebuilds. Nodes with other factory types own their status and are
 * skipped.
 */
public final class NodeHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NodeHealthChecker.class);

    private final NodeRegistry nodeRegistry;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final int busyThreshold;
    private final int closedThreshold;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NodeHealthChecker(
            NodeRegistry nodeRegistry,
            Duration checkInterval,
            Duration probeTimeout,
            int busyThreshold,
            int closedThreshold
    ) {
        if (busyThreshold < 1 || closedThreshold < busyThreshold) {
            throw new IllegalArgumentException("thresholds require 1 <= busyThreshold <= closedThreshold, got "
                    + busyThreshold + "/" + closedThreshold);
        }
        this.nodeRegistry = nodeRegistry;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.busyThreshold = busyThreshold;
        this.closedThreshold = closedThreshold;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllNodes,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started with interval: {}", checkInterval);
        }
    }

    /**
     * Probes every registered node once.
     */
    public void checkAllNodes() {
        var allNodes = nodeRegistry.getAllNodes();
        log.debug("Starting health check cycle: nodeCount={}", allNodes.size());

        for (ApertureNode node : allNodes) {
            if (node.factory() instanceof SocketConnectionFactory socket) {
                checkNode(socket);
            }
        }
    }

    /**
     * Probes a single node.
     */
    public void checkNode(SocketConnectionFactory socket) {
        try {
            socket.connect()
                    .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            handleFailure(socket, ex);
                        } else {
                            handleSuccess(socket);
                        }
                    });
        } catch (Exception e) {
            handleFailure(socket, e);
        }
    }

    void handleSuccess(SocketConnectionFactory socket) {
        socket.recordSuccess();
        log.debug("Health check passed: address={}", socket.address());
        setStatus(socket, NodeStatus.OPEN);
    }

    void handleFailure(SocketConnectionFactory socket, Throwable ex) {
        int failures = socket.recordFailure();

        NodeStatus newStatus;
        if (failures >= closedThreshold) {
            newStatus = NodeStatus.CLOSED;
        } else if (failures >= busyThreshold) {
            newStatus = NodeStatus.BUSY;
        } else {
            newStatus = socket.status(); // Keep current status
        }

        log.warn("Health check failed: address={}, consecutiveFailures={}, newStatus={}, error={}",
                socket.address(), failures, newStatus, ex.getMessage());

        setStatus(socket, newStatus);
    }

    private void setStatus(SocketConnectionFactory socket, NodeStatus status) {
        NodeStatus previous = socket.setStatus(status);
        if (previous != status) {
            nodeRegistry.statusChanged(socket.address(), previous, status);
        }
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health checker stopped");
    }
}
