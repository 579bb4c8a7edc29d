package fr.lapetina.aperture.infrastructure.health;

import fr.lapetina.aperture.domain.aperture.ApertureController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the controller's current snapshot for {@code needsRebuild()} and
 * rebuilds when it reports a recovery.
 *
 * Topology and status events rebuild immediately through the registry; this
 * loop catches recoveries that no event announced.
 */
public final class RebuildScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RebuildScheduler.class);

    private final ApertureController controller;
    private final Duration pollInterval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RebuildScheduler(ApertureController controller, Duration pollInterval) {
        this.controller = controller;
        this.pollInterval = pollInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "aperture-rebuild");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::poll,
                    pollInterval.toMillis(),
                    pollInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Rebuild scheduler started: label={}, interval={}", controller.getLabel(), pollInterval);
        }
    }

    void poll() {
        try {
            if (controller.rebuildIfNeeded()) {
                log.debug("Rebuilt after recovery: label={}", controller.getLabel());
            }
        } catch (Exception e) {
            // Keep the schedule alive; the current snapshot stays installed
            log.error("Rebuild poll failed: label={}", controller.getLabel(), e);
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
        log.info("Rebuild scheduler stopped: label={}", controller.getLabel());
    }
}
