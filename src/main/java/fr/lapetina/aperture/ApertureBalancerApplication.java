package fr.lapetina.aperture;

import fr.lapetina.aperture.api.AdminServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the aperture balancer.
 *
 * Resolves the configured pool, keeps the aperture current and serves its
 * state on the admin port.
 */
public class ApertureBalancerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApertureBalancerApplication.class);

    private final BalancerFactory factory;
    private final AdminServer adminServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ApertureBalancerApplication(String configPath) throws Exception {
        log.info("Starting Aperture Balancer...");

        this.factory = BalancerFactory.create(configPath).start();

        this.adminServer = new AdminServer(
                factory.getConfig().getAdmin().getPort(),
                factory.getConfig().getAdmin().getBacklog(),
                factory.getController(),
                factory.getMetrics()
        );

        log.info("Aperture Balancer initialized");
    }

    public void start() {
        adminServer.start();
        log.info("Aperture Balancer started, admin on port {}", adminServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public BalancerFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Aperture Balancer...");

        try {
            adminServer.close();
        } catch (Exception e) {
            log.warn("Error closing admin server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Aperture Balancer shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            ApertureBalancerApplication app = new ApertureBalancerApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Aperture Balancer", e);
            System.exit(1);
        }
    }
}
