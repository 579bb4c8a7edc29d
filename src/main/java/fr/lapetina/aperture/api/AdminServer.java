package fr.lapetina.aperture.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.aperture.api.dto.ApertureSnapshot;
import fr.lapetina.aperture.domain.aperture.ApertureController;
import fr.lapetina.aperture.domain.model.NodeStatus;
import fr.lapetina.aperture.infrastructure.metrics.ApertureMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Lightweight admin HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /aperture - Current window, strategy and metadata as JSON
 * - GET /health - Aggregate window status (200 when OPEN or BUSY, 503 when CLOSED)
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /aperture/rebuild - Force a rebuild
 */
public final class AdminServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ApertureController controller;
    private final ApertureMetrics metrics;

    public AdminServer(
            int port,
            int backlog,
            ApertureController controller,
            ApertureMetrics metrics
    ) throws IOException {
        this.controller = controller;
        this.metrics = metrics;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(port), backlog
        );

        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "admin-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/aperture", new ApertureHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("Admin server configured on port {}", port);
    }

    public void start() {
        server.start();
        log.info("Admin server started");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        log.info("Admin server stopped");
    }

    // ==================== APERTURE HANDLER ====================

    private class ApertureHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                String path = exchange.getRequestURI().getPath();
                String method = exchange.getRequestMethod();

                if (path.equals("/aperture/rebuild") && "POST".equalsIgnoreCase(method)) {
                    controller.rebuild();
                    sendJson(exchange, 200, ApertureSnapshot.from(controller));
                } else if (path.equals("/aperture") && "GET".equalsIgnoreCase(method)) {
                    sendJson(exchange, 200, ApertureSnapshot.from(controller));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error handling aperture request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            NodeStatus status = controller.status();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status.name());
            health.put("window", controller.window().size());
            health.put("poolSize", controller.getPoolSize());
            health.put("timestamp", System.currentTimeMillis());

            int statusCode = status == NodeStatus.CLOSED ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            byte[] body = metrics.scrape().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("status", statusCode);
        sendJson(exchange, statusCode, error);
    }
}
