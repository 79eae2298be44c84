package fr.lapetina.mcs.loadbalancer.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool;
import fr.lapetina.mcs.loadbalancer.infrastructure.registry.RegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight admin HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /health - Overall status, UP when at least one backend is eligible
 * - GET /backends - Every known backend and its state
 */
public final class AdminHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final BackendPool pool;
    private final MetricsRegistry metricsRegistry;
    private final RegistryClient registryClient;
    private final String strategyName;

    public AdminHttpServer(
            String host,
            int port,
            BackendPool pool,
            MetricsRegistry metricsRegistry,
            RegistryClient registryClient,
            String strategyName
    ) throws IOException {
        this.pool = pool;
        this.metricsRegistry = metricsRegistry;
        this.registryClient = registryClient;
        this.strategyName = strategyName;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);

        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "admin-http-" + threads.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/backends", new BackendsHandler());

        log.info("Admin HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("Admin HTTP server started on port {}", getPort());
    }

    /**
     * Returns the bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("Admin HTTP server stopped");
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            byte[] bytes = metricsRegistry.scrape().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
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

            int eligible = pool.eligibleCount();
            String status = eligible > 0 ? "UP" : "DEGRADED";

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", Instant.now());
            health.put("strategy", strategyName);
            health.put("eligibleBackends", eligible);
            health.put("knownBackends", pool.size());
            health.put("activeConnections", pool.totalActiveConnections());
            health.put("registryConsecutiveFailures", registryClient.getConsecutiveFailures());

            sendJson(exchange, "UP".equals(status) ? 200 : 503, health);
        }
    }

    // ==================== BACKENDS HANDLER ====================

    private class BackendsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<Map<String, Object>> backends = new ArrayList<>();
            for (BackendEndpoint backend : pool.getAllBackends()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("address", backend.getAddress());
                info.put("health", backend.getHealth().name());
                info.put("registryPresent", backend.isRegistryPresent());
                info.put("eligible", backend.isEligible());
                info.put("activeConnections", backend.getActiveConnections());
                info.put("consecutiveFailures", backend.getConsecutiveFailures());
                info.put("createdAt", backend.getCreatedAt());
                info.put("lastSeen", backend.getLastSeen());
                info.put("absentSince", backend.getAbsentSince());
                backends.add(info);
            }
            sendJson(exchange, 200, backends);
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }
}
