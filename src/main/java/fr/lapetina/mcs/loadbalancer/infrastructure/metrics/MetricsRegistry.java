package fr.lapetina.mcs.loadbalancer.infrastructure.metrics;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPoolEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Global and per-backend active connection gauges
 * - Accepted, rejected and rate-limited connection counters
 * - Per-backend health gauges and health-check failure counters
 * - Handshake and registry failure counters
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> healthCheckFailureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Meter>> backendGauges = new ConcurrentHashMap<>();

    // Global gauges
    private final AtomicInteger activeConnections = new AtomicInteger(0);

    private final Counter acceptedConnections;
    private final Counter rateLimitedConnections;
    private final Counter handshakeFailures;
    private final Counter registryPollFailures;
    private final Counter droppedEvents;
    private final Counter clientToBackendBytes;
    private final Counter backendToClientBytes;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_active_connections", activeConnections, AtomicInteger::get)
                .description("Number of client connections currently bridged to a backend")
                .register(registry);

        this.acceptedConnections = Counter.builder(prefix + "_connections_total")
                .description("Total number of client connections that completed the TLS handshake")
                .register(registry);

        this.rateLimitedConnections = Counter.builder(prefix + "_rate_limited_connections_total")
                .description("Client connections closed for exceeding the per-client connection rate")
                .register(registry);

        this.handshakeFailures = Counter.builder(prefix + "_handshake_failures_total")
                .description("Failed or timed out TLS handshakes")
                .register(registry);

        this.registryPollFailures = Counter.builder(prefix + "_registry_poll_failures_total")
                .description("Failed registry queries")
                .register(registry);

        this.droppedEvents = Counter.builder(prefix + "_metric_events_dropped_total")
                .description("Metric events dropped because the ring buffer was full")
                .register(registry);

        this.clientToBackendBytes = Counter.builder(prefix + "_bytes_total")
                .description("Bytes copied between clients and backends")
                .tag("direction", "client_to_backend")
                .register(registry);

        this.backendToClientBytes = Counter.builder(prefix + "_bytes_total")
                .description("Bytes copied between clients and backends")
                .tag("direction", "backend_to_client")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Registers pool-wide gauges and keeps per-backend gauges in sync with the pool.
     */
    public void bindPool(BackendPool pool) {
        Gauge.builder(prefix + "_backends", pool, BackendPool::eligibleCount)
                .description("Number of backends by state")
                .tag("state", "eligible")
                .register(registry);

        Gauge.builder(prefix + "_backends", pool, BackendPool::size)
                .description("Number of backends by state")
                .tag("state", "known")
                .register(registry);

        pool.getAllBackends().forEach(this::registerBackend);
        pool.addListener(this::onPoolEvent);
    }

    private void onPoolEvent(BackendPoolEvent event) {
        switch (event.type()) {
            case ADDED -> registerBackend(event.backend());
            case REMOVED -> removeBackend(event.backend().getAddress());
            default -> {
                // gauges read the live record
            }
        }
    }

    /**
     * Registers active-connection and health gauges for a backend.
     */
    public void registerBackend(BackendEndpoint backend) {
        backendGauges.computeIfAbsent(backend.getAddress(), address -> List.of(
                Gauge.builder(prefix + "_backend_active_connections", backend, BackendEndpoint::getActiveConnections)
                        .description("Active connections per backend")
                        .tag("backend", address)
                        .register(registry),
                Gauge.builder(prefix + "_backend_health", backend, MetricsRegistry::healthValue)
                        .description("Backend health status (0=UNHEALTHY, 1=UNKNOWN, 2=HEALTHY)")
                        .tag("backend", address)
                        .register(registry)
        ));
    }

    /**
     * Removes the gauges of a backend that left the pool. Its failure counter is kept.
     */
    public void removeBackend(String address) {
        List<Meter> meters = backendGauges.remove(address);
        if (meters != null) {
            meters.forEach(registry::remove);
        }
    }

    private static double healthValue(BackendEndpoint backend) {
        return switch (backend.getHealth()) {
            case HEALTHY -> 2;
            case UNKNOWN -> 1;
            case UNHEALTHY -> 0;
        };
    }

    public void incrementAcceptedConnections() {
        acceptedConnections.increment();
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed(long clientToBackend, long backendToClient) {
        activeConnections.decrementAndGet();
        clientToBackendBytes.increment(clientToBackend);
        backendToClientBytes.increment(backendToClient);
    }

    /**
     * Increments the rejection counter for a reason.
     */
    public void incrementRejectedConnections(String reason) {
        rejectionCounters.computeIfAbsent(reason, k ->
                Counter.builder(prefix + "_rejected_connections_total")
                        .description("Client connections closed before reaching a backend")
                        .tag("reason", reason)
                        .register(registry)
        ).increment();
    }

    public void incrementRateLimitedConnections() {
        rateLimitedConnections.increment();
    }

    public void incrementHandshakeFailures() {
        handshakeFailures.increment();
    }

    /**
     * Increments the health-check failure counter of a backend.
     */
    public void incrementHealthCheckFailures(String backend) {
        healthCheckFailureCounters.computeIfAbsent(backend, k ->
                Counter.builder(prefix + "_backend_health_check_failures_total")
                        .description("Failed health probes and backend connects per backend")
                        .tag("backend", backend)
                        .register(registry)
        ).increment();
    }

    public void incrementRegistryPollFailures() {
        registryPollFailures.increment();
    }

    public void incrementDroppedEvents() {
        droppedEvents.increment();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
