package fr.lapetina.mcs.loadbalancer.infrastructure.metrics;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendHealth;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;
    private MeterRegistry registry;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("lb");
        registry = metrics.getRegistry();
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should track active connections and bytes")
    void shouldTrackConnections() {
        metrics.incrementAcceptedConnections();
        metrics.connectionOpened();
        metrics.connectionOpened();
        metrics.connectionClosed(100, 250);

        assertThat(metrics.getActiveConnections()).isEqualTo(1);
        assertThat(registry.get("lb_connections_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("lb_bytes_total").tag("direction", "client_to_backend").counter().count())
                .isEqualTo(100.0);
        assertThat(registry.get("lb_bytes_total").tag("direction", "backend_to_client").counter().count())
                .isEqualTo(250.0);
    }

    @Test
    @DisplayName("should count rejections per reason")
    void shouldCountRejectionsPerReason() {
        metrics.incrementRejectedConnections("no_backend");
        metrics.incrementRejectedConnections("no_backend");
        metrics.incrementRejectedConnections("backend_unreachable");

        assertThat(registry.get("lb_rejected_connections_total").tag("reason", "no_backend").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("lb_rejected_connections_total").tag("reason", "backend_unreachable")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should follow pool membership with per-backend gauges")
    void shouldFollowPoolMembership() {
        BackendPool pool = new BackendPool();
        metrics.bindPool(pool);

        pool.upsert("10.0.0.1:7000", true, BackendHealth.HEALTHY);
        pool.incrementConnections("10.0.0.1:7000");

        assertThat(registry.get("lb_backend_active_connections").tag("backend", "10.0.0.1:7000").gauge().value())
                .isEqualTo(1.0);
        assertThat(registry.get("lb_backend_health").tag("backend", "10.0.0.1:7000").gauge().value())
                .isEqualTo(2.0);
        assertThat(registry.get("lb_backends").tag("state", "eligible").gauge().value()).isEqualTo(1.0);

        pool.decrementConnections("10.0.0.1:7000");
        pool.upsert("10.0.0.1:7000", false, null);
        pool.removeIfDrained("10.0.0.1:7000");

        assertThat(registry.find("lb_backend_active_connections").tag("backend", "10.0.0.1:7000").gauge())
                .isNull();
        assertThat(registry.get("lb_backends").tag("state", "known").gauge().value()).isZero();
    }

    @Test
    @DisplayName("should expose counters in the Prometheus format")
    void shouldExposePrometheusFormat() {
        metrics.incrementHealthCheckFailures("10.0.0.2:7000");
        metrics.incrementRegistryPollFailures();
        metrics.incrementRateLimitedConnections();

        String scrape = metrics.scrape();

        assertThat(scrape)
                .contains("lb_backend_health_check_failures_total{backend=\"10.0.0.2:7000\"")
                .contains("lb_registry_poll_failures_total")
                .contains("lb_rate_limited_connections_total")
                .contains("jvm_memory_used_bytes");
    }
}
