package fr.lapetina.mcs.loadbalancer.infrastructure.metrics;

import com.lmax.disruptor.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of the metric ring buffer: applies each event to the
 * Micrometer registry.
 */
public final class MetricsEventHandler implements EventHandler<MetricEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsEventHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsEventHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(MetricEvent event, long sequence, boolean endOfBatch) {
        try {
            apply(event);
        } finally {
            event.clear();
        }
    }

    private void apply(MetricEvent event) {
        MetricEventType type = event.getType();
        if (type == null) {
            log.debug("Skipping empty metric event: sequence slot was cleared");
            return;
        }

        switch (type) {
            case CONNECTION_ACCEPTED -> metricsRegistry.incrementAcceptedConnections();
            case CONNECTION_OPENED -> metricsRegistry.connectionOpened();
            case CONNECTION_CLOSED -> metricsRegistry.connectionClosed(
                    event.getClientToBackendBytes(), event.getBackendToClientBytes());
            case CONNECTION_REJECTED -> metricsRegistry.incrementRejectedConnections(
                    event.getReason() != null ? event.getReason() : "unknown");
            case RATE_LIMITED -> metricsRegistry.incrementRateLimitedConnections();
            case HANDSHAKE_FAILED -> metricsRegistry.incrementHandshakeFailures();
            case HEALTH_CHECK_FAILED -> metricsRegistry.incrementHealthCheckFailures(event.getBackend());
            case REGISTRY_POLL_FAILED -> metricsRegistry.incrementRegistryPollFailures();
        }
    }
}
