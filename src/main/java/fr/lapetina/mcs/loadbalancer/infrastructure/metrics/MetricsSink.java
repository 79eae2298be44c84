package fr.lapetina.mcs.loadbalancer.infrastructure.metrics;

/**
 * Receives metric events from the load balancer components.
 *
 * Implementations must never block the caller: connection threads publish
 * on their hot path.
 */
public interface MetricsSink {

    /**
     * Publishes a metric event.
     *
     * @param type Event kind
     * @param backend Backend address, or null when the event is not tied to a backend
     * @param reason Free-form reason tag (rejections), or null
     * @param clientToBackendBytes Bytes copied from client to backend (close events)
     * @param backendToClientBytes Bytes copied from backend to client (close events)
     */
    void publish(MetricEventType type, String backend, String reason,
                 long clientToBackendBytes, long backendToClientBytes);

    default void publish(MetricEventType type) {
        publish(type, null, null, 0, 0);
    }

    default void publish(MetricEventType type, String backend) {
        publish(type, backend, null, 0, 0);
    }

    default void reject(String reason) {
        publish(MetricEventType.CONNECTION_REJECTED, null, reason, 0, 0);
    }
}
