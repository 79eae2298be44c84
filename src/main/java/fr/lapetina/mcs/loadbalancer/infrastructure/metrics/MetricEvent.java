package fr.lapetina.mcs.loadbalancer.infrastructure.metrics;

/**
 * Mutable metric event living in the Disruptor ring buffer.
 *
 * Instances are pre-allocated and reused: producers overwrite every field
 * through {@link #set} before publishing.
 */
public final class MetricEvent {

    private MetricEventType type;
    private String backend;
    private String reason;
    private long clientToBackendBytes;
    private long backendToClientBytes;

    public void set(
            MetricEventType type,
            String backend,
            String reason,
            long clientToBackendBytes,
            long backendToClientBytes
    ) {
        this.type = type;
        this.backend = backend;
        this.reason = reason;
        this.clientToBackendBytes = clientToBackendBytes;
        this.backendToClientBytes = backendToClientBytes;
    }

    public void clear() {
        set(null, null, null, 0, 0);
    }

    public MetricEventType getType() {
        return type;
    }

    public String getBackend() {
        return backend;
    }

    public String getReason() {
        return reason;
    }

    public long getClientToBackendBytes() {
        return clientToBackendBytes;
    }

    public long getBackendToClientBytes() {
        return backendToClientBytes;
    }

    @Override
    public String toString() {
        return "MetricEvent{" +
                "type=" + type +
                ", backend='" + backend + '\'' +
                ", reason='" + reason + '\'' +
                '}';
    }
}
