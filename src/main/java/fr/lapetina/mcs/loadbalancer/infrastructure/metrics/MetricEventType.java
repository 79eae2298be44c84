package fr.lapetina.mcs.loadbalancer.infrastructure.metrics;

/**
 * Kinds of metric events published by the load balancer components.
 */
public enum MetricEventType {
    /** A client completed the TLS handshake and entered the bridge */
    CONNECTION_ACCEPTED,

    /** A bridge to a backend was established */
    CONNECTION_OPENED,

    /** A bridge ended, for any reason */
    CONNECTION_CLOSED,

    /** A client was closed before reaching a backend */
    CONNECTION_REJECTED,

    /** A client exceeded its connection rate and was closed before the handshake */
    RATE_LIMITED,

    /** TLS handshake failed or timed out */
    HANDSHAKE_FAILED,

    /** A health probe or backend connect attempt failed */
    HEALTH_CHECK_FAILED,

    /** The registry could not be queried */
    REGISTRY_POLL_FAILED
}
