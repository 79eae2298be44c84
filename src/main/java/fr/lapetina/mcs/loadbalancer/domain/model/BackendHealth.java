package fr.lapetina.mcs.loadbalancer.domain.model;

/**
 * Health status of a backend as seen by the active health checker.
 *
 * UNKNOWN: Not probed yet, still routable while present in the registry
 * HEALTHY: Last probe succeeded
 * UNHEALTHY: Failed the configured number of consecutive probes, receives no traffic
 */
public enum BackendHealth {
    UNKNOWN,
    HEALTHY,
    UNHEALTHY
}
