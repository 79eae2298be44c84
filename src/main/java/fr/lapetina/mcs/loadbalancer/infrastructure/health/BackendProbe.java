package fr.lapetina.mcs.loadbalancer.infrastructure.health;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;

import java.io.IOException;
import java.time.Duration;

/**
 * Lightweight liveness check of a single backend.
 */
@FunctionalInterface
public interface BackendProbe {

    /**
     * Probes a backend, returning normally on success.
     *
     * @param backend Backend to probe
     * @param timeout Upper bound for the whole probe
     * @throws IOException if the backend is unreachable or did not answer in time
     */
    void probe(BackendEndpoint backend, Duration timeout) throws IOException;
}
