package fr.lapetina.mcs.loadbalancer.domain.strategy;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for choosing the backend of a new client connection.
 *
 * Implementations must be thread-safe as they are called from every
 * connection thread concurrently.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and logging.
     */
    String getName();

    /**
     * Selects a backend from a snapshot of eligible backends.
     *
     * @param eligible Eligible backends ordered by address
     * @return Selected backend, or empty if the snapshot is empty
     */
    Optional<BackendEndpoint> select(List<BackendEndpoint> eligible);
}
