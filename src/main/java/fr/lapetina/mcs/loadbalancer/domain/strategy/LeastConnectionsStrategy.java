package fr.lapetina.mcs.loadbalancer.domain.strategy;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Least-connections load balancing strategy.
 *
 * Selects the backend with the fewest active connections; ties go to the
 * lowest address so selection stays deterministic. Two simultaneous dispatches
 * may both pick the same momentarily idle backend, the counters even out on the
 * following dispatches.
 *
 * Thread-safe as it only reads atomic counters from BackendEndpoint.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "least-connections";
    }

    @Override
    public Optional<BackendEndpoint> select(List<BackendEndpoint> eligible) {
        if (eligible == null || eligible.isEmpty()) {
            return Optional.empty();
        }

        BackendEndpoint selected = null;
        int minConnections = Integer.MAX_VALUE;

        for (BackendEndpoint backend : eligible) {
            int connections = backend.getActiveConnections();
            if (connections < minConnections
                    || (connections == minConnections
                        && backend.getAddress().compareTo(selected.getAddress()) < 0)) {
                minConnections = connections;
                selected = backend;
            }
        }

        return Optional.ofNullable(selected);
    }
}
