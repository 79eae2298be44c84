package fr.lapetina.mcs.loadbalancer.routing;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;
import fr.lapetina.mcs.loadbalancer.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool;
import fr.lapetina.mcs.loadbalancer.routing.exception.NoBackendsAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the backend for a new client connection.
 *
 * Takes a consistent snapshot of the eligible backends from the pool and lets the
 * configured strategy choose among them. Both strategies signal exhaustion the same
 * way, with {@link NoBackendsAvailableException}.
 */
public final class BackendScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackendScheduler.class);

    private final BackendPool pool;
    private final LoadBalancingStrategy strategy;

    public BackendScheduler(BackendPool pool, LoadBalancingStrategy strategy) {
        this.pool = pool;
        this.strategy = strategy;
    }

    /**
     * Selects a backend among all eligible backends.
     *
     * @throws NoBackendsAvailableException if no backend is eligible
     */
    public BackendEndpoint dispatch() {
        return dispatch(Set.of());
    }

    /**
     * Selects a backend among eligible backends, skipping the excluded addresses.
     *
     * @param excluded addresses that must not be selected (e.g. after a failed connect)
     * @throws NoBackendsAvailableException if no backend is left to choose from
     */
    public BackendEndpoint dispatch(Set<String> excluded) {
        List<BackendEndpoint> eligible = pool.snapshotEligible();
        if (!excluded.isEmpty()) {
            eligible = eligible.stream()
                    .filter(backend -> !excluded.contains(backend.getAddress()))
                    .toList();
        }

        Optional<BackendEndpoint> selected = strategy.select(eligible);
        if (selected.isEmpty()) {
            int known = pool.size();
            String reason = known == 0
                    ? "No backend in the pool"
                    : "No eligible backend among " + known + " known";
            log.warn("No backend available: strategy={}, knownBackends={}, excluded={}, reason={}",
                    strategy.getName(), known, excluded, reason);
            throw new NoBackendsAvailableException(reason, known);
        }

        BackendEndpoint backend = selected.get();
        log.debug("Backend selected: address={}, strategy={}, activeConnections={}, eligible={}",
                backend.getAddress(), strategy.getName(), backend.getActiveConnections(), eligible.size());
        return backend;
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy;
    }
}
