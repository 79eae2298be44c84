package fr.lapetina.mcs.loadbalancer.domain.strategy;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin load balancing strategy.
 *
 * Advances a shared cursor on every dispatch and picks the backend at
 * {@code cursor mod size} of the eligible snapshot. Only the cursor increment is
 * atomic, no lock is held across a dispatch. When the eligible set changes size the
 * rotation may be uneven for at most one turn.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicInteger cursor = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<BackendEndpoint> select(List<BackendEndpoint> eligible) {
        if (eligible == null || eligible.isEmpty()) {
            return Optional.empty();
        }

        // floorMod keeps the index valid once the counter overflows
        int index = Math.floorMod(cursor.getAndIncrement(), eligible.size());
        return Optional.of(eligible.get(index));
    }
}
