package fr.lapetina.mcs.loadbalancer.domain.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for creating load balancing strategies by configuration name.
 */
public final class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    public static final String ROUND_ROBIN = "round-robin";
    public static final String LEAST_CONNECTIONS = "least-connections";

    private static final Map<String, Supplier<LoadBalancingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        // Register built-in strategies
        register(ROUND_ROBIN, RoundRobinStrategy::new);
        register(LEAST_CONNECTIONS, LeastConnectionsStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<LoadBalancingStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @param name Strategy name from configuration
     * @return Strategy instance, or empty if not found
     */
    public static Optional<LoadBalancingStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<LoadBalancingStrategy> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, with default fallback.
     *
     * @param name Strategy name from configuration
     * @param defaultStrategy Default if name not found
     * @return Strategy instance
     */
    public static LoadBalancingStrategy createOrDefault(
            String name,
            LoadBalancingStrategy defaultStrategy
    ) {
        Optional<LoadBalancingStrategy> strategy = create(name);
        if (strategy.isEmpty()) {
            log.warn("Unknown load balancing strategy '{}', known={}, using {}",
                    name, getRegisteredNames(), defaultStrategy.getName());
            return defaultStrategy;
        }
        return strategy.get();
    }

    /**
     * Returns all registered strategy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
