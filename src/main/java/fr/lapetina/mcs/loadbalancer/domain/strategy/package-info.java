/**
 * Scheduling policies for distributing client connections across backends.
 *
 * <p>Strategies operate on an ordered snapshot of eligible backends taken from the
 * {@link fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool}. All implementations are
 * thread-safe for concurrent use from connection threads.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through eligible backends in address order</td></tr>
 *   <tr><td>{@code least-connections}</td><td>Selects the backend with the fewest active connections</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LoadBalancingStrategy strategy = StrategyFactory.create("least-connections").orElseThrow();
 * Optional<BackendEndpoint> backend = strategy.select(pool.snapshotEligible());
 * }</pre>
 *
 * @see fr.lapetina.mcs.loadbalancer.domain.strategy.LoadBalancingStrategy
 * @see fr.lapetina.mcs.loadbalancer.domain.strategy.StrategyFactory
 */
package fr.lapetina.mcs.loadbalancer.domain.strategy;
