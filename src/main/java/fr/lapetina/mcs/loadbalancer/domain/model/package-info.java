/**
 * Domain model classes representing backends of the load balancer.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint} - Thread-safe record of one backend chat server</li>
 *   <li>{@link fr.lapetina.mcs.loadbalancer.domain.model.BackendHealth} - Backend health states (UNKNOWN, HEALTHY, UNHEALTHY)</li>
 *   <li>{@link fr.lapetina.mcs.loadbalancer.domain.model.HealthTransition} - Outcome of applying one probe result</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code BackendEndpoint} keeps registry presence, health and the failure counter in a single
 * immutable {@code State} held by an {@code AtomicReference}, and its active connection count in an
 * {@code AtomicInteger} that never goes below zero.
 *
 * @see fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint
 */
package fr.lapetina.mcs.loadbalancer.domain.model;
