/**
 * Backend discovery from the Redis registry the chat servers heartbeat into.
 *
 * <p>{@link fr.lapetina.mcs.loadbalancer.infrastructure.registry.RedisRegistrySource} queries Redis,
 * {@link fr.lapetina.mcs.loadbalancer.infrastructure.registry.RegistryClient} applies each snapshot
 * to the pool on a fixed interval.
 */
package fr.lapetina.mcs.loadbalancer.infrastructure.registry;
