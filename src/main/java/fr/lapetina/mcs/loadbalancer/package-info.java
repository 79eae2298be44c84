/**
 * MCS Load Balancer - TLS terminating TCP load balancer for the MCS chat servers.
 *
 * <p>Clients connect over TLS; each connection is bridged over plain TCP to one chat
 * server picked among the healthy servers currently heartbeating in Redis.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mcs.loadbalancer.GatewayFactory} - Wires every component from
 *       YAML configuration and environment overrides</li>
 *   <li>{@link fr.lapetina.mcs.loadbalancer.McsLoadBalancerApplication} - Standalone process
 *       entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayFactory gateway = GatewayFactory.create("loadbalancer.yaml").start()) {
 *     System.out.println("Listening on " + gateway.getTlsPort());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Backend discovery from a Redis heartbeat registry, with bounded staleness</li>
 *   <li>TCP health probes with failure debouncing</li>
 *   <li>Round-robin and least-connections strategies</li>
 *   <li>Per client IP connection and bandwidth limits</li>
 *   <li>Micrometer metrics with Prometheus export, fed through a Disruptor ring buffer</li>
 * </ul>
 *
 * @see fr.lapetina.mcs.loadbalancer.GatewayFactory
 */
package fr.lapetina.mcs.loadbalancer;
