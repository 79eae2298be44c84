/**
 * Client facing side of the load balancer.
 *
 * <p>{@link fr.lapetina.mcs.loadbalancer.server.TlsFrontDoor} terminates TLS,
 * {@link fr.lapetina.mcs.loadbalancer.server.ConnectionBridge} splices each client
 * with its backend over plain TCP.
 */
package fr.lapetina.mcs.loadbalancer.server;
