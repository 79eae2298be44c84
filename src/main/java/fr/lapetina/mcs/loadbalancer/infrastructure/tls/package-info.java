/**
 * TLS material loading for the public listener.
 */
package fr.lapetina.mcs.loadbalancer.infrastructure.tls;
