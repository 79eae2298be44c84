/**
 * Per client IP connection and bandwidth limits.
 */
package fr.lapetina.mcs.loadbalancer.infrastructure.ratelimit;
