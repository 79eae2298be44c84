/**
 * Configuration loading.
 *
 * <p>YAML is bound onto {@link fr.lapetina.mcs.loadbalancer.infrastructure.config.LoadBalancerConfig}
 * with SnakeYAML, then environment variables ({@code MCS_PORT}, {@code REDIS_URL}, {@code TLS_CERT}, ...)
 * override individual values. Invalid values fail startup with a
 * {@link fr.lapetina.mcs.loadbalancer.infrastructure.config.ConfigLoader.ConfigurationException}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - public TLS listener, handshake timeout, shutdown drain</li>
 *   <li>{@code tls} - PEM certificate chain and key paths</li>
 *   <li>{@code registry} - Redis URL, registry mode, polling and staleness bounds</li>
 *   <li>{@code strategy} - load balancing strategy name</li>
 *   <li>{@code healthCheck} - probe interval, timeout and failure threshold</li>
 *   <li>{@code bridge} - backend connect timeout and retry</li>
 *   <li>{@code rateLimit} - per client IP connection and bandwidth limits</li>
 *   <li>{@code metrics} - admin endpoint and metric event ring buffer</li>
 * </ul>
 */
package fr.lapetina.mcs.loadbalancer.infrastructure.config;
