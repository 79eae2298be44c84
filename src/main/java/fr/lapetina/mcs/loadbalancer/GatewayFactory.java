package fr.lapetina.mcs.loadbalancer;

import fr.lapetina.mcs.loadbalancer.api.AdminHttpServer;
import fr.lapetina.mcs.loadbalancer.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.mcs.loadbalancer.domain.strategy.StrategyFactory;
import fr.lapetina.mcs.loadbalancer.infrastructure.config.ConfigLoader;
import fr.lapetina.mcs.loadbalancer.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.mcs.loadbalancer.infrastructure.health.BackendHealthChecker;
import fr.lapetina.mcs.loadbalancer.infrastructure.health.TcpConnectProbe;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.DisruptorMetricsSink;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool;
import fr.lapetina.mcs.loadbalancer.infrastructure.ratelimit.ClientRateLimiter;
import fr.lapetina.mcs.loadbalancer.infrastructure.registry.RedisRegistrySource;
import fr.lapetina.mcs.loadbalancer.infrastructure.registry.RegistryClient;
import fr.lapetina.mcs.loadbalancer.infrastructure.registry.RegistryMode;
import fr.lapetina.mcs.loadbalancer.infrastructure.registry.RegistrySource;
import fr.lapetina.mcs.loadbalancer.infrastructure.tls.TlsContextFactory;
import fr.lapetina.mcs.loadbalancer.routing.BackendScheduler;
import fr.lapetina.mcs.loadbalancer.server.BackendConnector;
import fr.lapetina.mcs.loadbalancer.server.ConnectionBridge;
import fr.lapetina.mcs.loadbalancer.server.TlsFrontDoor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

/**
 * Factory for creating a fully-wired gateway from configuration.
 *
 * <p>Construction loads the TLS material first and binds nothing, so a bad
 * certificate fails before any port is taken. {@link #start()} binds and starts
 * every component; {@link #close()} stops them in reverse order.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory gateway = GatewayFactory.create("loadbalancer.yaml")) {
 *     gateway.start();
 *     // serve...
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final LoadBalancerConfig config;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final DisruptorMetricsSink metricsSink;
    private final BackendPool pool;
    private final BackendScheduler scheduler;
    private final BackendHealthChecker healthChecker;
    private final RegistryClient registryClient;
    private final ClientRateLimiter rateLimiter;
    private final ConnectionBridge bridge;
    private final TlsFrontDoor frontDoor;

    private AdminHttpServer adminServer;

    protected GatewayFactory(LoadBalancerConfig config, RegistrySource registrySourceOverride) {
        this.config = config;
        this.clock = Clock.systemUTC();

        // TLS first, nothing is bound or started if this fails
        LoadBalancerConfig.TlsConfig tls = config.getTls();
        SSLContext sslContext = TlsContextFactory.createServerContext(
                Paths.get(tls.getCertPath()), Paths.get(tls.getKeyPath()));

        // Initialize metrics
        LoadBalancerConfig.MetricsConfig metrics = config.getMetrics();
        this.metricsRegistry = new MetricsRegistry(metrics.getPrefix());
        this.metricsSink = new DisruptorMetricsSink(
                metricsRegistry, metrics.getRingBufferSize(), metrics.getWaitStrategy());

        // Initialize backend pool
        this.pool = new BackendPool(clock);
        metricsRegistry.bindPool(pool);

        // Create strategy
        LoadBalancingStrategy strategy = StrategyFactory.createOrDefault(
                config.getStrategy().getType(),
                StrategyFactory.create(StrategyFactory.ROUND_ROBIN).orElseThrow()
        );
        this.scheduler = new BackendScheduler(pool, strategy);
        log.info("Using load balancing strategy: {}", strategy.getName());

        // Initialize health checker
        LoadBalancerConfig.HealthCheckConfig health = config.getHealthCheck();
        this.healthChecker = new BackendHealthChecker(
                pool,
                new TcpConnectProbe(),
                metricsSink,
                Duration.ofMillis(health.getIntervalMs()),
                Duration.ofMillis(health.getTimeoutMs()),
                health.getFailureThreshold(),
                health.getParallelism()
        );

        // Initialize registry client (allow override for testing)
        LoadBalancerConfig.RegistryConfig registry = config.getRegistry();
        RegistrySource registrySource = registrySourceOverride != null
                ? registrySourceOverride
                : createRegistrySource(registry);
        this.registryClient = new RegistryClient(
                pool,
                registrySource,
                metricsSink,
                Duration.ofMillis(registry.getPollIntervalMs()),
                registry.getMaxConsecutiveFailures(),
                Duration.ofMillis(registry.getStaleEntryTtlMs()),
                Duration.ofMillis(registry.getDrainGraceMs()),
                clock
        );

        // Client side
        LoadBalancerConfig.RateLimitConfig limits = config.getRateLimit();
        this.rateLimiter = new ClientRateLimiter(
                limits.isEnabled(),
                limits.getConnectionsPerSecond(),
                limits.getBytesPerSecond(),
                limits.getBurstBytes(),
                Duration.ofMillis(limits.getIdleTtlMs()),
                Duration.ofMillis(limits.getCleanupIntervalMs()),
                clock
        );

        LoadBalancerConfig.BridgeConfig bridgeConfig = config.getBridge();
        this.bridge = new ConnectionBridge(
                scheduler,
                pool,
                BackendConnector.tcp(),
                healthChecker::recordConnectFailure,
                rateLimiter,
                metricsSink,
                Duration.ofMillis(bridgeConfig.getConnectTimeoutMs()),
                bridgeConfig.isRetryOnConnectFailure(),
                bridgeConfig.getBufferSize()
        );

        LoadBalancerConfig.ServerConfig server = config.getServer();
        this.frontDoor = new TlsFrontDoor(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                sslContext,
                tls.getProtocols(),
                Duration.ofMillis(server.getHandshakeTimeoutMs()),
                Duration.ofMillis(server.getShutdownDrainMs()),
                rateLimiter,
                metricsSink,
                bridge
        );

        log.info("GatewayFactory initialized: registry={}", registrySource.describe());
    }

    /**
     * Creates a gateway from the specified configuration file and the process environment.
     */
    public static GatewayFactory create(String configPath) {
        return create(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a gateway from an already loaded configuration.
     */
    public static GatewayFactory create(LoadBalancerConfig config) {
        return new GatewayFactory(config, null);
    }

    private RegistrySource createRegistrySource(LoadBalancerConfig.RegistryConfig registry) {
        try {
            return new RedisRegistrySource(
                    registry.getUrl(),
                    RegistryMode.fromConfigName(registry.getMode()),
                    registry.getKey(),
                    registry.getKeyPattern(),
                    Duration.ofMillis(registry.getHeartbeatTtlMs()),
                    Duration.ofMillis(registry.getCommandTimeoutMs()),
                    clock
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigLoader.ConfigurationException("Invalid registry configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Starts background tasks, then binds the listeners.
     *
     * @throws IOException if a listener port cannot be bound
     */
    public GatewayFactory start() throws IOException {
        metricsSink.start();
        registryClient.start();
        healthChecker.start();
        rateLimiter.start();
        frontDoor.start();

        LoadBalancerConfig.MetricsConfig metrics = config.getMetrics();
        if (metrics.isEnabled()) {
            adminServer = new AdminHttpServer(
                    metrics.getHost(),
                    metrics.getPort(),
                    pool,
                    metricsRegistry,
                    registryClient,
                    scheduler.getStrategy().getName()
            );
            adminServer.start();
        }
        log.info("Gateway started: tlsPort={}, adminPort={}",
                frontDoor.getLocalPort(), adminServer != null ? adminServer.getPort() : -1);
        return this;
    }

    public BackendPool getPool() {
        return pool;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ConnectionBridge getBridge() {
        return bridge;
    }

    public int getTlsPort() {
        return frontDoor.getLocalPort();
    }

    public int getAdminPort() {
        return adminServer != null ? adminServer.getPort() : -1;
    }

    @Override
    public void close() {
        log.info("Shutting down gateway...");

        closeQuietly("TLS listener", frontDoor);
        closeQuietly("connection bridge", bridge);
        closeQuietly("health checker", healthChecker);
        closeQuietly("registry client", registryClient);
        closeQuietly("rate limiter", rateLimiter);
        if (adminServer != null) {
            closeQuietly("admin server", adminServer);
        }
        closeQuietly("metrics sink", metricsSink);
        closeQuietly("metrics registry", metricsRegistry);

        log.info("Gateway shut down");
    }

    private static void closeQuietly(String name, AutoCloseable component) {
        try {
            component.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }
}
