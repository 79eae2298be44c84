package fr.lapetina.mcs.loadbalancer.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Configuration loader.
 *
 * Resolution order:
 * - YAML file on the file system, then the same path on the classpath
 * - built-in defaults when neither exists
 * - environment variable overrides on top
 *
 * The result is validated before being returned.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_PATH = "loadbalancer.yaml";

    private static final Set<String> REGISTRY_MODES = Set.of("sorted-set", "key-pattern");

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(LoadBalancerConfig.class, loaderOptions));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    /**
     * Loads, overrides and validates the configuration.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public LoadBalancerConfig load() {
        LoadBalancerConfig config = loadFromPath();
        applyEnvironment(config);
        validate(config);
        return config;
    }

    /**
     * Loads configuration from an input stream, then applies overrides and validation.
     */
    public LoadBalancerConfig loadFromStream(InputStream inputStream) {
        LoadBalancerConfig config = parse(inputStream, "stream");
        applyEnvironment(config);
        validate(config);
        return config;
    }

    private LoadBalancerConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        log.info("Configuration file not found, using defaults: {}", configPath);
        return createDefault();
    }

    private LoadBalancerConfig parse(InputStream inputStream, String source) {
        try {
            LoadBalancerConfig config = yaml.load(inputStream);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private void applyEnvironment(LoadBalancerConfig config) {
        override("MCS_HOST", value -> config.getServer().setHost(value));
        override("MCS_PORT", value -> config.getServer().setPort(parseInt("MCS_PORT", value)));
        override("PROMETHEUS_PORT", value -> config.getMetrics().setPort(parseInt("PROMETHEUS_PORT", value)));
        override("REDIS_URL", value -> config.getRegistry().setUrl(value));
        override("TLS_CERT", value -> config.getTls().setCertPath(value));
        override("TLS_KEY", value -> config.getTls().setKeyPath(value));
        override("LB_STRATEGY", value -> config.getStrategy().setType(value));
        override("LB_REGISTRY_MODE", value -> config.getRegistry().setMode(value));
        override("LB_REGISTRY_POLL_MS",
                value -> config.getRegistry().setPollIntervalMs(parseLong("LB_REGISTRY_POLL_MS", value)));
        override("LB_HEALTH_INTERVAL_MS",
                value -> config.getHealthCheck().setIntervalMs(parseLong("LB_HEALTH_INTERVAL_MS", value)));
        override("LB_HEALTH_TIMEOUT_MS",
                value -> config.getHealthCheck().setTimeoutMs(parseLong("LB_HEALTH_TIMEOUT_MS", value)));
        override("LB_HEALTH_FAILURE_THRESHOLD",
                value -> config.getHealthCheck().setFailureThreshold(parseInt("LB_HEALTH_FAILURE_THRESHOLD", value)));
    }

    private void override(String name, Consumer<String> setter) {
        String value = environment.get(name);
        if (value != null && !value.isBlank()) {
            log.debug("Configuration override from environment: {}", name);
            setter.accept(value.trim());
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + name + ": " + value, e);
        }
    }

    /**
     * Validates a configuration.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public static void validate(LoadBalancerConfig config) {
        LoadBalancerConfig.ServerConfig server = config.getServer();
        requirePort("server.port", server.getPort());
        requirePositive("server.handshakeTimeoutMs", server.getHandshakeTimeoutMs());
        requireNonNegative("server.shutdownDrainMs", server.getShutdownDrainMs());

        LoadBalancerConfig.TlsConfig tls = config.getTls();
        requireText("tls.certPath", tls.getCertPath());
        requireText("tls.keyPath", tls.getKeyPath());
        if (tls.getProtocols() == null || tls.getProtocols().isEmpty()) {
            throw new ConfigurationException("tls.protocols must not be empty");
        }

        LoadBalancerConfig.RegistryConfig registry = config.getRegistry();
        requireText("registry.url", registry.getUrl());
        if (registry.getMode() == null
                || !REGISTRY_MODES.contains(registry.getMode().toLowerCase(Locale.ROOT))) {
            throw new ConfigurationException("registry.mode must be one of " + REGISTRY_MODES + ": "
                    + registry.getMode());
        }
        requireText("registry.key", registry.getKey());
        requireText("registry.keyPattern", registry.getKeyPattern());
        requirePositive("registry.pollIntervalMs", registry.getPollIntervalMs());
        requirePositive("registry.heartbeatTtlMs", registry.getHeartbeatTtlMs());
        requirePositive("registry.commandTimeoutMs", registry.getCommandTimeoutMs());
        requirePositive("registry.maxConsecutiveFailures", registry.getMaxConsecutiveFailures());
        requirePositive("registry.staleEntryTtlMs", registry.getStaleEntryTtlMs());
        requireNonNegative("registry.drainGraceMs", registry.getDrainGraceMs());

        requireText("strategy.type", config.getStrategy().getType());

        LoadBalancerConfig.HealthCheckConfig health = config.getHealthCheck();
        requirePositive("healthCheck.intervalMs", health.getIntervalMs());
        requirePositive("healthCheck.timeoutMs", health.getTimeoutMs());
        requirePositive("healthCheck.failureThreshold", health.getFailureThreshold());
        requirePositive("healthCheck.parallelism", health.getParallelism());

        LoadBalancerConfig.BridgeConfig bridge = config.getBridge();
        requirePositive("bridge.connectTimeoutMs", bridge.getConnectTimeoutMs());
        requirePositive("bridge.bufferSize", bridge.getBufferSize());

        LoadBalancerConfig.RateLimitConfig rateLimit = config.getRateLimit();
        if (rateLimit.isEnabled()) {
            requirePositive("rateLimit.connectionsPerSecond", rateLimit.getConnectionsPerSecond());
            requirePositive("rateLimit.bytesPerSecond", rateLimit.getBytesPerSecond());
            requirePositive("rateLimit.burstBytes", rateLimit.getBurstBytes());
            if (rateLimit.getBurstBytes() > rateLimit.getBytesPerSecond()) {
                throw new ConfigurationException("rateLimit.burstBytes must not exceed rateLimit.bytesPerSecond: "
                        + rateLimit.getBurstBytes());
            }
            requirePositive("rateLimit.idleTtlMs", rateLimit.getIdleTtlMs());
            requirePositive("rateLimit.cleanupIntervalMs", rateLimit.getCleanupIntervalMs());
        }

        LoadBalancerConfig.MetricsConfig metrics = config.getMetrics();
        if (metrics.isEnabled()) {
            requirePort("metrics.port", metrics.getPort());
        }
        requireText("metrics.prefix", metrics.getPrefix());
        int ringBufferSize = metrics.getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("metrics.ringBufferSize must be a power of 2: " + ringBufferSize);
        }
    }

    private static void requirePort(String name, int port) {
        // 0 binds an ephemeral port
        if (port < 0 || port > 65535) {
            throw new ConfigurationException(name + " out of range: " + port);
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive: " + value);
        }
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new ConfigurationException(name + " must not be negative: " + value);
        }
    }

    private static void requireText(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(name + " must not be empty");
        }
    }

    /**
     * Creates a default configuration.
     */
    public static LoadBalancerConfig createDefault() {
        return new LoadBalancerConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
