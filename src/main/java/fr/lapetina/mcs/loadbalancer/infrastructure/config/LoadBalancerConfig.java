package fr.lapetina.mcs.loadbalancer.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the load balancer.
 * Designed to be populated from YAML.
 */
public class LoadBalancerConfig {

    private ServerConfig server = new ServerConfig();
    private TlsConfig tls = new TlsConfig();
    private RegistryConfig registry = new RegistryConfig();
    private StrategyConfig strategy = new StrategyConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private BridgeConfig bridge = new BridgeConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public TlsConfig getTls() { return tls; }
    public void setTls(TlsConfig tls) { this.tls = tls; }

    public RegistryConfig getRegistry() { return registry; }
    public void setRegistry(RegistryConfig registry) { this.registry = registry; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public BridgeConfig getBridge() { return bridge; }
    public void setBridge(BridgeConfig bridge) { this.bridge = bridge; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Public TLS listener configuration.
     */
    public static class ServerConfig {
        private String host = "0.0.0.0";
        private int port = 64400;
        private int backlog = 128;
        private long handshakeTimeoutMs = 10000;
        private long shutdownDrainMs = 30000;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public long getHandshakeTimeoutMs() { return handshakeTimeoutMs; }
        public void setHandshakeTimeoutMs(long handshakeTimeoutMs) { this.handshakeTimeoutMs = handshakeTimeoutMs; }

        public long getShutdownDrainMs() { return shutdownDrainMs; }
        public void setShutdownDrainMs(long shutdownDrainMs) { this.shutdownDrainMs = shutdownDrainMs; }
    }

    /**
     * PEM certificate chain and private key.
     */
    public static class TlsConfig {
        private String certPath = "tls/server.cert";
        private String keyPath = "tls/server.key";
        private List<String> protocols = new ArrayList<>(List.of("TLSv1.3", "TLSv1.2"));

        public String getCertPath() { return certPath; }
        public void setCertPath(String certPath) { this.certPath = certPath; }

        public String getKeyPath() { return keyPath; }
        public void setKeyPath(String keyPath) { this.keyPath = keyPath; }

        public List<String> getProtocols() { return protocols; }
        public void setProtocols(List<String> protocols) { this.protocols = protocols; }
    }

    /**
     * Redis backend registry configuration.
     */
    public static class RegistryConfig {
        private String url = "redis://127.0.0.1:6379";
        private String mode = "sorted-set";
        private String key = "mcs:node";
        private String keyPattern = "mcs:node:*";
        private long pollIntervalMs = 2000;
        private long heartbeatTtlMs = 5000;
        private long commandTimeoutMs = 1000;
        private int maxConsecutiveFailures = 5;
        private long staleEntryTtlMs = 30000;
        private long drainGraceMs = 5000;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getKeyPattern() { return keyPattern; }
        public void setKeyPattern(String keyPattern) { this.keyPattern = keyPattern; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

        public long getHeartbeatTtlMs() { return heartbeatTtlMs; }
        public void setHeartbeatTtlMs(long heartbeatTtlMs) { this.heartbeatTtlMs = heartbeatTtlMs; }

        public long getCommandTimeoutMs() { return commandTimeoutMs; }
        public void setCommandTimeoutMs(long commandTimeoutMs) { this.commandTimeoutMs = commandTimeoutMs; }

        public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) { this.maxConsecutiveFailures = maxConsecutiveFailures; }

        public long getStaleEntryTtlMs() { return staleEntryTtlMs; }
        public void setStaleEntryTtlMs(long staleEntryTtlMs) { this.staleEntryTtlMs = staleEntryTtlMs; }

        public long getDrainGraceMs() { return drainGraceMs; }
        public void setDrainGraceMs(long drainGraceMs) { this.drainGraceMs = drainGraceMs; }
    }

    /**
     * Load balancing strategy configuration.
     */
    public static class StrategyConfig {
        private String type = "least-connections";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * Health check configuration.
     */
    public static class HealthCheckConfig {
        private long intervalMs = 3000;
        private long timeoutMs = 500;
        private int failureThreshold = 3;
        private int parallelism = 8;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }

    /**
     * Client to backend bridging configuration.
     */
    public static class BridgeConfig {
        private long connectTimeoutMs = 2000;
        private boolean retryOnConnectFailure = true;
        private int bufferSize = 16384;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public boolean isRetryOnConnectFailure() { return retryOnConnectFailure; }
        public void setRetryOnConnectFailure(boolean retryOnConnectFailure) { this.retryOnConnectFailure = retryOnConnectFailure; }

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }
    }

    /**
     * Per client IP limits.
     */
    public static class RateLimitConfig {
        private boolean enabled = true;
        private int connectionsPerSecond = 5;
        private long bytesPerSecond = 100 * 1024;
        private int burstBytes = 16 * 1024;
        private long idleTtlMs = 300000;
        private long cleanupIntervalMs = 60000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getConnectionsPerSecond() { return connectionsPerSecond; }
        public void setConnectionsPerSecond(int connectionsPerSecond) { this.connectionsPerSecond = connectionsPerSecond; }

        public long getBytesPerSecond() { return bytesPerSecond; }
        public void setBytesPerSecond(long bytesPerSecond) { this.bytesPerSecond = bytesPerSecond; }

        public int getBurstBytes() { return burstBytes; }
        public void setBurstBytes(int burstBytes) { this.burstBytes = burstBytes; }

        public long getIdleTtlMs() { return idleTtlMs; }
        public void setIdleTtlMs(long idleTtlMs) { this.idleTtlMs = idleTtlMs; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    }

    /**
     * Metrics and admin endpoint configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String host = "0.0.0.0";
        private int port = 9000;
        private String prefix = "lb";
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }
}
