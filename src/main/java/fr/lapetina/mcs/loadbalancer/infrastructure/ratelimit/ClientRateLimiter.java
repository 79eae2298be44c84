package fr.lapetina.mcs.loadbalancer.infrastructure.ratelimit;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per client IP limits on new connections and on client to backend bandwidth.
 *
 * Controls:
 * - at most {@code connectionsPerSecond} new connections per second per IP
 * - {@code bytesPerSecond} read bandwidth per IP, shared by all its connections,
 *   granted in chunks of {@code burstBytes}
 *
 * Client entries idle for longer than the TTL are evicted by a periodic cleanup.
 */
public final class ClientRateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientRateLimiter.class);

    // Upper bound of a single wait for bandwidth permits before re-checking interruption
    private static final Duration BANDWIDTH_WAIT = Duration.ofSeconds(1);

    private final boolean enabled;
    private final RateLimiterConfig connectionConfig;
    private final RateLimiterConfig bandwidthConfig;
    private final Duration idleTtl;
    private final Duration cleanupInterval;
    private final Clock clock;
    private final Map<String, ClientQuota> clients = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleaner;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ClientRateLimiter(
            boolean enabled,
            int connectionsPerSecond,
            long bytesPerSecond,
            int burstBytes,
            Duration idleTtl,
            Duration cleanupInterval,
            Clock clock
    ) {
        this.enabled = enabled;
        this.idleTtl = idleTtl;
        this.cleanupInterval = cleanupInterval;
        this.clock = clock;
        this.connectionConfig = RateLimiterConfig.custom()
                .limitForPeriod(connectionsPerSecond)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build();
        // burstBytes granted every burstBytes / bytesPerSecond seconds
        long refreshNanos = Math.max(1, TimeUnit.SECONDS.toNanos(burstBytes) / bytesPerSecond);
        this.bandwidthConfig = RateLimiterConfig.custom()
                .limitForPeriod(burstBytes)
                .limitRefreshPeriod(Duration.ofNanos(refreshNanos))
                .timeoutDuration(BANDWIDTH_WAIT)
                .build();
        this.cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rate-limit-cleanup");
            t.setDaemon(true);
            return t;
        });
        log.info("ClientRateLimiter initialized: enabled={}, connectionsPerSecond={}, bytesPerSecond={}, burstBytes={}",
                enabled, connectionsPerSecond, bytesPerSecond, burstBytes);
    }

    /**
     * Creates a limiter that never limits.
     */
    public static ClientRateLimiter disabled() {
        return new ClientRateLimiter(false, 1, 1, 1, Duration.ofMinutes(5), Duration.ofMinutes(1), Clock.systemUTC());
    }

    /**
     * Starts the idle client cleanup.
     */
    public void start() {
        if (enabled && running.compareAndSet(false, true)) {
            cleaner.scheduleWithFixedDelay(
                    this::runCleanup,
                    cleanupInterval.toMillis(),
                    cleanupInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
        }
    }

    private void runCleanup() {
        try {
            int evicted = evictIdle();
            if (evicted > 0) {
                log.debug("Evicted idle clients: evicted={}, remaining={}", evicted, clients.size());
            }
        } catch (Exception e) {
            log.error("Rate limiter cleanup failed", e);
        }
    }

    /**
     * Consumes one connection permit for the client.
     *
     * @return false if the client exceeded its connection rate
     */
    public boolean tryAcquireConnection(String clientIp) {
        if (!enabled) {
            return true;
        }
        boolean permitted = quota(clientIp).connections.acquirePermission();
        if (!permitted) {
            log.warn("Connection rate limit exceeded: client={}", clientIp);
        }
        return permitted;
    }

    /**
     * Wraps a client stream so its reads are charged to the client's bandwidth.
     */
    public InputStream limit(String clientIp, InputStream in) {
        if (!enabled) {
            return in;
        }
        return new RateLimitedInputStream(in, quota(clientIp).bandwidth);
    }

    /**
     * Removes clients not seen for longer than the idle TTL.
     *
     * @return number of evicted clients
     */
    public int evictIdle() {
        long cutoff = clock.millis() - idleTtl.toMillis();
        int before = clients.size();
        clients.values().removeIf(quota -> quota.lastSeenMillis.get() < cutoff);
        return before - clients.size();
    }

    private ClientQuota quota(String clientIp) {
        ClientQuota quota = clients.computeIfAbsent(clientIp, ip -> new ClientQuota(
                RateLimiter.of("connections-" + ip, connectionConfig),
                RateLimiter.of("bandwidth-" + ip, bandwidthConfig),
                clock.millis()));
        quota.lastSeenMillis.set(clock.millis());
        return quota;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int trackedClients() {
        return clients.size();
    }

    @Override
    public void close() {
        running.set(false);
        cleaner.shutdownNow();
        clients.clear();
    }

    private static final class ClientQuota {
        private final RateLimiter connections;
        private final RateLimiter bandwidth;
        private final AtomicLong lastSeenMillis;

        private ClientQuota(RateLimiter connections, RateLimiter bandwidth, long nowMillis) {
            this.connections = connections;
            this.bandwidth = bandwidth;
            this.lastSeenMillis = new AtomicLong(nowMillis);
        }
    }
}
