package fr.lapetina.mcs.loadbalancer.infrastructure.health;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;
import fr.lapetina.mcs.loadbalancer.domain.model.BackendHealth;
import fr.lapetina.mcs.loadbalancer.domain.model.HealthTransition;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricEventType;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricsSink;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background health checker for backends.
 *
 * Periodically probes every backend in the pool, including unhealthy and
 * draining ones, independently of registry presence. Probes run in parallel on a
 * bounded pool and their results are committed to the pool afterwards.
 *
 * State machine per backend:
 * - UNKNOWN or HEALTHY become UNHEALTHY after {@code failureThreshold} consecutive failures
 * - any state becomes HEALTHY after a single success
 */
public final class BackendHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendHealthChecker.class);

    // Extra time granted on top of the probe timeout before a probe is abandoned (slow DNS)
    private static final Duration PROBE_GRACE = Duration.ofSeconds(1);

    private final BackendPool pool;
    private final BackendProbe probe;
    private final MetricsSink metricsSink;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;
    private final Duration checkInterval;
    private final Duration probeTimeout;
    private final int failureThreshold;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public BackendHealthChecker(
            BackendPool pool,
            BackendProbe probe,
            MetricsSink metricsSink,
            Duration checkInterval,
            Duration probeTimeout,
            int failureThreshold,
            int parallelism
    ) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1: " + failureThreshold);
        }
        this.pool = pool;
        this.probe = probe;
        this.metricsSink = metricsSink;
        this.checkInterval = checkInterval;
        this.probeTimeout = probeTimeout;
        this.failureThreshold = failureThreshold;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger probeThreads = new AtomicInteger();
        this.probeExecutor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "health-probe-" + probeThreads.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCycle,
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started: interval={}, timeout={}, failureThreshold={}",
                    checkInterval, probeTimeout, failureThreshold);
        }
    }

    private void runCycle() {
        if (!running.get()) {
            return;
        }
        try {
            checkAllBackends().get(probeTimeout.plus(PROBE_GRACE).toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Health check cycle did not complete: error={}", e.toString());
        } catch (Exception e) {
            // Never let an exception cancel the scheduled task
            log.error("Health check cycle failed", e);
        }
    }

    /**
     * Probes every backend currently in the pool.
     *
     * @return future completed once every probe result has been committed
     */
    public CompletableFuture<Void> checkAllBackends() {
        List<BackendEndpoint> backends = pool.getAllBackends();
        log.debug("Starting health check cycle: backendCount={}", backends.size());

        CompletableFuture<?>[] probes = backends.stream()
                .map(this::checkBackend)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(probes);
    }

    /**
     * Probes a single backend and commits the result.
     *
     * The probe timeout runs from the moment the probe starts, time spent queued
     * behind slow probes does not count. A backend whose previous probe is still
     * running is skipped for this cycle.
     */
    public CompletableFuture<Void> checkBackend(BackendEndpoint backend) {
        String address = backend.getAddress();
        if (!inFlight.add(address)) {
            log.debug("Previous health check still running, skipping: address={}", address);
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Health check queued: address={}, currentHealth={}, consecutiveFailures={}",
                address, backend.getHealth(), backend.getConsecutiveFailures());

        CompletableFuture<Void> result = new CompletableFuture<>();
        try {
            probeExecutor.execute(() -> runProbe(backend, result));
        } catch (RejectedExecutionException e) {
            inFlight.remove(address);
            log.debug("Health check not run, checker shutting down: address={}", address);
            return CompletableFuture.completedFuture(null);
        }

        return result.handle((ignored, ex) -> {
            if (ex == null) {
                handleProbeSuccess(address);
            } else {
                handleFailure(address, unwrap(ex), "probe");
            }
            return null;
        });
    }

    private void runProbe(BackendEndpoint backend, CompletableFuture<Void> result) {
        // Backstop for probes that do not honour their own timeout (slow DNS)
        result.orTimeout(probeTimeout.plus(PROBE_GRACE).toMillis(), TimeUnit.MILLISECONDS);
        Exception failure = null;
        try {
            probe.probe(backend, probeTimeout);
        } catch (IOException | RuntimeException e) {
            failure = e;
        }
        // Released before completing, the next cycle may start as soon as the result is committed
        inFlight.remove(backend.getAddress());
        if (failure == null) {
            result.complete(null);
        } else {
            result.completeExceptionally(failure);
        }
    }

    /**
     * Feeds a failed backend connect from the connection bridge into the failure counter.
     * Counts exactly like one failed probe.
     */
    public void recordConnectFailure(String address, Throwable cause) {
        handleFailure(address, cause, "connect");
    }

    private void handleProbeSuccess(String address) {
        Optional<HealthTransition> transition = pool.recordProbeSuccess(address);
        if (transition.isEmpty()) {
            log.debug("Health check passed for a backend no longer in the pool: address={}", address);
            return;
        }
        if (transition.get().previous() == BackendHealth.UNHEALTHY) {
            log.info("Backend recovered: address={}", address);
        } else {
            log.debug("Health check passed: address={}", address);
        }
    }

    private void handleFailure(String address, Throwable cause, String source) {
        Optional<HealthTransition> transition = pool.recordProbeFailure(address, failureThreshold);
        if (transition.isEmpty()) {
            log.debug("Health check failed for a backend no longer in the pool: address={}", address);
            return;
        }

        // One metric increment per failure, not per transition
        metricsSink.publish(MetricEventType.HEALTH_CHECK_FAILED, address);

        HealthTransition result = transition.get();
        log.warn("Health check failed: address={}, source={}, consecutiveFailures={}/{}, health={}, error={}",
                address, source, result.consecutiveFailures(), failureThreshold, result.current(),
                cause != null ? cause.toString() : "none");
        if (result.changed() && result.current() == BackendHealth.UNHEALTHY) {
            log.warn("Backend marked UNHEALTHY, no longer eligible: address={}", address);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        probeExecutor.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!probeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                probeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            probeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health checker stopped");
    }
}
