package fr.lapetina.mcs.loadbalancer.infrastructure.registry;

import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricEventType;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricsSink;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the pool's registry presence in sync with the registry.
 *
 * Each poll:
 * - every advertised address is marked present (added if unknown, lastSeen refreshed)
 * - every present address no longer advertised is marked absent, and removed if drained
 * - drained records absent for longer than the grace period are purged
 *
 * A failed poll leaves the pool untouched. After too many consecutive failures,
 * backends not seen for the stale TTL are marked absent so the view stays bounded.
 */
public final class RegistryClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RegistryClient.class);

    private final BackendPool pool;
    private final RegistrySource source;
    private final MetricsSink metricsSink;
    private final Duration pollInterval;
    private final int maxConsecutiveFailures;
    private final Duration staleEntryTtl;
    private final Duration drainGrace;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    private volatile RegistrySnapshot lastSnapshot = RegistrySnapshot.empty();

    public RegistryClient(
            BackendPool pool,
            RegistrySource source,
            MetricsSink metricsSink,
            Duration pollInterval,
            int maxConsecutiveFailures,
            Duration staleEntryTtl,
            Duration drainGrace,
            Clock clock
    ) {
        this.pool = pool;
        this.source = source;
        this.metricsSink = metricsSink;
        this.pollInterval = pollInterval;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.staleEntryTtl = staleEntryTtl;
        this.drainGrace = drainGrace;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "registry-poller");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts periodic polling, the first poll runs immediately.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runPoll,
                    0,
                    pollInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Registry client started: source={}, pollInterval={}", source.describe(), pollInterval);
        }
    }

    private void runPoll() {
        if (!running.get()) {
            return;
        }
        try {
            pollOnce();
        } catch (Exception e) {
            // Never let an exception cancel the scheduled task
            log.error("Registry poll failed unexpectedly", e);
        }
    }

    /**
     * Runs one poll cycle.
     *
     * @return true if the registry answered
     */
    public boolean pollOnce() {
        boolean answered;
        try {
            RegistrySnapshot snapshot = source.fetch();
            applySnapshot(snapshot);
            answered = true;
        } catch (RegistryUnavailableException e) {
            onPollFailure(e);
            answered = false;
        }

        List<String> purged = pool.purgeDrained(drainGrace);
        if (!purged.isEmpty()) {
            log.info("Purged drained backends: {}", purged);
        }
        return answered;
    }

    private void applySnapshot(RegistrySnapshot snapshot) {
        int previousFailures = consecutiveFailures.getAndSet(0);
        if (previousFailures > 0) {
            log.info("Registry reachable again after {} failed polls", previousFailures);
        }

        RegistrySnapshot previous = lastSnapshot;
        Set<String> added = snapshot.addedSince(previous);
        Set<String> removed = snapshot.removedSince(previous);
        if (!added.isEmpty() || !removed.isEmpty()) {
            log.info("Registry changed: added={}, removed={}, total={}", added, removed, snapshot.addresses().size());
        } else {
            log.debug("Registry unchanged: total={}", snapshot.addresses().size());
        }

        for (String address : snapshot.addresses()) {
            try {
                pool.upsert(address, true, null);
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed registry entry: entry={}, error={}", address, e.getMessage());
            }
        }

        for (String address : pool.getPresentAddresses()) {
            if (!snapshot.addresses().contains(address)) {
                pool.upsert(address, false, null);
                if (!pool.removeIfDrained(address)) {
                    log.info("Backend left the registry, draining: address={}", address);
                }
            }
        }

        lastSnapshot = snapshot;
    }

    private void onPollFailure(RegistryUnavailableException e) {
        int failures = consecutiveFailures.incrementAndGet();
        metricsSink.publish(MetricEventType.REGISTRY_POLL_FAILED);
        log.warn("Registry poll failed, keeping last known backends: consecutiveFailures={}, error={}",
                failures, e.getMessage());

        if (failures >= maxConsecutiveFailures) {
            Instant cutoff = clock.instant().minus(staleEntryTtl);
            List<String> expired = pool.expireUnseenSince(cutoff);
            if (!expired.isEmpty()) {
                log.warn("Registry unreachable for {} polls, expired backends unseen since {}: {}",
                        failures, cutoff, expired);
            }
        }
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public RegistrySnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    /**
     * Stops polling and closes the registry source.
     */
    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        source.close();
        log.info("Registry client stopped");
    }
}
