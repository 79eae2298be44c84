package fr.lapetina.mcs.loadbalancer.infrastructure.pool;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;
import fr.lapetina.mcs.loadbalancer.domain.model.BackendHealth;
import fr.lapetina.mcs.loadbalancer.domain.model.HealthTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Authoritative set of backends and their live state.
 *
 * Thread-safe storage shared by the registry client and health checker (writers)
 * and by connection threads (readers). Every mutation is a single-key atomic
 * operation on the underlying map; nothing here performs network I/O.
 */
public final class BackendPool {

    private static final Logger log = LoggerFactory.getLogger(BackendPool.class);

    private static final Comparator<BackendEndpoint> BY_ADDRESS = Comparator.comparing(BackendEndpoint::getAddress);

    private final Map<String, BackendEndpoint> backends = new ConcurrentHashMap<>();
    private final List<Consumer<BackendPoolEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public BackendPool(Clock clock) {
        this.clock = clock;
    }

    public BackendPool() {
        this(Clock.systemUTC());
    }

    /**
     * Merges a partial update into a backend record, creating it if absent.
     *
     * @param address backend address as host:port
     * @param registryPresent new registry presence, or null to leave unchanged
     * @param health new health, or null to leave unchanged
     * @return the backend record
     * @throws IllegalArgumentException if the address is not a valid host:port
     */
    public BackendEndpoint upsert(String address, Boolean registryPresent, BackendHealth health) {
        Instant now = clock.instant();
        BackendEndpoint.State[] before = new BackendEndpoint.State[1];

        BackendEndpoint endpoint = backends.compute(address, (key, existing) -> {
            if (existing == null) {
                return BackendEndpoint.builder()
                        .address(key)
                        .registryPresent(Boolean.TRUE.equals(registryPresent))
                        .health(health != null ? health : BackendHealth.UNKNOWN)
                        .createdAt(now)
                        .build();
            }
            before[0] = existing.getState();
            existing.apply(registryPresent, health, now);
            return existing;
        });

        BackendEndpoint.State previous = before[0];
        BackendEndpoint.State current = endpoint.getState();
        if (previous == null) {
            log.info("Backend added: address={}, registryPresent={}, health={}",
                    address, current.registryPresent(), current.health());
            notifyListeners(new BackendPoolEvent(BackendPoolEvent.Type.ADDED, endpoint));
            return endpoint;
        }
        if (previous.registryPresent() != current.registryPresent()) {
            log.info("Backend registry presence changed: address={}, {} -> {}, activeConnections={}",
                    address, previous.registryPresent(), current.registryPresent(),
                    endpoint.getActiveConnections());
            notifyListeners(new BackendPoolEvent(BackendPoolEvent.Type.PRESENCE_CHANGED, endpoint));
        }
        if (previous.health() != current.health()) {
            log.info("Backend health changed: address={}, {} -> {}", address, previous.health(), current.health());
            notifyListeners(new BackendPoolEvent(BackendPoolEvent.Type.HEALTH_CHANGED, endpoint));
        }
        return endpoint;
    }

    /**
     * Removes a backend only if it left the registry and has no active connection.
     *
     * @return true if the record was removed
     */
    public boolean removeIfDrained(String address) {
        return removeIf(address, BackendEndpoint::isDrained);
    }

    /**
     * Removes every drained backend whose registry absence is older than the grace period.
     *
     * @return addresses of the removed backends
     */
    public List<String> purgeDrained(Duration gracePeriod) {
        Instant cutoff = clock.instant().minus(gracePeriod);
        List<String> purged = new ArrayList<>();
        for (String address : new ArrayList<>(backends.keySet())) {
            boolean removed = removeIf(address, backend -> backend.isDrained()
                    && backend.getAbsentSince() != null
                    && !backend.getAbsentSince().isAfter(cutoff));
            if (removed) {
                purged.add(address);
            }
        }
        return purged;
    }

    /**
     * Marks as absent every registry-present backend not seen since the cutoff.
     * Used as a local fallback while the registry itself cannot be reached.
     *
     * @return addresses of the expired backends
     */
    public List<String> expireUnseenSince(Instant cutoff) {
        List<String> expired = new ArrayList<>();
        for (BackendEndpoint backend : getAllBackends()) {
            Instant lastSeen = backend.getLastSeen();
            if (backend.isRegistryPresent() && lastSeen != null && lastSeen.isBefore(cutoff)) {
                upsert(backend.getAddress(), false, null);
                expired.add(backend.getAddress());
            }
        }
        return expired;
    }

    private boolean removeIf(String address, Predicate<BackendEndpoint> condition) {
        BackendEndpoint[] removed = new BackendEndpoint[1];
        backends.computeIfPresent(address, (key, existing) -> {
            if (condition.test(existing)) {
                removed[0] = existing;
                return null;
            }
            return existing;
        });
        if (removed[0] != null) {
            log.info("Backend removed: {}", removed[0]);
            notifyListeners(new BackendPoolEvent(BackendPoolEvent.Type.REMOVED, removed[0]));
            return true;
        }
        return false;
    }

    /**
     * Returns a point-in-time list of eligible backends ordered by address.
     */
    public List<BackendEndpoint> snapshotEligible() {
        return backends.values().stream()
                .filter(BackendEndpoint::isEligible)
                .sorted(BY_ADDRESS)
                .toList();
    }

    /**
     * Increments the active connection count of a backend.
     *
     * @return false if the backend is no longer in the pool
     */
    public boolean incrementConnections(String address) {
        return backends.computeIfPresent(address, (key, existing) -> {
            existing.incrementConnections();
            return existing;
        }) != null;
    }

    /**
     * Decrements the active connection count of a backend, never below zero.
     *
     * @return false if the backend is unknown or its count was already zero
     */
    public boolean decrementConnections(String address) {
        int[] remaining = {-1};
        backends.computeIfPresent(address, (key, existing) -> {
            remaining[0] = existing.decrementConnections();
            return existing;
        });
        if (remaining[0] < 0) {
            log.warn("Connection count not decremented: address={}, known={}", address, backends.containsKey(address));
            return false;
        }
        return true;
    }

    /**
     * Applies a successful probe to a backend.
     *
     * @return the resulting transition, or empty if the backend is unknown
     */
    public Optional<HealthTransition> recordProbeSuccess(String address) {
        return applyProbe(address, BackendEndpoint::recordProbeSuccess);
    }

    /**
     * Applies a failed probe to a backend.
     *
     * @return the resulting transition, or empty if the backend is unknown
     */
    public Optional<HealthTransition> recordProbeFailure(String address, int failureThreshold) {
        return applyProbe(address, backend -> backend.recordProbeFailure(failureThreshold));
    }

    private Optional<HealthTransition> applyProbe(
            String address,
            Function<BackendEndpoint, HealthTransition> probeResult
    ) {
        HealthTransition[] transition = new HealthTransition[1];
        BackendEndpoint endpoint = backends.computeIfPresent(address, (key, existing) -> {
            transition[0] = probeResult.apply(existing);
            return existing;
        });
        if (endpoint == null) {
            return Optional.empty();
        }
        if (transition[0].changed()) {
            log.info("Backend health changed: address={}, {} -> {}, consecutiveFailures={}",
                    address, transition[0].previous(), transition[0].current(),
                    transition[0].consecutiveFailures());
            notifyListeners(new BackendPoolEvent(BackendPoolEvent.Type.HEALTH_CHANGED, endpoint));
        }
        return Optional.of(transition[0]);
    }

    /**
     * Gets a backend by address.
     */
    public Optional<BackendEndpoint> getBackend(String address) {
        return Optional.ofNullable(backends.get(address));
    }

    /**
     * Gets all known backends ordered by address, eligible or not.
     */
    public List<BackendEndpoint> getAllBackends() {
        return backends.values().stream()
                .sorted(BY_ADDRESS)
                .toList();
    }

    /**
     * Gets the addresses of backends currently present in the registry.
     */
    public List<String> getPresentAddresses() {
        return backends.values().stream()
                .filter(BackendEndpoint::isRegistryPresent)
                .map(BackendEndpoint::getAddress)
                .sorted()
                .toList();
    }

    /**
     * Returns the number of known backends.
     */
    public int size() {
        return backends.size();
    }

    /**
     * Returns the number of eligible backends.
     */
    public int eligibleCount() {
        return (int) backends.values().stream()
                .filter(BackendEndpoint::isEligible)
                .count();
    }

    /**
     * Sum of active connections across all backends.
     */
    public int totalActiveConnections() {
        return backends.values().stream()
                .mapToInt(BackendEndpoint::getActiveConnections)
                .sum();
    }

    /**
     * Adds a listener for pool events.
     */
    public void addListener(Consumer<BackendPoolEvent> listener) {
        listeners.add(listener);
    }

    private void notifyListeners(BackendPoolEvent event) {
        for (Consumer<BackendPoolEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying pool listener: event={}", event.type(), e);
            }
        }
    }
}
