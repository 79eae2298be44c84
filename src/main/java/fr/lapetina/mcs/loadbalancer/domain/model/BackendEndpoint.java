package fr.lapetina.mcs.loadbalancer.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Represents a backend chat server in the pool.
 * Thread-safe for concurrent access from connection bridges, the registry client
 * and the health checker.
 *
 * Registry presence, health and the probe failure counter live in one immutable
 * {@link State} swapped atomically, so readers never see a half-applied update.
 * The active connection counter is kept apart because every bridge touches it.
 */
public final class BackendEndpoint {
    private final String address;
    private final String host;
    private final int port;
    private final Instant createdAt;

    // Mutable state - thread-safe
    private final AtomicReference<State> state;
    private final AtomicInteger activeConnections;

    private BackendEndpoint(Builder builder) {
        this.address = Objects.requireNonNull(builder.address, "Backend address is required");
        int separator = address.lastIndexOf(':');
        if (separator <= 0 || separator == address.length() - 1) {
            throw new IllegalArgumentException("Backend address must be host:port, got: " + address);
        }
        String rawHost = address.substring(0, separator);
        this.host = rawHost.startsWith("[") && rawHost.endsWith("]")
                ? rawHost.substring(1, rawHost.length() - 1)
                : rawHost;
        this.port = parsePort(address, address.substring(separator + 1));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.state = new AtomicReference<>(new State(
                builder.health,
                builder.registryPresent,
                0,
                builder.registryPresent ? createdAt : null,
                builder.registryPresent ? null : createdAt));
        this.activeConnections = new AtomicInteger(0);
    }

    private static int parsePort(String address, String rawPort) {
        try {
            int port = Integer.parseInt(rawPort);
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Backend port out of range: " + address);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Backend port is not a number: " + address, e);
        }
    }

    public String getAddress() {
        return address;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public State getState() {
        return state.get();
    }

    public BackendHealth getHealth() {
        return state.get().health();
    }

    public boolean isRegistryPresent() {
        return state.get().registryPresent();
    }

    public int getConsecutiveFailures() {
        return state.get().consecutiveFailures();
    }

    public Instant getLastSeen() {
        return state.get().lastSeen();
    }

    public Instant getAbsentSince() {
        return state.get().absentSince();
    }

    /**
     * Checks if the backend may receive new connections.
     * Eligible means present in the registry and not marked UNHEALTHY.
     */
    public boolean isEligible() {
        return state.get().isEligible();
    }

    /**
     * Checks if the backend left the registry and no connection is using it anymore.
     */
    public boolean isDrained() {
        return !state.get().registryPresent() && activeConnections.get() == 0;
    }

    /**
     * Merges a partial update. Null arguments leave the attribute unchanged.
     *
     * @return the state after the update
     */
    public State apply(Boolean registryPresent, BackendHealth health, Instant now) {
        return state.updateAndGet(current -> {
            State next = current;
            if (registryPresent != null) {
                next = registryPresent ? next.seenAt(now) : next.absentAt(now);
            }
            if (health != null) {
                next = next.withHealth(health);
            }
            return next;
        });
    }

    /**
     * Records a successful probe: the backend becomes HEALTHY at once, whatever its
     * previous health, and the failure counter is reset.
     */
    public HealthTransition recordProbeSuccess() {
        State previous = state.getAndUpdate(current ->
                new State(BackendHealth.HEALTHY, current.registryPresent(), 0,
                        current.lastSeen(), current.absentSince()));
        return new HealthTransition(previous.health(), BackendHealth.HEALTHY, 0);
    }

    /**
     * Records a failed probe. The backend turns UNHEALTHY once the failure counter
     * reaches the threshold, otherwise its health is unchanged.
     */
    public HealthTransition recordProbeFailure(int failureThreshold) {
        State[] previous = new State[1];
        State current = state.updateAndGet(s -> {
            previous[0] = s;
            int failures = s.consecutiveFailures() + 1;
            BackendHealth health = failures >= failureThreshold ? BackendHealth.UNHEALTHY : s.health();
            return new State(health, s.registryPresent(), failures, s.lastSeen(), s.absentSince());
        });
        return new HealthTransition(previous[0].health(), current.health(), current.consecutiveFailures());
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public int incrementConnections() {
        return activeConnections.incrementAndGet();
    }

    /**
     * Decrements the active connection counter, never below zero.
     *
     * @return the new count, or -1 if the counter was already zero
     */
    public int decrementConnections() {
        while (true) {
            int current = activeConnections.get();
            if (current == 0) {
                return -1;
            }
            if (activeConnections.compareAndSet(current, current - 1)) {
                return current - 1;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BackendEndpoint that = (BackendEndpoint) o;
        return address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address);
    }

    @Override
    public String toString() {
        State current = state.get();
        return "BackendEndpoint{" +
                "address='" + address + '\'' +
                ", health=" + current.health() +
                ", registryPresent=" + current.registryPresent() +
                ", activeConnections=" + activeConnections.get() +
                '}';
    }

    public static BackendEndpoint of(String address) {
        return builder().address(address).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Point-in-time view of the registry and health attributes of a backend.
     *
     * @param absentSince when registry presence was lost, null while present
     */
    public record State(
            BackendHealth health,
            boolean registryPresent,
            int consecutiveFailures,
            Instant lastSeen,
            Instant absentSince
    ) {

        public boolean isEligible() {
            return registryPresent && health != BackendHealth.UNHEALTHY;
        }

        State seenAt(Instant now) {
            return new State(health, true, consecutiveFailures, now, null);
        }

        State absentAt(Instant now) {
            if (!registryPresent) {
                return this;
            }
            return new State(health, false, consecutiveFailures, lastSeen, now);
        }

        State withHealth(BackendHealth newHealth) {
            int failures = newHealth == BackendHealth.HEALTHY ? 0 : consecutiveFailures;
            return new State(newHealth, registryPresent, failures, lastSeen, absentSince);
        }
    }

    public static final class Builder {
        private String address;
        private BackendHealth health = BackendHealth.UNKNOWN;
        private boolean registryPresent = true;
        private Instant createdAt;

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder address(String host, int port) {
            this.address = host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
            return this;
        }

        public Builder health(BackendHealth health) {
            this.health = health;
            return this;
        }

        public Builder registryPresent(boolean registryPresent) {
            this.registryPresent = registryPresent;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public BackendEndpoint build() {
            return new BackendEndpoint(this);
        }
    }
}
