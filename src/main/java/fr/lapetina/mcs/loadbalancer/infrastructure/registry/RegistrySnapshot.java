package fr.lapetina.mcs.loadbalancer.infrastructure.registry;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set of backend addresses currently advertised by the registry.
 */
public record RegistrySnapshot(Set<String> addresses, Instant takenAt) {

    public RegistrySnapshot {
        addresses = Set.copyOf(addresses);
    }

    public static RegistrySnapshot empty() {
        return new RegistrySnapshot(Set.of(), Instant.EPOCH);
    }

    /**
     * Addresses present here but not in the previous snapshot, sorted.
     */
    public Set<String> addedSince(RegistrySnapshot previous) {
        Set<String> added = new TreeSet<>(addresses);
        added.removeAll(previous.addresses());
        return added;
    }

    /**
     * Addresses present in the previous snapshot but not here, sorted.
     */
    public Set<String> removedSince(RegistrySnapshot previous) {
        Set<String> removed = new TreeSet<>(previous.addresses());
        removed.removeAll(addresses);
        return removed;
    }
}
