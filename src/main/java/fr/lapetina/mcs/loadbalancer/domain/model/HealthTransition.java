package fr.lapetina.mcs.loadbalancer.domain.model;

/**
 * Result of applying one probe outcome to a backend.
 *
 * @param previous health before the probe result was applied
 * @param current health after the probe result was applied
 * @param consecutiveFailures failure counter after the probe result was applied
 */
public record HealthTransition(BackendHealth previous, BackendHealth current, int consecutiveFailures) {

    public boolean changed() {
        return previous != current;
    }
}
