package fr.lapetina.mcs.loadbalancer.routing.exception;

/**
 * Thrown when a dispatch finds no eligible backend.
 *
 * This occurs when:
 * - The registry reports no backend
 * - Every registered backend is marked unhealthy
 * - Every eligible backend was excluded after a failed connect
 */
public final class NoBackendsAvailableException extends RuntimeException {

    private final int knownBackends;

    public NoBackendsAvailableException(String message, int knownBackends) {
        super(message);
        this.knownBackends = knownBackends;
    }

    /**
     * Number of backends in the pool, eligible or not, at dispatch time.
     */
    public int getKnownBackends() {
        return knownBackends;
    }
}
