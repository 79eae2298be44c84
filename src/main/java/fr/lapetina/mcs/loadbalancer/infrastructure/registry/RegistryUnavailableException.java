package fr.lapetina.mcs.loadbalancer.infrastructure.registry;

/**
 * Thrown when the registry cannot be queried.
 */
public class RegistryUnavailableException extends RuntimeException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
