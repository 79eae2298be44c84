package fr.lapetina.mcs.loadbalancer.infrastructure.registry;

/**
 * Read-only view of the backend registry.
 */
public interface RegistrySource extends AutoCloseable {

    /**
     * Returns the addresses currently advertised.
     *
     * @throws RegistryUnavailableException if the registry cannot be reached or answers with an error
     */
    RegistrySnapshot fetch();

    /**
     * Human readable description for logs.
     */
    String describe();

    @Override
    void close();
}
