package fr.lapetina.mcs.loadbalancer.infrastructure.tls;

/**
 * Thrown when the TLS certificate or key cannot be loaded. Fatal at startup.
 */
public class TlsConfigurationException extends RuntimeException {

    public TlsConfigurationException(String message) {
        super(message);
    }

    public TlsConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
