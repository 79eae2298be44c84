package fr.lapetina.mcs.loadbalancer.server;

/**
 * Receives failed backend connects so they count against the backend's health.
 */
@FunctionalInterface
public interface ConnectFailureReporter {

    void onConnectFailure(String address, Throwable cause);
}
