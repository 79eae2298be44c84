package fr.lapetina.mcs.loadbalancer.server;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Opens the plain TCP connection to a backend.
 */
@FunctionalInterface
public interface BackendConnector {

    /**
     * Connects to the backend within the timeout.
     *
     * @throws IOException if the connection cannot be established
     */
    Socket connect(BackendEndpoint backend, Duration timeout) throws IOException;

    /**
     * Default connector: plain socket with Nagle disabled, chat traffic is small packets.
     */
    static BackendConnector tcp() {
        return (backend, timeout) -> {
            Socket socket = new Socket();
            try {
                socket.setTcpNoDelay(true);
                socket.connect(new InetSocketAddress(backend.getHost(), backend.getPort()), (int) timeout.toMillis());
                return socket;
            } catch (IOException | RuntimeException e) {
                socket.close();
                throw e;
            }
        };
    }
}
