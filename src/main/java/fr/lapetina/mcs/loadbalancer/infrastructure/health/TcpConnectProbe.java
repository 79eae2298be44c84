package fr.lapetina.mcs.loadbalancer.infrastructure.health;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Probe that opens and immediately closes a TCP connection to the backend.
 * The chat protocol is not spoken, a completed connect is the liveness signal.
 */
public final class TcpConnectProbe implements BackendProbe {

    @Override
    public void probe(BackendEndpoint backend, Duration timeout) throws IOException {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(backend.getHost(), backend.getPort()), (int) timeout.toMillis());
        }
    }
}
