package fr.lapetina.mcs.loadbalancer.integration;

import fr.lapetina.mcs.loadbalancer.GatewayFactory;
import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;
import fr.lapetina.mcs.loadbalancer.domain.model.BackendHealth;
import fr.lapetina.mcs.loadbalancer.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.mcs.loadbalancer.infrastructure.tls.TlsConfigurationException;
import fr.lapetina.mcs.loadbalancer.support.CertificateGenerator;
import fr.lapetina.mcs.loadbalancer.support.CertificateGenerator.KeyFormat;
import fr.lapetina.mcs.loadbalancer.support.CertificateGenerator.Material;
import fr.lapetina.mcs.loadbalancer.support.EchoServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests: TLS clients through the gateway to plain TCP echo backends.
 */
class GatewayIntegrationTest {

    @TempDir
    Path tlsDir;

    private Material material;
    private SSLContext clientContext;
    private EchoServer backendA;
    private EchoServer backendB;
    private TestGatewayFactory gateway;
    private final List<Socket> clients = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        material = CertificateGenerator.generate(tlsDir, KeyFormat.PKCS8);
        clientContext = CertificateGenerator.clientContext(material.certificate());
        backendA = new EchoServer("a");
        backendB = new EchoServer("b");
    }

    @AfterEach
    void tearDown() throws IOException {
        for (Socket client : clients) {
            client.close();
        }
        if (gateway != null) {
            gateway.close();
        }
        backendA.close();
        backendB.close();
    }

    private LoadBalancerConfig config() {
        return TestGatewayFactory.testConfig(material.certPem(), material.keyPem());
    }

    private TestGatewayFactory start(LoadBalancerConfig config) throws IOException {
        gateway = TestGatewayFactory.startWith(config);
        return gateway;
    }

    private static void waitUntil(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out waiting until " + description);
            }
            Thread.sleep(20);
        }
    }

    private void waitForEligible(int count) throws InterruptedException {
        waitUntil(count + " eligible backends", () -> gateway.getPool().eligibleCount() == count);
    }

    private TlsClient connect() throws IOException {
        SSLSocket socket = (SSLSocket) clientContext.getSocketFactory()
                .createSocket(InetAddress.getLoopbackAddress(), gateway.getTlsPort());
        clients.add(socket);
        socket.setSoTimeout(5000);
        socket.startHandshake();
        return new TlsClient(socket);
    }

    private static final class TlsClient {
        private final SSLSocket socket;
        private final BufferedReader reader;

        private TlsClient(SSLSocket socket) throws IOException {
            this.socket = socket;
            this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        }

        String readLine() throws IOException {
            return reader.readLine();
        }

        void send(String text) throws IOException {
            OutputStream out = socket.getOutputStream();
            out.write(text.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        void close() throws IOException {
            socket.close();
        }
    }

    private HttpResponse<String> admin(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://127.0.0.1:" + gateway.getAdminPort() + path)).GET().build();
        return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("should relay a chat session over TLS")
        void shouldRelayOverTls() throws Exception {
            start(config()).getRegistry().advertise(backendA.address());
            waitForEligible(1);

            TlsClient client = connect();

            assertThat(client.readLine()).isEqualTo("a");
            client.send("/join lobby\n");
            assertThat(client.readLine()).isEqualTo("/join lobby");
        }

        @Test
        @DisplayName("should alternate between two backends with round-robin")
        void shouldAlternateBackends() throws Exception {
            start(config()).getRegistry().advertise(backendA.address(), backendB.address());
            waitForEligible(2);

            List<String> greetings = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                greetings.add(connect().readLine());
            }

            assertThat(greetings).containsOnly("a", "b");
            assertThat(greetings.get(0)).isNotEqualTo(greetings.get(1));
            assertThat(greetings.get(2)).isEqualTo(greetings.get(0));
            assertThat(greetings.get(3)).isEqualTo(greetings.get(1));
        }

        @Test
        @DisplayName("should close clients when no backend is registered")
        void shouldCloseWithoutBackend() throws Exception {
            start(config());

            TlsClient client = connect();

            assertThat(client.readLine()).isNull();
        }

        @Test
        @DisplayName("should stop routing to an unreachable backend")
        void shouldSkipUnhealthyBackend() throws Exception {
            int deadPort;
            try (ServerSocket socket = new ServerSocket(0)) {
                deadPort = socket.getLocalPort();
            }
            String dead = "127.0.0.1:" + deadPort;
            LoadBalancerConfig config = config();
            config.getHealthCheck().setFailureThreshold(1);
            start(config).getRegistry().advertise(backendA.address(), dead);
            waitUntil("unreachable backend marked unhealthy", () -> gateway.getPool().getBackend(dead)
                    .map(BackendEndpoint::getHealth)
                    .filter(health -> health == BackendHealth.UNHEALTHY)
                    .isPresent());

            for (int i = 0; i < 3; i++) {
                assertThat(connect().readLine()).isEqualTo("a");
            }
        }
    }

    @Nested
    @DisplayName("registry changes")
    class RegistryChanges {

        @Test
        @DisplayName("should drain a backend that left the registry")
        void shouldDrainRemovedBackend() throws Exception {
            start(config()).getRegistry().advertise(backendA.address());
            waitForEligible(1);
            TlsClient first = connect();
            assertThat(first.readLine()).isEqualTo("a");

            gateway.getRegistry().advertise(backendB.address());
            waitUntil("backend a absent", () -> gateway.getPool().getBackend(backendA.address())
                    .map(b -> !b.isRegistryPresent())
                    .orElse(false));

            TlsClient second = connect();
            assertThat(second.readLine()).isEqualTo("b");
            assertThat(gateway.getPool().getBackend(backendA.address())).get()
                    .extracting(BackendEndpoint::getActiveConnections).isEqualTo(1);

            first.send("still here\n");
            assertThat(first.readLine()).isEqualTo("still here");

            first.close();
            waitUntil("backend a purged", () -> gateway.getPool().getBackend(backendA.address()).isEmpty());
        }
    }

    @Nested
    @DisplayName("admin endpoints")
    class AdminEndpoints {

        @Test
        @DisplayName("should report UP with an eligible backend")
        void shouldReportUp() throws Exception {
            start(config()).getRegistry().advertise(backendA.address());
            waitForEligible(1);

            HttpResponse<String> response = admin("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("\"status\":\"UP\"").contains("\"strategy\":\"round-robin\"");
        }

        @Test
        @DisplayName("should report DEGRADED without backends")
        void shouldReportDegraded() throws Exception {
            start(config());

            HttpResponse<String> response = admin("/health");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(response.body()).contains("\"status\":\"DEGRADED\"");
        }

        @Test
        @DisplayName("should list backends and expose metrics")
        void shouldListBackendsAndMetrics() throws Exception {
            start(config()).getRegistry().advertise(backendA.address());
            waitForEligible(1);
            assertThat(connect().readLine()).isEqualTo("a");
            waitUntil("connection counted", () -> gateway.getMetricsRegistry().scrape()
                    .contains("lb_connections_total 1.0"));

            assertThat(admin("/backends").body())
                    .contains("\"address\":\"" + backendA.address() + "\"")
                    .contains("\"createdAt\":\"");
            assertThat(admin("/metrics").body())
                    .contains("lb_active_connections")
                    .contains("lb_backend_active_connections{backend=\"" + backendA.address() + "\"");
        }

        @Test
        @DisplayName("should refuse methods other than GET")
        void shouldRefuseOtherMethods() throws Exception {
            start(config());
            HttpRequest request = HttpRequest.newBuilder(
                    URI.create("http://127.0.0.1:" + gateway.getAdminPort() + "/health"))
                    .POST(HttpRequest.BodyPublishers.noBody())
                    .build();

            HttpResponse<String> response = HttpClient.newHttpClient()
                    .send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(405);
        }
    }

    @Nested
    @DisplayName("front door")
    class FrontDoor {

        @Test
        @DisplayName("should count failed handshakes and keep serving")
        void shouldSurviveFailedHandshake() throws Exception {
            start(config()).getRegistry().advertise(backendA.address());
            waitForEligible(1);

            try (Socket plain = new Socket(InetAddress.getLoopbackAddress(), gateway.getTlsPort())) {
                plain.getOutputStream().write("HELLO not tls\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
                plain.setSoTimeout(5000);
                while (plain.getInputStream().read() >= 0) {
                    // drain until the gateway closes
                }
            } catch (IOException e) {
                // reset by the gateway
            }
            waitUntil("handshake failure counted", () -> gateway.getMetricsRegistry().scrape()
                    .contains("lb_handshake_failures_total 1.0"));

            assertThat(connect().readLine()).isEqualTo("a");
        }

        @Test
        @DisplayName("should close a client that trickles its handshake past the timeout")
        void shouldBoundTheWholeHandshake() throws Exception {
            LoadBalancerConfig config = config();
            config.getServer().setHandshakeTimeoutMs(1000);
            start(config);

            long started = System.nanoTime();
            boolean closedByGateway = false;
            try (Socket slow = new Socket(InetAddress.getLoopbackAddress(), gateway.getTlsPort())) {
                slow.setSoTimeout(200);
                OutputStream out = slow.getOutputStream();
                // Handshake record header announcing a 128 byte ClientHello
                out.write(new byte[]{0x16, 0x03, 0x01, 0x00, (byte) 0x80});
                out.flush();
                long giveUp = started + Duration.ofSeconds(5).toNanos();
                while (!closedByGateway && System.nanoTime() < giveUp) {
                    try {
                        out.write(0x01);
                        out.flush();
                        closedByGateway = slow.getInputStream().read() < 0;
                    } catch (SocketTimeoutException e) {
                        // still open, keep trickling
                    } catch (IOException e) {
                        closedByGateway = true;
                    }
                }
            }
            long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

            assertThat(closedByGateway).isTrue();
            assertThat(elapsedMs).isLessThan(4000);
            waitUntil("handshake timeout counted", () -> gateway.getMetricsRegistry().scrape()
                    .contains("lb_handshake_failures_total 1.0"));
        }

        @Test
        @DisplayName("should close clients above the connection rate")
        void shouldRateLimitConnections() throws Exception {
            LoadBalancerConfig config = config();
            config.getRateLimit().setEnabled(true);
            start(config);

            for (int i = 0; i < 8; i++) {
                clients.add(new Socket(InetAddress.getLoopbackAddress(), gateway.getTlsPort()));
            }

            waitUntil("rate limited connection counted", () -> !gateway.getMetricsRegistry().scrape()
                    .contains("lb_rate_limited_connections_total 0.0"));
        }

        @Test
        @DisplayName("should fail before binding when the certificate is missing")
        void shouldFailOnMissingCertificate() throws Exception {
            int port;
            try (ServerSocket reserved = new ServerSocket(0)) {
                port = reserved.getLocalPort();
            }
            LoadBalancerConfig config = config();
            config.getServer().setPort(port);
            config.getTls().setCertPath(tlsDir.resolve("missing.cert").toString());

            assertThatThrownBy(() -> GatewayFactory.create(config))
                    .isInstanceOf(TlsConfigurationException.class)
                    .hasMessageContaining("missing.cert");

            try (ServerSocket stillFree = new ServerSocket(port)) {
                assertThat(stillFree.getLocalPort()).isEqualTo(port);
            }
        }
    }
}
