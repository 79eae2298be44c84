package fr.lapetina.mcs.loadbalancer.server;

import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricEventType;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricsSink;
import fr.lapetina.mcs.loadbalancer.infrastructure.ratelimit.ClientRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public TLS listener.
 *
 * Accepts raw TCP connections, applies the per client connection rate, then
 * performs the server-side TLS handshake on a connection thread and hands the
 * secured socket to the {@link ConnectionBridge}. A failed handshake only closes
 * that connection.
 */
public final class TlsFrontDoor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TlsFrontDoor.class);

    private final String host;
    private final int port;
    private final int backlog;
    private final SSLSocketFactory socketFactory;
    private final String[] protocols;
    private final Duration handshakeTimeout;
    private final Duration shutdownDrain;
    private final ClientRateLimiter rateLimiter;
    private final MetricsSink metricsSink;
    private final ConnectionBridge bridge;
    private final ExecutorService connectionExecutor;
    private final ScheduledExecutorService handshakeTimer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ServerSocket serverSocket;
    private Thread acceptThread;

    public TlsFrontDoor(
            String host,
            int port,
            int backlog,
            SSLContext sslContext,
            List<String> protocols,
            Duration handshakeTimeout,
            Duration shutdownDrain,
            ClientRateLimiter rateLimiter,
            MetricsSink metricsSink,
            ConnectionBridge bridge
    ) {
        this.host = host;
        this.port = port;
        this.backlog = backlog;
        this.socketFactory = sslContext.getSocketFactory();
        this.protocols = resolveProtocols(sslContext, protocols);
        this.handshakeTimeout = handshakeTimeout;
        this.shutdownDrain = shutdownDrain;
        this.rateLimiter = rateLimiter;
        this.metricsSink = metricsSink;
        this.bridge = bridge;
        AtomicInteger connectionThreads = new AtomicInteger();
        this.connectionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "connection-" + connectionThreads.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.handshakeTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "handshake-timer");
            t.setDaemon(true);
            return t;
        });
    }

    private static String[] resolveProtocols(SSLContext sslContext, List<String> configured) {
        List<String> supported = Arrays.asList(sslContext.getSupportedSSLParameters().getProtocols());
        String[] enabled = configured.stream()
                .filter(supported::contains)
                .toArray(String[]::new);
        if (enabled.length == 0) {
            log.warn("None of the configured TLS protocols {} is supported, using JVM defaults", configured);
            return sslContext.getDefaultSSLParameters().getProtocols();
        }
        return enabled;
    }

    /**
     * Binds the listener and starts accepting.
     *
     * @throws IOException if the port cannot be bound
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        ServerSocket socket = new ServerSocket();
        try {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(host, port), backlog);
        } catch (IOException e) {
            running.set(false);
            socket.close();
            throw e;
        }
        this.serverSocket = socket;

        acceptThread = new Thread(this::acceptLoop, "tls-acceptor");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("TLS listener started: address={}:{}, protocols={}, handshakeTimeout={}",
                host, getLocalPort(), Arrays.toString(protocols), handshakeTimeout);
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket raw;
            try {
                raw = serverSocket.accept();
            } catch (SocketException e) {
                if (running.get()) {
                    log.error("Listener socket failed, stopping accept loop", e);
                }
                return;
            } catch (IOException e) {
                log.warn("Accept failed: error={}", e.toString());
                continue;
            }

            String clientIp = raw.getInetAddress().getHostAddress();
            if (!rateLimiter.tryAcquireConnection(clientIp)) {
                metricsSink.publish(MetricEventType.RATE_LIMITED);
                ConnectionBridge.closeQuietly(raw);
                continue;
            }

            try {
                connectionExecutor.execute(() -> handleConnection(raw, clientIp));
            } catch (RejectedExecutionException e) {
                log.debug("Listener shutting down, dropping connection: client={}", clientIp);
                ConnectionBridge.closeQuietly(raw);
            }
        }
    }

    private void handleConnection(Socket raw, String clientIp) {
        SSLSocket tls;
        // Bounds the whole handshake, the socket timeout only bounds each read
        ScheduledFuture<?> deadline;
        try {
            deadline = handshakeTimer.schedule(
                    () -> abortHandshake(raw, clientIp), handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Listener shutting down, dropping connection: client={}", clientIp);
            ConnectionBridge.closeQuietly(raw);
            return;
        }
        try {
            raw.setTcpNoDelay(true);
            tls = (SSLSocket) socketFactory.createSocket(raw, clientIp, raw.getPort(), true);
            tls.setUseClientMode(false);
            tls.setEnabledProtocols(protocols);
            tls.setSoTimeout((int) handshakeTimeout.toMillis());
            tls.startHandshake();
            tls.setSoTimeout(0);
        } catch (IOException e) {
            deadline.cancel(false);
            metricsSink.publish(MetricEventType.HANDSHAKE_FAILED);
            log.debug("TLS handshake failed: client={}, error={}", clientIp, e.toString());
            ConnectionBridge.closeQuietly(raw);
            return;
        }
        if (!deadline.cancel(false)) {
            // Deadline fired as the handshake completed, the socket is already closed
            metricsSink.publish(MetricEventType.HANDSHAKE_FAILED);
            log.debug("TLS handshake completed past its deadline: client={}", clientIp);
            ConnectionBridge.closeQuietly(tls);
            return;
        }

        log.debug("TLS handshake completed: client={}, protocol={}, cipherSuite={}",
                clientIp, tls.getSession().getProtocol(), tls.getSession().getCipherSuite());
        try {
            bridge.handle(tls, clientIp);
        } catch (RuntimeException e) {
            log.error("Unexpected error serving client: client={}", clientIp, e);
            ConnectionBridge.closeQuietly(tls);
        }
    }

    private void abortHandshake(Socket raw, String clientIp) {
        log.debug("TLS handshake timed out: client={}, timeout={}", clientIp, handshakeTimeout);
        ConnectionBridge.closeQuietly(raw);
    }

    /**
     * Returns the bound port, useful when configured with port 0.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : -1;
    }

    /**
     * Stops accepting, waits for sessions to drain, then force-closes the rest.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            connectionExecutor.shutdownNow();
            handshakeTimer.shutdownNow();
            return;
        }
        ServerSocket socket = serverSocket;
        if (socket != null) {
            ConnectionBridge.closeQuietly(socket);
        }
        connectionExecutor.shutdown();

        int active = bridge.activeSessions();
        if (active > 0) {
            log.info("Waiting for sessions to drain: active={}, timeout={}", active, shutdownDrain);
        }
        if (!bridge.awaitDrain(shutdownDrain)) {
            bridge.closeAll();
        }
        try {
            if (!connectionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                connectionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            connectionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        handshakeTimer.shutdownNow();
        log.info("TLS listener stopped");
    }
}
