package fr.lapetina.mcs.loadbalancer.server;

import fr.lapetina.mcs.loadbalancer.domain.model.BackendEndpoint;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricEventType;
import fr.lapetina.mcs.loadbalancer.infrastructure.metrics.MetricsSink;
import fr.lapetina.mcs.loadbalancer.infrastructure.pool.BackendPool;
import fr.lapetina.mcs.loadbalancer.infrastructure.ratelimit.ClientRateLimiter;
import fr.lapetina.mcs.loadbalancer.routing.BackendScheduler;
import fr.lapetina.mcs.loadbalancer.routing.exception.NoBackendsAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bridges an established client connection to a backend.
 *
 * Lifecycle of a session:
 * - dispatch a backend, connect (one retry on another backend if enabled)
 * - increment the backend's connection count
 * - copy bytes both ways until either side ends or fails
 * - close both sockets, decrement the count exactly once
 *
 * The backend to client copy runs on the calling thread, the client to backend
 * copy on a thread of its own.
 */
public final class ConnectionBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionBridge.class);

    public static final String REJECT_NO_BACKEND = "no_backend";
    public static final String REJECT_BACKEND_UNREACHABLE = "backend_unreachable";
    public static final String REJECT_BACKEND_REMOVED = "backend_removed";

    private static final long COPY_JOIN_TIMEOUT_MS = 5000;

    private final BackendScheduler scheduler;
    private final BackendPool pool;
    private final BackendConnector connector;
    private final ConnectFailureReporter failureReporter;
    private final ClientRateLimiter rateLimiter;
    private final MetricsSink metricsSink;
    private final Duration connectTimeout;
    private final boolean retryOnConnectFailure;
    private final int bufferSize;
    private final ExecutorService copyExecutor;
    private final Set<Session> sessions = ConcurrentHashMap.newKeySet();
    private final Object drainMonitor = new Object();

    public ConnectionBridge(
            BackendScheduler scheduler,
            BackendPool pool,
            BackendConnector connector,
            ConnectFailureReporter failureReporter,
            ClientRateLimiter rateLimiter,
            MetricsSink metricsSink,
            Duration connectTimeout,
            boolean retryOnConnectFailure,
            int bufferSize
    ) {
        this.scheduler = scheduler;
        this.pool = pool;
        this.connector = connector;
        this.failureReporter = failureReporter;
        this.rateLimiter = rateLimiter;
        this.metricsSink = metricsSink;
        this.connectTimeout = connectTimeout;
        this.retryOnConnectFailure = retryOnConnectFailure;
        this.bufferSize = bufferSize;
        AtomicInteger copyThreads = new AtomicInteger();
        this.copyExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "bridge-copy-" + copyThreads.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Serves one client until the session ends. Blocks the calling thread.
     * The client socket is always closed on return.
     *
     * @param client socket with a completed TLS handshake
     * @param clientIp remote address of the client, used for limits and logs
     */
    public void handle(Socket client, String clientIp) {
        MDC.put("client", clientIp);
        try {
            metricsSink.publish(MetricEventType.CONNECTION_ACCEPTED);
            Connected connected = connect(client);
            if (connected != null) {
                bridge(client, clientIp, connected);
            }
        } finally {
            MDC.remove("backend");
            MDC.remove("client");
        }
    }

    private Connected connect(Socket client) {
        Set<String> excluded = new HashSet<>();
        int attempts = retryOnConnectFailure ? 2 : 1;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            BackendEndpoint backend;
            try {
                backend = scheduler.dispatch(excluded);
            } catch (NoBackendsAvailableException e) {
                String reason = excluded.isEmpty() ? REJECT_NO_BACKEND : REJECT_BACKEND_UNREACHABLE;
                reject(client, reason, e.getMessage());
                return null;
            }

            try {
                Socket backendSocket = connector.connect(backend, connectTimeout);
                return new Connected(backend, backendSocket);
            } catch (IOException | RuntimeException e) {
                excluded.add(backend.getAddress());
                failureReporter.onConnectFailure(backend.getAddress(), e);
                log.warn("Backend connect failed: backend={}, attempt={}/{}, error={}",
                        backend.getAddress(), attempt, attempts, e.toString());
            }
        }

        reject(client, REJECT_BACKEND_UNREACHABLE, "Connect failed on " + excluded);
        return null;
    }

    private void bridge(Socket client, String clientIp, Connected connected) {
        String address = connected.backend().getAddress();
        Socket backendSocket = connected.socket();
        MDC.put("backend", address);

        if (!pool.incrementConnections(address)) {
            // Purged between dispatch and increment
            closeQuietly(backendSocket);
            reject(client, REJECT_BACKEND_REMOVED, "Backend left the pool: " + address);
            return;
        }

        Session session = new Session(client, backendSocket);
        sessions.add(session);
        metricsSink.publish(MetricEventType.CONNECTION_OPENED, address);
        log.info("Connection bridged: client={}, backend={}, backendConnections={}",
                clientIp, address, connected.backend().getActiveConnections());

        long startNanos = System.nanoTime();
        try {
            splice(session, clientIp, address);
        } finally {
            session.close();
            pool.decrementConnections(address);
            sessions.remove(session);
            metricsSink.publish(MetricEventType.CONNECTION_CLOSED, address, null,
                    session.clientToBackend.get(), session.backendToClient.get());
            log.info("Connection closed: client={}, backend={}, durationMs={}, bytesIn={}, bytesOut={}",
                    clientIp, address, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos),
                    session.clientToBackend.get(), session.backendToClient.get());
            synchronized (drainMonitor) {
                drainMonitor.notifyAll();
            }
        }
    }

    private void splice(Session session, String clientIp, String address) {
        Future<?> upstream;
        try {
            upstream = copyExecutor.submit(() -> copyClientToBackend(session, clientIp, address));
        } catch (RejectedExecutionException e) {
            log.warn("Bridge shutting down, dropping connection: backend={}", address);
            return;
        }

        try {
            copy(session.backend.getInputStream(), session.client.getOutputStream(), session.backendToClient);
            log.debug("Backend closed the connection: backend={}", address);
        } catch (IOException e) {
            log.debug("Backend to client copy ended: backend={}, error={}", address, e.toString());
        }

        // Client streams over TLS cannot be half-closed, end the whole session
        session.close();
        try {
            upstream.get(COPY_JOIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException e) {
            upstream.cancel(true);
            log.warn("Client to backend copy did not stop: backend={}", address);
        } catch (Exception e) {
            log.debug("Client to backend copy failed: backend={}, error={}", address, e.toString());
        }
    }

    private void copyClientToBackend(Session session, String clientIp, String address) {
        MDC.put("client", clientIp);
        MDC.put("backend", address);
        try {
            InputStream in = rateLimiter.limit(clientIp, session.client.getInputStream());
            copy(in, session.backend.getOutputStream(), session.clientToBackend);
            log.debug("Client closed the connection: backend={}", address);
            // Let the backend see the end of stream and finish its side
            session.backend.shutdownOutput();
        } catch (IOException e) {
            log.debug("Client to backend copy ended: backend={}, error={}", address, e.toString());
            session.close();
        } finally {
            MDC.clear();
        }
    }

    private void copy(InputStream in, OutputStream out, AtomicLong counter) throws IOException {
        byte[] buffer = new byte[bufferSize];
        int n;
        while ((n = in.read(buffer)) >= 0) {
            out.write(buffer, 0, n);
            out.flush();
            counter.addAndGet(n);
        }
    }

    private void reject(Socket client, String reason, String detail) {
        metricsSink.reject(reason);
        log.warn("Connection rejected: reason={}, detail={}", reason, detail);
        closeQuietly(client);
    }

    /**
     * Number of sessions currently bridged.
     */
    public int activeSessions() {
        return sessions.size();
    }

    /**
     * Waits until every session has ended or the timeout elapses.
     *
     * @return true if no session is left
     */
    public boolean awaitDrain(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (drainMonitor) {
            while (!sessions.isEmpty()) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                try {
                    drainMonitor.wait(Math.min(remainingMs, 100));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return sessions.isEmpty();
                }
            }
        }
        return true;
    }

    /**
     * Force-closes every session. Counters are released by the session threads.
     */
    public void closeAll() {
        int count = sessions.size();
        if (count > 0) {
            log.warn("Force-closing remaining sessions: count={}", count);
        }
        sessions.forEach(Session::close);
    }

    @Override
    public void close() {
        closeAll();
        copyExecutor.shutdown();
        try {
            if (!copyExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                copyExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            copyExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.toString());
        }
    }

    private record Connected(BackendEndpoint backend, Socket socket) {
    }

    private static final class Session {
        private final Socket client;
        private final Socket backend;
        private final AtomicLong clientToBackend = new AtomicLong();
        private final AtomicLong backendToClient = new AtomicLong();

        private Session(Socket client, Socket backend) {
            this.client = client;
            this.backend = backend;
        }

        private void close() {
            closeQuietly(client);
            closeQuietly(backend);
        }
    }
}
