package fr.lapetina.mcs.loadbalancer.support;

import fr.lapetina.mcs.loadbalancer.infrastructure.registry.RegistrySnapshot;
import fr.lapetina.mcs.loadbalancer.infrastructure.registry.RegistrySource;
import fr.lapetina.mcs.loadbalancer.infrastructure.registry.RegistryUnavailableException;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory registry whose content and availability are set by the test.
 */
public final class FakeRegistrySource implements RegistrySource {

    private final Clock clock;
    private volatile Set<String> addresses = Set.of();
    private volatile boolean failing;
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public FakeRegistrySource(Clock clock) {
        this.clock = clock;
    }

    public FakeRegistrySource() {
        this(Clock.systemUTC());
    }

    public void advertise(String... addresses) {
        this.addresses = Set.of(addresses);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int fetchCount() {
        return fetches.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public RegistrySnapshot fetch() {
        fetches.incrementAndGet();
        if (failing) {
            throw new RegistryUnavailableException("registry down");
        }
        return new RegistrySnapshot(addresses, clock.instant());
    }

    @Override
    public String describe() {
        return "fake registry";
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
