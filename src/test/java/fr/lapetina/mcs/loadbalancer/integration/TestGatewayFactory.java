package fr.lapetina.mcs.loadbalancer.integration;

import fr.lapetina.mcs.loadbalancer.GatewayFactory;
import fr.lapetina.mcs.loadbalancer.infrastructure.config.ConfigLoader;
import fr.lapetina.mcs.loadbalancer.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.mcs.loadbalancer.support.FakeRegistrySource;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Test extension of GatewayFactory reading backends from an in-memory registry.
 */
public final class TestGatewayFactory extends GatewayFactory {

    private final FakeRegistrySource registry;

    private TestGatewayFactory(LoadBalancerConfig config, FakeRegistrySource registry) {
        super(config, registry);
        this.registry = registry;
    }

    /**
     * Loopback configuration on ephemeral ports with fast polling and no rate limit.
     */
    public static LoadBalancerConfig testConfig(Path certPem, Path keyPem) {
        LoadBalancerConfig config = ConfigLoader.createDefault();
        config.getServer().setHost("127.0.0.1");
        config.getServer().setPort(0);
        config.getServer().setHandshakeTimeoutMs(2000);
        config.getServer().setShutdownDrainMs(1000);
        config.getTls().setCertPath(certPem.toString());
        config.getTls().setKeyPath(keyPem.toString());
        config.getRegistry().setPollIntervalMs(50);
        config.getRegistry().setDrainGraceMs(0);
        config.getStrategy().setType("round-robin");
        config.getHealthCheck().setIntervalMs(100);
        config.getHealthCheck().setTimeoutMs(200);
        config.getRateLimit().setEnabled(false);
        config.getMetrics().setHost("127.0.0.1");
        config.getMetrics().setPort(0);
        return config;
    }

    /**
     * Creates and starts a gateway, closing it again if a listener cannot be bound.
     */
    public static TestGatewayFactory startWith(LoadBalancerConfig config) throws IOException {
        ConfigLoader.validate(config);
        TestGatewayFactory factory = new TestGatewayFactory(config, new FakeRegistrySource());
        try {
            factory.start();
        } catch (IOException | RuntimeException e) {
            factory.close();
            throw e;
        }
        return factory;
    }

    public FakeRegistrySource getRegistry() {
        return registry;
    }
}
