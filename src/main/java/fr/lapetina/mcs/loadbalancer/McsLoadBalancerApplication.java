package fr.lapetina.mcs.loadbalancer;

import fr.lapetina.mcs.loadbalancer.infrastructure.config.ConfigLoader;
import fr.lapetina.mcs.loadbalancer.infrastructure.tls.TlsConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the MCS Load Balancer.
 */
public class McsLoadBalancerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(McsLoadBalancerApplication.class);

    private final GatewayFactory gateway;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public McsLoadBalancerApplication(String configPath) {
        log.info("Starting MCS Load Balancer...");
        this.gateway = GatewayFactory.create(configPath);
        log.info("MCS Load Balancer initialized");
    }

    public void start() throws Exception {
        gateway.start();
        log.info("MCS Load Balancer started on port {}", gateway.getTlsPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    @Override
    public void close() {
        log.info("Shutting down MCS Load Balancer...");
        gateway.close();
        log.info("MCS Load Balancer shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : ConfigLoader.DEFAULT_CONFIG_PATH;

        McsLoadBalancerApplication app;
        try {
            app = new McsLoadBalancerApplication(configPath);
        } catch (ConfigLoader.ConfigurationException | TlsConfigurationException e) {
            log.error("Invalid startup configuration: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        try {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }, "shutdown"));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start MCS Load Balancer", e);
            System.exit(1);
        }
    }
}
