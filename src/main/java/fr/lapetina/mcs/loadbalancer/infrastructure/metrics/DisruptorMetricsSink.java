package fr.lapetina.mcs.loadbalancer.infrastructure.metrics;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics sink backed by an LMAX Disruptor ring buffer.
 *
 * Connection, health and registry threads publish events without blocking; a
 * single consumer thread applies them to the {@link MetricsRegistry}. When the
 * ring buffer is full the event is dropped and counted, the publisher never waits.
 *
 * PRODUCER TYPE: MULTI, since every connection thread publishes.
 *
 * WAIT STRATEGY: configurable, "blocking" by default as metric updates are not
 * latency sensitive and the gateway shares its host with the chat servers.
 */
public final class DisruptorMetricsSink implements MetricsSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DisruptorMetricsSink.class);

    private final Disruptor<MetricEvent> disruptor;
    private final RingBuffer<MetricEvent> ringBuffer;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DisruptorMetricsSink(MetricsRegistry metricsRegistry, int ringBufferSize, String waitStrategy) {
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("Ring buffer size must be power of 2: " + ringBufferSize);
        }
        this.metricsRegistry = metricsRegistry;
        this.disruptor = new Disruptor<>(
                new MetricEventFactory(),
                ringBufferSize,
                new MetricsThreadFactory(),
                ProducerType.MULTI,
                createWaitStrategy(waitStrategy)
        );
        disruptor.handleEventsWith(new MetricsEventHandler(metricsRegistry));
        disruptor.setDefaultExceptionHandler(new MetricsExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DisruptorMetricsSink created: ringBufferSize={}, waitStrategy={}", ringBufferSize, waitStrategy);
    }

    /**
     * Starts the consumer thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DisruptorMetricsSink started");
        }
    }

    @Override
    public void publish(MetricEventType type, String backend, String reason,
                        long clientToBackendBytes, long backendToClientBytes) {
        if (!running.get()) {
            log.debug("Metrics sink not running, event dropped: type={}, backend={}", type, backend);
            return;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            metricsRegistry.incrementDroppedEvents();
            log.debug("Metric ring buffer full, event dropped: type={}, backend={}", type, backend);
            return;
        }

        try {
            ringBuffer.get(sequence).set(type, backend, reason, clientToBackendBytes, backendToClientBytes);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Drains pending events, then stops the consumer thread.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
                log.info("DisruptorMetricsSink shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("DisruptorMetricsSink shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Thread factory for the metrics consumer thread.
     */
    private static class MetricsThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "metrics-sink-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for the metrics consumer.
     */
    private static class MetricsExceptionHandler implements ExceptionHandler<MetricEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, MetricEvent event) {
            log.error("Exception applying metric event: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during metrics sink start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during metrics sink shutdown", ex);
        }
    }
}
