package fr.lapetina.mcs.loadbalancer.infrastructure.metrics;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating MetricEvent instances in the Disruptor ring buffer.
 */
public final class MetricEventFactory implements EventFactory<MetricEvent> {

    @Override
    public MetricEvent newInstance() {
        return new MetricEvent();
    }
}
