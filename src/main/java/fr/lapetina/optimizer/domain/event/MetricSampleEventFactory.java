package fr.lapetina.optimizer.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates MetricSampleEvent instances for the ingest ring buffer.
 */
public final class MetricSampleEventFactory implements EventFactory<MetricSampleEvent> {

    @Override
    public MetricSampleEvent newInstance() {
        return new MetricSampleEvent();
    }
}
