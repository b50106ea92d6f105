package fr.lapetina.optimizer.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.optimizer.domain.event.MetricSampleEvent;
import fr.lapetina.optimizer.domain.model.MetricSample;
import fr.lapetina.optimizer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of the ingest ring buffer: appends each sample to the metrics registry.
 *
 * Tracks the last handled sequence so publishers can wait for the buffer to drain.
 */
public final class SampleRecordingHandler implements EventHandler<MetricSampleEvent> {

    private static final Logger log = LoggerFactory.getLogger(SampleRecordingHandler.class);

    private final MetricsRegistry metricsRegistry;
    private volatile long lastSequence = -1L;

    public SampleRecordingHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(MetricSampleEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.isEmpty()) {
                log.debug("Skipping empty sample event: sequence={}", sequence);
                return;
            }
            metricsRegistry.recordSample(new MetricSample(event.getTimestamp(), event.isSuccess(), event.getLatency()));
        } finally {
            event.clear();
            lastSequence = sequence;
        }
    }

    /**
     * Sequence of the last event handled, -1 before the first one.
     */
    public long getLastSequence() {
        return lastSequence;
    }
}
