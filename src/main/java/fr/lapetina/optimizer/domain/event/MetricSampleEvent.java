package fr.lapetina.optimizer.domain.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Event object for the metric ingest ring buffer.
 *
 * Mutable holder reused across the ring buffer. It must only be touched by the publisher
 * between claim and publish, and by the consumer while handling it.
 */
public final class MetricSampleEvent {

    private Instant timestamp;
    private boolean success;
    private Duration latency;

    public void set(Instant timestamp, boolean success, Duration latency) {
        this.timestamp = timestamp;
        this.success = success;
        this.latency = latency;
    }

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.timestamp = null;
        this.success = false;
        this.latency = null;
    }

    public boolean isEmpty() {
        return timestamp == null;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isSuccess() {
        return success;
    }

    public Duration getLatency() {
        return latency;
    }

    @Override
    public String toString() {
        return "MetricSampleEvent{" +
                "timestamp=" + timestamp +
                ", success=" + success +
                ", latency=" + latency +
                '}';
    }
}
