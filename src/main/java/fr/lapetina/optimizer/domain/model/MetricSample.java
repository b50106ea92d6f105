package fr.lapetina.optimizer.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One observed request outcome, fed into the rolling latency window.
 */
public record MetricSample(Instant timestamp, boolean success, Duration latency) {
    public MetricSample {
        Objects.requireNonNull(timestamp, "Timestamp is required");
        Objects.requireNonNull(latency, "Latency is required");
        if (latency.isNegative()) {
            throw new IllegalArgumentException("Latency must not be negative: " + latency);
        }
    }
}
