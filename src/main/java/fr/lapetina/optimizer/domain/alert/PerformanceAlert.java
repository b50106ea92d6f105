package fr.lapetina.optimizer.domain.alert;

import java.time.Instant;

/**
 * A threshold breach handed to every registered alert handler.
 *
 * @param metric    name of the breached metric, e.g. {@code cache_hit_rate}
 * @param value     observed value
 * @param threshold configured limit that was crossed
 */
public record PerformanceAlert(
        String id,
        AlertType type,
        AlertSeverity severity,
        String metric,
        String message,
        double value,
        double threshold,
        Instant timestamp
) {
}
