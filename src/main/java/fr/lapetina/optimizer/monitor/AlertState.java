package fr.lapetina.optimizer.monitor;

import fr.lapetina.optimizer.domain.alert.AlertSeverity;
import fr.lapetina.optimizer.domain.alert.AlertType;

import java.time.Duration;
import java.time.Instant;

/**
 * Cooldown tracking for one (metric, severity) pair. Created on the first breach.
 */
final class AlertState {

    private final AlertType type;
    private final String metric;
    private final AlertSeverity severity;

    private Instant lastFiredAt;
    private Instant cooldownUntil;
    private long fireCount;

    AlertState(AlertType type, String metric, AlertSeverity severity) {
        this.type = type;
        this.metric = metric;
        this.severity = severity;
    }

    /**
     * Fires if the cooldown has elapsed, and starts a new cooldown window.
     *
     * @return true if the breach should be dispatched
     */
    synchronized boolean tryFire(Instant now, Duration cooldown) {
        if (cooldownUntil != null && !now.isAfter(cooldownUntil)) {
            return false;
        }
        lastFiredAt = now;
        cooldownUntil = now.plus(cooldown);
        fireCount++;
        return true;
    }

    synchronized Instant lastFiredAt() {
        return lastFiredAt;
    }

    synchronized Instant cooldownUntil() {
        return cooldownUntil;
    }

    synchronized long fireCount() {
        return fireCount;
    }

    AlertType type() {
        return type;
    }

    @Override
    public String toString() {
        return "AlertState{" +
                "type=" + type +
                ", metric='" + metric + '\'' +
                ", severity=" + severity +
                ", fireCount=" + fireCount() +
                '}';
    }
}
