package fr.lapetina.optimizer.monitor;

import fr.lapetina.optimizer.domain.alert.PerformanceAlert;

/**
 * Receives fired alerts. Handlers run on the monitoring thread, outside any monitor lock,
 * and a failing handler does not prevent the others from being called.
 */
@FunctionalInterface
public interface AlertHandler {

    void onAlert(PerformanceAlert alert);
}
