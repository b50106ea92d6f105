package fr.lapetina.optimizer.monitor;

import fr.lapetina.optimizer.domain.alert.AlertSeverity;
import fr.lapetina.optimizer.domain.alert.PerformanceAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default alert handler, registered under the name {@code log}.
 */
public final class LoggingAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertHandler.class);

    @Override
    public void onAlert(PerformanceAlert alert) {
        if (alert.severity() == AlertSeverity.CRITICAL) {
            log.error("Performance alert: type={}, metric={}, value={}, threshold={}, message={}",
                    alert.type(), alert.metric(), alert.value(), alert.threshold(), alert.message());
        } else {
            log.warn("Performance alert: type={}, metric={}, value={}, threshold={}, message={}",
                    alert.type(), alert.metric(), alert.value(), alert.threshold(), alert.message());
        }
    }
}
