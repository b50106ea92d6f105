package fr.lapetina.optimizer.domain.alert;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
