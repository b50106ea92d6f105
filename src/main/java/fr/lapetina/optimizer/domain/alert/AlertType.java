package fr.lapetina.optimizer.domain.alert;

/**
 * Kind of threshold a performance alert refers to.
 */
public enum AlertType {
    RESPONSE_TIME,
    CACHE_HIT_RATE,
    ERROR_RATE,
    CONCURRENCY,
    SYSTEM_RESOURCE
}
