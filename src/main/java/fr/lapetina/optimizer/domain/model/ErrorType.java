package fr.lapetina.optimizer.domain.model;

/**
 * Error taxonomy for optimization requests.
 * Lets callers pick a recovery policy (backoff, retry, give up) per category.
 */
public enum ErrorType {
    /** No worker slot available, or waiting for one timed out */
    CAPACITY_ERROR,

    /** Generation backend failed (5xx, connection error, open circuit, unparsable reply) */
    BACKEND_ERROR,

    /** The request deadline elapsed while generating */
    TIMEOUT,

    /** The calling thread was interrupted */
    CANCELLED,

    /** Malformed request rejected before any work was done */
    INVALID_REQUEST,

    /** Unexpected failure inside the optimizer itself */
    INTERNAL_ERROR
}
