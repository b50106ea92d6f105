package fr.lapetina.optimizer.domain.exception;

import fr.lapetina.optimizer.domain.model.ErrorType;

/**
 * Typed failure surfaced by the request optimizer.
 *
 * Callers inspect {@link #getErrorType()} to tell capacity problems from
 * transient backend failures and fatal errors. The optimizer never retries
 * internally; {@link #isTransient()} tells the caller whether a retry makes sense.
 */
public class OptimizationException extends RuntimeException {

    private final ErrorType errorType;
    private final boolean transientFailure;

    public OptimizationException(ErrorType errorType, String message) {
        this(errorType, message, defaultTransient(errorType), null);
    }

    public OptimizationException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, defaultTransient(errorType), cause);
    }

    public OptimizationException(ErrorType errorType, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.transientFailure = transientFailure;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    private static boolean defaultTransient(ErrorType errorType) {
        return switch (errorType) {
            case TIMEOUT, BACKEND_ERROR -> true;
            default -> false;
        };
    }
}
