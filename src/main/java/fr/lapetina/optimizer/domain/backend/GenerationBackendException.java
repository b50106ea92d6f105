package fr.lapetina.optimizer.domain.backend;

/**
 * Failure reported by a generation backend.
 * Transient failures (5xx, connection loss, open circuit) may succeed on a later attempt.
 */
public class GenerationBackendException extends RuntimeException {

    private final boolean transientFailure;
    private final int statusCode;

    public GenerationBackendException(String message, boolean transientFailure) {
        this(message, transientFailure, -1, null);
    }

    public GenerationBackendException(String message, boolean transientFailure, int statusCode, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.statusCode = statusCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * HTTP status returned by the backend, or -1 when the failure happened before a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
