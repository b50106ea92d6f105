package fr.lapetina.optimizer.domain.exception;

import fr.lapetina.optimizer.domain.model.ErrorType;

/**
 * Exception thrown when the worker pool cannot take more work.
 *
 * This occurs when:
 * - Every worker is at capacity
 * - No worker carries the required specialization
 * - A slot did not free up before the request deadline
 *
 * Distinct from transient backend failures so callers can queue or back off.
 */
public final class BackpressureException extends OptimizationException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super(ErrorType.CAPACITY_ERROR, "Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super(ErrorType.CAPACITY_ERROR, "Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        NO_WORKER_CAPACITY("All workers are at maximum capacity"),
        NO_MATCHING_WORKER("No worker matches the required specializations"),
        SLOT_WAIT_TIMEOUT("Timed out waiting for a worker slot");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
