package fr.lapetina.optimizer.balancer;

import fr.lapetina.optimizer.domain.exception.BackpressureException;
import fr.lapetina.optimizer.domain.exception.BackpressureException.BackpressureReason;

import java.util.Objects;

/**
 * Outcome of a session assignment: either a worker or a capacity rejection.
 *
 * @param workerId        bound worker, null when rejected
 * @param reused          true if the session was already bound and kept its worker
 * @param rejectionReason why no worker was bound, null when assigned
 */
public record Assignment(String sessionId, String workerId, boolean reused, BackpressureReason rejectionReason) {

    public Assignment {
        Objects.requireNonNull(sessionId, "Session ID is required");
        if ((workerId == null) == (rejectionReason == null)) {
            throw new IllegalArgumentException("Assignment needs either a worker or a rejection reason");
        }
    }

    public static Assignment assigned(String sessionId, String workerId, boolean reused) {
        return new Assignment(sessionId, workerId, reused, null);
    }

    public static Assignment rejected(String sessionId, BackpressureReason reason) {
        return new Assignment(sessionId, null, false, reason);
    }

    public boolean isAssigned() {
        return workerId != null;
    }

    public boolean isRejected() {
        return rejectionReason != null;
    }

    public BackpressureException toException() {
        if (!isRejected()) {
            throw new IllegalStateException("Session was assigned to " + workerId);
        }
        return new BackpressureException(rejectionReason, "sessionId=" + sessionId);
    }
}
