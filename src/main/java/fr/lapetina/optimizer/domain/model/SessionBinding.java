package fr.lapetina.optimizer.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binds a session to exactly one worker until it is released or swept as inactive.
 */
public final class SessionBinding {
    private final String sessionId;
    private final String workerId;
    private final Instant assignedAt;
    private final AtomicLong requestCount = new AtomicLong(1);
    private volatile Instant lastActivity;

    public SessionBinding(String sessionId, String workerId, Instant assignedAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID is required");
        this.workerId = Objects.requireNonNull(workerId, "Worker ID is required");
        this.assignedAt = Objects.requireNonNull(assignedAt, "Assignment time is required");
        this.lastActivity = assignedAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    /**
     * Records activity on the session. Activity never moves backwards.
     */
    public void touch(Instant now) {
        if (now.isAfter(lastActivity)) {
            lastActivity = now;
        }
        requestCount.incrementAndGet();
    }

    @Override
    public String toString() {
        return "SessionBinding{" +
                "sessionId='" + sessionId + '\'' +
                ", workerId='" + workerId + '\'' +
                ", lastActivity=" + lastActivity +
                ", requests=" + requestCount.get() +
                '}';
    }
}
