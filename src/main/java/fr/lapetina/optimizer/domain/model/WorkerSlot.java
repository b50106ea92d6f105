package fr.lapetina.optimizer.domain.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A generation worker with a bounded number of concurrent sessions.
 * Thread-safe: load is only changed through CAS so it always stays in [0, capacity].
 */
public final class WorkerSlot {
    private final String id;
    private final int capacity;
    private final Set<String> specializationTags;

    // Mutable state - thread-safe
    private final AtomicInteger currentLoad;
    private volatile Instant lastHeartbeat;

    private WorkerSlot(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Worker ID is required");
        if (builder.capacity <= 0) {
            throw new IllegalArgumentException("Worker capacity must be positive: " + builder.capacity);
        }
        this.capacity = builder.capacity;
        this.specializationTags = Set.copyOf(builder.specializationTags);
        this.currentLoad = new AtomicInteger(0);
        this.lastHeartbeat = Objects.requireNonNull(builder.lastHeartbeat, "Heartbeat is required");
    }

    public String getId() {
        return id;
    }

    public int getCapacity() {
        return capacity;
    }

    public Set<String> getSpecializationTags() {
        return specializationTags;
    }

    public int getCurrentLoad() {
        return currentLoad.get();
    }

    public double getLoadRatio() {
        return (double) currentLoad.get() / capacity;
    }

    public boolean hasCapacity() {
        return currentLoad.get() < capacity;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public void heartbeat(Instant now) {
        this.lastHeartbeat = now;
    }

    /**
     * True if the worker carries at least one of the given tags.
     * An empty requirement matches every worker.
     */
    public boolean matchesAny(Collection<String> requiredTags) {
        if (requiredTags == null || requiredTags.isEmpty()) {
            return true;
        }
        for (String tag : requiredTags) {
            if (specializationTags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Attempts to reserve one unit of load.
     * @return true if reserved, false if at capacity
     */
    public boolean tryAcquireSlot() {
        while (true) {
            int current = currentLoad.get();
            if (current >= capacity) {
                return false;
            }
            if (currentLoad.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Releases one unit of load. Never drops below zero.
     */
    public void releaseSlot() {
        while (true) {
            int current = currentLoad.get();
            if (current <= 0) {
                return;
            }
            if (currentLoad.compareAndSet(current, current - 1)) {
                return;
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerSlot that = (WorkerSlot) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkerSlot{" +
                "id='" + id + '\'' +
                ", load=" + currentLoad.get() +
                "/" + capacity +
                ", tags=" + specializationTags +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private int capacity = 5;
        private Set<String> specializationTags = Set.of();
        private Instant lastHeartbeat = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder specializationTags(Set<String> tags) {
            this.specializationTags = tags != null ? tags : Set.of();
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public WorkerSlot build() {
            return new WorkerSlot(this);
        }
    }
}
