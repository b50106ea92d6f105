package fr.lapetina.optimizer.balancer;

import fr.lapetina.optimizer.domain.exception.BackpressureException.BackpressureReason;
import fr.lapetina.optimizer.domain.model.SessionBinding;
import fr.lapetina.optimizer.domain.model.WorkerSlot;
import fr.lapetina.optimizer.domain.report.LoadBalancingMetrics;
import fr.lapetina.optimizer.domain.strategy.StrategyFactory;
import fr.lapetina.optimizer.domain.strategy.WorkerSelectionStrategy;
import fr.lapetina.optimizer.infrastructure.config.OptimizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Binds generation sessions to a bounded pool of workers.
 *
 * <p>A session keeps its worker until it is released or swept as inactive. Worker load is
 * reserved through CAS on the worker itself, so {@code 0 <= load <= capacity} holds at every
 * instant without a global lock. The only lock guards the slot-freed condition used by
 * {@link #awaitAssignment}; releasers take it only when a waiter is registered.
 */
public final class SessionLoadBalancer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionLoadBalancer.class);

    private final Map<String, WorkerSlot> workers = new ConcurrentHashMap<>();
    private final Map<String, SessionBinding> bindings = new ConcurrentHashMap<>();
    private final AtomicReference<WorkerSelectionStrategy> strategyRef;
    private final Clock clock;

    private final AtomicLong totalSessions = new AtomicLong();
    private final AtomicLong balancedSessions = new AtomicLong();
    private final AtomicLong rejectedSessions = new AtomicLong();

    private final ReentrantLock slotLock = new ReentrantLock();
    private final Condition slotFreed = slotLock.newCondition();
    private final AtomicInteger waiters = new AtomicInteger();

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean cleanupRunning = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SessionLoadBalancer(Builder builder) {
        this.strategyRef = new AtomicReference<>(Objects.requireNonNull(builder.strategy, "Strategy is required"));
        this.clock = builder.clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleanup");
            t.setDaemon(true);
            return t;
        });
        for (WorkerSlot worker : builder.workers) {
            registerWorker(worker);
        }
        log.info("SessionLoadBalancer created: strategy={}, workers={}", builder.strategy.getName(), workers.size());
    }

    /**
     * Adds a worker to the pool.
     *
     * @throws IllegalArgumentException if a worker with the same id is already registered
     */
    public void registerWorker(WorkerSlot worker) {
        WorkerSlot previous = workers.putIfAbsent(worker.getId(), worker);
        if (previous != null) {
            throw new IllegalArgumentException("Worker already registered: " + worker.getId());
        }
        log.info("Worker registered: {}", worker);
        signalWaiters();
    }

    public void registerWorker(String workerId, int capacity, Set<String> tags) {
        registerWorker(WorkerSlot.builder()
                .id(workerId)
                .capacity(capacity)
                .specializationTags(tags)
                .lastHeartbeat(clock.instant())
                .build());
    }

    /**
     * Records a heartbeat from a worker.
     *
     * @return false if the worker is unknown
     */
    public boolean heartbeat(String workerId) {
        WorkerSlot worker = workers.get(workerId);
        if (worker == null) {
            return false;
        }
        worker.heartbeat(clock.instant());
        return true;
    }

    /**
     * Assigns a session to a worker without blocking.
     *
     * <p>A bound session keeps its worker. Otherwise the preferred worker is used if it has a
     * free slot, then the strategy's ranking of workers matching any required tag.
     *
     * @return the assignment, or a rejection when no worker can take the session
     */
    public Assignment assign(String sessionId, String preferredWorkerId, Collection<String> requiredTags) {
        Objects.requireNonNull(sessionId, "Session ID is required");
        totalSessions.incrementAndGet();
        return finish(tryAssign(sessionId, preferredWorkerId, requiredTags));
    }

    /**
     * Like {@link #assign} but waits up to {@code timeout} for a slot to free up.
     * A missing specialization is rejected immediately since waiting cannot fix it.
     *
     * @throws InterruptedException if interrupted while waiting; no slot is held in that case
     */
    public Assignment awaitAssignment(String sessionId, String preferredWorkerId,
                                      Collection<String> requiredTags, Duration timeout)
            throws InterruptedException {
        Objects.requireNonNull(sessionId, "Session ID is required");
        totalSessions.incrementAndGet();
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            Assignment attempt = tryAssign(sessionId, preferredWorkerId, requiredTags);
            if (attempt.isAssigned() || attempt.rejectionReason() == BackpressureReason.NO_MATCHING_WORKER) {
                return finish(attempt);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return finish(Assignment.rejected(sessionId, BackpressureReason.SLOT_WAIT_TIMEOUT));
            }

            slotLock.lock();
            try {
                waiters.incrementAndGet();
                try {
                    // Re-check after registering so a release in between is not missed
                    if (!hasFreeSlot(preferredWorkerId, requiredTags)) {
                        log.debug("Waiting for a worker slot: sessionId={}, remainingMs={}",
                                sessionId, TimeUnit.NANOSECONDS.toMillis(remaining));
                        slotFreed.awaitNanos(remaining);
                    }
                } finally {
                    waiters.decrementAndGet();
                }
            } finally {
                slotLock.unlock();
            }
        }
    }

    private Assignment tryAssign(String sessionId, String preferredWorkerId, Collection<String> requiredTags) {
        Instant now = clock.instant();

        SessionBinding existing = bindings.computeIfPresent(sessionId, (id, binding) -> {
            binding.touch(now);
            return binding;
        });
        if (existing != null) {
            return Assignment.assigned(sessionId, existing.getWorkerId(), true);
        }

        WorkerSlot chosen = null;
        if (preferredWorkerId != null) {
            WorkerSlot preferred = workers.get(preferredWorkerId);
            if (preferred != null && preferred.tryAcquireSlot()) {
                chosen = preferred;
            }
        }

        if (chosen == null) {
            List<WorkerSlot> candidates = new ArrayList<>();
            for (WorkerSlot worker : workers.values()) {
                if (worker.matchesAny(requiredTags)) {
                    candidates.add(worker);
                }
            }
            if (candidates.isEmpty()) {
                return Assignment.rejected(sessionId, BackpressureReason.NO_MATCHING_WORKER);
            }
            for (WorkerSlot worker : strategyRef.get().rank(candidates)) {
                if (worker.tryAcquireSlot()) {
                    chosen = worker;
                    break;
                }
            }
            if (chosen == null) {
                return Assignment.rejected(sessionId, BackpressureReason.NO_WORKER_CAPACITY);
            }
        }

        SessionBinding binding = new SessionBinding(sessionId, chosen.getId(), now);
        SessionBinding raced = bindings.putIfAbsent(sessionId, binding);
        if (raced != null) {
            // Another request bound the session first: keep its worker, give back ours
            chosen.releaseSlot();
            signalWaiters();
            raced.touch(now);
            return Assignment.assigned(sessionId, raced.getWorkerId(), true);
        }

        balancedSessions.incrementAndGet();
        log.debug("Session assigned: sessionId={}, workerId={}, load={}/{}",
                sessionId, chosen.getId(), chosen.getCurrentLoad(), chosen.getCapacity());
        return Assignment.assigned(sessionId, chosen.getId(), false);
    }

    private Assignment finish(Assignment assignment) {
        if (assignment.isRejected()) {
            rejectedSessions.incrementAndGet();
            log.warn("Session rejected: sessionId={}, reason={}",
                    assignment.sessionId(), assignment.rejectionReason());
        }
        return assignment;
    }

    private boolean hasFreeSlot(String preferredWorkerId, Collection<String> requiredTags) {
        if (preferredWorkerId != null) {
            WorkerSlot preferred = workers.get(preferredWorkerId);
            if (preferred != null && preferred.hasCapacity()) {
                return true;
            }
        }
        for (WorkerSlot worker : workers.values()) {
            if (worker.matchesAny(requiredTags) && worker.hasCapacity()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Ends a session and frees its worker slot.
     *
     * @return true if the session was bound, false if there was nothing to release
     */
    public boolean release(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        SessionBinding removed = bindings.remove(sessionId);
        if (removed == null) {
            return false;
        }
        releaseWorker(removed);
        log.debug("Session released: sessionId={}, workerId={}, requests={}",
                sessionId, removed.getWorkerId(), removed.getRequestCount());
        return true;
    }

    /**
     * Removes every binding idle for longer than {@code inactivityThreshold} and frees its slot.
     * Each removal re-checks the binding atomically, so a session touched concurrently survives.
     *
     * @return number of bindings removed
     */
    public int cleanupExpired(Duration inactivityThreshold) {
        Instant now = clock.instant();
        int removed = 0;
        for (String sessionId : bindings.keySet()) {
            SessionBinding[] expired = new SessionBinding[1];
            bindings.computeIfPresent(sessionId, (id, binding) -> {
                if (Duration.between(binding.getLastActivity(), now).compareTo(inactivityThreshold) > 0) {
                    expired[0] = binding;
                    return null;
                }
                return binding;
            });
            if (expired[0] != null) {
                releaseWorker(expired[0]);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Inactive sessions cleaned up: removed={}, remaining={}", removed, bindings.size());
        }
        return removed;
    }

    private void releaseWorker(SessionBinding binding) {
        WorkerSlot worker = workers.get(binding.getWorkerId());
        if (worker != null) {
            worker.releaseSlot();
        }
        signalWaiters();
    }

    private void signalWaiters() {
        if (waiters.get() > 0) {
            slotLock.lock();
            try {
                slotFreed.signalAll();
            } finally {
                slotLock.unlock();
            }
        }
    }

    /**
     * Atomically replaces the worker selection strategy.
     */
    public void setStrategy(WorkerSelectionStrategy strategy) {
        WorkerSelectionStrategy old = strategyRef.getAndSet(Objects.requireNonNull(strategy));
        log.info("Strategy changed from {} to {}", old.getName(), strategy.getName());
    }

    public WorkerSelectionStrategy getStrategy() {
        return strategyRef.get();
    }

    public int activeSessionCount() {
        return bindings.size();
    }

    public int workerCount() {
        return workers.size();
    }

    public Optional<WorkerSlot> getWorker(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    public Optional<SessionBinding> getBinding(String sessionId) {
        return Optional.ofNullable(bindings.get(sessionId));
    }

    public LoadBalancingMetrics metrics() {
        Map<String, LoadBalancingMetrics.WorkerLoad> loads = new HashMap<>();
        int available = 0;
        int busy = 0;
        double ratioSum = 0.0;
        for (WorkerSlot worker : workers.values()) {
            int load = worker.getCurrentLoad();
            double ratio = (double) load / worker.getCapacity();
            loads.put(worker.getId(), new LoadBalancingMetrics.WorkerLoad(
                    worker.getId(), load, worker.getCapacity(), ratio));
            if (load < worker.getCapacity()) {
                available++;
            }
            if (load > 0) {
                busy++;
            }
            ratioSum += ratio;
        }
        return new LoadBalancingMetrics(
                totalSessions.get(),
                bindings.size(),
                balancedSessions.get(),
                rejectedSessions.get(),
                loads.size(),
                available,
                busy,
                loads.isEmpty() ? 0.0 : ratioSum / loads.size(),
                loads,
                strategyRef.get().getName(),
                clock.instant()
        );
    }

    /**
     * Starts the periodic inactive-session sweep.
     */
    public void startCleanup(Duration interval, Duration inactivityThreshold) {
        if (cleanupRunning.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    () -> runCleanup(inactivityThreshold),
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Session cleanup started: interval={}, inactivityThreshold={}", interval, inactivityThreshold);
        }
    }

    private void runCleanup(Duration inactivityThreshold) {
        try {
            cleanupExpired(inactivityThreshold);
        } catch (RuntimeException e) {
            log.error("Session cleanup failed", e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("SessionLoadBalancer closed: activeSessions={}", bindings.size());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SessionLoadBalancer.
     */
    public static final class Builder {
        private WorkerSelectionStrategy strategy = StrategyFactory.createOrDefault(StrategyFactory.DEFAULT_STRATEGY);
        private Clock clock = Clock.systemUTC();
        private final List<WorkerSlot> workers = new ArrayList<>();

        public Builder strategy(WorkerSelectionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder worker(WorkerSlot worker) {
            this.workers.add(worker);
            return this;
        }

        /**
         * Configures strategy and worker pool from load balancer configuration.
         */
        public Builder fromConfig(OptimizerConfig.LoadBalancerConfig config) {
            this.strategy = StrategyFactory.createOrDefault(config.getStrategy());
            for (OptimizerConfig.WorkerConfig worker : config.getWorkers()) {
                this.workers.add(WorkerSlot.builder()
                        .id(worker.getId())
                        .capacity(worker.getCapacity())
                        .specializationTags(worker.getSpecializations())
                        .lastHeartbeat(clock.instant())
                        .build());
            }
            return this;
        }

        public SessionLoadBalancer build() {
            return new SessionLoadBalancer(this);
        }
    }
}
