package fr.lapetina.optimizer.balancer;

import fr.lapetina.optimizer.MutableClock;
import fr.lapetina.optimizer.domain.exception.BackpressureException;
import fr.lapetina.optimizer.domain.exception.BackpressureException.BackpressureReason;
import fr.lapetina.optimizer.domain.model.ErrorType;
import fr.lapetina.optimizer.domain.model.WorkerSlot;
import fr.lapetina.optimizer.domain.report.LoadBalancingMetrics;
import fr.lapetina.optimizer.domain.strategy.RoundRobinStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionLoadBalancerTest {

    private MutableClock clock;
    private SessionLoadBalancer balancer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        balancer = SessionLoadBalancer.builder().clock(clock).build();
    }

    @AfterEach
    void tearDown() {
        balancer.close();
    }

    private void registerTwoWorkers(int capacity) {
        balancer.registerWorker("worker-1", capacity, Set.of("summary"));
        balancer.registerWorker("worker-2", capacity, Set.of("extraction"));
    }

    @Nested
    @DisplayName("assignment")
    class AssignmentBehavior {

        @Test
        @DisplayName("should reject the seventh session when two workers of capacity three are full")
        void shouldRejectWhenAllWorkersFull() {
            registerTwoWorkers(3);

            for (int i = 0; i < 6; i++) {
                assertThat(balancer.assign("s" + i, null, null).isAssigned()).isTrue();
            }
            Assignment seventh = balancer.assign("s6", null, null);

            assertThat(seventh.isRejected()).isTrue();
            assertThat(seventh.rejectionReason()).isEqualTo(BackpressureReason.NO_WORKER_CAPACITY);
            assertThat(balancer.getWorker("worker-1").orElseThrow().getCurrentLoad()).isEqualTo(3);
            assertThat(balancer.getWorker("worker-2").orElseThrow().getCurrentLoad()).isEqualTo(3);
        }

        @Test
        @DisplayName("should keep a session on the same worker")
        void shouldBeSticky() {
            registerTwoWorkers(3);

            Assignment first = balancer.assign("session", null, null);
            Assignment second = balancer.assign("session", null, null);

            assertThat(second.workerId()).isEqualTo(first.workerId());
            assertThat(first.reused()).isFalse();
            assertThat(second.reused()).isTrue();
            assertThat(balancer.getWorker(first.workerId()).orElseThrow().getCurrentLoad()).isEqualTo(1);
            assertThat(balancer.getBinding("session").orElseThrow().getRequestCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should use the preferred worker when it has room")
        void shouldHonourPreferredWorker() {
            registerTwoWorkers(3);

            Assignment assignment = balancer.assign("session", "worker-2", Set.of("summary"));

            assertThat(assignment.workerId()).isEqualTo("worker-2");
        }

        @Test
        @DisplayName("should fall back to the strategy when the preferred worker is full")
        void shouldFallBackWhenPreferredFull() {
            registerTwoWorkers(1);
            balancer.assign("busy", "worker-1", null);

            Assignment assignment = balancer.assign("session", "worker-1", null);

            assertThat(assignment.workerId()).isEqualTo("worker-2");
        }

        @Test
        @DisplayName("should only consider workers carrying a required tag")
        void shouldFilterByTags() {
            registerTwoWorkers(3);

            for (int i = 0; i < 3; i++) {
                assertThat(balancer.assign("s" + i, null, Set.of("extraction")).workerId()).isEqualTo("worker-2");
            }
            Assignment overflow = balancer.assign("s3", null, Set.of("extraction"));

            assertThat(overflow.rejectionReason()).isEqualTo(BackpressureReason.NO_WORKER_CAPACITY);
        }

        @Test
        @DisplayName("should reject with NO_MATCHING_WORKER for unknown tags")
        void shouldRejectUnknownTags() {
            registerTwoWorkers(3);

            Assignment assignment = balancer.assign("session", null, Set.of("translation"));

            assertThat(assignment.rejectionReason()).isEqualTo(BackpressureReason.NO_MATCHING_WORKER);
            BackpressureException exception = assignment.toException();
            assertThat(exception.getReason()).isEqualTo(BackpressureReason.NO_MATCHING_WORKER);
            assertThat(exception.getErrorType()).isEqualTo(ErrorType.CAPACITY_ERROR);
        }

        @Test
        @DisplayName("should reject when no worker is registered")
        void shouldRejectWithoutWorkers() {
            Assignment assignment = balancer.assign("session", null, null);

            assertThat(assignment.rejectionReason()).isEqualTo(BackpressureReason.NO_MATCHING_WORKER);
        }

        @Test
        @DisplayName("should spread sessions with least-loaded selection")
        void shouldSpreadLoad() {
            registerTwoWorkers(3);

            String first = balancer.assign("a", null, null).workerId();
            String second = balancer.assign("b", null, null).workerId();

            assertThat(first).isNotEqualTo(second);
        }
    }

    @Nested
    @DisplayName("release and cleanup")
    class ReleaseAndCleanup {

        @Test
        @DisplayName("should free the slot on release")
        void shouldFreeSlotOnRelease() {
            registerTwoWorkers(1);
            String workerId = balancer.assign("session", null, null).workerId();

            assertThat(balancer.release("session")).isTrue();

            assertThat(balancer.getWorker(workerId).orElseThrow().getCurrentLoad()).isZero();
            assertThat(balancer.activeSessionCount()).isZero();
        }

        @Test
        @DisplayName("should report false when releasing an unknown session")
        void shouldIgnoreUnknownRelease() {
            registerTwoWorkers(1);

            assertThat(balancer.release("nobody")).isFalse();
            assertThat(balancer.release(null)).isFalse();
        }

        @Test
        @DisplayName("should remove only sessions idle strictly longer than the threshold")
        void shouldCleanupStrictlyExpiredSessions() {
            registerTwoWorkers(3);
            balancer.assign("old", null, null);
            clock.advance(Duration.ofMinutes(10));
            balancer.assign("recent", null, null);

            assertThat(balancer.cleanupExpired(Duration.ofMinutes(10))).isZero();

            clock.advance(Duration.ofMillis(1));
            assertThat(balancer.cleanupExpired(Duration.ofMinutes(10))).isEqualTo(1);

            assertThat(balancer.getBinding("old")).isEmpty();
            assertThat(balancer.getBinding("recent")).isPresent();
            assertThat(balancer.metrics().workerLoads().values())
                    .extracting(LoadBalancingMetrics.WorkerLoad::currentLoad)
                    .containsExactlyInAnyOrder(0, 1);
        }

        @Test
        @DisplayName("should keep a session alive when it is used again")
        void shouldRefreshActivityOnReuse() {
            registerTwoWorkers(3);
            balancer.assign("session", null, null);
            clock.advance(Duration.ofMinutes(8));
            balancer.assign("session", null, null);
            clock.advance(Duration.ofMinutes(8));

            assertThat(balancer.cleanupExpired(Duration.ofMinutes(10))).isZero();
        }
    }

    @Nested
    @DisplayName("waiting for a slot")
    class Waiting {

        @Test
        @DisplayName("should hand a freed slot to a waiting session")
        void shouldWakeOnRelease() throws Exception {
            balancer.registerWorker("worker-1", 1, Set.of());
            balancer.assign("holder", null, null);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                CompletableFuture<Assignment> waiting = CompletableFuture.supplyAsync(() -> {
                    try {
                        return balancer.awaitAssignment("waiter", null, null, Duration.ofSeconds(5));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                }, executor);

                Thread.sleep(100);
                assertThat(waiting).isNotDone();
                balancer.release("holder");

                Assignment assignment = waiting.get(5, TimeUnit.SECONDS);
                assertThat(assignment.isAssigned()).isTrue();
                assertThat(assignment.workerId()).isEqualTo("worker-1");
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("should reject with SLOT_WAIT_TIMEOUT when no slot frees up in time")
        void shouldTimeOutWaiting() throws InterruptedException {
            balancer.registerWorker("worker-1", 1, Set.of());
            balancer.assign("holder", null, null);

            long start = System.nanoTime();
            Assignment assignment = balancer.awaitAssignment("waiter", null, null, Duration.ofMillis(100));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(assignment.rejectionReason()).isEqualTo(BackpressureReason.SLOT_WAIT_TIMEOUT);
            assertThat(elapsedMs).isGreaterThanOrEqualTo(90);
            assertThat(balancer.metrics().rejectedSessions()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not wait when no worker can ever match")
        void shouldNotWaitForMissingSpecialization() throws InterruptedException {
            balancer.registerWorker("worker-1", 1, Set.of("summary"));

            long start = System.nanoTime();
            Assignment assignment = balancer.awaitAssignment("s", null, Set.of("translation"), Duration.ofSeconds(5));

            assertThat(assignment.rejectionReason()).isEqualTo(BackpressureReason.NO_MATCHING_WORKER);
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1000);
        }

        @Test
        @DisplayName("should propagate interruption without holding a slot")
        void shouldPropagateInterrupt() throws Exception {
            balancer.registerWorker("worker-1", 1, Set.of());
            balancer.assign("holder", null, null);
            AtomicBoolean interrupted = new AtomicBoolean(false);
            CountDownLatch finished = new CountDownLatch(1);

            Thread waiter = new Thread(() -> {
                try {
                    balancer.awaitAssignment("waiter", null, null, Duration.ofSeconds(10));
                } catch (InterruptedException e) {
                    interrupted.set(true);
                } finally {
                    finished.countDown();
                }
            });
            waiter.start();
            Thread.sleep(100);
            waiter.interrupt();

            assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(interrupted).isTrue();
            assertThat(balancer.getBinding("waiter")).isEmpty();
            assertThat(balancer.getWorker("worker-1").orElseThrow().getCurrentLoad()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should never exceed worker capacity under concurrent assignment")
    void shouldRespectCapacityConcurrently() throws InterruptedException {
        registerTwoWorkers(5);
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger assigned = new AtomicInteger();
        AtomicInteger overloaded = new AtomicInteger();

        for (int t = 0; t < threads; t++) {
            int thread = t;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        String session = "t" + thread + "-" + i;
                        Assignment assignment = balancer.assign(session, null, null);
                        if (assignment.isAssigned()) {
                            assigned.incrementAndGet();
                            WorkerSlot worker = balancer.getWorker(assignment.workerId()).orElseThrow();
                            if (worker.getCurrentLoad() > worker.getCapacity()) {
                                overloaded.incrementAndGet();
                            }
                            balancer.release(session);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(overloaded).hasValue(0);
        assertThat(assigned.get()).isPositive();
        assertThat(balancer.activeSessionCount()).isZero();
        assertThat(balancer.metrics().workerLoads().values())
                .allSatisfy(load -> assertThat(load.currentLoad()).isZero());
    }

    @Test
    @DisplayName("should bind concurrent requests of one session to a single worker")
    void shouldBindSessionOnceUnderRace() throws InterruptedException {
        registerTwoWorkers(5);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicBoolean split = new AtomicBoolean(false);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    String workerId = balancer.assign("shared", null, null).workerId();
                    if (!seen.compareAndSet(null, workerId) && !seen.get().equals(workerId)) {
                        split.set(true);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(split).isFalse();
        int totalLoad = balancer.metrics().workerLoads().values().stream()
                .mapToInt(LoadBalancingMetrics.WorkerLoad::currentLoad)
                .sum();
        assertThat(totalLoad).isEqualTo(1);
    }

    @Test
    @DisplayName("should refuse a duplicate worker id")
    void shouldRefuseDuplicateWorker() {
        balancer.registerWorker("worker-1", 1, Set.of());

        assertThatThrownBy(() -> balancer.registerWorker("worker-1", 2, Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should record heartbeats for known workers only")
    void shouldRecordHeartbeats() {
        balancer.registerWorker("worker-1", 1, Set.of());
        clock.advance(Duration.ofSeconds(30));

        assertThat(balancer.heartbeat("worker-1")).isTrue();
        assertThat(balancer.heartbeat("ghost")).isFalse();
        assertThat(balancer.getWorker("worker-1").orElseThrow().getLastHeartbeat()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("should report load metrics")
    void shouldReportMetrics() {
        registerTwoWorkers(2);
        balancer.assign("a", "worker-1", null);
        balancer.assign("b", "worker-1", null);
        balancer.assign("c", null, Set.of("translation"));

        LoadBalancingMetrics metrics = balancer.metrics();

        assertThat(metrics.totalSessions()).isEqualTo(3);
        assertThat(metrics.balancedSessions()).isEqualTo(2);
        assertThat(metrics.rejectedSessions()).isEqualTo(1);
        assertThat(metrics.activeSessions()).isEqualTo(2);
        assertThat(metrics.totalWorkers()).isEqualTo(2);
        assertThat(metrics.availableWorkers()).isEqualTo(1);
        assertThat(metrics.busyWorkers()).isEqualTo(1);
        assertThat(metrics.averageLoad()).isEqualTo(0.5);
        assertThat(metrics.strategy()).isEqualTo("least-loaded");
    }

    @Test
    @DisplayName("should swap strategy at runtime")
    void shouldSwapStrategy() {
        balancer.setStrategy(new RoundRobinStrategy());

        assertThat(balancer.getStrategy().getName()).isEqualTo("round-robin");
        assertThat(balancer.metrics().strategy()).isEqualTo("round-robin");
    }

    @Test
    @DisplayName("should build workers from the builder")
    void shouldBuildWithWorkers() {
        try (SessionLoadBalancer built = SessionLoadBalancer.builder()
                .clock(clock)
                .worker(WorkerSlot.builder().id("w").capacity(2).lastHeartbeat(clock.instant()).build())
                .build()) {
            assertThat(built.workerCount()).isEqualTo(1);
            assertThat(built.assign("s", null, List.of()).workerId()).isEqualTo("w");
        }
    }
}
