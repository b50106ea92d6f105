package fr.lapetina.optimizer;

import fr.lapetina.optimizer.balancer.SessionLoadBalancer;
import fr.lapetina.optimizer.cache.CacheStore;
import fr.lapetina.optimizer.domain.backend.FinishReason;
import fr.lapetina.optimizer.domain.backend.GenerationBackendException;
import fr.lapetina.optimizer.domain.backend.GenerationResult;
import fr.lapetina.optimizer.domain.exception.BackpressureException;
import fr.lapetina.optimizer.domain.exception.BackpressureException.BackpressureReason;
import fr.lapetina.optimizer.domain.exception.OptimizationException;
import fr.lapetina.optimizer.domain.model.ErrorType;
import fr.lapetina.optimizer.domain.model.OptimizationRequest;
import fr.lapetina.optimizer.domain.model.OptimizationResult;
import fr.lapetina.optimizer.domain.report.LoadBalancingMetrics;
import fr.lapetina.optimizer.domain.report.PerformanceOptimizationMetrics;
import fr.lapetina.optimizer.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.optimizer.monitor.PerformanceMonitor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

class RequestOptimizerTest {

    private MetricsRegistry metrics;
    private CacheStore cache;
    private SessionLoadBalancer balancer;
    private PerformanceMonitor monitor;
    private StubGenerationBackend backend;
    private RequestOptimizer optimizer;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("optimizer_test");
        cache = CacheStore.builder().maxSize(100).compressionThreshold(500).build();
        balancer = SessionLoadBalancer.builder().build();
        balancer.registerWorker("worker-1", 1, Set.of("summary"));
        balancer.registerWorker("worker-2", 1, Set.of("extraction"));
        monitor = PerformanceMonitor.builder()
                .metricsRegistry(metrics)
                .collectSystemMetrics(false)
                .build();
        backend = new StubGenerationBackend();
        optimizer = RequestOptimizer.builder()
                .cache(cache)
                .balancer(balancer)
                .monitor(monitor)
                .metrics(metrics)
                .backend(backend)
                .defaultTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        balancer.close();
        cache.close();
        metrics.close();
    }

    private static OptimizationRequest request(String content) {
        return OptimizationRequest.builder().analysisType("summary").content(content).build();
    }

    private void assertAllSlotsFree() {
        assertThat(balancer.activeSessionCount()).isZero();
        assertThat(balancer.metrics().workerLoads().values())
                .extracting(LoadBalancingMetrics.WorkerLoad::currentLoad)
                .containsOnly(0);
    }

    @Nested
    @DisplayName("serving requests")
    class Serving {

        @Test
        @DisplayName("should generate on a miss and serve the repeat from cache")
        void shouldCacheGeneratedResults() {
            OptimizationResult first = optimizer.optimize(request("quarterly report"));
            OptimizationResult second = optimizer.optimize(request("quarterly report"));

            assertThat(first.cacheHit()).isFalse();
            assertThat(first.workerId()).isNotNull();
            assertThat(first.content()).isEqualTo("generated answer");
            assertThat(first.tokensUsed()).isEqualTo(25);

            assertThat(second.cacheHit()).isTrue();
            assertThat(second.optimized()).isTrue();
            assertThat(second.workerId()).isNull();
            assertThat(second.content()).isEqualTo("generated answer");

            assertThat(backend.callCount()).isEqualTo(1);
            assertAllSlotsFree();
        }

        @Test
        @DisplayName("should report optimizer figures")
        void shouldReportMetrics() {
            optimizer.optimize(request("a"));
            optimizer.optimize(request("a"));
            optimizer.optimize(request("b"));

            PerformanceOptimizationMetrics summary = optimizer.metrics();

            assertThat(summary.totalRequests()).isEqualTo(3);
            assertThat(summary.cacheHits()).isEqualTo(1);
            assertThat(summary.loadBalancedRequests()).isEqualTo(2);
            assertThat(summary.cacheHitRate()).isCloseTo(1.0 / 3, within(1e-9));
            assertThat(optimizer.cacheStatistics().size()).isEqualTo(2);
            assertThat(optimizer.report().requests().successfulRequests()).isEqualTo(3);
        }

        @Test
        @DisplayName("should store the estimated quality with the result")
        void shouldStoreEstimatedQuality() {
            optimizer.optimize(request("short answer please"));

            assertThat(cache.lookup("summary", "short answer please").orElseThrow().quality()).isCloseTo(0.8, within(1e-9));
        }

        @Test
        @DisplayName("should route by required tags")
        void shouldRouteByTags() {
            OptimizationResult result = optimizer.optimize(OptimizationRequest.builder()
                    .analysisType("extraction")
                    .content("invoice")
                    .requiredTags(Set.of("extraction"))
                    .build());

            assertThat(result.workerId()).isEqualTo("worker-2");
        }

        @Test
        @DisplayName("should keep a binding it did not create")
        void shouldNotReleaseForeignBinding() {
            balancer.assign("conversation", null, null);

            optimizer.optimize(OptimizationRequest.builder()
                    .analysisType("summary")
                    .content("follow-up")
                    .sessionId("conversation")
                    .build());

            assertThat(balancer.getBinding("conversation")).isPresent();
        }
    }

    @Nested
    @DisplayName("tuning")
    class Tuning {

        @Test
        @DisplayName("should collapse whitespace and cap oversized parameters")
        void shouldTuneRequest() {
            OptimizationResult result = optimizer.optimize(OptimizationRequest.builder()
                    .analysisType("summary")
                    .content("doc")
                    .prompt("  summarize\n\n   this   document ")
                    .maxTokens(5000)
                    .temperature(0.95)
                    .build());

            assertThat(result.optimized()).isTrue();
            assertThat(backend.lastPrompt()).isEqualTo("summarize this document");
            assertThat(backend.lastOptions().maxTokens()).isEqualTo(1500);
            assertThat(backend.lastOptions().temperature()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("should leave a clean request untouched")
        void shouldNotTuneCleanRequest() {
            OptimizationResult result = optimizer.optimize(request("clean prompt"));

            assertThat(result.optimized()).isFalse();
            assertThat(backend.lastPrompt()).isEqualTo("clean prompt");
            assertThat(backend.lastOptions().maxTokens()).isEqualTo(OptimizationRequest.DEFAULT_MAX_TOKENS);
        }

        @Test
        @DisplayName("should hand the remaining request time to the backend")
        void shouldPassRemainingTimeout() {
            optimizer.optimize(OptimizationRequest.builder()
                    .analysisType("summary")
                    .content("timed doc")
                    .timeout(Duration.ofSeconds(3))
                    .build());

            assertThat(backend.lastOptions().timeout())
                    .isNotNull()
                    .isPositive()
                    .isLessThanOrEqualTo(Duration.ofSeconds(3));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should time out, cancel the generation and free the slot")
        void shouldTimeOut() {
            CompletableFuture<GenerationResult> pending = new CompletableFuture<>();
            backend.respondingWith((prompt, opts) -> pending);

            OptimizationException error = catchThrowableOfType(() -> optimizer.optimize(
                    OptimizationRequest.builder().analysisType("summary").content("slow")
                            .timeout(Duration.ofMillis(100)).build()),
                    OptimizationException.class);

            assertThat(error.getErrorType()).isEqualTo(ErrorType.TIMEOUT);
            assertThat(error.isTransient()).isTrue();
            assertThat(pending).isCancelled();
            assertThat(cache.size()).isZero();
            assertThat(metrics.requestMetrics().timeoutRequests()).isEqualTo(1);
            assertAllSlotsFree();
        }

        @Test
        @DisplayName("should surface backend failures without caching them")
        void shouldSurfaceBackendFailure() {
            backend.respondingWith((prompt, opts) ->
                    CompletableFuture.failedFuture(new GenerationBackendException("HTTP 400: bad model", false)));

            OptimizationException error = catchThrowableOfType(() -> optimizer.optimize(request("broken")),
                    OptimizationException.class);

            assertThat(error.getErrorType()).isEqualTo(ErrorType.BACKEND_ERROR);
            assertThat(error.isTransient()).isFalse();
            assertThat(error.getCause()).isInstanceOf(GenerationBackendException.class);
            assertThat(cache.contains("summary", "broken")).isFalse();
            assertThat(monitor.report().requests().failedRequests()).isEqualTo(1);
            assertAllSlotsFree();
        }

        @Test
        @DisplayName("should treat a backend throwing synchronously as a transient backend error")
        void shouldHandleSynchronousThrow() {
            backend.respondingWith((prompt, opts) -> {
                throw new IllegalStateException("connection pool exhausted");
            });

            OptimizationException error = catchThrowableOfType(() -> optimizer.optimize(request("x")),
                    OptimizationException.class);

            assertThat(error.getErrorType()).isEqualTo(ErrorType.BACKEND_ERROR);
            assertThat(error.isTransient()).isTrue();
            assertAllSlotsFree();
        }

        @Test
        @DisplayName("should return but not cache a truncated result")
        void shouldNotCacheTruncatedResult() {
            backend.respondingWith((prompt, opts) ->
                    CompletableFuture.completedFuture(new GenerationResult("cut off mid", 1000, FinishReason.LENGTH)));

            OptimizationResult result = optimizer.optimize(request("long question"));

            assertThat(result.content()).isEqualTo("cut off mid");
            assertThat(cache.contains("summary", "long question")).isFalse();
        }

        @Test
        @DisplayName("should reject with a capacity error when no slot frees up before the deadline")
        void shouldRejectOnCapacity() {
            balancer.assign("holder", "worker-1", null);
            balancer.assign("holder-2", "worker-2", null);

            OptimizationException error = catchThrowableOfType(() -> optimizer.optimize(
                    OptimizationRequest.builder().analysisType("summary").content("queued")
                            .timeout(Duration.ofMillis(100)).build()),
                    OptimizationException.class);

            assertThat(error).isInstanceOf(BackpressureException.class);
            assertThat(error.getErrorType()).isEqualTo(ErrorType.CAPACITY_ERROR);
            assertThat(((BackpressureException) error).getReason()).isEqualTo(BackpressureReason.SLOT_WAIT_TIMEOUT);
            assertThat(backend.callCount()).isZero();
        }

        @Test
        @DisplayName("should reject at once when no worker has the specialization")
        void shouldRejectMissingSpecialization() {
            BackpressureException error = catchThrowableOfType(() -> optimizer.optimize(
                    OptimizationRequest.builder().analysisType("translation").content("bonjour")
                            .requiredTags(Set.of("translation")).build()),
                    BackpressureException.class);

            assertThat(error.getReason()).isEqualTo(BackpressureReason.NO_MATCHING_WORKER);
        }

        @Test
        @DisplayName("should reject invalid parameters before any work")
        void shouldRejectInvalidRequest() {
            OptimizationException zeroTokens = catchThrowableOfType(() -> optimizer.optimize(
                    OptimizationRequest.builder().analysisType("summary").content("x").maxTokens(0).build()),
                    OptimizationException.class);
            OptimizationException blankType = catchThrowableOfType(() -> optimizer.optimize(
                    OptimizationRequest.builder().analysisType(" ").content("x").build()),
                    OptimizationException.class);
            OptimizationException negativeTimeout = catchThrowableOfType(() -> optimizer.optimize(
                    OptimizationRequest.builder().analysisType("summary").content("x")
                            .timeout(Duration.ofSeconds(-1)).build()),
                    OptimizationException.class);

            assertThat(zeroTokens.getErrorType()).isEqualTo(ErrorType.INVALID_REQUEST);
            assertThat(blankType.getErrorType()).isEqualTo(ErrorType.INVALID_REQUEST);
            OptimizationException nanTemperature = catchThrowableOfType(() -> optimizer.optimize(
                    OptimizationRequest.builder().analysisType("summary").content("x")
                            .temperature(Double.NaN).build()),
                    OptimizationException.class);

            assertThat(negativeTimeout.getErrorType()).isEqualTo(ErrorType.INVALID_REQUEST);
            assertThat(nanTemperature.getErrorType()).isEqualTo(ErrorType.INVALID_REQUEST);
            assertThat(zeroTokens.isTransient()).isFalse();
            assertThat(backend.callCount()).isZero();
            assertThat(cache.stats().totalRequests()).isZero();
        }

        @Test
        @DisplayName("should return but not cache a result whose quality cannot be estimated")
        void shouldNotCacheUnscoredResult() {
            RequestOptimizer unscored = RequestOptimizer.builder()
                    .cache(cache)
                    .balancer(balancer)
                    .monitor(monitor)
                    .metrics(metrics)
                    .backend(backend)
                    .qualityEstimator(result -> Double.NaN)
                    .defaultTimeout(Duration.ofSeconds(5))
                    .build();

            OptimizationResult result = unscored.optimize(OptimizationRequest.of("summary", "unscored doc"));

            assertThat(result.content()).isEqualTo("generated answer");
            assertThat(cache.contains("summary", "unscored doc")).isFalse();
            assertThat(balancer.activeSessionCount()).isZero();
        }

        @Test
        @DisplayName("should report cancellation when the caller is interrupted")
        void shouldReportCancellation() {
            CompletableFuture<GenerationResult> pending = new CompletableFuture<>();
            backend.respondingWith((prompt, opts) -> pending);

            Thread.currentThread().interrupt();
            OptimizationException error;
            try {
                error = catchThrowableOfType(() -> optimizer.optimize(request("interrupted")),
                        OptimizationException.class);
            } finally {
                assertThat(Thread.interrupted()).isTrue();
            }

            assertThat(error.getErrorType()).isEqualTo(ErrorType.CANCELLED);
            assertThat(pending).isCancelled();
            assertAllSlotsFree();
        }
    }

    @Test
    @DisplayName("should serve concurrent requests without leaking slots")
    void shouldServeConcurrently() throws InterruptedException {
        backend.respondingWith((prompt, opts) -> CompletableFuture.supplyAsync(() -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new GenerationResult("answer to " + prompt, 10, FinishReason.STOP);
        }));
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        for (int t = 0; t < threads; t++) {
            int thread = t;
            executor.submit(() -> {
                try {
                    optimizer.optimize(OptimizationRequest.builder()
                            .analysisType("summary")
                            .content("document " + thread)
                            .timeout(Duration.ofSeconds(10))
                            .build());
                    succeeded.incrementAndGet();
                } catch (RuntimeException e) {
                    failure.set(e);
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(failure.get()).isNull();
        assertThat(succeeded).hasValue(threads);
        assertThat(cache.size()).isEqualTo(threads);
        assertAllSlotsFree();
    }
}
