package fr.lapetina.optimizer;

import fr.lapetina.optimizer.balancer.Assignment;
import fr.lapetina.optimizer.balancer.SessionLoadBalancer;
import fr.lapetina.optimizer.cache.CacheStore;
import fr.lapetina.optimizer.domain.backend.GenerationBackend;
import fr.lapetina.optimizer.domain.backend.GenerationBackendException;
import fr.lapetina.optimizer.domain.backend.GenerationResult;
import fr.lapetina.optimizer.domain.exception.OptimizationException;
import fr.lapetina.optimizer.domain.model.CachedAnalysis;
import fr.lapetina.optimizer.domain.model.ErrorType;
import fr.lapetina.optimizer.domain.model.OptimizationRequest;
import fr.lapetina.optimizer.domain.model.OptimizationResult;
import fr.lapetina.optimizer.domain.report.CacheStatistics;
import fr.lapetina.optimizer.domain.report.LoadBalancingMetrics;
import fr.lapetina.optimizer.domain.report.PerformanceOptimizationMetrics;
import fr.lapetina.optimizer.domain.report.SystemPerformanceReport;
import fr.lapetina.optimizer.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.optimizer.monitor.PerformanceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for generation requests: cache lookup, worker slot, backend call, cache store.
 *
 * <p>A request either returns a result or throws an {@link OptimizationException}. Every
 * failure releases the worker slot it holds, is recorded as a failed request and is never
 * cached. The backend is called at most once per request; retrying is the caller's decision.
 * The request deadline covers both the slot wait and the generation.
 */
public final class RequestOptimizer {

    private static final Logger log = LoggerFactory.getLogger(RequestOptimizer.class);

    private final CacheStore cache;
    private final SessionLoadBalancer balancer;
    private final PerformanceMonitor monitor;
    private final MetricsRegistry metrics;
    private final GenerationBackend backend;
    private final PromptTuner tuner;
    private final QualityEstimator qualityEstimator;
    private final Duration defaultTimeout;
    private final Clock clock;

    private RequestOptimizer(Builder builder) {
        this.cache = builder.cache;
        this.balancer = builder.balancer;
        this.monitor = builder.monitor;
        this.metrics = builder.metrics;
        this.backend = builder.backend;
        this.tuner = builder.tuner;
        this.qualityEstimator = builder.qualityEstimator;
        this.defaultTimeout = builder.defaultTimeout;
        this.clock = builder.clock;
    }

    /**
     * Serves a request from the cache or the backend.
     *
     * @throws OptimizationException with {@link ErrorType#INVALID_REQUEST} for bad parameters,
     *         {@link ErrorType#CAPACITY_ERROR} when no worker slot is available in time,
     *         {@link ErrorType#TIMEOUT} when generation exceeds the deadline,
     *         {@link ErrorType#CANCELLED} when the calling thread is interrupted,
     *         {@link ErrorType#BACKEND_ERROR} when the backend fails
     */
    public OptimizationResult optimize(OptimizationRequest request) {
        validate(request);

        long start = System.nanoTime();
        MDC.put("requestId", request.requestId());
        MDC.put("sessionId", request.sessionId());
        MDC.put("analysisType", request.analysisType());
        metrics.requestStarted();
        try {
            Optional<CachedAnalysis> cached = cache.lookup(request.analysisType(), request.content());
            if (cached.isPresent()) {
                Duration elapsed = elapsedSince(start);
                metrics.recordOutcome(true, true, false);
                monitor.recordRequest(true, elapsed);
                log.debug("Served from cache: requestId={}, accessCount={}, elapsedMs={}",
                        request.requestId(), cached.get().accessCount(), elapsed.toMillis());
                return new OptimizationResult(request.requestId(), cached.get().content(),
                        cached.get().tokensUsed(), elapsed, true, true, request.sessionId(), null);
            }
            return generate(request, start);
        } catch (OptimizationException e) {
            recordFailure(request, e, start);
            throw e;
        } catch (RuntimeException e) {
            OptimizationException wrapped = new OptimizationException(ErrorType.INTERNAL_ERROR,
                    "Unexpected failure: " + e.getMessage(), e);
            recordFailure(request, wrapped, start);
            throw wrapped;
        } finally {
            metrics.requestFinished();
            MDC.remove("requestId");
            MDC.remove("sessionId");
            MDC.remove("analysisType");
            MDC.remove("workerId");
        }
    }

    private OptimizationResult generate(OptimizationRequest request, long start) {
        Duration timeout = request.timeout() != null ? request.timeout() : defaultTimeout;
        long deadline = start + timeout.toNanos();
        PromptTuner.Tuned tuned = tuner.tune(request.prompt(), request.maxTokens(), request.temperature());

        Assignment assignment;
        try {
            assignment = balancer.awaitAssignment(request.sessionId(), request.preferredWorkerId(),
                    request.requiredTags(), remaining(deadline));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OptimizationException(ErrorType.CANCELLED, "Interrupted while waiting for a worker slot", e);
        }
        if (assignment.isRejected()) {
            throw assignment.toException();
        }
        MDC.put("workerId", assignment.workerId());

        // A reused binding belongs to the request that created it
        boolean ownsBinding = !assignment.reused();
        try {
            GenerationResult result = awaitGeneration(tuned, deadline);
            Duration elapsed = elapsedSince(start);

            if (result.isComplete()) {
                double estimate = qualityEstimator.estimate(result);
                if (Double.isNaN(estimate)) {
                    log.warn("Generation result not cached, quality estimate is NaN: requestId={}, estimator={}",
                            request.requestId(), qualityEstimator.getClass().getSimpleName());
                } else {
                    double quality = Math.max(0.0, Math.min(1.0, estimate));
                    cache.store(request.analysisType(), request.content(), result.text(), result.tokensUsed(), quality);
                }
            } else {
                log.info("Generation result not cached: requestId={}, finishReason={}, blank={}",
                        request.requestId(), result.finishReason(), result.text().isBlank());
            }

            metrics.recordOutcome(false, tuned.changed(), true);
            monitor.recordRequest(true, elapsed);
            log.info("Request generated: requestId={}, workerId={}, tokens={}, tuned={}, elapsedMs={}",
                    request.requestId(), assignment.workerId(), result.tokensUsed(), tuned.changed(), elapsed.toMillis());
            return new OptimizationResult(request.requestId(), result.text(), result.tokensUsed(), elapsed,
                    false, tuned.changed(), request.sessionId(), assignment.workerId());
        } finally {
            if (ownsBinding) {
                balancer.release(request.sessionId());
            }
        }
    }

    private GenerationResult awaitGeneration(PromptTuner.Tuned tuned, long deadline) {
        CompletableFuture<GenerationResult> future;
        try {
            future = backend.generate(tuned.prompt(), tuned.options().withTimeout(remaining(deadline)));
        } catch (RuntimeException e) {
            throw new OptimizationException(ErrorType.BACKEND_ERROR,
                    "Backend rejected the request: " + e.getMessage(), isTransient(e), e);
        }
        if (future == null) {
            throw new OptimizationException(ErrorType.INTERNAL_ERROR, "Backend returned no result: " + backend.getName());
        }

        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OptimizationException(ErrorType.TIMEOUT, "Generation exceeded the request deadline", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OptimizationException(ErrorType.CANCELLED, "Interrupted while waiting for generation", e);
        } catch (CancellationException e) {
            throw new OptimizationException(ErrorType.CANCELLED, "Generation was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new OptimizationException(ErrorType.BACKEND_ERROR,
                    "Generation failed: " + cause.getMessage(), isTransient(cause), cause);
        }
    }

    /**
     * Backend failures are transient unless the backend says otherwise.
     */
    private static boolean isTransient(Throwable failure) {
        return !(failure instanceof GenerationBackendException)
                || ((GenerationBackendException) failure).isTransient();
    }

    private void validate(OptimizationRequest request) {
        String problem = null;
        if (request == null) {
            problem = "Request is required";
        } else if (request.analysisType().isBlank()) {
            problem = "Analysis type must not be blank";
        } else if (request.maxTokens() <= 0) {
            problem = "maxTokens must be positive: " + request.maxTokens();
        } else if (Double.isNaN(request.temperature()) || request.temperature() < 0.0) {
            problem = "temperature must be a non-negative number: " + request.temperature();
        } else if (request.timeout() != null && (request.timeout().isNegative() || request.timeout().isZero())) {
            problem = "timeout must be positive: " + request.timeout();
        }
        if (problem != null) {
            metrics.incrementErrorCount(ErrorType.INVALID_REQUEST);
            log.warn("Invalid request rejected: requestId={}, reason={}",
                    request != null ? request.requestId() : null, problem);
            throw new OptimizationException(ErrorType.INVALID_REQUEST, problem);
        }
    }

    private void recordFailure(OptimizationRequest request, OptimizationException e, long start) {
        Duration elapsed = elapsedSince(start);
        metrics.recordOutcome(false, false, false);
        metrics.incrementErrorCount(e.getErrorType());
        monitor.recordRequest(false, elapsed);

        switch (e.getErrorType()) {
            case BACKEND_ERROR, INTERNAL_ERROR -> log.error(
                    "Request failed: requestId={}, errorType={}, transient={}, elapsedMs={}, error={}",
                    request.requestId(), e.getErrorType(), e.isTransient(), elapsed.toMillis(), e.getMessage());
            default -> log.warn("Request failed: requestId={}, errorType={}, elapsedMs={}, error={}",
                    request.requestId(), e.getErrorType(), elapsed.toMillis(), e.getMessage());
        }
    }

    public PerformanceOptimizationMetrics metrics() {
        long total = metrics.getOptimizerRequests();
        long hits = metrics.getCacheHits();
        long optimized = metrics.getOptimizedRequests();
        return new PerformanceOptimizationMetrics(
                total,
                optimized,
                hits,
                metrics.getLoadBalancedRequests(),
                total > 0 ? (double) hits / total : 0.0,
                total > 0 ? (double) optimized / total : 0.0,
                balancer.activeSessionCount(),
                metrics.latencyMetrics().mean(),
                clock.instant()
        );
    }

    public SystemPerformanceReport report() {
        return monitor.report();
    }

    public CacheStatistics cacheStatistics() {
        return cache.stats();
    }

    public LoadBalancingMetrics loadBalancingMetrics() {
        return balancer.metrics();
    }

    private static Duration remaining(long deadline) {
        return Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
    }

    private static Duration elapsedSince(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for RequestOptimizer.
     */
    public static final class Builder {
        private CacheStore cache;
        private SessionLoadBalancer balancer;
        private PerformanceMonitor monitor;
        private MetricsRegistry metrics;
        private GenerationBackend backend;
        private PromptTuner tuner = new PromptTuner(2000, 1500, 0.8, 0.7);
        private QualityEstimator qualityEstimator = new HeuristicQualityEstimator();
        private Duration defaultTimeout = Duration.ofSeconds(60);
        private Clock clock = Clock.systemUTC();

        public Builder cache(CacheStore cache) {
            this.cache = cache;
            return this;
        }

        public Builder balancer(SessionLoadBalancer balancer) {
            this.balancer = balancer;
            return this;
        }

        public Builder monitor(PerformanceMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder backend(GenerationBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder tuner(PromptTuner tuner) {
            this.tuner = tuner;
            return this;
        }

        public Builder qualityEstimator(QualityEstimator qualityEstimator) {
            this.qualityEstimator = qualityEstimator;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RequestOptimizer build() {
            if (cache == null) {
                throw new IllegalStateException("CacheStore is required");
            }
            if (balancer == null) {
                throw new IllegalStateException("SessionLoadBalancer is required");
            }
            if (monitor == null) {
                throw new IllegalStateException("PerformanceMonitor is required");
            }
            if (metrics == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (backend == null) {
                throw new IllegalStateException("GenerationBackend is required");
            }
            return new RequestOptimizer(this);
        }
    }
}
