package fr.lapetina.optimizer.infrastructure.metrics;

import fr.lapetina.optimizer.domain.model.ErrorType;
import fr.lapetina.optimizer.domain.model.MetricSample;
import fr.lapetina.optimizer.domain.report.LatencyMetrics;
import fr.lapetina.optimizer.domain.report.RequestMetrics;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Metrics registry for the optimizer, one instance per optimizer.
 *
 * Provides:
 * - Thread-safe request, cache and error counters
 * - A rolling sample window with nearest-rank percentiles
 * - Concurrency and peak-concurrency tracking
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final Clock clock;
    private final LatencyWindow window;
    private final JvmGcMetrics gcMetrics;

    private final Timer requestLatency;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final ConcurrentHashMap<ErrorType, Counter> errorCounters = new ConcurrentHashMap<>();

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong timeoutRequests = new AtomicLong();
    private final AtomicInteger concurrentRequests = new AtomicInteger();
    private final AtomicInteger peakConcurrentRequests = new AtomicInteger();

    // Optimizer outcome counters
    private final AtomicLong optimizerRequests = new AtomicLong();
    private final AtomicLong optimizedRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong loadBalancedRequests = new AtomicLong();

    public MetricsRegistry(String prefix, int windowSize, Duration windowDuration, Clock clock) {
        this.prefix = prefix;
        this.clock = clock;
        this.window = new LatencyWindow(windowSize, windowDuration);
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        this.gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.requestLatency = Timer.builder(prefix + "_request_latency")
                .description("Optimize call latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        this.successCounter = Counter.builder(prefix + "_requests_total")
                .description("Total number of optimize calls")
                .tag("outcome", "success")
                .register(registry);
        this.failureCounter = Counter.builder(prefix + "_requests_total")
                .description("Total number of optimize calls")
                .tag("outcome", "failure")
                .register(registry);

        Gauge.builder(prefix + "_concurrent_requests", concurrentRequests, AtomicInteger::get)
                .description("Optimize calls currently in progress")
                .register(registry);
        Gauge.builder(prefix + "_window_samples", window, LatencyWindow::size)
                .description("Samples currently held in the rolling window")
                .register(registry);
        FunctionCounter.builder(prefix + "_cache_hits_total", cacheHits, AtomicLong::get)
                .description("Optimize calls served from the cache")
                .register(registry);
        FunctionCounter.builder(prefix + "_optimized_total", optimizedRequests, AtomicLong::get)
                .description("Optimize calls served from cache or tuned")
                .register(registry);

        log.info("MetricsRegistry initialized: prefix={}, windowSize={}, windowDuration={}",
                prefix, windowSize, windowDuration);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, 1000, Duration.ofMinutes(5), Clock.systemUTC());
    }

    /**
     * Records one request outcome into the counters, the Micrometer timer and the rolling window.
     */
    public void recordSample(MetricSample sample) {
        totalRequests.incrementAndGet();
        if (sample.success()) {
            successfulRequests.incrementAndGet();
            successCounter.increment();
        } else {
            failedRequests.incrementAndGet();
            failureCounter.increment();
        }
        requestLatency.record(sample.latency());
        window.add(sample);
    }

    /**
     * Increments the error counter for a failure category.
     */
    public void incrementErrorCount(ErrorType errorType) {
        if (errorType == ErrorType.TIMEOUT) {
            timeoutRequests.incrementAndGet();
        }
        errorCounters.computeIfAbsent(errorType, type ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of failed optimize calls")
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Marks the start of a request for concurrency tracking.
     */
    public void requestStarted() {
        int current = concurrentRequests.incrementAndGet();
        peakConcurrentRequests.accumulateAndGet(current, Math::max);
    }

    public void requestFinished() {
        concurrentRequests.decrementAndGet();
    }

    /**
     * Records how an optimize call was served.
     */
    public void recordOutcome(boolean cacheHit, boolean optimized, boolean loadBalanced) {
        optimizerRequests.incrementAndGet();
        if (cacheHit) {
            cacheHits.incrementAndGet();
        }
        if (optimized) {
            optimizedRequests.incrementAndGet();
        }
        if (loadBalanced) {
            loadBalancedRequests.incrementAndGet();
        }
    }

    /**
     * Request counters plus window-derived error rate and throughput.
     */
    public RequestMetrics requestMetrics() {
        Instant now = clock.instant();
        List<MetricSample> samples = window.snapshot(now);

        int failures = 0;
        for (MetricSample sample : samples) {
            if (!sample.success()) {
                failures++;
            }
        }
        double errorRate = samples.isEmpty() ? 0.0 : (double) failures / samples.size();

        double requestsPerSecond = 0.0;
        if (!samples.isEmpty()) {
            Duration span = Duration.between(samples.get(0).timestamp(), now);
            double seconds = Math.max(span.toMillis() / 1000.0, 1.0);
            requestsPerSecond = samples.size() / seconds;
        }

        return new RequestMetrics(
                totalRequests.get(),
                successfulRequests.get(),
                failedRequests.get(),
                timeoutRequests.get(),
                samples.size(),
                errorRate,
                requestsPerSecond,
                concurrentRequests.get(),
                peakConcurrentRequests.get()
        );
    }

    /**
     * Latency distribution over the current window.
     */
    public LatencyMetrics latencyMetrics() {
        List<MetricSample> samples = window.snapshot(clock.instant());
        if (samples.isEmpty()) {
            return LatencyMetrics.empty();
        }

        long[] nanos = new long[samples.size()];
        long sum = 0;
        for (int i = 0; i < nanos.length; i++) {
            nanos[i] = samples.get(i).latency().toNanos();
            sum += nanos[i];
        }
        Arrays.sort(nanos);

        return new LatencyMetrics(
                Duration.ofNanos(sum / nanos.length),
                Duration.ofNanos(Percentiles.nearestRank(nanos, 0.50)),
                Duration.ofNanos(Percentiles.nearestRank(nanos, 0.95)),
                Duration.ofNanos(Percentiles.nearestRank(nanos, 0.99)),
                Duration.ofNanos(nanos[0]),
                Duration.ofNanos(nanos[nanos.length - 1]),
                nanos.length
        );
    }

    /**
     * Registers a gauge backed by a supplier, e.g. cache size or active sessions.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    public long getOptimizerRequests() {
        return optimizerRequests.get();
    }

    public long getOptimizedRequests() {
        return optimizedRequests.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getLoadBalancedRequests() {
        return loadBalancedRequests.get();
    }

    public int getConcurrentRequests() {
        return concurrentRequests.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        gcMetrics.close();
        registry.close();
    }
}
