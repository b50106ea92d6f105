package fr.lapetina.optimizer.monitor;

import fr.lapetina.optimizer.disruptor.MetricIngestPipeline;
import fr.lapetina.optimizer.domain.alert.AlertSeverity;
import fr.lapetina.optimizer.domain.alert.AlertThresholds;
import fr.lapetina.optimizer.domain.alert.AlertType;
import fr.lapetina.optimizer.domain.alert.PerformanceAlert;
import fr.lapetina.optimizer.domain.model.MetricSample;
import fr.lapetina.optimizer.domain.report.CacheMetrics;
import fr.lapetina.optimizer.domain.report.LatencyMetrics;
import fr.lapetina.optimizer.domain.report.LoadBalancingMetrics;
import fr.lapetina.optimizer.domain.report.RequestMetrics;
import fr.lapetina.optimizer.domain.report.SystemMetrics;
import fr.lapetina.optimizer.domain.report.SystemPerformanceReport;
import fr.lapetina.optimizer.infrastructure.config.ConfigValidator;
import fr.lapetina.optimizer.infrastructure.config.OptimizerConfig;
import fr.lapetina.optimizer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Aggregates request, cache and system figures and raises alerts on threshold breaches.
 *
 * <p>Request samples arrive through a Disruptor ring buffer and never block the caller.
 * A single scheduled task evaluates every threshold on each tick. Each (metric, severity)
 * pair fires at most once per cooldown window however long the breach lasts. Handlers are
 * invoked after evaluation, outside any lock.
 */
public final class PerformanceMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    static final int MAX_ALERT_HISTORY = 1000;
    public static final String DEFAULT_HANDLER = "log";

    private final MetricsRegistry metricsRegistry;
    private final MetricIngestPipeline ingest;
    private final Clock clock;
    private final Duration alertCooldown;
    private final int minimumSampleSize;
    private final boolean collectSystemMetrics;
    private final SystemMetricsCollector systemCollector;

    private final AtomicReference<AlertThresholds> thresholds;
    private final AtomicReference<CacheMetrics> cacheMetrics;
    private final AtomicReference<SystemMetrics> systemMetrics;
    private volatile Supplier<CacheMetrics> cacheSource;
    private volatile Supplier<LoadBalancingMetrics> loadBalancerSource;

    private final Map<String, AlertHandler> handlers = new ConcurrentHashMap<>();
    private final Map<AlertKey, AlertState> alertStates = new ConcurrentHashMap<>();
    private final Deque<PerformanceAlert> alertHistory = new ArrayDeque<>();

    private final ScheduledExecutorService scheduler;
    private final AtomicReference<ScheduledFuture<?>> monitoringTask = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private PerformanceMonitor(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.clock = builder.clock;
        this.alertCooldown = builder.alertCooldown;
        this.minimumSampleSize = builder.minimumSampleSize;
        this.collectSystemMetrics = builder.collectSystemMetrics;
        this.thresholds = new AtomicReference<>(builder.thresholds);
        this.cacheMetrics = new AtomicReference<>(CacheMetrics.empty(clock.instant()));
        this.systemMetrics = new AtomicReference<>(SystemMetrics.empty(clock.instant()));
        this.systemCollector = new SystemMetricsCollector(
                metricsRegistry.getRegistry(), this::currentWorkerCount, clock);
        this.ingest = MetricIngestPipeline.builder()
                .bufferSize(builder.ingestBufferSize)
                .waitStrategy(builder.waitStrategy)
                .metricsRegistry(metricsRegistry)
                .build();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "performance-monitor");
            t.setDaemon(true);
            return t;
        });

        handlers.put(DEFAULT_HANDLER, new LoggingAlertHandler());

        log.info("PerformanceMonitor created: alertCooldown={}, minimumSampleSize={}, thresholds={}",
                alertCooldown, minimumSampleSize, builder.thresholds);
    }

    /**
     * Starts asynchronous sample ingestion. Before this, samples are recorded inline.
     */
    public void start() {
        ingest.start();
    }

    /**
     * Records one request outcome. Never blocks: when the ingest buffer is full the sample is
     * dropped and counted.
     */
    public void recordRequest(boolean success, Duration latency) {
        Instant now = clock.instant();
        if (ingest.isRunning()) {
            ingest.tryPublish(now, success, latency);
        } else {
            metricsRegistry.recordSample(new MetricSample(now, success, latency));
        }
    }

    public void recordCacheMetrics(long hits, long misses, int size, long evictions, Duration averageAge) {
        cacheMetrics.set(new CacheMetrics(hits, misses, size, evictions, averageAge, clock.instant()));
    }

    public void recordSystemMetrics(double cpuUsage, double memoryUsage, int workerCount,
                                    long heapSize, Duration gcPause) {
        systemMetrics.set(new SystemMetrics(cpuUsage, memoryUsage, workerCount, heapSize, gcPause, clock.instant()));
    }

    /**
     * Cache figures pulled on every monitoring tick.
     */
    public void attachCacheSource(Supplier<CacheMetrics> source) {
        this.cacheSource = source;
    }

    /**
     * Load balancer figures included in every report.
     */
    public void attachLoadBalancerSource(Supplier<LoadBalancingMetrics> source) {
        this.loadBalancerSource = source;
    }

    public SystemPerformanceReport report() {
        RequestMetrics requests = metricsRegistry.requestMetrics();
        LatencyMetrics latency = metricsRegistry.latencyMetrics();
        Supplier<LoadBalancingMetrics> lbSource = loadBalancerSource;
        return new SystemPerformanceReport(
                requests,
                latency,
                cacheMetrics.get(),
                systemMetrics.get(),
                lbSource != null ? lbSource.get() : null,
                thresholds.get(),
                clock.instant()
        );
    }

    /**
     * Runs one monitoring tick: refresh sources, evaluate thresholds, dispatch alerts.
     *
     * @return alerts fired on this tick
     */
    public List<PerformanceAlert> runMonitoringCycle() {
        if (collectSystemMetrics) {
            systemMetrics.set(systemCollector.collect());
        }
        Supplier<CacheMetrics> source = cacheSource;
        if (source != null) {
            cacheMetrics.set(source.get());
        }

        SystemPerformanceReport report = report();
        List<PerformanceAlert> fired = evaluate(report, clock.instant());
        for (PerformanceAlert alert : fired) {
            dispatch(alert);
        }
        log.debug("Monitoring cycle complete: windowRequests={}, p95={}, alertsFired={}",
                report.requests().windowRequests(), report.latency().p95(), fired.size());
        return fired;
    }

    private List<PerformanceAlert> evaluate(SystemPerformanceReport report, Instant now) {
        List<PerformanceAlert> fired = new ArrayList<>();
        AlertThresholds t = report.thresholds();

        LatencyMetrics latency = report.latency();
        if (latency.sampleCount() > 0 && latency.mean().compareTo(t.maxResponseTime()) > 0) {
            breach(fired, AlertType.RESPONSE_TIME, AlertSeverity.WARNING, "avg_response_time",
                    "Average response time above limit",
                    latency.mean().toMillis(), t.maxResponseTime().toMillis(), now);
        }

        CacheMetrics cache = report.cache();
        if (cache.lookups() > 0 && cache.lookups() >= minimumSampleSize
                && cache.hitRate() < t.minCacheHitRate()) {
            breach(fired, AlertType.CACHE_HIT_RATE, AlertSeverity.WARNING, "cache_hit_rate",
                    "Cache hit rate below limit", cache.hitRate(), t.minCacheHitRate(), now);
        }

        RequestMetrics requests = report.requests();
        if (requests.windowRequests() > 0 && requests.windowRequests() >= minimumSampleSize
                && requests.windowErrorRate() > t.maxErrorRate()) {
            breach(fired, AlertType.ERROR_RATE, AlertSeverity.CRITICAL, "error_rate",
                    "Error rate above limit", requests.windowErrorRate(), t.maxErrorRate(), now);
        }

        if (requests.concurrentRequests() > t.maxConcurrentRequests()) {
            breach(fired, AlertType.CONCURRENCY, AlertSeverity.WARNING, "concurrent_requests",
                    "Concurrent requests above limit",
                    requests.concurrentRequests(), t.maxConcurrentRequests(), now);
        }

        SystemMetrics system = report.system();
        if (system.cpuUsage() > t.maxCpuUsage()) {
            breach(fired, AlertType.SYSTEM_RESOURCE, AlertSeverity.WARNING, "cpu_usage",
                    "CPU usage above limit", system.cpuUsage(), t.maxCpuUsage(), now);
        }
        if (system.memoryUsage() > t.maxMemoryUsage()) {
            breach(fired, AlertType.SYSTEM_RESOURCE, AlertSeverity.WARNING, "memory_usage",
                    "Memory usage above limit", system.memoryUsage(), t.maxMemoryUsage(), now);
        }
        return fired;
    }

    private void breach(List<PerformanceAlert> fired, AlertType type, AlertSeverity severity, String metric,
                        String description, double value, double threshold, Instant now) {
        AlertState state = alertStates.computeIfAbsent(
                new AlertKey(metric, severity), key -> new AlertState(type, metric, severity));
        if (!state.tryFire(now, alertCooldown)) {
            log.debug("Alert suppressed by cooldown: metric={}, severity={}, cooldownUntil={}",
                    metric, severity, state.cooldownUntil());
            return;
        }
        String message = String.format(Locale.ROOT, "%s: value=%.4f, threshold=%.4f", description, value, threshold);
        fired.add(new PerformanceAlert(UUID.randomUUID().toString(), type, severity, metric,
                message, value, threshold, now));
    }

    private void dispatch(PerformanceAlert alert) {
        synchronized (alertHistory) {
            alertHistory.addLast(alert);
            while (alertHistory.size() > MAX_ALERT_HISTORY) {
                alertHistory.removeFirst();
            }
        }
        for (Map.Entry<String, AlertHandler> entry : handlers.entrySet()) {
            try {
                entry.getValue().onAlert(alert);
            } catch (RuntimeException e) {
                log.error("Alert handler failed: handler={}, alertId={}, metric={}",
                        entry.getKey(), alert.id(), alert.metric(), e);
            }
        }
    }

    /**
     * Starts the periodic monitoring task. A second call while running has no effect.
     */
    public void startMonitoring(Duration interval) {
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(
                this::runScheduledCycle,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        if (!monitoringTask.compareAndSet(null, task)) {
            task.cancel(false);
            return;
        }
        log.info("Performance monitoring started with interval: {}", interval);
    }

    private void runScheduledCycle() {
        try {
            runMonitoringCycle();
        } catch (RuntimeException e) {
            log.error("Monitoring cycle failed", e);
        }
    }

    public void stopMonitoring() {
        ScheduledFuture<?> task = monitoringTask.getAndSet(null);
        if (task != null) {
            task.cancel(false);
            log.info("Performance monitoring stopped");
        }
    }

    public boolean isMonitoring() {
        return monitoringTask.get() != null;
    }

    public void registerAlertHandler(String name, AlertHandler handler) {
        Objects.requireNonNull(name, "Handler name is required");
        Objects.requireNonNull(handler, "Handler is required");
        handlers.put(name, handler);
        log.info("Alert handler registered: name={}", name);
    }

    /**
     * @return true if a handler was registered under that name
     */
    public boolean unregisterAlertHandler(String name) {
        boolean removed = handlers.remove(name) != null;
        if (removed) {
            log.info("Alert handler unregistered: name={}", name);
        }
        return removed;
    }

    /**
     * Validates then atomically swaps the thresholds used from the next tick on.
     *
     * @throws fr.lapetina.optimizer.infrastructure.config.ConfigLoader.ConfigurationException if invalid
     */
    public void setThresholds(AlertThresholds newThresholds) {
        ConfigValidator.validate(newThresholds);
        AlertThresholds old = thresholds.getAndSet(newThresholds);
        log.info("Alert thresholds updated: {} -> {}", old, newThresholds);
    }

    public AlertThresholds getThresholds() {
        return thresholds.get();
    }

    /**
     * Most recent alerts, oldest first.
     */
    public List<PerformanceAlert> getAlertHistory() {
        synchronized (alertHistory) {
            return new ArrayList<>(alertHistory);
        }
    }

    /**
     * Waits until every sample recorded so far is visible in reports.
     */
    public boolean flush(Duration timeout) {
        return !ingest.isRunning() || ingest.flush(timeout);
    }

    public long getDroppedSamples() {
        return ingest.getDroppedSamples();
    }

    private int currentWorkerCount() {
        Supplier<LoadBalancingMetrics> source = loadBalancerSource;
        return source != null ? source.get().totalWorkers() : 0;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            stopMonitoring();
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            ingest.close();
            log.info("PerformanceMonitor closed: droppedSamples={}", ingest.getDroppedSamples());
        }
    }

    private record AlertKey(String metric, AlertSeverity severity) {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for PerformanceMonitor.
     */
    public static final class Builder {
        private MetricsRegistry metricsRegistry;
        private Clock clock = Clock.systemUTC();
        private AlertThresholds thresholds = AlertThresholds.defaults();
        private Duration alertCooldown = Duration.ofMinutes(5);
        private int minimumSampleSize = 100;
        private int ingestBufferSize = 1024;
        private String waitStrategy = "blocking";
        private boolean collectSystemMetrics = true;

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder thresholds(AlertThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder alertCooldown(Duration alertCooldown) {
            this.alertCooldown = alertCooldown;
            return this;
        }

        public Builder minimumSampleSize(int minimumSampleSize) {
            this.minimumSampleSize = minimumSampleSize;
            return this;
        }

        public Builder ingestBufferSize(int ingestBufferSize) {
            this.ingestBufferSize = ingestBufferSize;
            return this;
        }

        public Builder waitStrategy(String waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public Builder collectSystemMetrics(boolean collectSystemMetrics) {
            this.collectSystemMetrics = collectSystemMetrics;
            return this;
        }

        /**
         * Configures builder from monitor configuration.
         */
        public Builder fromConfig(OptimizerConfig.MonitorConfig config) {
            return this
                    .thresholds(config.getAlertThresholds().toAlertThresholds())
                    .alertCooldown(Duration.ofMillis(config.getAlertCooldownMs()))
                    .minimumSampleSize(config.getMinimumSampleSize())
                    .ingestBufferSize(config.getIngestBufferSize())
                    .waitStrategy(config.getWaitStrategy())
                    .collectSystemMetrics(config.isCollectSystemMetrics());
        }

        public PerformanceMonitor build() {
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            ConfigValidator.validate(thresholds);
            return new PerformanceMonitor(this);
        }
    }
}
