package fr.lapetina.optimizer;

import fr.lapetina.optimizer.balancer.SessionLoadBalancer;
import fr.lapetina.optimizer.cache.CacheSeed;
import fr.lapetina.optimizer.cache.CacheStore;
import fr.lapetina.optimizer.domain.backend.GenerationBackend;
import fr.lapetina.optimizer.domain.report.CacheMetrics;
import fr.lapetina.optimizer.domain.report.CacheStatistics;
import fr.lapetina.optimizer.domain.strategy.StrategyFactory;
import fr.lapetina.optimizer.infrastructure.config.ConfigLoader;
import fr.lapetina.optimizer.infrastructure.config.OptimizerConfig;
import fr.lapetina.optimizer.infrastructure.http.OllamaGenerationBackend;
import fr.lapetina.optimizer.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.optimizer.monitor.CacheTuningAlertHandler;
import fr.lapetina.optimizer.monitor.PerformanceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Factory for creating a fully-wired request optimizer from configuration.
 * Each factory owns its own cache, balancer, monitor and metrics registry; nothing is global.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OptimizerFactory factory = OptimizerFactory.create("optimizer.yaml").start()) {
 *     RequestOptimizer optimizer = factory.getOptimizer();
 *     OptimizationResult result = optimizer.optimize(OptimizationRequest.of("summary", text));
 * }
 * }</pre>
 */
public class OptimizerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OptimizerFactory.class);

    private final ConfigLoader configLoader;
    private final OptimizerConfig config;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final CacheStore cache;
    private final SessionLoadBalancer balancer;
    private final PerformanceMonitor monitor;
    private final GenerationBackend backend;
    private final RequestOptimizer optimizer;
    private volatile CompletableFuture<Integer> warmup = CompletableFuture.completedFuture(0);

    protected OptimizerFactory(String configPath, GenerationBackend backendOverride) {
        this(configPath, backendOverride, Clock.systemUTC());
    }

    protected OptimizerFactory(String configPath, GenerationBackend backendOverride, Clock clock) {
        log.info("Initializing OptimizerFactory from config: {}", configPath);
        this.clock = clock;

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        OptimizerConfig.MonitorConfig monitorConfig = config.getMonitor();
        this.metricsRegistry = new MetricsRegistry(
                config.getMetrics().getPrefix(),
                monitorConfig.getWindowSize(),
                Duration.ofMillis(monitorConfig.getWindowDurationMs()),
                clock
        );

        this.cache = CacheStore.builder()
                .fromConfig(config.getCache())
                .clock(clock)
                .build();

        this.balancer = SessionLoadBalancer.builder()
                .clock(clock)
                .fromConfig(config.getLoadBalancer())
                .build();

        this.monitor = PerformanceMonitor.builder()
                .fromConfig(monitorConfig)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();
        monitor.attachCacheSource(() -> toCacheMetrics(cache.stats()));
        monitor.attachLoadBalancerSource(balancer::metrics);
        monitor.registerAlertHandler(CacheTuningAlertHandler.NAME,
                new CacheTuningAlertHandler(cache, () -> warmupSeeds(configLoader.getCurrentConfig())));

        // Allow override for testing
        this.backend = backendOverride != null
                ? backendOverride
                : OllamaGenerationBackend.fromConfig(config.getBackend(), clock);

        this.optimizer = RequestOptimizer.builder()
                .cache(cache)
                .balancer(balancer)
                .monitor(monitor)
                .metrics(metricsRegistry)
                .backend(backend)
                .tuner(PromptTuner.fromConfig(config.getOptimizer()))
                .defaultTimeout(Duration.ofMillis(config.getOptimizer().getRequestTimeoutMs()))
                .clock(clock)
                .build();

        configLoader.addListener(this::onConfigChanged);
        registerGauges();

        log.info("OptimizerFactory initialized: backend={}, workers={}, cacheMaxSize={}",
                backend.getName(), balancer.workerCount(), cache.maxSize());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OptimizerFactory create(String configPath) {
        return new OptimizerFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (optimizer.yaml).
     */
    public static OptimizerFactory create() {
        return create("optimizer.yaml");
    }

    /**
     * Starts metric ingestion, the periodic tasks, config watching and the configured warm-up.
     */
    public OptimizerFactory start() {
        monitor.start();
        monitor.startMonitoring(Duration.ofMillis(config.getMonitor().getIntervalMs()));
        cache.startMaintenance(Duration.ofMillis(config.getCache().getOptimizeIntervalMs()));
        balancer.startCleanup(
                Duration.ofMillis(config.getLoadBalancer().getCleanupIntervalMs()),
                Duration.ofMillis(config.getLoadBalancer().getInactivityThresholdMs())
        );
        configLoader.startWatching();
        warmup = cache.warm(warmupSeeds(config));
        log.info("Optimizer started");
        return this;
    }

    public RequestOptimizer getOptimizer() {
        return optimizer;
    }

    public CacheStore getCache() {
        return cache;
    }

    public SessionLoadBalancer getBalancer() {
        return balancer;
    }

    public PerformanceMonitor getMonitor() {
        return monitor;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public GenerationBackend getBackend() {
        return backend;
    }

    public OptimizerConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Completes with the number of entries inserted by the startup warm-up.
     */
    public CompletableFuture<Integer> getWarmup() {
        return warmup;
    }

    /**
     * Prometheus text exposition of every metric of this optimizer.
     */
    public String scrape() {
        return metricsRegistry.scrape();
    }

    static CacheMetrics toCacheMetrics(CacheStatistics stats) {
        return new CacheMetrics(stats.hits(), stats.misses(), stats.size(), stats.evictions(),
                stats.averageAge(), stats.timestamp());
    }

    private static List<CacheSeed> warmupSeeds(OptimizerConfig config) {
        List<CacheSeed> seeds = new ArrayList<>();
        if (config.getCache().getWarmup() != null) {
            for (OptimizerConfig.WarmupEntry entry : config.getCache().getWarmup()) {
                seeds.add(new CacheSeed(entry.getAnalysisType(), entry.getContent(), entry.getResult(),
                        entry.getTokensUsed(), entry.getQuality()));
            }
        }
        return seeds;
    }

    private void registerGauges() {
        metricsRegistry.registerGauge("cache_size", "Entries currently cached", cache::size);
        metricsRegistry.registerGauge("active_sessions", "Sessions currently bound to a worker",
                balancer::activeSessionCount);
        metricsRegistry.registerGauge("ingest_dropped_samples", "Samples dropped because the ingest buffer was full",
                monitor::getDroppedSamples);
    }

    private void onConfigChanged(OptimizerConfig oldConfig, OptimizerConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        monitor.setThresholds(newConfig.getMonitor().getAlertThresholds().toAlertThresholds());

        if (oldConfig == null
                || !oldConfig.getLoadBalancer().getStrategy().equalsIgnoreCase(newConfig.getLoadBalancer().getStrategy())) {
            balancer.setStrategy(StrategyFactory.createOrDefault(newConfig.getLoadBalancer().getStrategy()));
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down OptimizerFactory...");

        try {
            monitor.close();
        } catch (Exception e) {
            log.warn("Error closing performance monitor", e);
        }

        try {
            balancer.close();
        } catch (Exception e) {
            log.warn("Error closing session load balancer", e);
        }

        try {
            cache.close();
        } catch (Exception e) {
            log.warn("Error closing cache", e);
        }

        try {
            backend.close();
        } catch (Exception e) {
            log.warn("Error closing generation backend", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("OptimizerFactory shut down");
    }
}
