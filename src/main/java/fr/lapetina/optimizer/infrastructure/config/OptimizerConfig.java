package fr.lapetina.optimizer.infrastructure.config;

import fr.lapetina.optimizer.domain.alert.AlertThresholds;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration object for the request optimizer.
 * Designed to be populated from YAML.
 */
public class OptimizerConfig {

    private CacheConfig cache = new CacheConfig();
    private LoadBalancerConfig loadBalancer = new LoadBalancerConfig();
    private MonitorConfig monitor = new MonitorConfig();
    private RequestConfig optimizer = new RequestConfig();
    private BackendConfig backend = new BackendConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public LoadBalancerConfig getLoadBalancer() { return loadBalancer; }
    public void setLoadBalancer(LoadBalancerConfig loadBalancer) { this.loadBalancer = loadBalancer; }

    public MonitorConfig getMonitor() { return monitor; }
    public void setMonitor(MonitorConfig monitor) { this.monitor = monitor; }

    public RequestConfig getOptimizer() { return optimizer; }
    public void setOptimizer(RequestConfig optimizer) { this.optimizer = optimizer; }

    public BackendConfig getBackend() { return backend; }
    public void setBackend(BackendConfig backend) { this.backend = backend; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Analysis cache configuration.
     */
    public static class CacheConfig {
        private int maxSize = 1000;
        private long baseTtlMs = 1_800_000;
        private long minTtlMs = 300_000;
        private long maxTtlMs = 7_200_000;
        private int compressionThreshold = 1000;
        private int shardCount = 16;
        private double recencyWeight = 1.0;
        private double frequencyWeight = 0.5;
        private double qualityWeight = 1.0;
        private long recencyHalfLifeMs = 600_000;
        private double initialFrequencyBoost = 0.5;
        private double maxFrequencyBoost = 2.0;
        private int minRequestsForTuning = 10;
        private long optimizeIntervalMs = 300_000;
        private List<WarmupEntry> warmup = new ArrayList<>();

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public long getBaseTtlMs() { return baseTtlMs; }
        public void setBaseTtlMs(long baseTtlMs) { this.baseTtlMs = baseTtlMs; }

        public long getMinTtlMs() { return minTtlMs; }
        public void setMinTtlMs(long minTtlMs) { this.minTtlMs = minTtlMs; }

        public long getMaxTtlMs() { return maxTtlMs; }
        public void setMaxTtlMs(long maxTtlMs) { this.maxTtlMs = maxTtlMs; }

        public int getCompressionThreshold() { return compressionThreshold; }
        public void setCompressionThreshold(int compressionThreshold) { this.compressionThreshold = compressionThreshold; }

        public int getShardCount() { return shardCount; }
        public void setShardCount(int shardCount) { this.shardCount = shardCount; }

        public double getRecencyWeight() { return recencyWeight; }
        public void setRecencyWeight(double recencyWeight) { this.recencyWeight = recencyWeight; }

        public double getFrequencyWeight() { return frequencyWeight; }
        public void setFrequencyWeight(double frequencyWeight) { this.frequencyWeight = frequencyWeight; }

        public double getQualityWeight() { return qualityWeight; }
        public void setQualityWeight(double qualityWeight) { this.qualityWeight = qualityWeight; }

        public long getRecencyHalfLifeMs() { return recencyHalfLifeMs; }
        public void setRecencyHalfLifeMs(long recencyHalfLifeMs) { this.recencyHalfLifeMs = recencyHalfLifeMs; }

        public double getInitialFrequencyBoost() { return initialFrequencyBoost; }
        public void setInitialFrequencyBoost(double initialFrequencyBoost) { this.initialFrequencyBoost = initialFrequencyBoost; }

        public double getMaxFrequencyBoost() { return maxFrequencyBoost; }
        public void setMaxFrequencyBoost(double maxFrequencyBoost) { this.maxFrequencyBoost = maxFrequencyBoost; }

        public int getMinRequestsForTuning() { return minRequestsForTuning; }
        public void setMinRequestsForTuning(int minRequestsForTuning) { this.minRequestsForTuning = minRequestsForTuning; }

        public long getOptimizeIntervalMs() { return optimizeIntervalMs; }
        public void setOptimizeIntervalMs(long optimizeIntervalMs) { this.optimizeIntervalMs = optimizeIntervalMs; }

        public List<WarmupEntry> getWarmup() { return warmup; }
        public void setWarmup(List<WarmupEntry> warmup) { this.warmup = warmup; }
    }

    /**
     * Seed entry loaded into the cache at startup.
     */
    public static class WarmupEntry {
        private String analysisType;
        private String content;
        private String result;
        private int tokensUsed = 100;
        private double quality = 0.8;

        public String getAnalysisType() { return analysisType; }
        public void setAnalysisType(String analysisType) { this.analysisType = analysisType; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }

        public String getResult() { return result; }
        public void setResult(String result) { this.result = result; }

        public int getTokensUsed() { return tokensUsed; }
        public void setTokensUsed(int tokensUsed) { this.tokensUsed = tokensUsed; }

        public double getQuality() { return quality; }
        public void setQuality(double quality) { this.quality = quality; }
    }

    /**
     * Session load balancer configuration.
     */
    public static class LoadBalancerConfig {
        private String strategy = "least-loaded";
        private long inactivityThresholdMs = 1_800_000;
        private long cleanupIntervalMs = 300_000;
        private List<WorkerConfig> workers = new ArrayList<>();

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public long getInactivityThresholdMs() { return inactivityThresholdMs; }
        public void setInactivityThresholdMs(long inactivityThresholdMs) { this.inactivityThresholdMs = inactivityThresholdMs; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }

        public List<WorkerConfig> getWorkers() { return workers; }
        public void setWorkers(List<WorkerConfig> workers) { this.workers = workers; }
    }

    /**
     * Individual worker configuration.
     */
    public static class WorkerConfig {
        private String id;
        private int capacity = 5;
        private Set<String> specializations = new HashSet<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public Set<String> getSpecializations() { return specializations; }
        public void setSpecializations(Set<String> specializations) { this.specializations = specializations; }
    }

    /**
     * Performance monitor configuration.
     */
    public static class MonitorConfig {
        private long intervalMs = 30_000;
        private long alertCooldownMs = 300_000;
        private int windowSize = 1000;
        private long windowDurationMs = 300_000;
        private int minimumSampleSize = 100;
        private int ingestBufferSize = 1024;
        private String waitStrategy = "blocking";
        private boolean collectSystemMetrics = true;
        private ThresholdsConfig alertThresholds = new ThresholdsConfig();

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getAlertCooldownMs() { return alertCooldownMs; }
        public void setAlertCooldownMs(long alertCooldownMs) { this.alertCooldownMs = alertCooldownMs; }

        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }

        public long getWindowDurationMs() { return windowDurationMs; }
        public void setWindowDurationMs(long windowDurationMs) { this.windowDurationMs = windowDurationMs; }

        public int getMinimumSampleSize() { return minimumSampleSize; }
        public void setMinimumSampleSize(int minimumSampleSize) { this.minimumSampleSize = minimumSampleSize; }

        public int getIngestBufferSize() { return ingestBufferSize; }
        public void setIngestBufferSize(int ingestBufferSize) { this.ingestBufferSize = ingestBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public boolean isCollectSystemMetrics() { return collectSystemMetrics; }
        public void setCollectSystemMetrics(boolean collectSystemMetrics) { this.collectSystemMetrics = collectSystemMetrics; }

        public ThresholdsConfig getAlertThresholds() { return alertThresholds; }
        public void setAlertThresholds(ThresholdsConfig alertThresholds) { this.alertThresholds = alertThresholds; }
    }

    /**
     * Alert thresholds. CPU and memory are percentages.
     */
    public static class ThresholdsConfig {
        private long maxResponseTimeMs = 5000;
        private double minCacheHitRate = 0.7;
        private double maxErrorRate = 0.05;
        private int maxConcurrentRequests = 100;
        private double maxCpuUsage = 80.0;
        private double maxMemoryUsage = 85.0;

        public long getMaxResponseTimeMs() { return maxResponseTimeMs; }
        public void setMaxResponseTimeMs(long maxResponseTimeMs) { this.maxResponseTimeMs = maxResponseTimeMs; }

        public double getMinCacheHitRate() { return minCacheHitRate; }
        public void setMinCacheHitRate(double minCacheHitRate) { this.minCacheHitRate = minCacheHitRate; }

        public double getMaxErrorRate() { return maxErrorRate; }
        public void setMaxErrorRate(double maxErrorRate) { this.maxErrorRate = maxErrorRate; }

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        public double getMaxCpuUsage() { return maxCpuUsage; }
        public void setMaxCpuUsage(double maxCpuUsage) { this.maxCpuUsage = maxCpuUsage; }

        public double getMaxMemoryUsage() { return maxMemoryUsage; }
        public void setMaxMemoryUsage(double maxMemoryUsage) { this.maxMemoryUsage = maxMemoryUsage; }

        public AlertThresholds toAlertThresholds() {
            return new AlertThresholds(
                    Duration.ofMillis(maxResponseTimeMs),
                    minCacheHitRate,
                    maxErrorRate,
                    maxConcurrentRequests,
                    maxCpuUsage,
                    maxMemoryUsage
            );
        }
    }

    /**
     * Per-request optimizer settings.
     */
    public static class RequestConfig {
        private long requestTimeoutMs = 60_000;
        private int tokenLimitThreshold = 2000;
        private int tokenLimitCap = 1500;
        private double temperatureThreshold = 0.8;
        private double temperatureCap = 0.7;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getTokenLimitThreshold() { return tokenLimitThreshold; }
        public void setTokenLimitThreshold(int tokenLimitThreshold) { this.tokenLimitThreshold = tokenLimitThreshold; }

        public int getTokenLimitCap() { return tokenLimitCap; }
        public void setTokenLimitCap(int tokenLimitCap) { this.tokenLimitCap = tokenLimitCap; }

        public double getTemperatureThreshold() { return temperatureThreshold; }
        public void setTemperatureThreshold(double temperatureThreshold) { this.temperatureThreshold = temperatureThreshold; }

        public double getTemperatureCap() { return temperatureCap; }
        public void setTemperatureCap(double temperatureCap) { this.temperatureCap = temperatureCap; }
    }

    /**
     * Generation backend connection.
     */
    public static class BackendConfig {
        private String baseUrl = "http://localhost:11434";
        private String model = "llama3";
        private long connectTimeoutMs = 10_000;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30_000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int circuitBreakerFailureThreshold) { this.circuitBreakerFailureThreshold = circuitBreakerFailureThreshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long circuitBreakerRecoveryMs) { this.circuitBreakerRecoveryMs = circuitBreakerRecoveryMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "optimizer";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
