package fr.lapetina.optimizer.infrastructure.config;

import fr.lapetina.optimizer.domain.alert.AlertThresholds;
import fr.lapetina.optimizer.domain.strategy.StrategyFactory;
import fr.lapetina.optimizer.infrastructure.config.ConfigLoader.ConfigurationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects invalid configuration at load time instead of at request time.
 * All problems are collected and reported together.
 */
public final class ConfigValidator {

    private ConfigValidator() {
        // Utility class
    }

    /**
     * @throws ConfigurationException listing every invalid value
     */
    public static void validate(OptimizerConfig config) {
        List<String> errors = new ArrayList<>();
        validateCache(config.getCache(), errors);
        validateLoadBalancer(config.getLoadBalancer(), errors);
        validateMonitor(config.getMonitor(), errors);
        validateRequest(config.getOptimizer(), errors);
        validateBackend(config.getBackend(), errors);
        if (config.getMonitor() != null && config.getMonitor().getAlertThresholds() != null) {
            collectThresholdErrors(config.getMonitor().getAlertThresholds().toAlertThresholds(), errors);
        }
        failIfAny(errors);
    }

    /**
     * @throws ConfigurationException if any threshold is out of range
     */
    public static void validate(AlertThresholds thresholds) {
        if (thresholds == null) {
            throw new ConfigurationException("Alert thresholds are required");
        }
        List<String> errors = new ArrayList<>();
        collectThresholdErrors(thresholds, errors);
        failIfAny(errors);
    }

    private static void validateCache(OptimizerConfig.CacheConfig cache, List<String> errors) {
        if (cache == null) {
            errors.add("cache section is required");
            return;
        }
        if (cache.getMaxSize() <= 0) {
            errors.add("cache.maxSize must be positive: " + cache.getMaxSize());
        }
        if (cache.getMinTtlMs() <= 0) {
            errors.add("cache.minTtlMs must be positive: " + cache.getMinTtlMs());
        }
        if (cache.getMaxTtlMs() < cache.getMinTtlMs()) {
            errors.add("cache.maxTtlMs must be >= cache.minTtlMs");
        }
        if (cache.getBaseTtlMs() <= 0) {
            errors.add("cache.baseTtlMs must be positive: " + cache.getBaseTtlMs());
        }
        if (cache.getCompressionThreshold() < 0) {
            errors.add("cache.compressionThreshold must not be negative");
        }
        if (cache.getShardCount() <= 0) {
            errors.add("cache.shardCount must be positive: " + cache.getShardCount());
        }
        if (cache.getRecencyWeight() < 0 || cache.getFrequencyWeight() < 0 || cache.getQualityWeight() < 0) {
            errors.add("cache eviction weights must not be negative");
        }
        if (cache.getRecencyHalfLifeMs() <= 0) {
            errors.add("cache.recencyHalfLifeMs must be positive");
        }
        if (cache.getInitialFrequencyBoost() < 0 || cache.getInitialFrequencyBoost() > cache.getMaxFrequencyBoost()) {
            errors.add("cache.initialFrequencyBoost must be within [0, maxFrequencyBoost]");
        }
        if (cache.getOptimizeIntervalMs() <= 0) {
            errors.add("cache.optimizeIntervalMs must be positive");
        }
        if (cache.getWarmup() != null) {
            for (OptimizerConfig.WarmupEntry seed : cache.getWarmup()) {
                if (seed.getAnalysisType() == null || seed.getContent() == null || seed.getResult() == null) {
                    errors.add("cache.warmup entries need analysisType, content and result");
                } else if (seed.getQuality() < 0.0 || seed.getQuality() > 1.0) {
                    errors.add("cache.warmup quality must be within [0, 1] for type " + seed.getAnalysisType());
                }
            }
        }
    }

    private static void validateLoadBalancer(OptimizerConfig.LoadBalancerConfig lb, List<String> errors) {
        if (lb == null) {
            errors.add("loadBalancer section is required");
            return;
        }
        if (lb.getStrategy() == null || StrategyFactory.create(lb.getStrategy()).isEmpty()) {
            errors.add("loadBalancer.strategy is unknown: " + lb.getStrategy());
        }
        if (lb.getInactivityThresholdMs() <= 0) {
            errors.add("loadBalancer.inactivityThresholdMs must be positive");
        }
        if (lb.getCleanupIntervalMs() <= 0) {
            errors.add("loadBalancer.cleanupIntervalMs must be positive");
        }
        if (lb.getWorkers() == null) {
            errors.add("loadBalancer.workers must be a list");
            return;
        }
        Set<String> ids = new HashSet<>();
        for (OptimizerConfig.WorkerConfig worker : lb.getWorkers()) {
            if (worker.getId() == null || worker.getId().isBlank()) {
                errors.add("loadBalancer.workers entries need an id");
            } else if (!ids.add(worker.getId())) {
                errors.add("loadBalancer.workers has duplicate id: " + worker.getId());
            }
            if (worker.getCapacity() <= 0) {
                errors.add("worker capacity must be positive: " + worker.getId());
            }
        }
    }

    private static void validateMonitor(OptimizerConfig.MonitorConfig monitor, List<String> errors) {
        if (monitor == null) {
            errors.add("monitor section is required");
            return;
        }
        if (monitor.getIntervalMs() <= 0) {
            errors.add("monitor.intervalMs must be positive");
        }
        if (monitor.getAlertCooldownMs() < 0) {
            errors.add("monitor.alertCooldownMs must not be negative");
        }
        if (monitor.getWindowSize() <= 0) {
            errors.add("monitor.windowSize must be positive");
        }
        if (monitor.getWindowDurationMs() <= 0) {
            errors.add("monitor.windowDurationMs must be positive");
        }
        if (monitor.getMinimumSampleSize() < 0) {
            errors.add("monitor.minimumSampleSize must not be negative");
        }
        if (Integer.bitCount(monitor.getIngestBufferSize()) != 1) {
            errors.add("monitor.ingestBufferSize must be a power of 2: " + monitor.getIngestBufferSize());
        }
        if (monitor.getAlertThresholds() == null) {
            errors.add("monitor.alertThresholds section is required");
        }
    }

    private static void validateRequest(OptimizerConfig.RequestConfig request, List<String> errors) {
        if (request == null) {
            errors.add("optimizer section is required");
            return;
        }
        if (request.getRequestTimeoutMs() <= 0) {
            errors.add("optimizer.requestTimeoutMs must be positive");
        }
        if (request.getTokenLimitCap() <= 0 || request.getTokenLimitThreshold() <= 0) {
            errors.add("optimizer token limits must be positive");
        }
        if (request.getTemperatureCap() < 0 || request.getTemperatureThreshold() < 0) {
            errors.add("optimizer temperature limits must not be negative");
        }
    }

    private static void validateBackend(OptimizerConfig.BackendConfig backend, List<String> errors) {
        if (backend == null) {
            errors.add("backend section is required");
            return;
        }
        if (backend.getBaseUrl() == null || backend.getBaseUrl().isBlank()) {
            errors.add("backend.baseUrl is required");
        }
        if (backend.getConnectTimeoutMs() <= 0) {
            errors.add("backend.connectTimeoutMs must be positive: " + backend.getConnectTimeoutMs());
        }
        if (backend.getCircuitBreakerFailureThreshold() <= 0) {
            errors.add("backend.circuitBreakerFailureThreshold must be positive");
        }
        if (backend.getCircuitBreakerRecoveryMs() <= 0) {
            errors.add("backend.circuitBreakerRecoveryMs must be positive: " + backend.getCircuitBreakerRecoveryMs());
        }
    }

    private static void collectThresholdErrors(AlertThresholds t, List<String> errors) {
        if (t.maxResponseTime().isNegative() || t.maxResponseTime().isZero()) {
            errors.add("maxResponseTime must be positive: " + t.maxResponseTime());
        }
        if (!isFraction(t.minCacheHitRate())) {
            errors.add("minCacheHitRate must be within [0, 1]: " + t.minCacheHitRate());
        }
        if (!isFraction(t.maxErrorRate())) {
            errors.add("maxErrorRate must be within [0, 1]: " + t.maxErrorRate());
        }
        if (t.maxConcurrentRequests() <= 0) {
            errors.add("maxConcurrentRequests must be positive: " + t.maxConcurrentRequests());
        }
        if (!isPercentage(t.maxCpuUsage())) {
            errors.add("maxCpuUsage must be within [0, 100]: " + t.maxCpuUsage());
        }
        if (!isPercentage(t.maxMemoryUsage())) {
            errors.add("maxMemoryUsage must be within [0, 100]: " + t.maxMemoryUsage());
        }
    }

    private static boolean isFraction(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static boolean isPercentage(double value) {
        return value >= 0.0 && value <= 100.0;
    }

    private static void failIfAny(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
    }
}
