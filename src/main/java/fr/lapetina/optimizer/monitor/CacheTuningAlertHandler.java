package fr.lapetina.optimizer.monitor;

import fr.lapetina.optimizer.cache.CacheSeed;
import fr.lapetina.optimizer.cache.CacheStore;
import fr.lapetina.optimizer.domain.alert.PerformanceAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reacts to cache-related alerts without waiting for the next maintenance tick.
 *
 * <p>A low hit rate re-tunes the per-type TTL boosts right away. Slow responses re-run
 * the configured warm-up, which only inserts seeds that are no longer cached.
 */
public final class CacheTuningAlertHandler implements AlertHandler {

    public static final String NAME = "cache-tuning";

    private static final Logger log = LoggerFactory.getLogger(CacheTuningAlertHandler.class);

    private final CacheStore cache;
    private final Supplier<? extends Collection<CacheSeed>> warmupSeeds;

    public CacheTuningAlertHandler(CacheStore cache, Supplier<? extends Collection<CacheSeed>> warmupSeeds) {
        this.cache = Objects.requireNonNull(cache, "Cache is required");
        this.warmupSeeds = Objects.requireNonNull(warmupSeeds, "Warm-up seeds are required");
    }

    @Override
    public void onAlert(PerformanceAlert alert) {
        switch (alert.type()) {
            case CACHE_HIT_RATE -> {
                int adjusted = cache.optimizeStrategy();
                log.info("Cache strategy re-tuned on alert: alertId={}, hitRate={}, adjustedTypes={}",
                        alert.id(), alert.value(), adjusted);
            }
            case RESPONSE_TIME -> {
                Collection<CacheSeed> seeds = warmupSeeds.get();
                if (seeds != null && !seeds.isEmpty()) {
                    cache.warm(seeds);
                    log.info("Cache warm-up scheduled on alert: alertId={}, seeds={}", alert.id(), seeds.size());
                }
            }
            default -> {
                // Other alert types do not concern the cache
            }
        }
    }
}
