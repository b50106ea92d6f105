package fr.lapetina.optimizer.cache;

import fr.lapetina.optimizer.domain.model.CachedAnalysis;
import fr.lapetina.optimizer.domain.report.AnalysisTypeStats;
import fr.lapetina.optimizer.domain.report.CacheStatistics;
import fr.lapetina.optimizer.infrastructure.config.OptimizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fingerprinted, TTL-governed, quality-weighted cache of generation results.
 *
 * <p>The keyspace is split into shards by fingerprint prefix, each guarded by its own lock,
 * so lookups and stores on different shards never contend. Capacity is tracked by a global
 * counter: an insert first reserves a unit of capacity, evicting the lowest-scored entry when
 * the cache is full, and the evicted entry's unit is handed straight to the inserting thread.
 * {@code size <= maxSize} therefore holds at every instant.
 *
 * <p>Eviction locks every shard in index order to score a consistent snapshot. It only runs
 * when the cache is full.
 */
public final class CacheStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final int maxSize;
    private final int compressionThreshold;
    private final TtlPolicy ttlPolicy;
    private final EvictionScorer scorer;
    private final double initialFrequencyBoost;
    private final double maxFrequencyBoost;
    private final int minRequestsForTuning;
    private final Clock clock;

    private final Shard[] shards;
    private final AtomicInteger size = new AtomicInteger();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final Map<String, AnalysisTypeTracker> trackers = new ConcurrentHashMap<>();

    private final ScheduledExecutorService maintenance;
    private final AtomicBoolean maintenanceRunning = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private CacheStore(Builder builder) {
        if (builder.maxSize <= 0) {
            throw new IllegalArgumentException("Cache maxSize must be positive: " + builder.maxSize);
        }
        if (builder.shardCount <= 0) {
            throw new IllegalArgumentException("Cache shardCount must be positive: " + builder.shardCount);
        }
        this.maxSize = builder.maxSize;
        this.compressionThreshold = builder.compressionThreshold;
        this.ttlPolicy = new TtlPolicy(builder.baseTtl, builder.minTtl, builder.maxTtl);
        this.scorer = new EvictionScorer(builder.recencyWeight, builder.frequencyWeight,
                builder.qualityWeight, builder.recencyHalfLife);
        this.initialFrequencyBoost = builder.initialFrequencyBoost;
        this.maxFrequencyBoost = builder.maxFrequencyBoost;
        this.minRequestsForTuning = builder.minRequestsForTuning;
        this.clock = builder.clock;

        this.shards = new Shard[builder.shardCount];
        for (int i = 0; i < shards.length; i++) {
            shards[i] = new Shard();
        }

        this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-maintenance");
            t.setDaemon(true);
            return t;
        });

        log.info("CacheStore created: maxSize={}, shards={}, baseTtl={}, compressionThreshold={}",
                maxSize, shards.length, builder.baseTtl, compressionThreshold);
    }

    /**
     * Looks up a live entry. A hit increments the entry's access count and refreshes its
     * last access time atomically; an expired entry is removed and counts as a miss.
     */
    public Optional<CachedAnalysis> lookup(String analysisType, String content) {
        requireKey(analysisType, content);
        String fingerprint = Fingerprint.of(analysisType, content);
        AnalysisTypeTracker tracker = tracker(analysisType);
        Instant now = clock.instant();

        CacheEntry.Snapshot snapshot = null;
        Shard shard = shardFor(fingerprint);
        shard.lock.lock();
        try {
            CacheEntry entry = shard.entries.get(fingerprint);
            if (entry != null && entry.isExpired(now)) {
                shard.entries.remove(fingerprint);
                size.decrementAndGet();
                log.debug("Expired entry removed on lookup: fingerprint={}, analysisType={}",
                        fingerprint, analysisType);
            } else if (entry != null) {
                entry.touch(now);
                snapshot = entry.snapshot();
            }
        } finally {
            shard.lock.unlock();
        }

        if (snapshot == null) {
            misses.incrementAndGet();
            tracker.recordMiss();
            return Optional.empty();
        }
        hits.incrementAndGet();
        tracker.recordHit();
        return Optional.of(snapshot.toView());
    }

    /**
     * True if a live entry exists. Does not touch the entry or the hit/miss counters.
     */
    public boolean contains(String analysisType, String content) {
        requireKey(analysisType, content);
        String fingerprint = Fingerprint.of(analysisType, content);
        Instant now = clock.instant();
        Shard shard = shardFor(fingerprint);
        shard.lock.lock();
        try {
            CacheEntry entry = shard.entries.get(fingerprint);
            return entry != null && !entry.isExpired(now);
        } finally {
            shard.lock.unlock();
        }
    }

    /**
     * Stores a result. Re-storing a fingerprint replaces the entry without evicting anything.
     * At capacity exactly one entry, the lowest-scored, is evicted first.
     *
     * @throws IllegalArgumentException on null key/result, quality outside [0, 1] or negative tokens
     */
    public void store(String analysisType, String content, String result, int tokensUsed, double quality) {
        requireKey(analysisType, content);
        if (result == null) {
            throw new IllegalArgumentException("Result is required");
        }
        if (Double.isNaN(quality) || quality < 0.0 || quality > 1.0) {
            throw new IllegalArgumentException("Quality must be within [0, 1]: " + quality);
        }
        if (tokensUsed < 0) {
            throw new IllegalArgumentException("tokensUsed must not be negative: " + tokensUsed);
        }

        Instant now = clock.instant();
        String fingerprint = Fingerprint.of(analysisType, content);
        AnalysisTypeTracker tracker = tracker(analysisType);
        Duration ttl = ttlPolicy.ttl(quality, tracker.hits(), tracker.frequencyBoost());
        CacheEntry entry = newEntry(fingerprint, analysisType, result, tokensUsed, quality, now, ttl);
        tracker.recordStore(tokensUsed, quality);

        Shard shard = shardFor(fingerprint);
        shard.lock.lock();
        try {
            if (shard.entries.containsKey(fingerprint)) {
                shard.entries.put(fingerprint, entry);
                log.debug("Cache entry replaced: fingerprint={}, analysisType={}, ttl={}",
                        fingerprint, analysisType, ttl);
                return;
            }
            if (shard.inFlight.containsKey(fingerprint)) {
                // Another writer holds the capacity unit for this fingerprint and publishes the latest value
                shard.inFlight.put(fingerprint, entry);
                log.debug("Cache entry replaced before insert: fingerprint={}, analysisType={}",
                        fingerprint, analysisType);
                return;
            }
            shard.inFlight.put(fingerprint, entry);
        } finally {
            shard.lock.unlock();
        }

        CacheEntry published;
        boolean reserved = false;
        try {
            reserveCapacity();
            reserved = true;
        } finally {
            shard.lock.lock();
            try {
                published = shard.inFlight.remove(fingerprint);
                if (reserved) {
                    shard.entries.put(fingerprint, published);
                }
            } finally {
                shard.lock.unlock();
            }
        }

        log.debug("Cache entry stored: fingerprint={}, analysisType={}, quality={}, compressed={}",
                fingerprint, analysisType, published.quality(), published.isCompressed());
    }

    private CacheEntry newEntry(String fingerprint, String analysisType, String result,
                                int tokensUsed, double quality, Instant now, Duration ttl) {
        if (result.length() > compressionThreshold) {
            byte[] compressed = Compression.gzip(result);
            if (compressed.length < result.getBytes(StandardCharsets.UTF_8).length) {
                return new CacheEntry(fingerprint, analysisType, null, compressed, tokensUsed, quality, now, ttl);
            }
        }
        return new CacheEntry(fingerprint, analysisType, result, null, tokensUsed, quality, now, ttl);
    }

    /**
     * Claims one unit of capacity, evicting when full. On return the caller owns the unit.
     */
    private void reserveCapacity() {
        while (true) {
            int current = size.get();
            if (current < maxSize) {
                if (size.compareAndSet(current, current + 1)) {
                    return;
                }
                continue;
            }
            if (evictLowestScored()) {
                return;
            }
            // Every unit is reserved by an insert still in flight
            Thread.onSpinWait();
        }
    }

    /**
     * Removes the lowest-scored entry across all shards and keeps its capacity unit reserved
     * for the caller.
     */
    private boolean evictLowestScored() {
        Instant now = clock.instant();
        lockAll();
        try {
            CacheEntry victim = null;
            double victimScore = 0.0;
            Shard victimShard = null;
            for (Shard shard : shards) {
                for (CacheEntry entry : shard.entries.values()) {
                    double score = scorer.score(entry, now);
                    if (victim == null || EvictionScorer.evictsBefore(entry, score, victim, victimScore)) {
                        victim = entry;
                        victimScore = score;
                        victimShard = shard;
                    }
                }
            }
            if (victim == null) {
                return false;
            }
            victimShard.entries.remove(victim.fingerprint());
            evictions.incrementAndGet();
            log.debug("Cache entry evicted: fingerprint={}, analysisType={}, score={}",
                    victim.fingerprint(), victim.analysisType(), victimScore);
            return true;
        } finally {
            unlockAll();
        }
    }

    /**
     * Re-tunes the per-type TTL frequency boost from observed hit rates, then purges expired
     * entries. Types with more than {@code minRequestsForTuning} lookups are considered: a hit
     * rate above 0.8 raises the boost, below 0.3 lowers it. The boost stays within
     * [0, maxFrequencyBoost], so TTLs remain monotonic in quality and hits.
     *
     * @return number of analysis types whose boost changed
     */
    public int optimizeStrategy() {
        Instant now = clock.instant();
        int adjusted = 0;
        for (AnalysisTypeTracker tracker : trackers.values()) {
            if (tracker.requests() <= minRequestsForTuning) {
                continue;
            }
            double hitRate = tracker.hitRate();
            double boost = tracker.frequencyBoost();
            double next = boost;
            if (hitRate > 0.8) {
                next = Math.min(maxFrequencyBoost, Math.max(boost * 1.2, boost + 0.1));
            } else if (hitRate < 0.3) {
                next = Math.max(0.0, boost * 0.8);
            }
            if (next != boost) {
                tracker.updateBoost(next, now);
                adjusted++;
                log.debug("TTL boost tuned: analysisType={}, hitRate={}, boost={} -> {}",
                        tracker.snapshot().analysisType(), hitRate, boost, next);
            }
        }
        int purged = purgeExpired();
        log.info("Cache strategy optimized: adjustedTypes={}, purgedEntries={}, size={}",
                adjusted, purged, size.get());
        return adjusted;
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<CacheEntry> it = shard.entries.values().iterator();
                while (it.hasNext()) {
                    if (it.next().isExpired(now)) {
                        it.remove();
                        size.decrementAndGet();
                        purged++;
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        return purged;
    }

    /**
     * Pre-populates the cache in the background. Seeds whose fingerprint is already cached
     * are skipped. Never blocks the caller.
     *
     * @return future completing with the number of entries inserted
     */
    public CompletableFuture<Integer> warm(Collection<CacheSeed> seeds) {
        if (seeds == null || seeds.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        List<CacheSeed> copy = List.copyOf(seeds);
        try {
            return CompletableFuture.supplyAsync(() -> warmNow(copy), maintenance);
        } catch (RejectedExecutionException e) {
            log.warn("Cache warm-up skipped, store is closed: seeds={}", copy.size());
            return CompletableFuture.completedFuture(0);
        }
    }

    private int warmNow(List<CacheSeed> seeds) {
        int inserted = 0;
        for (CacheSeed seed : seeds) {
            try {
                if (!contains(seed.analysisType(), seed.content())) {
                    store(seed.analysisType(), seed.content(), seed.result(), seed.tokensUsed(), seed.quality());
                    inserted++;
                }
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid warm-up seed: analysisType={}, error={}",
                        seed.analysisType(), e.getMessage());
            }
        }
        log.info("Cache warmed: seeds={}, inserted={}", seeds.size(), inserted);
        return inserted;
    }

    /**
     * Point-in-time statistics. Shards are visited one at a time.
     */
    public CacheStatistics stats() {
        Instant now = clock.instant();
        int total = 0;
        int valid = 0;
        int expired = 0;
        int compressed = 0;
        long ageMillisSum = 0;

        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                for (CacheEntry entry : shard.entries.values()) {
                    total++;
                    if (entry.isCompressed()) {
                        compressed++;
                    }
                    if (entry.isExpired(now)) {
                        expired++;
                    } else {
                        valid++;
                        ageMillisSum += Math.max(0L, Duration.between(entry.createdAt(), now).toMillis());
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }

        long hitCount = hits.get();
        long missCount = misses.get();
        return new CacheStatistics(
                hitCount + missCount,
                hitCount,
                missCount,
                CacheStatistics.hitRate(hitCount, missCount),
                total,
                maxSize,
                valid,
                expired,
                compressed,
                valid > 0 ? Duration.ofMillis(ageMillisSum / valid) : Duration.ZERO,
                evictions.get(),
                trackers.size(),
                now
        );
    }

    /**
     * Per analysis type usage and TTL boost.
     */
    public List<AnalysisTypeStats> analysisTypeStats() {
        List<AnalysisTypeStats> result = new ArrayList<>(trackers.size());
        for (AnalysisTypeTracker tracker : trackers.values()) {
            result.add(tracker.snapshot());
        }
        return result;
    }

    public int size() {
        return size.get();
    }

    public int maxSize() {
        return maxSize;
    }

    /**
     * TTL a new entry would receive right now.
     */
    public Duration ttlFor(String analysisType, double quality) {
        AnalysisTypeTracker tracker = tracker(analysisType);
        return ttlPolicy.ttl(quality, tracker.hits(), tracker.frequencyBoost());
    }

    /**
     * Eviction scores of all entries at the current instant, keyed by fingerprint.
     */
    Map<String, Double> evictionScores() {
        Instant now = clock.instant();
        Map<String, Double> scores = new HashMap<>();
        lockAll();
        try {
            for (Shard shard : shards) {
                for (CacheEntry entry : shard.entries.values()) {
                    scores.put(entry.fingerprint(), scorer.score(entry, now));
                }
            }
        } finally {
            unlockAll();
        }
        return scores;
    }

    /**
     * Starts the periodic {@link #optimizeStrategy()} task.
     */
    public void startMaintenance(Duration interval) {
        if (maintenanceRunning.compareAndSet(false, true)) {
            maintenance.scheduleWithFixedDelay(
                    this::runMaintenance,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Cache maintenance started with interval: {}", interval);
        }
    }

    private void runMaintenance() {
        try {
            optimizeStrategy();
        } catch (RuntimeException e) {
            log.error("Cache maintenance cycle failed", e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            maintenance.shutdown();
            try {
                if (!maintenance.awaitTermination(5, TimeUnit.SECONDS)) {
                    maintenance.shutdownNow();
                }
            } catch (InterruptedException e) {
                maintenance.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("CacheStore closed: size={}, evictions={}", size.get(), evictions.get());
        }
    }

    private AnalysisTypeTracker tracker(String analysisType) {
        return trackers.computeIfAbsent(analysisType, type -> new AnalysisTypeTracker(type, initialFrequencyBoost));
    }

    private Shard shardFor(String fingerprint) {
        return shards[Fingerprint.shardIndex(fingerprint, shards.length)];
    }

    private void lockAll() {
        for (Shard shard : shards) {
            shard.lock.lock();
        }
    }

    private void unlockAll() {
        for (int i = shards.length - 1; i >= 0; i--) {
            shards[i].lock.unlock();
        }
    }

    private static void requireKey(String analysisType, String content) {
        if (analysisType == null || content == null) {
            throw new IllegalArgumentException("Analysis type and content are required");
        }
    }

    private static final class Shard {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<String, CacheEntry> entries = new HashMap<>();
        // Inserts holding a reservation, keyed by fingerprint; not yet visible to lookups
        private final Map<String, CacheEntry> inFlight = new HashMap<>();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for CacheStore.
     */
    public static final class Builder {
        private int maxSize = 1000;
        private Duration baseTtl = Duration.ofMinutes(30);
        private Duration minTtl = Duration.ofMinutes(5);
        private Duration maxTtl = Duration.ofHours(2);
        private int compressionThreshold = 1000;
        private int shardCount = 16;
        private double recencyWeight = 1.0;
        private double frequencyWeight = 0.5;
        private double qualityWeight = 1.0;
        private Duration recencyHalfLife = Duration.ofMinutes(10);
        private double initialFrequencyBoost = 0.5;
        private double maxFrequencyBoost = 2.0;
        private int minRequestsForTuning = 10;
        private Clock clock = Clock.systemUTC();

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder baseTtl(Duration baseTtl) {
            this.baseTtl = baseTtl;
            return this;
        }

        public Builder minTtl(Duration minTtl) {
            this.minTtl = minTtl;
            return this;
        }

        public Builder maxTtl(Duration maxTtl) {
            this.maxTtl = maxTtl;
            return this;
        }

        public Builder compressionThreshold(int compressionThreshold) {
            this.compressionThreshold = compressionThreshold;
            return this;
        }

        public Builder shardCount(int shardCount) {
            this.shardCount = shardCount;
            return this;
        }

        public Builder weights(double recency, double frequency, double quality) {
            this.recencyWeight = recency;
            this.frequencyWeight = frequency;
            this.qualityWeight = quality;
            return this;
        }

        public Builder recencyHalfLife(Duration recencyHalfLife) {
            this.recencyHalfLife = recencyHalfLife;
            return this;
        }

        public Builder frequencyBoost(double initial, double max) {
            this.initialFrequencyBoost = initial;
            this.maxFrequencyBoost = max;
            return this;
        }

        public Builder minRequestsForTuning(int minRequestsForTuning) {
            this.minRequestsForTuning = minRequestsForTuning;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Configures builder from cache configuration.
         */
        public Builder fromConfig(OptimizerConfig.CacheConfig config) {
            return this
                    .maxSize(config.getMaxSize())
                    .baseTtl(Duration.ofMillis(config.getBaseTtlMs()))
                    .minTtl(Duration.ofMillis(config.getMinTtlMs()))
                    .maxTtl(Duration.ofMillis(config.getMaxTtlMs()))
                    .compressionThreshold(config.getCompressionThreshold())
                    .shardCount(config.getShardCount())
                    .weights(config.getRecencyWeight(), config.getFrequencyWeight(), config.getQualityWeight())
                    .recencyHalfLife(Duration.ofMillis(config.getRecencyHalfLifeMs()))
                    .frequencyBoost(config.getInitialFrequencyBoost(), config.getMaxFrequencyBoost())
                    .minRequestsForTuning(config.getMinRequestsForTuning());
        }

        public CacheStore build() {
            return new CacheStore(this);
        }
    }
}
