package fr.lapetina.optimizer.cache;

import fr.lapetina.optimizer.domain.report.AnalysisTypeStats;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Per analysis type usage counters and the self-tuned TTL frequency boost.
 */
final class AnalysisTypeTracker {

    private final String analysisType;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong stores = new AtomicLong();
    private final AtomicLong tokenSum = new AtomicLong();
    private final DoubleAdder qualitySum = new DoubleAdder();

    private volatile double frequencyBoost;
    private volatile Instant lastOptimized;

    AnalysisTypeTracker(String analysisType, double initialBoost) {
        this.analysisType = analysisType;
        this.frequencyBoost = initialBoost;
    }

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordStore(int tokensUsed, double quality) {
        stores.incrementAndGet();
        tokenSum.addAndGet(tokensUsed);
        qualitySum.add(quality);
    }

    long hits() {
        return hits.get();
    }

    long requests() {
        return hits.get() + misses.get();
    }

    double hitRate() {
        long total = requests();
        return total > 0 ? (double) hits.get() / total : 0.0;
    }

    double frequencyBoost() {
        return frequencyBoost;
    }

    /**
     * Written only by the maintenance task.
     */
    void updateBoost(double boost, Instant now) {
        this.frequencyBoost = boost;
        this.lastOptimized = now;
    }

    AnalysisTypeStats snapshot() {
        long storeCount = stores.get();
        return new AnalysisTypeStats(
                analysisType,
                requests(),
                hits.get(),
                misses.get(),
                hitRate(),
                storeCount > 0 ? qualitySum.sum() / storeCount : 0.0,
                storeCount > 0 ? (double) tokenSum.get() / storeCount : 0.0,
                frequencyBoost,
                lastOptimized
        );
    }
}
