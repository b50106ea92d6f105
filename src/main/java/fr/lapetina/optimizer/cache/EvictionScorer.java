package fr.lapetina.optimizer.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Hybrid recency / frequency / quality eviction score.
 *
 * <pre>
 * score = recencyWeight * 2^(-idle / halfLife)
 *       + frequencyWeight * ln(1 + accessCount)
 *       + qualityWeight * quality
 * </pre>
 * The lowest score is evicted first. Ties go to the oldest {@code createdAt},
 * then to the smallest fingerprint.
 */
public final class EvictionScorer {

    private final double recencyWeight;
    private final double frequencyWeight;
    private final double qualityWeight;
    private final long halfLifeMillis;

    public EvictionScorer(double recencyWeight, double frequencyWeight, double qualityWeight, Duration halfLife) {
        if (recencyWeight < 0 || frequencyWeight < 0 || qualityWeight < 0) {
            throw new IllegalArgumentException("Eviction weights must not be negative");
        }
        if (halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("Recency half-life must be positive: " + halfLife);
        }
        this.recencyWeight = recencyWeight;
        this.frequencyWeight = frequencyWeight;
        this.qualityWeight = qualityWeight;
        this.halfLifeMillis = halfLife.toMillis();
    }

    public double score(Instant lastAccessed, long accessCount, double quality, Instant now) {
        long idleMillis = Math.max(0L, Duration.between(lastAccessed, now).toMillis());
        double ageDecay = Math.pow(2.0, -(double) idleMillis / halfLifeMillis);
        return recencyWeight * ageDecay
                + frequencyWeight * Math.log1p(accessCount)
                + qualityWeight * quality;
    }

    double score(CacheEntry entry, Instant now) {
        return score(entry.lastAccessed(), entry.accessCount(), entry.quality(), now);
    }

    /**
     * True if {@code candidate} should be evicted before {@code current}.
     */
    static boolean evictsBefore(CacheEntry candidate, double candidateScore,
                                CacheEntry current, double currentScore) {
        if (candidateScore != currentScore) {
            return candidateScore < currentScore;
        }
        int byAge = candidate.createdAt().compareTo(current.createdAt());
        if (byAge != 0) {
            return byAge < 0;
        }
        return candidate.fingerprint().compareTo(current.fingerprint()) < 0;
    }
}
