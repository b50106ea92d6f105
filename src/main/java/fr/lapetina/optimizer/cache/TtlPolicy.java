package fr.lapetina.optimizer.cache;

import java.time.Duration;

/**
 * Computes entry lifetimes.
 *
 * <pre>
 * ttl = clamp(baseTtl * (0.5 + 0.5 * quality) * (1 + boost * (1 - e^(-typeHits / 10))), minTtl, maxTtl)
 * </pre>
 * For any fixed non-negative {@code boost} the result is non-decreasing in both
 * quality and historical hits of the analysis type, and never exceeds {@code maxTtl}.
 */
public final class TtlPolicy {

    private static final double HIT_SATURATION = 10.0;

    private final Duration baseTtl;
    private final Duration minTtl;
    private final Duration maxTtl;

    public TtlPolicy(Duration baseTtl, Duration minTtl, Duration maxTtl) {
        if (minTtl.compareTo(maxTtl) > 0) {
            throw new IllegalArgumentException("minTtl must not exceed maxTtl");
        }
        this.baseTtl = baseTtl;
        this.minTtl = minTtl;
        this.maxTtl = maxTtl;
    }

    public Duration ttl(double quality, long typeHits, double frequencyBoost) {
        double qualityFactor = 0.5 + 0.5 * clamp01(quality);
        double familiarity = 1.0 - Math.exp(-Math.max(0L, typeHits) / HIT_SATURATION);
        double frequencyFactor = 1.0 + Math.max(0.0, frequencyBoost) * familiarity;

        long millis = Math.round(baseTtl.toMillis() * qualityFactor * frequencyFactor);
        long clamped = Math.max(minTtl.toMillis(), Math.min(maxTtl.toMillis(), millis));
        return Duration.ofMillis(clamped);
    }

    public Duration maxTtl() {
        return maxTtl;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
