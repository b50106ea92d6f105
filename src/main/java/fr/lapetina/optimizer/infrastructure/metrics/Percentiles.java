package fr.lapetina.optimizer.infrastructure.metrics;

/**
 * Nearest-rank percentiles over a sorted sample.
 *
 * <p>For {@code n} sorted values the p-th percentile is the value at index
 * {@code ceil(p * n) - 1}. The result is always an observed value and is identical
 * for identical sample sets. With samples 10, 20, ..., 100 this gives p50 = 50 and p99 = 100.
 */
public final class Percentiles {

    private Percentiles() {
        // Utility class
    }

    /**
     * @param sorted     values in ascending order, not empty
     * @param percentile fraction in (0, 1]
     */
    public static long nearestRank(long[] sorted, double percentile) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of an empty sample");
        }
        if (percentile <= 0.0 || percentile > 1.0) {
            throw new IllegalArgumentException("Percentile must be in (0, 1]: " + percentile);
        }
        int rank = (int) Math.ceil(percentile * sorted.length);
        int index = Math.min(Math.max(rank - 1, 0), sorted.length - 1);
        return sorted[index];
    }
}
