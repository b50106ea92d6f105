package fr.lapetina.optimizer.infrastructure.metrics;

import fr.lapetina.optimizer.domain.model.MetricSample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling window of request samples, bounded by count and by age.
 * Whichever bound is hit first ages samples out.
 */
final class LatencyWindow {

    private final int maxSamples;
    private final Duration maxAge;
    private final Deque<MetricSample> samples = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    LatencyWindow(int maxSamples, Duration maxAge) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + maxSamples);
        }
        this.maxSamples = maxSamples;
        this.maxAge = maxAge;
    }

    void add(MetricSample sample) {
        lock.lock();
        try {
            samples.addLast(sample);
            while (samples.size() > maxSamples) {
                samples.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops samples older than the age bound and returns a copy of the rest, oldest first.
     */
    List<MetricSample> snapshot(Instant now) {
        Instant cutoff = now.minus(maxAge);
        lock.lock();
        try {
            while (!samples.isEmpty() && samples.peekFirst().timestamp().isBefore(cutoff)) {
                samples.removeFirst();
            }
            return new ArrayList<>(samples);
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return samples.size();
        } finally {
            lock.unlock();
        }
    }

    Duration maxAge() {
        return maxAge;
    }
}
