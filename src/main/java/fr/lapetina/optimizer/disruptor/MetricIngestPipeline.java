package fr.lapetina.optimizer.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.optimizer.disruptor.handlers.SampleRecordingHandler;
import fr.lapetina.optimizer.domain.event.MetricSampleEvent;
import fr.lapetina.optimizer.domain.event.MetricSampleEventFactory;
import fr.lapetina.optimizer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

/**
 * Lock-free ingest of request samples into the metrics registry.
 *
 * Request threads publish with {@code tryNext}, so recording never blocks the request path.
 * When the ring is full the sample is dropped and counted. A single consumer thread appends
 * samples to the rolling window in publish order.
 *
 * PRODUCER TYPE: MULTI, every request thread publishes.
 * WAIT STRATEGY: configurable, blocking by default since ingest is not latency critical.
 */
public final class MetricIngestPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricIngestPipeline.class);

    private final Disruptor<MetricSampleEvent> disruptor;
    private final RingBuffer<MetricSampleEvent> ringBuffer;
    private final SampleRecordingHandler recordingHandler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong droppedSamples = new AtomicLong();

    private MetricIngestPipeline(Builder builder) {
        this.disruptor = new Disruptor<>(
                new MetricSampleEventFactory(),
                builder.bufferSize,
                new IngestThreadFactory("metric-ingest"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        this.recordingHandler = new SampleRecordingHandler(builder.metricsRegistry);
        disruptor.handleEventsWith(recordingHandler);
        disruptor.setDefaultExceptionHandler(new IngestExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("MetricIngestPipeline created: bufferSize={}, waitStrategy={}",
                builder.bufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("MetricIngestPipeline started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Publishes a sample without blocking.
     *
     * @return false if the pipeline is stopped or the ring buffer is full
     */
    public boolean tryPublish(Instant timestamp, boolean success, Duration latency) {
        if (!running.get()) {
            return false;
        }
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            long dropped = droppedSamples.incrementAndGet();
            if (dropped == 1 || dropped % 1000 == 0) {
                log.warn("Metric ingest buffer full, samples dropped: total={}", dropped);
            }
            return false;
        }
        try {
            ringBuffer.get(sequence).set(timestamp, success, latency);
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    /**
     * Waits until every sample published so far has been recorded.
     *
     * @return true if drained within the timeout
     */
    public boolean flush(Duration timeout) {
        long target = ringBuffer.getCursor();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (recordingHandler.getLastSequence() < target) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(1));
        }
        return true;
    }

    public long getDroppedSamples() {
        return droppedSamples.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down MetricIngestPipeline...");
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
                log.info("MetricIngestPipeline shut down gracefully: droppedSamples={}", droppedSamples.get());
            } catch (TimeoutException e) {
                log.warn("MetricIngestPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Daemon threads so an unclosed pipeline never keeps the JVM alive.
     */
    private static class IngestThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        IngestThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class IngestExceptionHandler implements com.lmax.disruptor.ExceptionHandler<MetricSampleEvent> {

        private static final Logger log = LoggerFactory.getLogger(IngestExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, MetricSampleEvent event) {
            log.error("Failed to record metric sample: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during metric ingest start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during metric ingest shutdown", ex);
        }
    }

    /**
     * Builder for MetricIngestPipeline.
     */
    public static final class Builder {
        private int bufferSize = 1024;
        private String waitStrategy = "blocking";
        private MetricsRegistry metricsRegistry;

        public Builder bufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.bufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public MetricIngestPipeline build() {
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new MetricIngestPipeline(this);
        }
    }
}
