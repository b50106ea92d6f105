package fr.lapetina.optimizer.disruptor;

import fr.lapetina.optimizer.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricIngestPipelineTest {

    private MetricsRegistry metricsRegistry;
    private MetricIngestPipeline pipeline;

    @BeforeEach
    void setUp() {
        metricsRegistry = new MetricsRegistry("ingest_test");
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
        metricsRegistry.close();
    }

    @Test
    @DisplayName("should record published samples in the registry")
    void shouldRecordSamples() {
        pipeline = MetricIngestPipeline.builder().bufferSize(64).metricsRegistry(metricsRegistry).build();
        pipeline.start();

        assertThat(pipeline.tryPublish(Instant.now(), true, Duration.ofMillis(10))).isTrue();
        assertThat(pipeline.tryPublish(Instant.now(), false, Duration.ofMillis(30))).isTrue();
        assertThat(pipeline.flush(Duration.ofSeconds(5))).isTrue();

        assertThat(metricsRegistry.requestMetrics().totalRequests()).isEqualTo(2);
        assertThat(metricsRegistry.requestMetrics().failedRequests()).isEqualTo(1);
    }

    @Test
    @DisplayName("should refuse samples before start")
    void shouldRefuseBeforeStart() {
        pipeline = MetricIngestPipeline.builder().bufferSize(16).metricsRegistry(metricsRegistry).build();

        assertThat(pipeline.isRunning()).isFalse();
        assertThat(pipeline.tryPublish(Instant.now(), true, Duration.ZERO)).isFalse();
        assertThat(pipeline.getDroppedSamples()).isZero();
    }

    @Test
    @DisplayName("should account for every sample as recorded or dropped under load")
    void shouldAccountForEverySample() throws InterruptedException {
        pipeline = MetricIngestPipeline.builder()
                .bufferSize(4)
                .waitStrategy("yielding")
                .metricsRegistry(metricsRegistry)
                .build();
        pipeline.start();

        int threads = 4;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicLong accepted = new AtomicLong();

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        if (pipeline.tryPublish(Instant.now(), true, Duration.ofMillis(1))) {
                            accepted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(pipeline.flush(Duration.ofSeconds(5))).isTrue();

        assertThat(metricsRegistry.requestMetrics().totalRequests()).isEqualTo(accepted.get());
        assertThat(accepted.get() + pipeline.getDroppedSamples()).isEqualTo((long) threads * perThread);
    }

    @Test
    @DisplayName("should reject a buffer size that is not a power of two")
    void shouldRejectInvalidBufferSize() {
        assertThatThrownBy(() -> MetricIngestPipeline.builder().bufferSize(1000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should require a metrics registry")
    void shouldRequireRegistry() {
        assertThatThrownBy(() -> MetricIngestPipeline.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should stop accepting samples after close")
    void shouldStopAfterClose() {
        pipeline = MetricIngestPipeline.builder().bufferSize(16).metricsRegistry(metricsRegistry).build();
        pipeline.start();

        pipeline.close();

        assertThat(pipeline.isRunning()).isFalse();
        assertThat(pipeline.tryPublish(Instant.now(), true, Duration.ZERO)).isFalse();
    }
}
