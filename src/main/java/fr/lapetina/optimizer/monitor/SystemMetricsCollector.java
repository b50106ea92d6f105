package fr.lapetina.optimizer.monitor;

import fr.lapetina.optimizer.domain.report.SystemMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Reads process figures from the JVM and processor binders bound to a Micrometer registry.
 * The GC pause is the pause time accumulated since the previous collection.
 */
final class SystemMetricsCollector {

    private final MeterRegistry registry;
    private final IntSupplier workerCount;
    private final Clock clock;
    private double lastGcPauseMillis;

    SystemMetricsCollector(MeterRegistry registry, IntSupplier workerCount, Clock clock) {
        this.registry = registry;
        this.workerCount = workerCount;
        this.clock = clock;
    }

    /**
     * Only called from the monitoring thread.
     */
    SystemMetrics collect() {
        double cpu = gaugeValue("system.cpu.usage");
        if (cpu <= 0.0) {
            cpu = gaugeValue("process.cpu.usage");
        }

        double heapUsed = sumGauges("jvm.memory.used");
        double heapMax = sumGauges("jvm.memory.max");
        double memoryUsage = heapMax > 0 ? heapUsed / heapMax * 100.0 : 0.0;

        double gcPauseMillis = 0.0;
        for (Timer timer : registry.find("jvm.gc.pause").timers()) {
            gcPauseMillis += timer.totalTime(TimeUnit.MILLISECONDS);
        }
        double pauseDelta = Math.max(0.0, gcPauseMillis - lastGcPauseMillis);
        lastGcPauseMillis = gcPauseMillis;

        return new SystemMetrics(
                clampPercentage(cpu * 100.0),
                clampPercentage(memoryUsage),
                workerCount.getAsInt(),
                (long) heapUsed,
                Duration.ofMillis((long) pauseDelta),
                clock.instant()
        );
    }

    private double gaugeValue(String name) {
        Gauge gauge = registry.find(name).gauge();
        if (gauge == null) {
            return 0.0;
        }
        double value = gauge.value();
        return Double.isNaN(value) ? 0.0 : value;
    }

    private double sumGauges(String name) {
        double sum = 0.0;
        for (Gauge gauge : registry.find(name).tag("area", "heap").gauges()) {
            double value = gauge.value();
            // Pools without a limit report -1
            if (!Double.isNaN(value) && value > 0) {
                sum += value;
            }
        }
        return sum;
    }

    private static double clampPercentage(double value) {
        return Math.min(100.0, Math.max(0.0, value));
    }
}
