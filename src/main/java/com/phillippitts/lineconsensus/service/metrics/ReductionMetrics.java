package com.phillippitts.lineconsensus.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for subject reductions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Reduction latency per subject</li>
 *   <li>Success/failure counts (failures tagged by reason)</li>
 *   <li>Clusters formed and observations left as noise</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class ReductionMetrics {

    private static final String METRIC_PREFIX = "lineconsensus.reduction";

    private final MeterRegistry registry;

    public ReductionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to reduce one subject")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of subjects reduced")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (malformed_record, timeout, unexpected_error)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of subjects whose reduction aborted")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records the grouping of one frame.
     *
     * @param clusters number of multi-member clusters
     * @param noise number of observations labeled noise
     */
    public void recordFrame(int clusters, int noise) {
        Counter.builder(METRIC_PREFIX + ".clusters")
                .description("Number of multi-member clusters formed")
                .register(registry)
                .increment(clusters);
        Counter.builder(METRIC_PREFIX + ".noise")
                .description("Number of observations kept as singletons because they were noise")
                .register(registry)
                .increment(noise);
    }
}
