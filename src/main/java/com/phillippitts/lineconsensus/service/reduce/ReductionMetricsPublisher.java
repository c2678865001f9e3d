package com.phillippitts.lineconsensus.service.reduce;

import com.phillippitts.lineconsensus.service.metrics.ReductionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe front for {@link ReductionMetrics}, so reducers run without a meter registry in tests.
 */
@Component
public final class ReductionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(ReductionMetricsPublisher.class);

    /** No-op instance for tests and manual wiring. */
    public static final ReductionMetricsPublisher NOOP = new ReductionMetricsPublisher(null);

    private final ReductionMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public ReductionMetricsPublisher(ReductionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("ReductionMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(durationNanos);
        metrics.incrementSuccess();
    }

    public void recordFailure(String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(reason);
    }

    public void recordFrame(FrameReduction reduction) {
        if (metrics == null) {
            return;
        }
        metrics.recordFrame(reduction.clusterCount(), reduction.noiseCount());
    }
}
