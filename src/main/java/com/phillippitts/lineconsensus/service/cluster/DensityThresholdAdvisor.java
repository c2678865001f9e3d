package com.phillippitts.lineconsensus.service.cluster;

/**
 * Chooses the density parameter ({@code min_samples}) from the number of distinct contributors
 * on a subject.
 *
 * <p>Calibrated policy (inclusive bounds, first match wins):
 * <pre>
 *   N &lt;= 6    -&gt; 2
 *   N &lt;= 10   -&gt; 3
 *   N &lt;= 15   -&gt; 4
 *   N &lt;= 20   -&gt; 5
 *   otherwise -&gt; floor(0.25 * N)
 * </pre>
 *
 * <p>A fixed value can be configured instead ({@code consensus.clustering.min-samples}); 0 keeps
 * the calibrated policy.
 */
public final class DensityThresholdAdvisor {

    /** Marker for "derive min_samples from the contributor count". */
    public static final int AUTO = 0;

    private final int fixedMinSamples;

    public DensityThresholdAdvisor() {
        this(AUTO);
    }

    /**
     * @param fixedMinSamples fixed min_samples, or {@link #AUTO}
     * @throws IllegalArgumentException if fixedMinSamples is negative
     */
    public DensityThresholdAdvisor(int fixedMinSamples) {
        if (fixedMinSamples < 0) {
            throw new IllegalArgumentException("fixedMinSamples must be >= 0, got: " + fixedMinSamples);
        }
        this.fixedMinSamples = fixedMinSamples;
    }

    /**
     * Returns min_samples for a subject with {@code contributors} distinct contributors.
     */
    public int minSamples(int contributors) {
        return fixedMinSamples > AUTO ? fixedMinSamples : recommended(contributors);
    }

    public boolean isAuto() {
        return fixedMinSamples == AUTO;
    }

    /**
     * Calibrated min_samples for {@code contributors} distinct contributors.
     */
    public static int recommended(int contributors) {
        if (contributors <= 6) {
            return 2;
        }
        if (contributors <= 10) {
            return 3;
        }
        if (contributors <= 15) {
            return 4;
        }
        if (contributors <= 20) {
            return 5;
        }
        // Truncates, does not round
        return (int) (0.25 * contributors);
    }
}
