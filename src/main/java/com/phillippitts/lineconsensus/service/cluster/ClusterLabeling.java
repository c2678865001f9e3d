package com.phillippitts.lineconsensus.service.cluster;

import java.util.Arrays;
import java.util.Objects;

/**
 * Output of a {@link ClusteringAdapter}: one label and one core distance per observation.
 *
 * <p>A shared non-negative label means cluster membership; {@link #NOISE} means the observation
 * belongs to no cluster. Core distances are only used as a comparison key.
 *
 * @param labels        cluster label per observation
 * @param coreDistances core distance per observation (same length as labels)
 */
public record ClusterLabeling(int[] labels, double[] coreDistances) {

    public static final int NOISE = -1;

    public ClusterLabeling {
        Objects.requireNonNull(labels, "labels must not be null");
        Objects.requireNonNull(coreDistances, "coreDistances must not be null");
        if (labels.length != coreDistances.length) {
            throw new IllegalArgumentException("labels and coreDistances differ in length: "
                    + labels.length + " vs " + coreDistances.length);
        }
        labels = labels.clone();
        coreDistances = coreDistances.clone();
    }

    /**
     * Labeling in which every observation is noise.
     */
    public static ClusterLabeling allNoise(int observationCount) {
        int[] labels = new int[observationCount];
        double[] core = new double[observationCount];
        Arrays.fill(labels, NOISE);
        Arrays.fill(core, Double.POSITIVE_INFINITY);
        return new ClusterLabeling(labels, core);
    }

    public int size() {
        return labels.length;
    }

    @Override
    public int[] labels() {
        return labels.clone();
    }

    @Override
    public double[] coreDistances() {
        return coreDistances.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClusterLabeling other)) {
            return false;
        }
        return Arrays.equals(labels, other.labels) && Arrays.equals(coreDistances, other.coreDistances);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(labels) + Arrays.hashCode(coreDistances);
    }

    @Override
    public String toString() {
        return "ClusterLabeling[labels=" + Arrays.toString(labels)
                + ", coreDistances=" + Arrays.toString(coreDistances) + "]";
    }
}
