package com.phillippitts.lineconsensus.service.cluster;

/**
 * Density-based clustering with noise detection over a pluggable dissimilarity.
 *
 * <p>Callers pass the dissimilarity opaquely and rely only on the {@link ClusterLabeling}
 * contract: one label per observation ({@link ClusterLabeling#NOISE} for noise) and one core
 * distance per observation. Implementations must be deterministic for a fixed input order.
 *
 * <p>A {@code minSamples} larger than {@code observationCount} is not an error: the expected
 * result is an all-noise labeling.
 *
 * @see com.phillippitts.lineconsensus.service.cluster.optics.OpticsClusteringAdapter
 */
public interface ClusteringAdapter {

    /**
     * Labels {@code observationCount} observations.
     *
     * @param observationCount number of observations (addressed 0..n-1)
     * @param distance         pairwise dissimilarity; infinite values never connect
     * @param minSamples       minimum neighborhood size (including the point itself) of a core point
     * @return labels and core distances, both of length {@code observationCount}
     */
    ClusterLabeling cluster(int observationCount, PairwiseDistance distance, int minSamples);
}
