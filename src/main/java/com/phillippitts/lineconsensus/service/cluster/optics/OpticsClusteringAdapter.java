package com.phillippitts.lineconsensus.service.cluster.optics;

import com.phillippitts.lineconsensus.service.cluster.ClusterLabeling;
import com.phillippitts.lineconsensus.service.cluster.ClusteringAdapter;
import com.phillippitts.lineconsensus.service.cluster.PairwiseDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/**
 * OPTICS ordering with a DBSCAN-style cut at a fixed reachability threshold.
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Core distance of a point: distance to its {@code minSamples}-th nearest observation,
 *       the point itself included. With fewer than {@code minSamples} observations every core
 *       distance is infinite.</li>
 *   <li>Ordering: repeatedly take the unprocessed point with the smallest reachability (lowest
 *       index on ties), then lower the reachability of the remaining points to
 *       {@code max(core(p), d(p, q))}.</li>
 *   <li>Cut: walking the ordering, a point whose reachability exceeds {@code eps} starts a new
 *       cluster if its core distance is within {@code eps}, and is noise otherwise; any other
 *       point joins the current cluster.</li>
 * </ol>
 *
 * <p>Infinite distances never lower a reachability, so pairs the dissimilarity marks as
 * "never connect" are never linked directly. The full distance matrix is never stored;
 * each pair is requested on demand.
 */
public final class OpticsClusteringAdapter implements ClusteringAdapter {

    private static final Logger LOG = LogManager.getLogger(OpticsClusteringAdapter.class);

    private final double eps;

    /**
     * @param eps reachability threshold used to cut clusters (must be positive and finite)
     * @throws IllegalArgumentException if eps is not a positive finite number
     */
    public OpticsClusteringAdapter(double eps) {
        if (!(eps > 0.0) || Double.isInfinite(eps)) {
            throw new IllegalArgumentException("eps must be a positive finite number, got: " + eps);
        }
        this.eps = eps;
    }

    public double getEps() {
        return eps;
    }

    @Override
    public ClusterLabeling cluster(int observationCount, PairwiseDistance distance, int minSamples) {
        Objects.requireNonNull(distance, "distance must not be null");
        if (observationCount < 0) {
            throw new IllegalArgumentException("observationCount must be >= 0, got: " + observationCount);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        if (observationCount == 0) {
            return new ClusterLabeling(new int[0], new double[0]);
        }
        if (minSamples > observationCount) {
            LOG.debug("minSamples={} exceeds observation count {}; labeling everything as noise",
                    minSamples, observationCount);
            return ClusterLabeling.allNoise(observationCount);
        }

        double[] core = coreDistances(observationCount, distance, minSamples);
        double[] reachability = new double[observationCount];
        Arrays.fill(reachability, Double.POSITIVE_INFINITY);
        int[] ordering = order(observationCount, distance, core, reachability);
        int[] labels = cut(ordering, core, reachability);
        return new ClusterLabeling(labels, core);
    }

    private static double[] coreDistances(int n, PairwiseDistance distance, int minSamples) {
        double[] core = new double[n];
        double[] row = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                row[j] = i == j ? 0.0 : distance.between(i, j);
            }
            double[] sorted = row.clone();
            Arrays.sort(sorted);
            core[i] = sorted[minSamples - 1];
        }
        return core;
    }

    private static int[] order(int n, PairwiseDistance distance, double[] core, double[] reachability) {
        boolean[] processed = new boolean[n];
        int[] ordering = new int[n];
        for (int k = 0; k < n; k++) {
            int point = nextPoint(processed, reachability);
            processed[point] = true;
            ordering[k] = point;
            if (Double.isInfinite(core[point])) {
                continue;
            }
            for (int q = 0; q < n; q++) {
                if (processed[q]) {
                    continue;
                }
                double reach = Math.max(core[point], distance.between(point, q));
                if (reach < reachability[q]) {
                    reachability[q] = reach;
                }
            }
        }
        return ordering;
    }

    private static int nextPoint(boolean[] processed, double[] reachability) {
        int best = -1;
        for (int i = 0; i < processed.length; i++) {
            if (!processed[i] && (best < 0 || reachability[i] < reachability[best])) {
                best = i;
            }
        }
        return best;
    }

    private int[] cut(int[] ordering, double[] core, double[] reachability) {
        int[] labels = new int[ordering.length];
        int current = ClusterLabeling.NOISE;
        for (int point : ordering) {
            boolean farReach = reachability[point] > eps;
            boolean nearCore = core[point] <= eps;
            if (farReach && nearCore) {
                current++;
            }
            labels[point] = farReach && !nearCore ? ClusterLabeling.NOISE : current;
        }
        return labels;
    }
}
