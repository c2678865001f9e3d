package com.phillippitts.lineconsensus.service.cluster;

/**
 * Distance between two observations addressed by their position (0..n-1).
 */
@FunctionalInterface
public interface PairwiseDistance {

    double between(int i, int j);
}
