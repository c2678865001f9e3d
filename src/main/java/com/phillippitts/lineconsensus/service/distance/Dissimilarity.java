package com.phillippitts.lineconsensus.service.distance;

import com.phillippitts.lineconsensus.domain.ObservationKey;

/**
 * Scalar dissimilarity between two observations of the same frame.
 *
 * <p>Implementations are bound to one frame's records and must not share state across
 * subjects, so frames can be reduced on parallel workers without coordination.
 */
@FunctionalInterface
public interface Dissimilarity {

    /**
     * Returns the dissimilarity of two observations; {@link Double#POSITIVE_INFINITY} means the
     * two must never be connected.
     */
    double between(ObservationKey a, ObservationKey b);
}
