package com.phillippitts.lineconsensus.service.cluster;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Repairs a labeling so each contributor appears at most once per cluster.
 *
 * <p>For every cluster label, observations are grouped by contributor. A contributor with more
 * than one observation keeps the one with the smallest core distance; the others are demoted to
 * {@link ClusterLabeling#NOISE}. Exact ties keep the observation that comes first in input
 * order. Labels are never merged, split or renumbered.
 */
public final class UserUniquenessEnforcer {

    private static final Logger LOG = LogManager.getLogger(UserUniquenessEnforcer.class);

    private UserUniquenessEnforcer() {
    }

    /**
     * Returns a repaired copy of {@code labels}; the inputs are not modified.
     *
     * @param labels        cluster label per observation
     * @param coreDistances core distance per observation
     * @param userIndices   contributor index per observation
     * @return cleaned labels
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static int[] enforce(int[] labels, double[] coreDistances, int[] userIndices) {
        Objects.requireNonNull(labels, "labels");
        Objects.requireNonNull(coreDistances, "coreDistances");
        Objects.requireNonNull(userIndices, "userIndices");
        if (labels.length != coreDistances.length || labels.length != userIndices.length) {
            throw new IllegalArgumentException("labels, coreDistances and userIndices must have equal length");
        }

        int[] cleaned = labels.clone();
        int demoted = 0;
        for (Map<Integer, List<Integer>> byUser : membersByLabelAndUser(labels, userIndices).values()) {
            for (List<Integer> members : byUser.values()) {
                if (members.size() < 2) {
                    continue;
                }
                int keep = members.get(0);
                for (int idx : members) {
                    // strict comparison keeps the first occurrence on ties
                    if (coreDistances[idx] < coreDistances[keep]) {
                        keep = idx;
                    }
                }
                for (int idx : members) {
                    if (idx != keep) {
                        cleaned[idx] = ClusterLabeling.NOISE;
                        demoted++;
                    }
                }
            }
        }
        if (demoted > 0) {
            LOG.debug("Demoted {} duplicate contributor observation(s) to noise", demoted);
        }
        return cleaned;
    }

    private static Map<Integer, Map<Integer, List<Integer>>> membersByLabelAndUser(int[] labels, int[] users) {
        Map<Integer, Map<Integer, List<Integer>>> grouped = new LinkedHashMap<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] < 0) {
                continue;
            }
            grouped.computeIfAbsent(labels[i], l -> new LinkedHashMap<>())
                    .computeIfAbsent(users[i], u -> new ArrayList<>())
                    .add(i);
        }
        return grouped;
    }
}
