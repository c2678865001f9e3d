package com.phillippitts.lineconsensus.service.reduce;

import com.phillippitts.lineconsensus.domain.ConsensusRecord;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of reducing one frame: the consensus records plus the grouping that produced them.
 *
 * @param consensus    aggregated clusters (ascending label order) followed by singletons (input order)
 * @param labels       cleaned cluster label per observation, -1 for noise
 * @param clusterCount number of multi-member clusters
 * @param noiseCount   number of observations labeled noise
 * @param minSamples   density parameter used for this frame (0 for an empty frame)
 */
public record FrameReduction(
        List<ConsensusRecord> consensus,
        List<Integer> labels,
        int clusterCount,
        int noiseCount,
        int minSamples
) {

    public FrameReduction {
        consensus = List.copyOf(Objects.requireNonNull(consensus, "consensus"));
        labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
    }

    public static FrameReduction empty() {
        return new FrameReduction(List.of(), List.of(), 0, 0, 0);
    }
}
