package com.phillippitts.lineconsensus.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Caller-visible consensus for one real document line.
 *
 * <p>Multi-member clusters are built by a
 * {@link com.phillippitts.lineconsensus.service.consensus.ClusterAggregator}; standalone
 * observations are built by
 * {@link com.phillippitts.lineconsensus.service.consensus.SingletonSynthesizer} with one view and
 * a score of 1.0.
 *
 * @param clustersX      start and end x coordinates of the consensus line
 * @param clustersY      start and end y coordinates of the consensus line
 * @param clustersText   one inner list per word position, holding the candidate words
 * @param numberViews    number of observations that contributed
 * @param lineSlope      signed angle of the line in degrees, in [-180, 180]
 * @param consensusScore agreement score (1.0 for a standalone observation)
 */
public record ConsensusRecord(
        @JsonProperty("clusters_x") List<Double> clustersX,
        @JsonProperty("clusters_y") List<Double> clustersY,
        @JsonProperty("clusters_text") List<List<String>> clustersText,
        @JsonProperty("number_views") int numberViews,
        @JsonProperty("line_slope") double lineSlope,
        @JsonProperty("consensus_score") double consensusScore
) {

    public ConsensusRecord {
        clustersX = List.copyOf(Objects.requireNonNull(clustersX, "clustersX"));
        clustersY = List.copyOf(Objects.requireNonNull(clustersY, "clustersY"));
        Objects.requireNonNull(clustersText, "clustersText");
        clustersText = clustersText.stream().map(List::copyOf).toList();
        if (numberViews < 1) {
            throw new IllegalArgumentException("numberViews must be >= 1, got: " + numberViews);
        }
    }
}
