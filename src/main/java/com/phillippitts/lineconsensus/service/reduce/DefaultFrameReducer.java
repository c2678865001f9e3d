package com.phillippitts.lineconsensus.service.reduce;

import com.phillippitts.lineconsensus.domain.ConsensusRecord;
import com.phillippitts.lineconsensus.domain.LineRecord;
import com.phillippitts.lineconsensus.domain.ObservationKey;
import com.phillippitts.lineconsensus.service.cluster.ClusterLabeling;
import com.phillippitts.lineconsensus.service.cluster.ClusteringAdapter;
import com.phillippitts.lineconsensus.service.cluster.DensityThresholdAdvisor;
import com.phillippitts.lineconsensus.service.cluster.UserUniquenessEnforcer;
import com.phillippitts.lineconsensus.service.consensus.ClusterAggregator;
import com.phillippitts.lineconsensus.service.consensus.SingletonSynthesizer;
import com.phillippitts.lineconsensus.service.distance.Dissimilarity;
import com.phillippitts.lineconsensus.service.distance.LineTextDissimilarity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Default consensus pipeline for one frame.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>Pick min_samples from the subject's distinct contributor count via {@link DensityThresholdAdvisor}</li>
 *   <li>Cluster with {@link ClusteringAdapter} over a {@link LineTextDissimilarity}</li>
 *   <li>Demote duplicate contributors per cluster with {@link UserUniquenessEnforcer}</li>
 *   <li>Aggregate each multi-member cluster with {@link ClusterAggregator}</li>
 *   <li>Represent noise (and any cluster left with one member) with {@link SingletonSynthesizer}</li>
 * </ol>
 *
 * <p>The result is deterministic for a fixed input order.
 */
public final class DefaultFrameReducer implements FrameReducer {

    private static final Logger LOG = LogManager.getLogger(DefaultFrameReducer.class);

    private final ClusteringAdapter clustering;
    private final DensityThresholdAdvisor thresholdAdvisor;
    private final ClusterAggregator aggregator;
    private final SingletonSynthesizer singletons;

    /**
     * @throws NullPointerException if any collaborator is null
     */
    public DefaultFrameReducer(ClusteringAdapter clustering,
                               DensityThresholdAdvisor thresholdAdvisor,
                               ClusterAggregator aggregator,
                               SingletonSynthesizer singletons) {
        this.clustering = Objects.requireNonNull(clustering, "clustering must not be null");
        this.thresholdAdvisor = Objects.requireNonNull(thresholdAdvisor, "thresholdAdvisor must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.singletons = Objects.requireNonNull(singletons, "singletons must not be null");
    }

    @Override
    public FrameReduction reduce(List<LineRecord> records, int[] userIndices, int contributors) {
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(userIndices, "userIndices must not be null");
        if (records.size() != userIndices.length) {
            throw new IllegalArgumentException("records and userIndices differ in length: "
                    + records.size() + " vs " + userIndices.length);
        }
        if (records.isEmpty()) {
            return FrameReduction.empty();
        }
        long present = Arrays.stream(userIndices).distinct().count();
        if (contributors < present) {
            throw new IllegalArgumentException("contributors (" + contributors
                    + ") is fewer than the " + present + " users present on the frame");
        }

        List<ObservationKey> keys = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            keys.add(new ObservationKey(i, userIndices[i]));
        }
        int minSamples = thresholdAdvisor.minSamples(contributors);

        Dissimilarity dissimilarity = new LineTextDissimilarity(records);
        ClusterLabeling raw = clustering.cluster(keys.size(),
                (i, j) -> dissimilarity.between(keys.get(i), keys.get(j)), minSamples);
        if (raw.size() != keys.size()) {
            throw new IllegalStateException("Clustering returned " + raw.size()
                    + " labels for " + keys.size() + " observations");
        }
        int[] labels = UserUniquenessEnforcer.enforce(raw.labels(), raw.coreDistances(), userIndices);

        Map<Integer, List<ObservationKey>> clusters = new TreeMap<>();
        List<ObservationKey> standalone = new ArrayList<>();
        int noise = 0;
        for (ObservationKey key : keys) {
            int label = labels[key.dataIndex()];
            if (label < 0) {
                noise++;
            } else {
                clusters.computeIfAbsent(label, l -> new ArrayList<>()).add(key);
            }
        }

        List<ConsensusRecord> consensus = new ArrayList<>();
        int multiMember = 0;
        for (List<ObservationKey> members : clusters.values()) {
            if (members.size() > 1) {
                consensus.add(aggregator.aggregate(members, records));
                multiMember++;
            }
        }
        for (ObservationKey key : keys) {
            int label = labels[key.dataIndex()];
            if (label < 0 || clusters.get(label).size() == 1) {
                standalone.add(key);
            }
        }
        consensus.addAll(singletons.synthesize(standalone, records));

        LOG.debug("Frame reduced: observations={}, contributors={}, minSamples={}, clusters={}, noise={}",
                keys.size(), contributors, minSamples, multiMember, noise);
        return new FrameReduction(consensus, Arrays.stream(labels).boxed().toList(), multiMember, noise, minSamples);
    }
}
