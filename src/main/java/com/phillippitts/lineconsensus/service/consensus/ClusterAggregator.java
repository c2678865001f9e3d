package com.phillippitts.lineconsensus.service.consensus;

import com.phillippitts.lineconsensus.domain.ConsensusRecord;
import com.phillippitts.lineconsensus.domain.LineRecord;
import com.phillippitts.lineconsensus.domain.ObservationKey;

import java.util.List;

/**
 * Builds one consensus record from the members of a multi-member cluster.
 *
 * <p>Members are guaranteed to come from distinct contributors. Implementations should be
 * stateless and thread-safe; a custom bean of this type replaces the default
 * {@link com.phillippitts.lineconsensus.service.consensus.impl.PositionalClusterAggregator}.
 */
@FunctionalInterface
public interface ClusterAggregator {

    /**
     * @param members cluster members in input order
     * @param records the frame's records, indexed by data index
     * @return consensus record for the cluster
     */
    ConsensusRecord aggregate(List<ObservationKey> members, List<LineRecord> records);
}
