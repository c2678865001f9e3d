package com.phillippitts.lineconsensus.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consensus lines of one subject, per frame.
 *
 * @param subjectId subject the lines belong to
 * @param frames    frame key to consensus records, in first-seen frame order
 */
public record SubjectReduction(String subjectId, Map<String, List<ConsensusRecord>> frames) {

    public SubjectReduction {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        frames = frames == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(frames));
    }

    /**
     * Total number of consensus lines over all frames.
     */
    public int consensusCount() {
        return frames.values().stream().mapToInt(List::size).sum();
    }
}
