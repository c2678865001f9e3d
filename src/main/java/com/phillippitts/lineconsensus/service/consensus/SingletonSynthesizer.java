package com.phillippitts.lineconsensus.service.consensus;

import com.phillippitts.lineconsensus.domain.ConsensusRecord;
import com.phillippitts.lineconsensus.domain.LineRecord;
import com.phillippitts.lineconsensus.domain.ObservationKey;
import com.phillippitts.lineconsensus.service.text.WordTokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns observations that belong to no cluster into standalone consensus records, so every
 * submitted line is represented in the output.
 *
 * <p>Each record keeps the observation's endpoints as they were drawn, lists every raw word as a
 * single-candidate column, and reports one view with a consensus score of 1.0.
 */
public class SingletonSynthesizer {

    public static final double SINGLETON_SCORE = 1.0;

    /**
     * @param observations observations to represent, in output order
     * @param records      the frame's records, indexed by data index
     * @return one consensus record per observation
     * @throws com.phillippitts.lineconsensus.exception.MalformedRecordException if a record lacks a field
     */
    public List<ConsensusRecord> synthesize(List<ObservationKey> observations, List<LineRecord> records) {
        List<ConsensusRecord> out = new ArrayList<>(observations.size());
        for (ObservationKey key : observations) {
            out.add(synthesize(records.get(key.dataIndex())));
        }
        return out;
    }

    ConsensusRecord synthesize(LineRecord line) {
        LineRecord.Point start = line.start();
        LineRecord.Point end = line.end();
        List<List<String>> columns = new ArrayList<>();
        for (String word : WordTokenizer.words(line.rawText())) {
            columns.add(List.of(word));
        }
        return new ConsensusRecord(
                line.x(),
                line.y(),
                columns,
                1,
                LineGeometry.slopeDegrees(start, end),
                SINGLETON_SCORE
        );
    }
}
