package com.phillippitts.lineconsensus.service.consensus.impl;

import com.phillippitts.lineconsensus.domain.ConsensusRecord;
import com.phillippitts.lineconsensus.domain.LineRecord;
import com.phillippitts.lineconsensus.domain.ObservationKey;
import com.phillippitts.lineconsensus.service.consensus.ClusterAggregator;
import com.phillippitts.lineconsensus.service.consensus.LineGeometry;
import com.phillippitts.lineconsensus.service.text.WordTokenizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates a cluster by averaging endpoints and stacking words by position.
 *
 * <p>Column {@code i} of {@code clusters_text} holds the {@code i}-th raw word of every member
 * that has one, in member order. Words are not aligned, so an insertion early in one
 * transcription shifts all of its later words into neighbouring columns.
 *
 * <p>The consensus score is the mean, over columns, of how many members agree on the most
 * common word of that column.
 */
public final class PositionalClusterAggregator implements ClusterAggregator {

    @Override
    public ConsensusRecord aggregate(List<ObservationKey> members, List<LineRecord> records) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("cluster must have at least one member");
        }
        double sx = 0;
        double sy = 0;
        double ex = 0;
        double ey = 0;
        List<List<String>> columns = new ArrayList<>();
        for (ObservationKey key : members) {
            LineRecord line = records.get(key.dataIndex());
            LineRecord.Point start = line.start();
            LineRecord.Point end = line.end();
            sx += start.x();
            sy += start.y();
            ex += end.x();
            ey += end.y();
            List<String> words = WordTokenizer.words(line.rawText());
            for (int i = 0; i < words.size(); i++) {
                if (columns.size() <= i) {
                    columns.add(new ArrayList<>());
                }
                columns.get(i).add(words.get(i));
            }
        }
        int n = members.size();
        LineRecord.Point meanStart = new LineRecord.Point(sx / n, sy / n);
        LineRecord.Point meanEnd = new LineRecord.Point(ex / n, ey / n);
        return new ConsensusRecord(
                List.of(meanStart.x(), meanEnd.x()),
                List.of(meanStart.y(), meanEnd.y()),
                columns,
                n,
                LineGeometry.slopeDegrees(meanStart, meanEnd),
                score(columns)
        );
    }

    static double score(List<List<String>> columns) {
        if (columns.isEmpty()) {
            return 0.0;
        }
        double total = 0;
        for (List<String> column : columns) {
            Map<String, Integer> counts = new HashMap<>();
            int best = 0;
            for (String word : column) {
                best = Math.max(best, counts.merge(word, 1, Integer::sum));
            }
            total += best;
        }
        return total / columns.size();
    }
}
