package com.phillippitts.lineconsensus.service.distance;

import com.phillippitts.lineconsensus.domain.LineRecord;
import com.phillippitts.lineconsensus.domain.ObservationKey;
import com.phillippitts.lineconsensus.service.text.EditDistance;
import com.phillippitts.lineconsensus.service.text.TextNormalizer;

import java.util.List;
import java.util.Objects;

/**
 * Dissimilarity of two drawn lines with transcriptions.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>same data index: 0</li>
 *   <li>same contributor, distinct observations: {@link #NEVER_CONNECT}</li>
 *   <li>otherwise: Euclidean distance between the start points, plus Euclidean distance between
 *       the end points, plus the edit distance of the normalized transcriptions</li>
 * </ol>
 *
 * <p>The same-contributor rule breaks the triangle inequality on purpose. It keeps one
 * contributor's repeated submissions from clustering with each other and must stay infinite.
 *
 * <p>Normalized texts are computed lazily and memoized per instance; an instance is bound to
 * one frame and is not thread-safe.
 */
public final class LineTextDissimilarity implements Dissimilarity {

    /** Sentinel distance the clustering collaborator treats as "never connect". */
    public static final double NEVER_CONNECT = Double.POSITIVE_INFINITY;

    private final List<LineRecord> records;
    private final String[] normalized;

    /**
     * @param records the frame's records, indexed by data index
     * @throws NullPointerException if records is null
     */
    public LineTextDissimilarity(List<LineRecord> records) {
        this.records = List.copyOf(Objects.requireNonNull(records, "records must not be null"));
        this.normalized = new String[this.records.size()];
    }

    @Override
    public double between(ObservationKey a, ObservationKey b) {
        if (a.dataIndex() == b.dataIndex()) {
            return 0.0;
        }
        if (a.userIndex() == b.userIndex()) {
            return NEVER_CONNECT;
        }
        LineRecord first = records.get(a.dataIndex());
        LineRecord second = records.get(b.dataIndex());
        double geometry = first.start().distanceTo(second.start()) + first.end().distanceTo(second.end());
        int text = EditDistance.between(normalizedText(a.dataIndex()), normalizedText(b.dataIndex()));
        return geometry + text;
    }

    private String normalizedText(int dataIndex) {
        String cached = normalized[dataIndex];
        if (cached == null) {
            cached = TextNormalizer.normalize(records.get(dataIndex).rawText());
            normalized[dataIndex] = cached;
        }
        return cached;
    }
}
