package com.phillippitts.lineconsensus.service.distance;

import com.phillippitts.lineconsensus.domain.LineRecord;
import com.phillippitts.lineconsensus.domain.ObservationKey;
import com.phillippitts.lineconsensus.exception.MalformedRecordException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LineTextDissimilarityTest {

    private final List<LineRecord> records = List.of(
            LineRecord.of(0, 0, 100, 0, "the cat sat"),
            LineRecord.of(3, 4, 100, 10, "the cat sot"),
            LineRecord.of(0, 0, 100, 0, "the [del]cat[/del] sat"),
            LineRecord.of(50, 50, 150, 50, "the cat sat")
    );

    private final Dissimilarity dissimilarity = new LineTextDissimilarity(records);

    @Test
    void sameObservationIsZero() {
        ObservationKey a = new ObservationKey(0, 0);
        assertThat(dissimilarity.between(a, a)).isZero();
    }

    @Test
    void sameObservationIsZeroEvenWhenUserIndicesDiffer() {
        assertThat(dissimilarity.between(new ObservationKey(1, 0), new ObservationKey(1, 5))).isZero();
    }

    @Test
    void sameUserNeverConnects() {
        double d = dissimilarity.between(new ObservationKey(0, 2), new ObservationKey(1, 2));
        assertThat(d).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void sumsEndpointDistancesAndEditDistance() {
        // start: hypot(3, 4) = 5, end: 10, text: 1 substitution
        double d = dissimilarity.between(new ObservationKey(0, 0), new ObservationKey(1, 1));
        assertThat(d).isCloseTo(16.0, within(1e-9));
    }

    @Test
    void comparesNormalizedText() {
        double d = dissimilarity.between(new ObservationKey(0, 0), new ObservationKey(2, 1));
        assertThat(d).isZero();
    }

    @Test
    void isSymmetric() {
        ObservationKey a = new ObservationKey(1, 0);
        ObservationKey b = new ObservationKey(3, 1);
        assertThat(dissimilarity.between(a, b)).isEqualTo(dissimilarity.between(b, a));
    }

    @Test
    void missingTextFailsWhenRead() {
        List<LineRecord> bad = List.of(
                LineRecord.of(0, 0, 1, 1, "ok"),
                new LineRecord(List.of(0.0, 1.0), List.of(0.0, 1.0), null));
        Dissimilarity d = new LineTextDissimilarity(bad);

        assertThatThrownBy(() -> d.between(new ObservationKey(0, 0), new ObservationKey(1, 1)))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("text");
    }
}
