package com.phillippitts.lineconsensus.service.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EditDistanceTest {

    @Test
    void identicalStringsHaveZeroDistance() {
        assertThat(EditDistance.between("the cat", "the cat")).isZero();
    }

    @Test
    void emptyAgainstNonEmptyIsLength() {
        assertThat(EditDistance.between("", "abc")).isEqualTo(3);
        assertThat(EditDistance.between("abcd", "")).isEqualTo(4);
    }

    @Test
    void classicKittenSitting() {
        assertThat(EditDistance.between("kitten", "sitting")).isEqualTo(3);
    }

    @Test
    void singleSubstitution() {
        assertThat(EditDistance.between("the cat sat", "the cat sot")).isEqualTo(1);
    }

    @Test
    void isSymmetric() {
        assertThat(EditDistance.between("flaw", "lawn"))
                .isEqualTo(EditDistance.between("lawn", "flaw"))
                .isEqualTo(2);
    }

    @Test
    void countsCodePointsNotUtf16Units() {
        // U+1D49C is outside the BMP
        assertThat(EditDistance.between("a𝒜b", "ab")).isEqualTo(1);
    }
}
