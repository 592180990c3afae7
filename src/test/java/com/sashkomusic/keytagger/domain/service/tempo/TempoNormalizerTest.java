package com.sashkomusic.keytagger.domain.service.tempo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class TempoNormalizerTest {

    private final TempoNormalizer normalizer = new TempoNormalizer();

    @ParameterizedTest
    @CsvSource({
            "65.4, 130",
            "220.0, 110",
            "140.9, 140",
            "69.99, 138",
            "70.0, 70",
            "200.9, 200",
            "201.0, 100",
            "203.0, 101"
    })
    void truncatesThenCorrectsOctave(double raw, int expected) {
        assertThat(normalizer.normalize(raw)).hasValue(expected);
    }

    @Test
    void appliesAtMostOneCorrection() {
        assertThat(normalizer.normalize(30.0)).hasValue(60);
        assertThat(normalizer.normalize(500.0)).hasValue(250);
    }

    @Test
    void rejectsUnusableEstimates() {
        assertThat(normalizer.normalize(Double.NaN)).isEmpty();
        assertThat(normalizer.normalize(Double.POSITIVE_INFINITY)).isEmpty();
        assertThat(normalizer.normalize(0.7)).isEmpty();
        assertThat(normalizer.normalize(-90.0)).isEmpty();
    }
}
