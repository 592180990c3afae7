package com.sashkomusic.keytagger.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureVectorTest {

    @Test
    void normalizesToUnitLength() {
        FeatureVector vector = FeatureVector.normalized(3, 4, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

        assertThat(vector.get(0)).isCloseTo(0.6, within(1e-12));
        assertThat(vector.get(1)).isCloseTo(0.8, within(1e-12));
        assertThat(vector.dot(vector)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void rotateMovesIndexZeroForward() {
        FeatureVector vector = FeatureVector.normalized(1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

        assertThat(vector.rotate(9).get(9)).isEqualTo(1.0);
        assertThat(vector.rotate(9).get(0)).isEqualTo(0.0);
        assertThat(vector.rotate(12)).isEqualTo(vector);
    }

    @Test
    void rejectsWrongDimension() {
        assertThatThrownBy(() -> FeatureVector.normalized(1, 2, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsSilentVector() {
        assertThatThrownBy(() -> FeatureVector.normalized(new double[12]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no energy");
    }

    @Test
    void rejectsNegativeEnergy() {
        assertThatThrownBy(() -> FeatureVector.normalized(1, -1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
