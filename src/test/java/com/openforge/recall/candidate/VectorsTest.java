package com.openforge.recall.candidate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VectorsTest {

    @Test
    void cosineOfParallelAndOrthogonalVectors() {
        assertThat(Vectors.cosine(new float[]{1, 0}, new float[]{2, 0})).isCloseTo(1.0, within(1e-9));
        assertThat(Vectors.cosine(new float[]{1, 0}, new float[]{0, 3})).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void cosineIsZeroForMissingOrZeroVectors() {
        assertThat(Vectors.cosine(null, new float[]{1, 0})).isZero();
        assertThat(Vectors.cosine(new float[]{0, 0}, new float[]{1, 0})).isZero();
    }

    @Test
    void dimensionMismatchFailsLoudly() {
        assertThatThrownBy(() -> Vectors.cosine(new float[]{1, 0}, new float[]{1, 0, 0}))
                .isInstanceOf(VectorDimensionMismatchException.class);
    }

    @Test
    void meanCosineSkipsMissingVectors() {
        double mean = Vectors.meanCosine(new float[]{1, 0},
                java.util.Arrays.asList(new float[]{1, 0}, null, new float[]{0, 1}));
        assertThat(mean).isCloseTo(0.5, within(1e-9));
        assertThat(Vectors.meanCosine(new float[]{1, 0}, List.of())).isZero();
    }

    @Test
    void toArrayRejectsUnusableComponents() {
        assertThat(Vectors.toArray(List.of(0.5, 1))).containsExactly(0.5f, 1f);
        assertThat(Vectors.toArray(List.of(Double.NaN, 0.0))).isNull();
        assertThat(Vectors.toArray(List.of(1.0, Double.NEGATIVE_INFINITY))).isNull();
        assertThat(Vectors.toArray(java.util.Arrays.asList(1.0, null))).isNull();
        assertThat(Vectors.toArray(List.of("x"))).isNull();
        assertThat(Vectors.toArray(List.of())).isNull();
    }
}
