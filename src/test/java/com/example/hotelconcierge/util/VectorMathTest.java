package com.example.hotelconcierge.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class VectorMathTest {

    @Test
    void cosineReturnsExpectedSimilarity() {
        // Colinear vectors should produce a similarity close to 1.0.
        double similarity = VectorMath.cosine(new double[] {1, 0}, new double[] {0.5, 0});

        assertThat(similarity).isCloseTo(1.0, within(0.0001));
    }

    @Test
    void cosineOfOrthogonalAndOppositeVectors() {
        assertThat(VectorMath.cosine(new double[] {1, 0}, new double[] {0, 1})).isCloseTo(0.0, within(0.0001));
        assertThat(VectorMath.cosine(new double[] {1, 1}, new double[] {-1, -1})).isCloseTo(-1.0, within(0.0001));
    }

    @Test
    void cosineReturnsZeroOnInvalidInput() {
        assertThat(VectorMath.cosine(new double[] {}, new double[] {})).isZero();
        assertThat(VectorMath.cosine(null, new double[] {1})).isZero();
        assertThat(VectorMath.cosine(new double[] {1, 2}, new double[] {1, 2, 3})).isZero();
        assertThat(VectorMath.cosine(new double[] {0, 0}, new double[] {1, 2})).isZero();
    }

    @Test
    void cosineIsSymmetric() {
        double[] a = {0.3, -1.2, 4.5, 0.01};
        double[] b = {2.2, 0.7, -0.4, 3.3};

        assertThat(VectorMath.cosine(a, b)).isEqualTo(VectorMath.cosine(b, a));
        assertThat(VectorMath.cosine(a, b)).isBetween(-1.0, 1.0);
    }
}
