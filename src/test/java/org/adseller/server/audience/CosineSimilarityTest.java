package org.adseller.server.audience;

import org.adseller.server.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class CosineSimilarityTest {

    @Test
    public void similarityShouldReturnOneForParallelVectors() {
        assertThat(CosineSimilarity.similarity(new float[]{1F, 2F, 3F}, new float[]{2F, 4F, 6F}))
                .isCloseTo(1.0d, within(1e-9));
    }

    @Test
    public void similarityShouldReturnZeroForOrthogonalVectors() {
        assertThat(CosineSimilarity.similarity(new float[]{1F, 0F}, new float[]{0F, 1F})).isZero();
    }

    @Test
    public void similarityShouldClampOppositeVectorsToZero() {
        assertThat(CosineSimilarity.similarity(new float[]{1F, 1F}, new float[]{-1F, -1F})).isZero();
    }

    @Test
    public void similarityShouldReturnZeroForZeroNormVector() {
        assertThat(CosineSimilarity.similarity(new float[]{0F, 0F}, new float[]{1F, 1F})).isZero();
    }

    @Test
    public void similarityShouldReturnZeroForNonFiniteValues() {
        assertThat(CosineSimilarity.similarity(new float[]{Float.NaN, 1F}, new float[]{1F, 1F})).isZero();
        assertThat(CosineSimilarity.similarity(new float[]{Float.POSITIVE_INFINITY, 1F}, new float[]{1F, 1F}))
                .isZero();
    }

    @Test
    public void similarityShouldReturnCosineOfAngle() {
        assertThat(CosineSimilarity.similarity(new float[]{1F, 0F}, new float[]{1F, 1F}))
                .isCloseTo(Math.sqrt(0.5d), within(1e-6));
    }

    @Test
    public void similarityShouldFailOnDifferentLengths() {
        assertThatThrownBy(() -> CosineSimilarity.similarity(new float[3], new float[4]))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessage("Embedding dimension mismatch: buyer 3 vs seller 4");
    }
}
