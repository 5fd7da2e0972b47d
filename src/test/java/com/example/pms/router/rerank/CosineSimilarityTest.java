package com.example.pms.router.rerank;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CosineSimilarityTest {

  @Test
  void identicalAndOppositeVectors() {
    float[] v = {1f, 2f, 3f};
    float[] opposite = {-1f, -2f, -3f};

    assertThat(CosineSimilarity.of(v, v)).isCloseTo(1.0, within(1e-9));
    assertThat(CosineSimilarity.of(v, opposite)).isCloseTo(-1.0, within(1e-9));
    assertThat(CosineSimilarity.clamped(v, opposite)).isZero();
  }

  @Test
  void orthogonalVectors() {
    assertThat(CosineSimilarity.of(new float[]{1f, 0f}, new float[]{0f, 5f})).isZero();
  }

  @Test
  void missingOrMismatchedVectorsScoreZero() {
    float[] v = {1f, 1f};
    assertThat(CosineSimilarity.of(null, v)).isZero();
    assertThat(CosineSimilarity.of(v, new float[0])).isZero();
    assertThat(CosineSimilarity.of(v, new float[]{1f, 1f, 1f})).isZero();
    assertThat(CosineSimilarity.of(v, new float[]{0f, 0f})).isZero();
  }
}
