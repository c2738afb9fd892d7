package com.recordsearch.embeddings.service.vector;

/**
 * Vector arithmetic used by the similarity search. All functions are pure and tolerate malformed
 * input by returning {@code 0} instead of failing.
 */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Calculate the L2 norm of a vector.
   *
   * @param vector the vector, may be empty
   * @return the magnitude, {@code 0} for an empty or null vector
   */
  public static float magnitude(float[] vector) {
    if (vector == null) {
      return 0f;
    }
    float sum = 0f;
    for (float value : vector) {
      sum += value * value;
    }
    return (float) Math.sqrt(sum);
  }

  /**
   * Calculate cosine similarity between two raw vectors.
   *
   * @param a first vector
   * @param b second vector
   * @return similarity in [-1, 1], or {@code 0} when the vectors are empty, of different length or
   *     either has zero magnitude
   */
  public static float cosineSimilarity(float[] a, float[] b) {
    if (a == null || b == null || a.length != b.length || a.length == 0) {
      return 0f;
    }

    float dot = 0f;
    float normA = 0f;
    float normB = 0f;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }

    if (normA == 0f || normB == 0f) {
      return 0f;
    }
    return dot / ((float) Math.sqrt(normA) * (float) Math.sqrt(normB));
  }

  /**
   * Calculate cosine similarity using magnitudes computed ahead of time, so only the dot product is
   * evaluated per comparison.
   *
   * @param a first vector
   * @param magnitudeA precomputed magnitude of {@code a}
   * @param b second vector
   * @param magnitudeB precomputed magnitude of {@code b}
   * @return similarity in [-1, 1], or {@code 0} for malformed input
   */
  public static float cosineSimilarity(float[] a, float magnitudeA, float[] b, float magnitudeB) {
    if (a == null
        || b == null
        || a.length != b.length
        || a.length == 0
        || magnitudeA == 0f
        || magnitudeB == 0f) {
      return 0f;
    }

    float dot = 0f;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
    }
    return dot / (magnitudeA * magnitudeB);
  }
}
