package com.recordsearch.embeddings.service.vector;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A decoded embedding ready for ranking, with its magnitude computed once at load time.
 *
 * <p>{@link #of} copies the caller's array, so later changes to it do not reach the cache. {@link
 * #getVector()} returns the internal array without copying because ranking reads it for every
 * candidate; callers must treat it as read-only.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CachedVector {

  String recordId;

  float[] vector;

  float magnitude;

  public static CachedVector of(String recordId, float[] vector) {
    float[] copy = vector == null ? null : vector.clone();
    return new CachedVector(recordId, copy, VectorMath.magnitude(copy));
  }

  public int dimensions() {
    return vector == null ? 0 : vector.length;
  }
}
