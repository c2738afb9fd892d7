package com.recordsearch.embeddings.service.storage;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A persisted embedding for one record field. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StoredVector {

  private String id;

  private String recordId;

  private String datasetId;

  /** Field name, or {@code _record} for whole-record embeddings. */
  private String fieldName;

  /**
   * The vector as the store returns it: a typed array, a JSON string or a list of numbers. Use
   * {@link com.recordsearch.embeddings.service.vector.VectorDecoder} to read it.
   */
  private Object embedding;

  private String model;

  private int dimensions;

  private Instant createdAt;

  private Instant updatedAt;
}
