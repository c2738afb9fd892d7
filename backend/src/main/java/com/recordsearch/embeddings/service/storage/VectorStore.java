package com.recordsearch.embeddings.service.storage;

import java.util.List;
import java.util.Optional;

/** Persistence for generated embeddings. At most one vector is kept per record and field. */
public interface VectorStore {

  /**
   * Finds every stored vector of a dataset field.
   *
   * @param datasetId canonical dataset id
   * @param fieldName field name or {@code _record}
   * @return the stored vectors, empty if none
   */
  List<StoredVector> findByDatasetField(String datasetId, String fieldName);

  /**
   * Finds the vector stored for one record field.
   *
   * @param recordId the record id
   * @param fieldName field name or {@code _record}
   * @return the stored vector if present
   */
  Optional<StoredVector> findByRecordField(String recordId, String fieldName);

  /**
   * Finds all vectors stored for a record, across fields.
   *
   * @param recordId the record id
   * @return the stored vectors, empty if none
   */
  List<StoredVector> findByRecord(String recordId);

  /**
   * Creates the vector for a record field, or updates it in place when one exists.
   *
   * @return the stored vector
   */
  StoredVector upsert(
      String recordId,
      String datasetId,
      String fieldName,
      float[] vector,
      String model,
      int dimensions);

  /** @return number of vectors deleted */
  int deleteByRecord(String recordId);

  /** @return number of vectors deleted */
  int deleteByDataset(String datasetId);

  /** @return number of vectors deleted */
  int deleteByDatasetField(String datasetId, String fieldName);

  int countByDatasetField(String datasetId, String fieldName);
}
