package com.recordsearch.embeddings.service.storage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import lombok.extern.slf4j.Slf4j;

/**
 * Vector store kept in process memory. Vectors are held the way a JSON column would return them,
 * as lists of doubles.
 */
@Slf4j
@Repository
public class InMemoryVectorStore implements VectorStore {

  private final Map<String, StoredVector> vectors = new ConcurrentHashMap<>();

  @Override
  public List<StoredVector> findByDatasetField(String datasetId, String fieldName) {
    return find(v -> datasetId.equals(v.getDatasetId()) && fieldName.equals(v.getFieldName()));
  }

  @Override
  public Optional<StoredVector> findByRecordField(String recordId, String fieldName) {
    return Optional.ofNullable(vectors.get(key(recordId, fieldName)));
  }

  @Override
  public List<StoredVector> findByRecord(String recordId) {
    return find(v -> recordId.equals(v.getRecordId()));
  }

  @Override
  public StoredVector upsert(
      String recordId,
      String datasetId,
      String fieldName,
      float[] vector,
      String model,
      int dimensions) {
    List<Double> json = new ArrayList<>(vector.length);
    for (float value : vector) {
      json.add((double) value);
    }
    List<Double> embedding = Collections.unmodifiableList(json);
    Instant now = Instant.now();

    return vectors.compute(
        key(recordId, fieldName),
        (k, existing) -> {
          if (existing != null) {
            return existing.toBuilder()
                .datasetId(datasetId)
                .embedding(embedding)
                .model(model)
                .dimensions(dimensions)
                .updatedAt(now)
                .build();
          }
          return StoredVector.builder()
              .id(UUID.randomUUID().toString())
              .recordId(recordId)
              .datasetId(datasetId)
              .fieldName(fieldName)
              .embedding(embedding)
              .model(model)
              .dimensions(dimensions)
              .createdAt(now)
              .updatedAt(now)
              .build();
        });
  }

  @Override
  public int deleteByRecord(String recordId) {
    return delete(v -> recordId.equals(v.getRecordId()));
  }

  @Override
  public int deleteByDataset(String datasetId) {
    return delete(v -> datasetId.equals(v.getDatasetId()));
  }

  @Override
  public int deleteByDatasetField(String datasetId, String fieldName) {
    return delete(v -> datasetId.equals(v.getDatasetId()) && fieldName.equals(v.getFieldName()));
  }

  @Override
  public int countByDatasetField(String datasetId, String fieldName) {
    return findByDatasetField(datasetId, fieldName).size();
  }

  private List<StoredVector> find(Predicate<StoredVector> filter) {
    return vectors.values().stream().filter(filter).collect(Collectors.toList());
  }

  private int delete(Predicate<StoredVector> filter) {
    int removed = 0;
    Iterator<StoredVector> it = vectors.values().iterator();
    while (it.hasNext()) {
      if (filter.test(it.next())) {
        it.remove();
        removed++;
      }
    }
    log.debug("Deleted {} stored vectors", removed);
    return removed;
  }

  private static String key(String recordId, String fieldName) {
    return recordId + ":" + fieldName;
  }
}
