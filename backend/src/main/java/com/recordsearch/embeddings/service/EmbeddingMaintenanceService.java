package com.recordsearch.embeddings.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.recordsearch.embeddings.dto.EmbeddableField;
import com.recordsearch.embeddings.dto.EmbeddingMode;
import com.recordsearch.embeddings.dto.EmbeddingStats;
import com.recordsearch.embeddings.exception.ResourceNotFoundException;
import com.recordsearch.embeddings.service.cache.EmbeddingCache;
import com.recordsearch.embeddings.service.storage.Dataset;
import com.recordsearch.embeddings.service.storage.DatasetField;
import com.recordsearch.embeddings.service.storage.DatasetRecord;
import com.recordsearch.embeddings.service.storage.DatasetRepository;
import com.recordsearch.embeddings.service.storage.StoredVector;
import com.recordsearch.embeddings.service.storage.VectorStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Deletes stored embeddings and reports embedding coverage of datasets. */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingMaintenanceService {

  private final EmbeddingTargetResolver targetResolver;
  private final DatasetRepository datasetRepository;
  private final VectorStore vectorStore;
  private final EmbeddingCache embeddingCache;

  /**
   * Delete every embedding of a record, typically after the record itself was deleted.
   *
   * @param recordId the record id
   * @return number of embeddings removed
   */
  public int deleteForRecord(String recordId) {
    Map<String, StoredVector> affected = new LinkedHashMap<>();
    for (StoredVector vector : vectorStore.findByRecord(recordId)) {
      affected.putIfAbsent(
          EmbeddingCache.cacheKey(vector.getDatasetId(), vector.getFieldName()), vector);
    }

    int deleted = vectorStore.deleteByRecord(recordId);
    affected
        .values()
        .forEach(v -> embeddingCache.invalidate(v.getDatasetId(), v.getFieldName()));
    log.info(
        "Deleted {} embeddings of record {} ({} cache entries invalidated)",
        deleted,
        recordId,
        affected.size());
    return deleted;
  }

  /**
   * Delete every embedding of a dataset.
   *
   * @param datasetNameOrId dataset name or id
   * @return number of embeddings removed
   */
  public int deleteForDataset(String datasetNameOrId) {
    Dataset dataset = targetResolver.requireDataset(datasetNameOrId);
    int deleted = vectorStore.deleteByDataset(dataset.getId());
    embeddingCache.invalidateDataset(dataset.getId());
    log.info("Deleted {} embeddings of dataset {}", deleted, dataset.getId());
    return deleted;
  }

  /**
   * Delete the embeddings of one dataset field, e.g. when the field stops being embeddable.
   *
   * @param datasetNameOrId dataset name or id
   * @param fieldName field name or {@code _record}
   * @return number of embeddings removed
   */
  public int deleteForField(String datasetNameOrId, String fieldName) {
    Dataset dataset = targetResolver.requireDataset(datasetNameOrId);
    int deleted = vectorStore.deleteByDatasetField(dataset.getId(), fieldName);
    embeddingCache.invalidate(dataset.getId(), fieldName);
    log.info("Deleted {} embeddings of {}:{}", deleted, dataset.getId(), fieldName);
    return deleted;
  }

  public EmbeddingStats stats(String datasetNameOrId, String fieldName) {
    Dataset dataset = requireFieldOf(datasetNameOrId, fieldName);
    List<DatasetRecord> records = datasetRepository.findRecords(dataset.getId());
    Set<String> embedded = embeddedRecordIds(dataset.getId(), fieldName);

    int embeddedCount = (int) records.stream().filter(r -> embedded.contains(r.getId())).count();
    return EmbeddingStats.builder()
        .totalRecords(records.size())
        .embeddedRecords(embeddedCount)
        .notEmbeddedRecords(records.size() - embeddedCount)
        .build();
  }

  /**
   * Ids of the records that have no embedding for a field yet.
   *
   * @return record ids in ascending order
   */
  public List<String> pendingRecordIds(String datasetNameOrId, String fieldName) {
    Dataset dataset = requireFieldOf(datasetNameOrId, fieldName);
    Set<String> embedded = embeddedRecordIds(dataset.getId(), fieldName);
    return datasetRepository.findRecords(dataset.getId()).stream()
        .map(DatasetRecord::getId)
        .filter(id -> !embedded.contains(id))
        .sorted()
        .collect(Collectors.toList());
  }

  public List<EmbeddableField> embeddableFields(String datasetNameOrId) {
    Dataset dataset = targetResolver.requireDataset(datasetNameOrId);
    return dataset.getFields().stream()
        .filter(DatasetField::canEmbed)
        .map(field -> new EmbeddableField(field.getName(), field.getType().getValue()))
        .collect(Collectors.toList());
  }

  private Dataset requireFieldOf(String datasetNameOrId, String fieldName) {
    if (fieldName == null || fieldName.isBlank()) {
      throw new IllegalArgumentException("fieldName is required");
    }
    Dataset dataset = targetResolver.requireDataset(datasetNameOrId);
    if (!EmbeddingMode.RECORD_FIELD_NAME.equals(fieldName)
        && dataset.findField(fieldName).isEmpty()) {
      throw new ResourceNotFoundException(
          String.format("field '%s' not found in dataset", fieldName));
    }
    return dataset;
  }

  private Set<String> embeddedRecordIds(String datasetId, String fieldName) {
    return vectorStore.findByDatasetField(datasetId, fieldName).stream()
        .map(StoredVector::getRecordId)
        .collect(Collectors.toSet());
  }
}
