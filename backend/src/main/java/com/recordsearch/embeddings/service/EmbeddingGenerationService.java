package com.recordsearch.embeddings.service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.google.common.collect.Lists;
import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.dto.EmbeddingMode;
import com.recordsearch.embeddings.dto.GenerateEmbeddingsRequest;
import com.recordsearch.embeddings.dto.GenerateEmbeddingsResponse;
import com.recordsearch.embeddings.exception.EmbeddingProviderException;
import com.recordsearch.embeddings.service.cache.EmbeddingCache;
import com.recordsearch.embeddings.service.provider.EmbeddingProvider;
import com.recordsearch.embeddings.service.storage.DatasetRecord;
import com.recordsearch.embeddings.service.storage.DatasetRepository;
import com.recordsearch.embeddings.service.storage.VectorStore;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates embeddings for the records of a dataset and stores them.
 *
 * <p>Texts are sent to the provider in batches. A failed batch or a failed store is reported in
 * the response and does not stop the remaining work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingGenerationService {

  private final EmbeddingTargetResolver targetResolver;
  private final DatasetRepository datasetRepository;
  private final VectorStore vectorStore;
  private final EmbeddingCache embeddingCache;
  private final RecordTextBuilder textBuilder;
  private final ApplicationProperties properties;

  /**
   * Generate and store embeddings.
   *
   * @param request dataset, mode, field and optional record selection
   * @return counts of generated and skipped records with capped error messages
   */
  public GenerateEmbeddingsResponse generate(GenerateEmbeddingsRequest request) {
    targetResolver.requireEnabled();
    EmbeddingTarget target =
        targetResolver.resolve(
            request.getDatasetId(), request.getMode(), request.getFieldName(), true);
    EmbeddingProvider provider = targetResolver.requireProvider();

    List<DatasetRecord> records = selectRecords(target.getDatasetId(), request.getRecordIds());
    GenerateEmbeddingsResponse response = GenerateEmbeddingsResponse.builder().build();
    if (records.isEmpty()) {
      return response;
    }

    List<PendingText> pending = new ArrayList<>();
    for (DatasetRecord record : records) {
      String text = textFor(record, target, request.getTemplate());
      if (text.isEmpty()) {
        response.setSkipped(response.getSkipped() + 1);
      } else {
        pending.add(new PendingText(record.getId(), text));
      }
    }

    int batchSize = properties.getGeneration().getMaxTextsPerBatch();
    for (List<PendingText> batch : Lists.partition(pending, batchSize)) {
      processBatch(provider, target, batch, response);
    }

    capErrors(response, properties.getGeneration().getMaxReportedErrors());

    log.info(
        "Generated {} embeddings for {}:{} with {} ({} skipped, {} errors)",
        response.getGenerated(),
        target.getDatasetId(),
        target.getFieldName(),
        provider.getName(),
        response.getSkipped(),
        response.getErrors().size());
    return response;
  }

  private void processBatch(
      EmbeddingProvider provider,
      EmbeddingTarget target,
      List<PendingText> batch,
      GenerateEmbeddingsResponse response) {
    List<float[]> vectors;
    try {
      vectors = provider.embed(batch.stream().map(PendingText::getText).collect(Collectors.toList()));
    } catch (EmbeddingProviderException e) {
      log.warn("Embedding batch of {} texts failed: {}", batch.size(), e.getMessage());
      response.getErrors().add("batch error: " + e.getMessage());
      response.setSkipped(response.getSkipped() + batch.size());
      return;
    }

    for (int i = 0; i < batch.size(); i++) {
      PendingText item = batch.get(i);
      if (i >= vectors.size()) {
        response.getErrors().add(String.format("record %s: no embedding returned", item.getRecordId()));
        response.setSkipped(response.getSkipped() + 1);
        continue;
      }
      float[] vector = vectors.get(i);
      try {
        vectorStore.upsert(
            item.getRecordId(),
            target.getDatasetId(),
            target.getFieldName(),
            vector,
            provider.getModelId(),
            vector.length);
        embeddingCache.invalidate(target.getDatasetId(), target.getFieldName());
        response.setGenerated(response.getGenerated() + 1);
      } catch (RuntimeException e) {
        log.warn("Failed to store embedding for record {}: {}", item.getRecordId(), e.getMessage());
        response.getErrors().add(String.format("record %s: %s", item.getRecordId(), e.getMessage()));
        response.setSkipped(response.getSkipped() + 1);
      }
    }
  }

  private List<DatasetRecord> selectRecords(String datasetId, List<String> recordIds) {
    if (recordIds == null || recordIds.isEmpty()) {
      return datasetRepository.findRecords(datasetId);
    }
    List<DatasetRecord> records = new ArrayList<>();
    for (String recordId : recordIds) {
      datasetRepository.findRecord(datasetId, recordId).ifPresent(records::add);
    }
    return records;
  }

  private String textFor(DatasetRecord record, EmbeddingTarget target, String template) {
    if (target.getMode() == EmbeddingMode.RECORD) {
      return textBuilder.recordText(record, target.getDataset(), template);
    }
    return textBuilder.fieldText(record, target.getField());
  }

  static void capErrors(GenerateEmbeddingsResponse response, int maxErrors) {
    List<String> errors = response.getErrors();
    if (errors.size() <= maxErrors) {
      return;
    }
    int hidden = errors.size() - maxErrors;
    List<String> capped = new ArrayList<>(errors.subList(0, maxErrors));
    capped.add(String.format("... and %d more errors", hidden));
    response.setErrors(capped);
  }

  @Value
  private static class PendingText {
    String recordId;
    String text;
  }
}
