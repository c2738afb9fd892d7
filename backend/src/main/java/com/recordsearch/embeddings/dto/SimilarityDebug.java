package com.recordsearch.embeddings.dto;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.recordsearch.embeddings.service.cache.CacheInfo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Diagnostic counters returned alongside similarity results. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SimilarityDebug {

  /** Number of decode error messages kept as samples. */
  public static final int MAX_SAMPLED_ERRORS = 3;

  private String datasetId;
  private String fieldName;
  private int queryEmbeddingLen;
  private int storedEmbeddings;
  private int processedCount;
  private int errorCount;
  private boolean cacheHit;
  private boolean cacheSkipped;
  private CacheInfo cacheStats;

  @Builder.Default private List<String> errors = new ArrayList<>();

  public void recordError(String message) {
    errorCount++;
    if (errors.size() < MAX_SAMPLED_ERRORS) {
      errors.add(message);
    }
  }
}
