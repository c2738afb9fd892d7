package com.recordsearch.embeddings.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.dto.FindSimilarRequest;
import com.recordsearch.embeddings.dto.FindSimilarResponse;
import com.recordsearch.embeddings.dto.SimilarRecord;
import com.recordsearch.embeddings.dto.SimilarityDebug;
import com.recordsearch.embeddings.exception.ResourceNotFoundException;
import com.recordsearch.embeddings.exception.VectorDecodeException;
import com.recordsearch.embeddings.service.cache.EmbeddingCache;
import com.recordsearch.embeddings.service.provider.EmbeddingProvider;
import com.recordsearch.embeddings.service.storage.StoredVector;
import com.recordsearch.embeddings.service.storage.VectorStore;
import com.recordsearch.embeddings.service.vector.CachedVector;
import com.recordsearch.embeddings.service.vector.SimilarityEngine;
import com.recordsearch.embeddings.service.vector.VectorDecoder;
import com.recordsearch.embeddings.service.vector.VectorMath;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers "find similar" queries: resolves the query vector, loads the candidate set through the
 * embedding cache and ranks it with the {@link SimilarityEngine}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimilaritySearchService {

  private final EmbeddingTargetResolver targetResolver;
  private final VectorStore vectorStore;
  private final VectorDecoder vectorDecoder;
  private final EmbeddingCache embeddingCache;
  private final SimilarityEngine similarityEngine;
  private final ApplicationProperties properties;

  /**
   * Find the records whose embeddings are closest to the query.
   *
   * <p>The query is either free text, embedded through the configured provider, or the id of a
   * record whose stored vector is reused; text wins when both are given. The record given by id is
   * left out of its own results.
   *
   * @param request search request
   * @return ranked results with diagnostics
   */
  public FindSimilarResponse findSimilar(FindSimilarRequest request) {
    targetResolver.requireEnabled();
    EmbeddingTarget target =
        targetResolver.resolve(
            request.getDatasetId(), request.getMode(), request.getFieldName(), false);

    boolean hasText = request.getText() != null && !request.getText().isBlank();
    boolean hasRecordId = request.getRecordId() != null && !request.getRecordId().isBlank();
    if (!hasText && !hasRecordId) {
      throw new IllegalArgumentException("either text or recordId must be provided");
    }
    EmbeddingProvider provider = hasText ? targetResolver.requireProvider() : null;
    int limit = effectiveLimit(request.getLimit());

    float[] queryVector =
        hasText
            ? provider.embedQuery(request.getText())
            : loadRecordVector(request.getRecordId(), target.getFieldName());

    SimilarityDebug debug =
        SimilarityDebug.builder()
            .datasetId(target.getDatasetId())
            .fieldName(target.getFieldName())
            .queryEmbeddingLen(queryVector.length)
            .build();

    List<CachedVector> candidates = loadCandidates(target, debug);

    String excludeId = hasRecordId ? request.getRecordId() : null;
    List<SimilarRecord> ranked =
        similarityEngine.rank(
            queryVector, VectorMath.magnitude(queryVector), candidates, excludeId);
    debug.setProcessedCount(ranked.size());

    List<SimilarRecord> results = SimilarityEngine.selectTop(ranked, limit);
    debug.setCacheStats(embeddingCache.info());

    log.info(
        "Similarity search on {}:{} ranked {} candidates (cacheHit={}), returning {}",
        target.getDatasetId(),
        target.getFieldName(),
        ranked.size(),
        debug.isCacheHit(),
        results.size());

    return FindSimilarResponse.builder().results(results).debug(debug).build();
  }

  private float[] loadRecordVector(String recordId, String fieldName) {
    StoredVector stored =
        vectorStore
            .findByRecordField(recordId, fieldName)
            .orElseThrow(
                () -> new ResourceNotFoundException("no embedding found for record " + recordId));
    try {
      return vectorDecoder.decode(stored.getEmbedding());
    } catch (VectorDecodeException e) {
      throw new VectorDecodeException(
          "failed to parse existing embedding for record " + recordId + ": " + e.getMessage(), e);
    }
  }

  private List<CachedVector> loadCandidates(EmbeddingTarget target, SimilarityDebug debug) {
    Optional<List<CachedVector>> cached =
        embeddingCache.get(target.getDatasetId(), target.getFieldName());
    if (cached.isPresent()) {
      debug.setCacheHit(true);
      debug.setStoredEmbeddings(cached.get().size());
      return cached.get();
    }

    long generation = embeddingCache.generation(target.getDatasetId(), target.getFieldName());
    List<StoredVector> stored =
        vectorStore.findByDatasetField(target.getDatasetId(), target.getFieldName());
    debug.setStoredEmbeddings(stored.size());

    List<CachedVector> candidates = new ArrayList<>(stored.size());
    for (StoredVector vector : stored) {
      try {
        candidates.add(
            CachedVector.of(vector.getRecordId(), vectorDecoder.decode(vector.getEmbedding())));
      } catch (VectorDecodeException e) {
        debug.recordError(String.format("record %s: %s", vector.getRecordId(), e.getMessage()));
      }
    }
    if (debug.getErrorCount() > 0) {
      log.warn(
          "Skipped {} undecodable embeddings in {}:{}",
          debug.getErrorCount(),
          target.getDatasetId(),
          target.getFieldName());
    }

    if (!embeddingCache.set(
        target.getDatasetId(), target.getFieldName(), candidates, generation)) {
      debug.setCacheSkipped(true);
    }
    return candidates;
  }

  private int effectiveLimit(Integer requested) {
    ApplicationProperties.Search search = properties.getSearch();
    if (requested == null || requested <= 0) {
      return search.getDefaultLimit();
    }
    return Math.min(requested, search.getMaxLimit());
  }
}
