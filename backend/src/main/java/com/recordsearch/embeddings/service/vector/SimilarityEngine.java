package com.recordsearch.embeddings.service.vector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import com.google.common.collect.Lists;
import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.dto.SimilarRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Ranks a candidate set against a query vector by cosine similarity. The candidates are split into
 * contiguous chunks, one per worker, and each chunk is scored on the shared ranking executor.
 */
@Slf4j
@Service
public class SimilarityEngine {

  /** Number of results returned when no positive limit is requested. */
  public static final int DEFAULT_LIMIT = 10;

  private static final Comparator<SimilarRecord> BY_SIMILARITY_DESC =
      Comparator.comparingDouble(SimilarRecord::getSimilarity)
          .reversed()
          .thenComparing(
              SimilarRecord::getRecordId, Comparator.nullsLast(Comparator.naturalOrder()));

  private final AsyncTaskExecutor executor;
  private final int parallelism;

  public SimilarityEngine(
      @Qualifier("similarityExecutor") AsyncTaskExecutor executor,
      ApplicationProperties properties) {
    this.executor = executor;
    this.parallelism = properties.getSimilarity().resolveParallelism();
  }

  /**
   * Score every candidate against the query using the configured parallelism.
   *
   * @param query query vector
   * @param queryMagnitude precomputed magnitude of the query
   * @param candidates vectors to score
   * @param excludeId record to leave out of the results, typically the query's own record; may be
   *     null
   * @return one result per scored candidate, in no particular order
   */
  public List<SimilarRecord> rank(
      float[] query, float queryMagnitude, List<CachedVector> candidates, String excludeId) {
    return rank(query, queryMagnitude, candidates, excludeId, parallelism);
  }

  public List<SimilarRecord> rank(
      float[] query,
      float queryMagnitude,
      List<CachedVector> candidates,
      String excludeId,
      int workers) {
    if (candidates == null || candidates.isEmpty()) {
      return new ArrayList<>();
    }

    int numWorkers = Math.max(1, Math.min(workers, candidates.size()));
    int chunkSize = (candidates.size() + numWorkers - 1) / numWorkers;
    List<List<CachedVector>> chunks = Lists.partition(candidates, chunkSize);

    if (chunks.size() == 1) {
      return scoreChunk(query, queryMagnitude, chunks.get(0), excludeId);
    }

    List<Future<List<SimilarRecord>>> futures = new ArrayList<>(chunks.size());
    try {
      for (List<CachedVector> chunk : chunks) {
        futures.add(submitChunk(query, queryMagnitude, chunk, excludeId));
      }
    } catch (RuntimeException e) {
      futures.forEach(f -> f.cancel(true));
      throw e;
    }

    List<SimilarRecord> merged = new ArrayList<>(candidates.size());
    try {
      for (Future<List<SimilarRecord>> future : futures) {
        merged.addAll(future.get());
      }
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Similarity ranking was interrupted", e);
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      throw new IllegalStateException("Similarity ranking worker failed", e.getCause());
    }

    log.debug(
        "Ranked {} candidates with {} workers, {} results",
        candidates.size(),
        chunks.size(),
        merged.size());
    return merged;
  }

  /**
   * Sort results by descending similarity, breaking ties by record id, and keep the first {@code
   * limit}.
   *
   * @param results unsorted results; not modified
   * @param limit maximum size, {@link #DEFAULT_LIMIT} when not positive
   */
  public static List<SimilarRecord> selectTop(List<SimilarRecord> results, int limit) {
    int effectiveLimit = limit <= 0 ? DEFAULT_LIMIT : limit;
    List<SimilarRecord> sorted = new ArrayList<>(results);
    sorted.sort(BY_SIMILARITY_DESC);
    if (sorted.size() > effectiveLimit) {
      return new ArrayList<>(sorted.subList(0, effectiveLimit));
    }
    return sorted;
  }

  private Future<List<SimilarRecord>> submitChunk(
      float[] query, float queryMagnitude, List<CachedVector> chunk, String excludeId) {
    try {
      return executor.submit(() -> scoreChunk(query, queryMagnitude, chunk, excludeId));
    } catch (TaskRejectedException e) {
      log.debug("Ranking executor saturated, scoring {} candidates inline", chunk.size());
      return CompletableFuture.completedFuture(
          scoreChunk(query, queryMagnitude, chunk, excludeId));
    }
  }

  private static List<SimilarRecord> scoreChunk(
      float[] query, float queryMagnitude, List<CachedVector> chunk, String excludeId) {
    List<SimilarRecord> results = new ArrayList<>(chunk.size());
    for (CachedVector candidate : chunk) {
      if (excludeId != null && excludeId.equals(candidate.getRecordId())) {
        continue;
      }
      float similarity =
          VectorMath.cosineSimilarity(
              query, queryMagnitude, candidate.getVector(), candidate.getMagnitude());
      results.add(new SimilarRecord(candidate.getRecordId(), similarity));
    }
    return results;
  }
}
