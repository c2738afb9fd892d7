package com.recordsearch.embeddings.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.recordsearch.embeddings.service.cache.CacheStats;
import com.recordsearch.embeddings.service.cache.EmbeddingCache;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/** Inspection and reset of the in-memory embedding cache. */
@RestController
@RequestMapping("/api/embeddings/cache")
@RequiredArgsConstructor
@Tag(name = "Embedding Cache", description = "Inspect and clear the embedding cache")
public class EmbeddingCacheController {

  private final EmbeddingCache embeddingCache;

  @GetMapping("/stats")
  @Operation(
      summary = "Get cache statistics",
      description = "Entry count, memory use and per-entry details, least recently used first")
  public ResponseEntity<CacheStats> getStats() {
    return ResponseEntity.ok(embeddingCache.stats());
  }

  @PostMapping("/clear")
  @Operation(summary = "Clear the cache")
  public ResponseEntity<Map<String, String>> clear() {
    embeddingCache.clear();
    return ResponseEntity.ok(Map.of("status", "ok", "message", "Embeddings cache cleared"));
  }
}
