package com.recordsearch.embeddings.service.cache;

import java.time.Duration;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Point-in-time snapshot of the embedding cache for monitoring. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

  private int entriesCount;

  private int totalEmbeddings;

  private double memoryUsedMb;

  private double memoryBudgetMb;

  private double memoryUsagePercent;

  private int maxPerEntry;

  private Duration ttl;

  /** Entries ordered least recently used first. */
  private List<EntryStats> entries;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class EntryStats {
    private String key;
    private int count;
    private double memoryMb;
    private Duration age;
    private Duration lastAccess;
  }
}
