package com.recordsearch.embeddings.service.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Summary of cache occupancy, attached to similarity search diagnostics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheInfo {

  private int entriesCount;

  private double memoryUsedMb;

  private double memoryBudgetMb;

  private double memoryUsagePercent;
}
