package com.recordsearch.embeddings.service.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.recordsearch.embeddings.service.vector.CachedVector;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory cache of decoded embeddings, one entry per dataset/field pair.
 *
 * <p>Memory is bounded by an estimated budget: every vector is assumed to cost a fixed number of
 * bytes, and inserting an entry evicts least recently used entries until the new one fits. Entries
 * also expire after a period of inactivity (sliding TTL), checked lazily on {@link #get}.
 *
 * <p>Entries are replaced wholesale and their vector lists are unmodifiable, so a reader never sees
 * a partially written entry. {@code get} takes the write lock because it updates recency and may
 * expire the entry; {@link #stats()} and {@link #info()} only take the read lock.
 */
@Slf4j
public class EmbeddingCache {

  private static final double BYTES_PER_MB = 1024d * 1024d;

  @Getter private final double maxMemoryMb;
  @Getter private final int maxPerEntry;
  @Getter private final Duration ttl;
  @Getter private final int bytesPerRecord;

  private final long ttlNanos;
  private final Ticker ticker;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  // Access-ordered: iteration starts at the least recently used key.
  private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
  private double totalMemoryMb;

  // Invalidation counters: per key, plus one bumped by dataset-wide invalidation and clear.
  private final Map<String, Long> keyGenerations = new HashMap<>();
  private long globalGeneration;

  public EmbeddingCache(
      double maxMemoryMb, int maxPerEntry, Duration ttl, int bytesPerRecord, Ticker ticker) {
    Preconditions.checkArgument(maxMemoryMb > 0, "maxMemoryMb must be positive");
    Preconditions.checkArgument(maxPerEntry > 0, "maxPerEntry must be positive");
    Preconditions.checkArgument(
        ttl != null && !ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
    Preconditions.checkArgument(bytesPerRecord > 0, "bytesPerRecord must be positive");
    this.maxMemoryMb = maxMemoryMb;
    this.maxPerEntry = maxPerEntry;
    this.ttl = ttl;
    this.ttlNanos = ttl.toNanos();
    this.bytesPerRecord = bytesPerRecord;
    this.ticker = Preconditions.checkNotNull(ticker, "ticker");
  }

  public static String cacheKey(String datasetId, String fieldName) {
    return datasetId + ":" + fieldName;
  }

  /**
   * Estimated size of an entry holding {@code count} vectors.
   *
   * @param count number of vectors
   * @return size in megabytes
   */
  public double estimateMemoryMb(int count) {
    return (double) count * bytesPerRecord / BYTES_PER_MB;
  }

  /**
   * Look up the vectors cached for a dataset field. A hit refreshes the entry's last access time
   * and marks it most recently used; an entry idle for longer than the TTL is evicted instead.
   *
   * @return the cached vectors, or empty on a miss or expiry
   */
  public Optional<List<CachedVector>> get(String datasetId, String fieldName) {
    String key = cacheKey(datasetId, fieldName);
    lock.writeLock().lock();
    try {
      CacheEntry entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }

      long now = ticker.read();
      if (now - entry.accessedAt > ttlNanos) {
        removeEntry(key);
        log.debug("Embedding cache entry '{}' expired after {} of inactivity", key, ttl);
        return Optional.empty();
      }

      entry.accessedAt = now;
      return Optional.of(entry.vectors);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Current invalidation generation of a dataset field. Read it before loading vectors from the
   * store and pass it to {@link #set(String, String, List, long)} so that a load overtaken by an
   * invalidation is not cached.
   */
  public long generation(String datasetId, String fieldName) {
    lock.readLock().lock();
    try {
      return currentGeneration(cacheKey(datasetId, fieldName));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Store the vectors for a dataset field, replacing any previous entry for the same key. Least
   * recently used entries are evicted until the new entry fits the memory budget.
   *
   * @return true if cached, false if the set is too large to cache at all
   */
  public boolean set(String datasetId, String fieldName, List<CachedVector> vectors) {
    return put(cacheKey(datasetId, fieldName), vectors, null);
  }

  /**
   * Like {@link #set(String, String, List)}, but only if the key has not been invalidated since
   * {@code expectedGeneration} was read.
   *
   * @return true if cached, false if too large or the vectors are stale
   */
  public boolean set(
      String datasetId, String fieldName, List<CachedVector> vectors, long expectedGeneration) {
    return put(cacheKey(datasetId, fieldName), vectors, expectedGeneration);
  }

  private boolean put(String key, List<CachedVector> vectors, Long expectedGeneration) {
    int count = vectors == null ? 0 : vectors.size();

    if (count > maxPerEntry) {
      log.info(
          "Not caching '{}': {} vectors exceeds the per-entry limit of {}", key, count, maxPerEntry);
      return false;
    }

    double entryMemoryMb = estimateMemoryMb(count);
    if (entryMemoryMb > maxMemoryMb) {
      log.info(
          "Not caching '{}': {} MB exceeds the total budget of {} MB",
          key,
          String.format("%.2f", entryMemoryMb),
          maxMemoryMb);
      return false;
    }

    List<CachedVector> snapshot = count == 0 ? List.of() : List.copyOf(vectors);

    lock.writeLock().lock();
    try {
      if (expectedGeneration != null && expectedGeneration != currentGeneration(key)) {
        log.debug("Not caching '{}': invalidated while the vectors were loading", key);
        return false;
      }
      removeEntry(key);

      Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();
      while (totalMemoryMb + entryMemoryMb > maxMemoryMb && eldest.hasNext()) {
        Map.Entry<String, CacheEntry> victim = eldest.next();
        totalMemoryMb -= victim.getValue().memoryMb;
        eldest.remove();
        log.debug(
            "Evicted embedding cache entry '{}' ({} vectors) to make room for '{}'",
            victim.getKey(),
            victim.getValue().vectors.size(),
            key);
      }
      if (entries.isEmpty()) {
        totalMemoryMb = 0;
      }

      long now = ticker.read();
      entries.put(key, new CacheEntry(snapshot, entryMemoryMb, now, now));
      totalMemoryMb += entryMemoryMb;
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Remove the entry for one dataset field, if present. */
  public void invalidate(String datasetId, String fieldName) {
    String key = cacheKey(datasetId, fieldName);
    lock.writeLock().lock();
    try {
      keyGenerations.merge(key, 1L, Long::sum);
      if (removeEntry(key)) {
        log.debug("Invalidated embedding cache entry '{}'", key);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Remove every entry belonging to a dataset. */
  public void invalidateDataset(String datasetId) {
    String prefix = datasetId + ":";
    lock.writeLock().lock();
    try {
      globalGeneration++;
      int removed = 0;
      Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<String, CacheEntry> entry = it.next();
        if (entry.getKey().startsWith(prefix)) {
          totalMemoryMb -= entry.getValue().memoryMb;
          it.remove();
          removed++;
        }
      }
      if (entries.isEmpty()) {
        totalMemoryMb = 0;
      }
      if (removed > 0) {
        log.debug("Invalidated {} embedding cache entries for dataset '{}'", removed, datasetId);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Drop all entries. */
  public void clear() {
    lock.writeLock().lock();
    try {
      globalGeneration++;
      entries.clear();
      totalMemoryMb = 0;
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Embedding cache cleared");
  }

  public CacheStats stats() {
    lock.readLock().lock();
    try {
      long now = ticker.read();
      int totalEmbeddings = 0;
      List<CacheStats.EntryStats> entryStats = new ArrayList<>(entries.size());

      for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
        CacheEntry entry = e.getValue();
        totalEmbeddings += entry.vectors.size();
        entryStats.add(
            CacheStats.EntryStats.builder()
                .key(e.getKey())
                .count(entry.vectors.size())
                .memoryMb(entry.memoryMb)
                .age(Duration.ofNanos(now - entry.createdAt))
                .lastAccess(Duration.ofNanos(now - entry.accessedAt))
                .build());
      }

      return CacheStats.builder()
          .entriesCount(entries.size())
          .totalEmbeddings(totalEmbeddings)
          .memoryUsedMb(totalMemoryMb)
          .memoryBudgetMb(maxMemoryMb)
          .memoryUsagePercent(usagePercent())
          .maxPerEntry(maxPerEntry)
          .ttl(ttl)
          .entries(entryStats)
          .build();
    } finally {
      lock.readLock().unlock();
    }
  }

  public CacheInfo info() {
    lock.readLock().lock();
    try {
      return CacheInfo.builder()
          .entriesCount(entries.size())
          .memoryUsedMb(totalMemoryMb)
          .memoryBudgetMb(maxMemoryMb)
          .memoryUsagePercent(usagePercent())
          .build();
    } finally {
      lock.readLock().unlock();
    }
  }

  // Caller must hold the lock. Both counters only grow, so the sum changes on every invalidation.
  private long currentGeneration(String key) {
    return globalGeneration + keyGenerations.getOrDefault(key, 0L);
  }

  // Caller must hold the write lock.
  private boolean removeEntry(String key) {
    CacheEntry removed = entries.remove(key);
    if (removed == null) {
      return false;
    }
    totalMemoryMb -= removed.memoryMb;
    if (entries.isEmpty()) {
      totalMemoryMb = 0;
    }
    return true;
  }

  private double usagePercent() {
    return totalMemoryMb / maxMemoryMb * 100;
  }

  private static final class CacheEntry {
    private final List<CachedVector> vectors;
    private final double memoryMb;
    private final long createdAt;
    private long accessedAt;

    private CacheEntry(List<CachedVector> vectors, double memoryMb, long createdAt, long accessedAt) {
      this.vectors = vectors;
      this.memoryMb = memoryMb;
      this.createdAt = createdAt;
      this.accessedAt = accessedAt;
    }
  }
}
