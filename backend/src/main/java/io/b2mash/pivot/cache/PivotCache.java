package io.b2mash.pivot.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.b2mash.pivot.config.PivotProperties;
import io.b2mash.pivot.model.PivotStructure;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Memoizes computed structures by fingerprint. Bounded by an estimated byte budget (Caffeine
 * weight) and a time to live after write. Structures whose estimate exceeds the configured share
 * of the budget are never cached.
 *
 * <p>Eviction under weight pressure follows Caffeine's frequency-aware policy, so a recently used
 * entry that is rarely used may leave before an older but popular one.
 */
@Component
public class PivotCache {

  private static final Logger log = LoggerFactory.getLogger(PivotCache.class);

  private final ObjectMapper objectMapper;
  private final long maxWeight;
  private final long maxEntryWeight;
  private final Cache<String, CachedStructure> entries;
  private volatile CacheStats baseline = CacheStats.empty();

  @Autowired
  public PivotCache(PivotProperties properties, ObjectMapper objectMapper) {
    this(properties, objectMapper, Ticker.systemTicker());
  }

  PivotCache(PivotProperties properties, ObjectMapper objectMapper, Ticker ticker) {
    this.objectMapper = objectMapper;
    this.maxWeight = properties.cache().maxSizeBytes();
    this.maxEntryWeight = properties.cache().maxEntryBytes();
    this.entries =
        Caffeine.newBuilder()
            .maximumWeight(maxWeight)
            .weigher((String key, CachedStructure value) -> value.weight())
            .expireAfterWrite(properties.cache().ttl())
            .ticker(ticker)
            .executor(Runnable::run)
            .recordStats()
            .build();
  }

  public Optional<PivotStructure> get(String fingerprint) {
    return Optional.ofNullable(entries.getIfPresent(fingerprint)).map(CachedStructure::structure);
  }

  /**
   * Stores a structure unless it is too large.
   *
   * @return whether the structure was cached
   */
  public boolean put(String fingerprint, PivotStructure structure) {
    long size = estimateSize(structure);
    if (size > maxEntryWeight) {
      log.debug(
          "Not caching pivot {}: estimated {} bytes exceeds entry limit of {} bytes",
          fingerprint,
          size,
          maxEntryWeight);
      return false;
    }
    entries.put(fingerprint, new CachedStructure(structure, (int) size));
    return true;
  }

  /** Hits and misses count from the last {@link #clear()}. */
  public CacheStatistics statistics() {
    entries.cleanUp();
    var stats = entries.stats().minus(baseline);
    long weightedSize =
        entries.policy().eviction().map(eviction -> eviction.weightedSize().orElse(0L)).orElse(0L);
    return new CacheStatistics(
        stats.hitCount(),
        stats.missCount(),
        stats.hitRate(),
        entries.estimatedSize(),
        weightedSize,
        maxWeight);
  }

  public void clear() {
    entries.invalidateAll();
    entries.cleanUp();
    baseline = entries.stats();
  }

  /** Serialized size doubled to approximate the in-memory footprint, capped at int range. */
  long estimateSize(PivotStructure structure) {
    long serialized = objectMapper.writeValueAsBytes(structure).length;
    return Math.min(serialized * 2, Integer.MAX_VALUE);
  }

  private record CachedStructure(PivotStructure structure, int weight) {}
}
