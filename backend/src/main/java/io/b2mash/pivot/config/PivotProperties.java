package io.b2mash.pivot.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the pivot engine, bound from {@code pivot.*}. Missing values fall back to the
 * defaults below.
 *
 * @param batchSize rows filtered per batch before yielding
 * @param cache result cache limits
 * @param drillDown expansion limits
 */
@ConfigurationProperties(prefix = "pivot")
public record PivotProperties(Integer batchSize, Cache cache, DrillDown drillDown) {

  public static final int DEFAULT_BATCH_SIZE = 1000;

  public PivotProperties {
    batchSize = batchSize == null || batchSize < 1 ? DEFAULT_BATCH_SIZE : batchSize;
    cache = cache == null ? Cache.defaults() : cache;
    drillDown = drillDown == null ? DrillDown.defaults() : drillDown;
  }

  public static PivotProperties defaults() {
    return new PivotProperties(null, null, null);
  }

  /**
   * @param maxSizeMb total weight budget in megabytes
   * @param ttl time to live after a write
   * @param maxEntryFraction largest share of the budget a single entry may take
   */
  public record Cache(Long maxSizeMb, Duration ttl, Double maxEntryFraction) {

    public Cache {
      maxSizeMb = maxSizeMb == null || maxSizeMb < 1 ? 50L : maxSizeMb;
      ttl = ttl == null ? Duration.ofMinutes(30) : ttl;
      maxEntryFraction =
          maxEntryFraction == null || maxEntryFraction <= 0 || maxEntryFraction > 1
              ? 0.1
              : maxEntryFraction;
    }

    public static Cache defaults() {
      return new Cache(null, null, null);
    }

    public long maxSizeBytes() {
      return maxSizeMb * 1024 * 1024;
    }

    public long maxEntryBytes() {
      return (long) (maxSizeBytes() * maxEntryFraction);
    }
  }

  public record DrillDown(Integer maxDepth) {

    public DrillDown {
      maxDepth = maxDepth == null || maxDepth < 1 ? 10 : maxDepth;
    }

    public static DrillDown defaults() {
      return new DrillDown(null);
    }
  }
}
