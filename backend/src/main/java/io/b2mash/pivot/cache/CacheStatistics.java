package io.b2mash.pivot.cache;

/**
 * Snapshot of result cache activity.
 *
 * @param hits lookups answered from the cache
 * @param misses lookups that found nothing
 * @param hitRate hits divided by lookups, 1.0 when there were none
 * @param entryCount cached structures
 * @param weightedSize estimated bytes held
 * @param maxWeight byte budget
 */
public record CacheStatistics(
    long hits, long misses, double hitRate, long entryCount, long weightedSize, long maxWeight) {}
