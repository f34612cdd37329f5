package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.grouping.GroupKey;
import io.b2mash.pivot.model.PivotConfiguration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates of every bucket and every rolled-up bucket of one computation, in first-appearance
 * order. Retained inside a {@link io.b2mash.pivot.model.PivotStructure} so later rows can be
 * merged without re-reading the original dataset.
 */
public final class AggregationState {

  private final PivotConfiguration configuration;
  private final List<ResolvedValue> values;
  private final LinkedHashMap<GroupKey, BucketAggregate> aggregates;
  private int filteredRowCount;
  private int dataColumnCount;

  AggregationState(
      PivotConfiguration configuration,
      List<ResolvedValue> values,
      LinkedHashMap<GroupKey, BucketAggregate> aggregates,
      int filteredRowCount,
      int dataColumnCount) {
    this.configuration = configuration;
    this.values = List.copyOf(values);
    this.aggregates = aggregates;
    this.filteredRowCount = filteredRowCount;
    this.dataColumnCount = dataColumnCount;
  }

  public PivotConfiguration configuration() {
    return configuration;
  }

  public List<ResolvedValue> values() {
    return values;
  }

  public int rowDepth() {
    return configuration.rows().size();
  }

  public int columnDepth() {
    return configuration.columns().size();
  }

  public BucketAggregate get(GroupKey key) {
    return aggregates.get(key);
  }

  public Map<GroupKey, BucketAggregate> aggregates() {
    return Collections.unmodifiableMap(aggregates);
  }

  /** Keys of full-depth buckets in first-appearance order. */
  public List<GroupKey> leafKeys() {
    return aggregates.keySet().stream()
        .filter(key -> key.isLeaf(rowDepth(), columnDepth()))
        .toList();
  }

  public int filteredRowCount() {
    return filteredRowCount;
  }

  public int dataColumnCount() {
    return dataColumnCount;
  }

  public int bucketCount() {
    return leafKeys().size();
  }

  /**
   * Adds one filtered row to the aggregates of the given keys, creating aggregates for keys seen
   * for the first time.
   */
  public void addRow(Map<String, Object> row, List<GroupKey> keys) {
    for (var key : keys) {
      aggregates.computeIfAbsent(key, k -> BucketAggregate.create(values)).add(row, values);
    }
    if (filteredRowCount == 0) {
      dataColumnCount = row.size();
    }
    filteredRowCount++;
  }

  /** A deep copy whose accumulators can be advanced independently. */
  public AggregationState copy() {
    var copies = new LinkedHashMap<GroupKey, BucketAggregate>();
    aggregates.forEach((key, aggregate) -> copies.put(key, aggregate.copy()));
    return new AggregationState(configuration, values, copies, filteredRowCount, dataColumnCount);
  }
}
