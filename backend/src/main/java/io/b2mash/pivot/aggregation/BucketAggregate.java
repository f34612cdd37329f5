package io.b2mash.pivot.aggregation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Accumulators of every value spec for one bucket, plus its row count. */
public final class BucketAggregate {

  private final List<Accumulator> accumulators;
  private long rowCount;

  private BucketAggregate(List<Accumulator> accumulators, long rowCount) {
    this.accumulators = accumulators;
    this.rowCount = rowCount;
  }

  public static BucketAggregate create(List<ResolvedValue> values) {
    var accumulators = new ArrayList<Accumulator>(values.size());
    for (var value : values) {
      accumulators.add(value.newAccumulator());
    }
    return new BucketAggregate(accumulators, 0);
  }

  public void add(Map<String, Object> row, List<ResolvedValue> values) {
    for (int i = 0; i < values.size(); i++) {
      accumulators.get(i).add(row.get(values.get(i).fieldId()));
    }
    rowCount++;
  }

  public long rowCount() {
    return rowCount;
  }

  public AggregatedValue value(int index) {
    return new AggregatedValue(accumulators.get(index).result(), rowCount);
  }

  /**
   * Results keyed by display name. When two value specs share a display name the later one wins,
   * which is the long-standing behaviour callers rely on.
   */
  public Map<String, AggregatedValue> byDisplayName(List<ResolvedValue> values) {
    var result = new LinkedHashMap<String, AggregatedValue>();
    for (int i = 0; i < values.size(); i++) {
      result.put(values.get(i).displayName(), value(i));
    }
    return result;
  }

  public BucketAggregate copy() {
    var copies = new ArrayList<Accumulator>(accumulators.size());
    for (var accumulator : accumulators) {
      copies.add(accumulator.copy());
    }
    return new BucketAggregate(copies, rowCount);
  }
}
