package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.grouping.Bucket;
import io.b2mash.pivot.grouping.GroupKey;
import io.b2mash.pivot.model.PivotConfiguration;
import io.b2mash.pivot.model.ValueSpec;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Computes one result per value spec for each bucket. */
@Component
public class Aggregator {

  private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

  private final AggregationRegistry registry;

  public Aggregator(AggregationRegistry registry) {
    this.registry = registry;
  }

  /**
   * Checks every aggregation identifier up front, built-in and registered ones alike, so that a
   * misspelled one fails the computation before any work is done.
   *
   * @throws io.b2mash.pivot.exception.UnsupportedAggregationException on the first unknown
   *     identifier
   */
  public List<ResolvedValue> resolve(List<ValueSpec> specs) {
    var seen = new HashSet<String>();
    for (var spec : specs) {
      if (!seen.add(spec.resolvedDisplayName())) {
        log.warn(
            "Value display name '{}' is used more than once; later values overwrite earlier ones",
            spec.resolvedDisplayName());
      }
    }
    return specs.stream().map(registry::resolve).toList();
  }

  /**
   * Aggregates the rows of one bucket.
   *
   * @param bucket the bucket to aggregate
   * @param filteredRows the rows the bucket indices point into
   * @param specs the value specs
   * @return results keyed by display name; a repeated display name keeps the later result
   */
  public Map<String, AggregatedValue> aggregate(
      Bucket bucket, List<Map<String, Object>> filteredRows, List<ValueSpec> specs) {
    var values = resolve(specs);
    return accumulate(bucket, filteredRows, values).byDisplayName(values);
  }

  /** Feeds the rows of a bucket, in order, into fresh accumulators. */
  public BucketAggregate accumulate(
      Bucket bucket, List<Map<String, Object>> filteredRows, List<ResolvedValue> values) {
    var aggregate = BucketAggregate.create(values);
    for (int index : bucket.rowIndices()) {
      aggregate.add(filteredRows.get(index), values);
    }
    return aggregate;
  }

  /**
   * Aggregates every bucket produced by {@link
   * io.b2mash.pivot.grouping.GroupingEngine#groupWithRollups} into a state that the matrix
   * builder and the incremental updater share.
   */
  public AggregationState aggregateAll(
      Map<GroupKey, Bucket> buckets,
      List<Map<String, Object>> filteredRows,
      PivotConfiguration configuration,
      List<ResolvedValue> values) {
    var aggregates = new LinkedHashMap<GroupKey, BucketAggregate>();
    buckets.forEach((key, bucket) -> aggregates.put(key, accumulate(bucket, filteredRows, values)));
    int dataColumnCount = filteredRows.isEmpty() ? 0 : filteredRows.get(0).size();
    return new AggregationState(
        configuration, values, aggregates, filteredRows.size(), dataColumnCount);
  }
}
