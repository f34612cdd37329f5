package io.b2mash.pivot.grouping;

import io.b2mash.pivot.model.Field;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Partitions filtered rows into buckets by their row and column dimension values. */
@Component
public class GroupingEngine {

  /**
   * Groups rows by the tuple of row-dimension then column-dimension values. Single pass over the
   * rows; buckets appear in the order their first row appears.
   *
   * @param rows the filtered rows
   * @param rowFields row dimensions, outermost first
   * @param columnFields column dimensions, outermost first
   * @return buckets keyed by their full-depth group key
   */
  public Map<GroupKey, Bucket> group(
      List<Map<String, Object>> rows, List<Field> rowFields, List<Field> columnFields) {
    var buckets = new LinkedHashMap<GroupKey, Bucket>();
    for (int i = 0; i < rows.size(); i++) {
      var key = GroupKey.of(rows.get(i), rowFields, columnFields);
      buckets.computeIfAbsent(key, Bucket::new).add(i);
    }
    return buckets;
  }

  /**
   * Like {@link #group} but every row is also placed in the bucket of each (row prefix, column
   * prefix) pair, so subtotals and grand totals can be aggregated over exactly the rows they
   * cover.
   */
  public Map<GroupKey, Bucket> groupWithRollups(
      List<Map<String, Object>> rows, List<Field> rowFields, List<Field> columnFields) {
    var buckets = new LinkedHashMap<GroupKey, Bucket>();
    for (int i = 0; i < rows.size(); i++) {
      for (var key : keysOf(rows.get(i), rowFields, columnFields)) {
        buckets.computeIfAbsent(key, Bucket::new).add(i);
      }
    }
    return buckets;
  }

  /** The full key of a row followed by all of its rolled-up keys. */
  public List<GroupKey> keysOf(
      Map<String, Object> row, List<Field> rowFields, List<Field> columnFields) {
    return GroupKey.of(row, rowFields, columnFields).withRollups();
  }
}
