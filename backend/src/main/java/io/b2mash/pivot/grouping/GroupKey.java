package io.b2mash.pivot.grouping;

import io.b2mash.pivot.model.DataValues;
import io.b2mash.pivot.model.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Composite key of a bucket: the row tuple and the column tuple, each a list of normalised
 * dimension keys. A rolled-up bucket holds a prefix of the full tuples; the empty tuple stands
 * for "all values" of that axis.
 */
public record GroupKey(List<String> rowTuple, List<String> columnTuple) {

  public GroupKey {
    rowTuple = List.copyOf(rowTuple);
    columnTuple = List.copyOf(columnTuple);
  }

  public static GroupKey of(
      Map<String, Object> row, List<Field> rowFields, List<Field> columnFields) {
    return new GroupKey(tuple(row, rowFields), tuple(row, columnFields));
  }

  /** Normalised key of one dimension value: null and absent become the empty string. */
  public static String component(Object value) {
    return DataValues.stringify(value);
  }

  public boolean isLeaf(int rowDepth, int columnDepth) {
    return rowTuple.size() == rowDepth && columnTuple.size() == columnDepth;
  }

  public GroupKey prefix(int rowLength, int columnLength) {
    return new GroupKey(rowTuple.subList(0, rowLength), columnTuple.subList(0, columnLength));
  }

  /**
   * This key followed by every (row prefix, column prefix) combination, from the full tuples down
   * to the grand total key.
   */
  public List<GroupKey> withRollups() {
    var keys = new ArrayList<GroupKey>((rowTuple.size() + 1) * (columnTuple.size() + 1));
    for (int r = rowTuple.size(); r >= 0; r--) {
      for (int c = columnTuple.size(); c >= 0; c--) {
        keys.add(r == rowTuple.size() && c == columnTuple.size() ? this : prefix(r, c));
      }
    }
    return keys;
  }

  private static List<String> tuple(Map<String, Object> row, List<Field> fields) {
    var values = new ArrayList<String>(fields.size());
    for (var field : fields) {
      values.add(component(row.get(field.id())));
    }
    return values;
  }
}
