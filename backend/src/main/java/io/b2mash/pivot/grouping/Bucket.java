package io.b2mash.pivot.grouping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Rows sharing one group key, held as ascending indices into the filtered row list. */
public final class Bucket {

  private final GroupKey key;
  private final List<Integer> rowIndices = new ArrayList<>();

  public Bucket(GroupKey key) {
    this.key = key;
  }

  public GroupKey key() {
    return key;
  }

  public List<String> rowTuple() {
    return key.rowTuple();
  }

  public List<String> columnTuple() {
    return key.columnTuple();
  }

  public List<Integer> rowIndices() {
    return Collections.unmodifiableList(rowIndices);
  }

  public int size() {
    return rowIndices.size();
  }

  /** The contributing rows of {@code filteredRows}, in their original order. */
  public List<Map<String, Object>> rows(List<Map<String, Object>> filteredRows) {
    return rowIndices.stream().map(filteredRows::get).toList();
  }

  void add(int rowIndex) {
    rowIndices.add(rowIndex);
  }
}
