package io.b2mash.pivot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.b2mash.pivot.aggregation.AggregationState;
import java.util.List;
import java.util.Objects;

/**
 * The engine's output: a cell matrix plus multi-level row and column headers.
 *
 * <p>Equality covers the rendered output only. {@code state} and the summary's computation time
 * are ignored, so repeated computations over the same input are equal.
 *
 * @param matrix cells indexed {@code [row][column]}
 * @param rowHeaders one inner list per row dimension level
 * @param columnHeaders one inner list per column dimension level, then the value level
 * @param rowCount visible matrix rows
 * @param columnCount visible matrix columns
 * @param totalRows matrix rows if every node were expanded
 * @param totalColumns matrix columns if every node were expanded
 * @param expandedPaths the expansion the structure was built with
 * @param summary computation statistics
 * @param state aggregation state retained for incremental updates; never serialized
 */
public record PivotStructure(
    List<List<Cell>> matrix,
    List<List<Header>> rowHeaders,
    List<List<Header>> columnHeaders,
    int rowCount,
    int columnCount,
    int totalRows,
    int totalColumns,
    ExpandedPaths expandedPaths,
    PivotSummary summary,
    @JsonIgnore AggregationState state) {

  public Cell cell(int row, int column) {
    return matrix.get(row).get(column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PivotStructure other)) {
      return false;
    }
    return rowCount == other.rowCount
        && columnCount == other.columnCount
        && totalRows == other.totalRows
        && totalColumns == other.totalColumns
        && matrix.equals(other.matrix)
        && rowHeaders.equals(other.rowHeaders)
        && columnHeaders.equals(other.columnHeaders)
        && Objects.equals(expandedPaths, other.expandedPaths)
        && summary.sameCountsAs(other.summary);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        matrix,
        rowHeaders,
        columnHeaders,
        rowCount,
        columnCount,
        totalRows,
        totalColumns,
        expandedPaths,
        summary.totalDataRows(),
        summary.totalDataColumns(),
        summary.bucketCount());
  }

  /** Terminal column headers, one per physical column. */
  @JsonIgnore
  public List<Header> valueHeaders() {
    return columnHeaders.isEmpty() ? List.of() : columnHeaders.get(columnHeaders.size() - 1);
  }
}
