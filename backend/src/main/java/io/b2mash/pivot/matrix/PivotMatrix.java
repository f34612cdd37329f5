package io.b2mash.pivot.matrix;

import io.b2mash.pivot.aggregation.AggregationState;
import io.b2mash.pivot.model.Cell;
import io.b2mash.pivot.model.ExpandedPaths;
import io.b2mash.pivot.model.Header;
import io.b2mash.pivot.model.PivotStructure;
import io.b2mash.pivot.model.PivotSummary;
import java.util.List;

/** Output of the matrix builder, before summary statistics are attached. */
public record PivotMatrix(
    List<List<Cell>> matrix,
    List<List<Header>> rowHeaders,
    List<List<Header>> columnHeaders,
    int columnCount,
    int totalRows,
    int totalColumns) {

  public int rowCount() {
    return matrix.size();
  }

  /** Attaches summary statistics and the retained aggregation state. */
  public PivotStructure toStructure(
      AggregationState state, ExpandedPaths expandedPaths, double computationTimeMillis) {
    var summary =
        new PivotSummary(
            state.filteredRowCount(),
            state.dataColumnCount(),
            state.bucketCount(),
            computationTimeMillis);
    return new PivotStructure(
        matrix,
        rowHeaders,
        columnHeaders,
        rowCount(),
        columnCount,
        totalRows,
        totalColumns,
        expandedPaths,
        summary,
        state);
  }
}
