package io.b2mash.pivot.matrix;

import io.b2mash.pivot.aggregation.AggregationState;
import io.b2mash.pivot.aggregation.BucketAggregate;
import io.b2mash.pivot.aggregation.ResolvedValue;
import io.b2mash.pivot.grouping.GroupKey;
import io.b2mash.pivot.model.Cell;
import io.b2mash.pivot.model.CellType;
import io.b2mash.pivot.model.ExpandedPaths;
import io.b2mash.pivot.model.Header;
import io.b2mash.pivot.model.PivotConfiguration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Assembles the cell matrix and the row and column header hierarchies from aggregated buckets.
 *
 * <p>Physical column of a value: {@code columnLineIndex * values.size() + valueIndex}. Subtotal
 * and grand total lines read the aggregate of the corresponding rolled-up bucket, so they are
 * re-aggregations over the rows they cover rather than sums of displayed cells.
 */
@Component
public class MatrixBuilder {

  public PivotMatrix build(
      AggregationState state, PivotConfiguration configuration, ExpandedPaths expandedPaths) {
    var values = state.values();
    var options = configuration.options();

    Set<List<String>> rowTuples = new LinkedHashSet<>();
    Set<List<String>> columnTuples = new LinkedHashSet<>();
    for (var key : state.leafKeys()) {
      rowTuples.add(key.rowTuple());
      columnTuples.add(key.columnTuple());
    }

    var rowLayout =
        AxisLayout.of(
            rowTuples,
            configuration.rows(),
            expandedPaths,
            options.showSubtotals(),
            options.showGrandTotals(),
            1);
    var columnLayout =
        AxisLayout.of(
            columnTuples,
            configuration.columns(),
            expandedPaths,
            options.showSubtotals(),
            options.showGrandTotals(),
            values.size());

    var columnHeaders = new ArrayList<>(columnLayout.headers());
    columnHeaders.add(valueHeaders(columnLayout.lines(), values, configuration.columns().size()));

    var winners = displayNameWinners(values);
    var matrix = new ArrayList<List<Cell>>(rowLayout.lines().size());
    for (var rowLine : rowLayout.lines()) {
      var cells = new ArrayList<Cell>(columnLayout.lines().size() * values.size());
      for (var columnLine : columnLayout.lines()) {
        var aggregate = state.get(new GroupKey(rowLine.path(), columnLine.path()));
        var type = cellType(rowLine.type(), columnLine.type());
        for (int v = 0; v < values.size(); v++) {
          var path =
              cellPath(rowLine.displayPath(), columnLine.displayPath(), values.get(v).fieldId());
          cells.add(
              aggregate == null
                  ? Cell.empty(path)
                  : cell(aggregate, values.get(winners[v]), winners[v], type, path));
        }
      }
      matrix.add(List.copyOf(cells));
    }

    return new PivotMatrix(
        List.copyOf(matrix),
        rowLayout.headers(),
        List.copyOf(columnHeaders),
        columnLayout.lines().size() * values.size(),
        rowLayout.totalLines(),
        columnLayout.totalLines() * values.size());
  }

  private List<Header> valueHeaders(
      List<AxisLine> columnLines, List<ResolvedValue> values, int level) {
    var headers = new ArrayList<Header>(columnLines.size() * values.size());
    for (var line : columnLines) {
      for (var value : values) {
        var path = new ArrayList<>(line.displayPath());
        path.add(value.fieldId());
        headers.add(
            new Header(value.displayName(), level, 1, path, value.spec().field(), false, false));
      }
    }
    return List.copyOf(headers);
  }

  private Cell cell(
      BucketAggregate aggregate,
      ResolvedValue value,
      int valueIndex,
      CellType type,
      List<String> path) {
    var result = aggregate.value(valueIndex).value();
    return new Cell(
        result,
        value.format(result),
        type,
        path);
  }

  /**
   * For each value index, the index whose result is shown. Values sharing a display name all show
   * the last one, matching the display-name keyed output of the aggregator.
   */
  private int[] displayNameWinners(List<ResolvedValue> values) {
    Map<String, Integer> last = new HashMap<>();
    for (int i = 0; i < values.size(); i++) {
      last.put(values.get(i).displayName(), i);
    }
    var winners = new int[values.size()];
    for (int i = 0; i < values.size(); i++) {
      winners[i] = last.get(values.get(i).displayName());
    }
    return winners;
  }

  private static CellType cellType(LineType row, LineType column) {
    if (row == LineType.GRAND_TOTAL && column == LineType.GRAND_TOTAL) {
      return CellType.GRAND_TOTAL;
    }
    if (row == LineType.GRAND_TOTAL || column == LineType.GRAND_TOTAL) {
      return CellType.TOTAL;
    }
    if (row == LineType.SUBTOTAL || column == LineType.SUBTOTAL) {
      return CellType.SUBTOTAL;
    }
    return CellType.DATA;
  }

  private static List<String> cellPath(
      List<String> rowPath, List<String> columnPath, String valueFieldId) {
    var path = new ArrayList<String>(rowPath.size() + columnPath.size() + 1);
    path.addAll(rowPath);
    path.addAll(columnPath);
    path.add(valueFieldId);
    return path;
  }
}
