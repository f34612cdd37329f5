package io.b2mash.pivot.matrix;

import io.b2mash.pivot.model.DataValues;
import io.b2mash.pivot.model.ExpandedPaths;
import io.b2mash.pivot.model.Field;
import io.b2mash.pivot.model.Header;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Visible lines and dimension headers of one axis. Collapsed nodes contribute a single line;
 * expanded nodes contribute their children's lines plus, with subtotals on, one line of their
 * own after the last child.
 */
final class AxisLayout {

  static final String GRAND_TOTAL_LABEL = "Grand Total";

  private final List<Field> fields;
  private final ExpandedPaths expandedPaths;
  private final boolean subtotals;
  private final int spanUnit;
  private final List<AxisLine> lines = new ArrayList<>();
  private final List<List<Header>> headers = new ArrayList<>();
  private int totalLines;

  private AxisLayout(
      List<Field> fields, ExpandedPaths expandedPaths, boolean subtotals, int spanUnit) {
    this.fields = fields;
    this.expandedPaths = expandedPaths;
    this.subtotals = subtotals;
    this.spanUnit = spanUnit;
    for (int i = 0; i < fields.size(); i++) {
      headers.add(new ArrayList<>());
    }
  }

  /**
   * Lays out an axis.
   *
   * @param tuples distinct full-depth tuples of the axis in first-appearance order
   * @param fields the axis dimensions
   * @param expandedPaths which nodes are expanded
   * @param subtotals whether expanded nodes get a subtotal line
   * @param grandTotal whether a trailing grand total line is added
   * @param spanUnit matrix lines or columns covered by one axis line
   */
  static AxisLayout of(
      Collection<List<String>> tuples,
      List<Field> fields,
      ExpandedPaths expandedPaths,
      boolean subtotals,
      boolean grandTotal,
      int spanUnit) {
    var layout = new AxisLayout(fields, expandedPaths, subtotals, spanUnit);
    if (!tuples.isEmpty()) {
      if (fields.isEmpty()) {
        layout.lines.add(new AxisLine(List.of(), LineType.DATA));
        layout.totalLines = 1;
      } else {
        var root = AxisNode.rootOf(tuples);
        for (var child : root.children()) {
          layout.place(child);
        }
        layout.totalLines = root.expandedLineCount(subtotals);
      }
    }
    if (grandTotal) {
      if (!fields.isEmpty()) {
        layout.headers
            .get(0)
            .add(
                new Header(
                    GRAND_TOTAL_LABEL, 0, spanUnit, Header.GRAND_TOTAL_PATH, null, false, false));
      }
      layout.lines.add(new AxisLine(List.of(), LineType.GRAND_TOTAL));
      layout.totalLines++;
    }
    return layout;
  }

  List<AxisLine> lines() {
    return lines;
  }

  List<List<Header>> headers() {
    return headers.stream().map(List::copyOf).toList();
  }

  int totalLines() {
    return totalLines;
  }

  private void place(AxisNode node) {
    int level = node.level();
    boolean expandable = level < fields.size() - 1;
    boolean expanded = expandable && expandedPaths.isExpanded(node.path());
    int start = lines.size();
    if (expanded) {
      for (var child : node.children()) {
        place(child);
      }
      if (subtotals) {
        lines.add(new AxisLine(node.path(), LineType.SUBTOTAL));
      }
    } else {
      lines.add(new AxisLine(node.path(), LineType.DATA));
    }
    int span = (lines.size() - start) * spanUnit;
    headers
        .get(level)
        .add(
            new Header(
                DataValues.label(node.key()),
                level,
                span,
                node.path(),
                fields.get(level),
                expandable,
                expanded));
  }
}
