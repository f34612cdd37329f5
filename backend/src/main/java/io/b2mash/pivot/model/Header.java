package io.b2mash.pivot.model;

import java.util.List;

/**
 * A row or column header node.
 *
 * @param label display label; empty keys show as "(empty)"
 * @param level depth in the hierarchy, 0 for the outermost dimension
 * @param span number of matrix rows (row axis) or physical columns (column axis) covered
 * @param path full sequence of dimension keys from the root to this node; the identity used for
 *     drill-down and expand/collapse. The grand total header has {@link #GRAND_TOTAL_PATH}.
 * @param field the dimension or value field this header represents, null for grand totals
 * @param expandable whether the node has a deeper dimension below it
 * @param expanded whether the node is currently expanded
 */
public record Header(
    String label,
    int level,
    int span,
    List<String> path,
    Field field,
    boolean expandable,
    boolean expanded) {

  /** Reserved path segment of grand total lines, keeping their cell paths unique. */
  public static final String GRAND_TOTAL_KEY = "__grandTotal__";

  public static final List<String> GRAND_TOTAL_PATH = List.of(GRAND_TOTAL_KEY);

  public Header {
    path = path == null ? List.of() : List.copyOf(path);
  }

  public boolean isGrandTotal() {
    return path.equals(GRAND_TOTAL_PATH) && field == null;
  }
}
