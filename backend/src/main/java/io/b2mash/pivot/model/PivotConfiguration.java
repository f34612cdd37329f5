package io.b2mash.pivot.model;

import java.util.List;

/**
 * Complete pivot configuration as produced by a configuration editor. Missing lists are treated
 * as empty and missing options as "no totals".
 */
public record PivotConfiguration(
    List<Field> rows,
    List<Field> columns,
    List<ValueSpec> values,
    List<FilterSpec> filters,
    PivotOptions options) {

  public PivotConfiguration {
    rows = rows == null ? List.of() : List.copyOf(rows);
    columns = columns == null ? List.of() : List.copyOf(columns);
    values = values == null ? List.of() : List.copyOf(values);
    filters = filters == null ? List.of() : List.copyOf(filters);
    options = options == null ? PivotOptions.none() : options;
  }

  public PivotConfiguration withOptions(PivotOptions options) {
    return new PivotConfiguration(rows, columns, values, filters, options);
  }

  public PivotConfiguration withFilters(List<FilterSpec> filters) {
    return new PivotConfiguration(rows, columns, values, filters, options);
  }

  /**
   * Whether both configurations group, aggregate and filter identically. Options are ignored
   * because totals are derived from the same aggregation state.
   */
  public boolean hasSameShapeAs(PivotConfiguration other) {
    return other != null
        && rows.equals(other.rows)
        && columns.equals(other.columns)
        && values.equals(other.values)
        && filters.equals(other.filters);
  }
}
