package io.b2mash.pivot.drilldown;

import io.b2mash.pivot.filter.FilterEvaluator;
import io.b2mash.pivot.grouping.GroupKey;
import io.b2mash.pivot.model.Field;
import io.b2mash.pivot.model.Header;
import io.b2mash.pivot.model.PivotConfiguration;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Finds the raw rows behind a cell or header. Paths are the dimension keys of the header path,
 * outermost first, so {@code ""} selects rows whose value is null or absent. A grand total path
 * selects every row on its axis.
 */
@Component
public class DrillDownResolver {

  private final FilterEvaluator filterEvaluator;

  public DrillDownResolver(FilterEvaluator filterEvaluator) {
    this.filterEvaluator = filterEvaluator;
  }

  /**
   * Returns the filtered rows whose leading row and column dimension keys equal the given paths,
   * in their original order. An empty path matches every row on its axis; a path deeper than the
   * configured dimensions matches nothing.
   */
  public List<Map<String, Object>> resolve(
      List<Map<String, Object>> dataset,
      PivotConfiguration configuration,
      List<String> rowPath,
      List<String> columnPath) {
    var rowKeys = axisPath(rowPath);
    var columnKeys = axisPath(columnPath);
    if (rowKeys.size() > configuration.rows().size()
        || columnKeys.size() > configuration.columns().size()) {
      return List.of();
    }
    return filterEvaluator.apply(dataset, configuration.filters()).stream()
        .filter(
            row ->
                matches(row, configuration.rows(), rowKeys)
                    && matches(row, configuration.columns(), columnKeys))
        .toList();
  }

  private static List<String> axisPath(List<String> path) {
    return Header.GRAND_TOTAL_PATH.equals(path) ? List.of() : path;
  }

  private boolean matches(Map<String, Object> row, List<Field> fields, List<String> path) {
    for (int i = 0; i < path.size(); i++) {
      if (!GroupKey.component(row.get(fields.get(i).id())).equals(path.get(i))) {
        return false;
      }
    }
    return true;
  }
}
