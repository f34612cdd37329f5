package io.b2mash.pivot.filter;

import io.b2mash.pivot.model.DataValues;
import io.b2mash.pivot.model.FilterSpec;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies filter predicates to raw rows. Enabled filters are combined with AND; disabled ones are
 * skipped. An unknown operator lets every row through and logs a warning, unlike an unknown
 * aggregation which fails the computation.
 */
@Component
public class FilterEvaluator {

  private static final Logger log = LoggerFactory.getLogger(FilterEvaluator.class);

  /**
   * Returns the rows matching every enabled filter, in their original order. The input list is
   * not modified.
   */
  public List<Map<String, Object>> apply(List<Map<String, Object>> rows, List<FilterSpec> filters) {
    var active = filters.stream().filter(FilterSpec::active).toList();
    if (active.isEmpty()) {
      return List.copyOf(rows);
    }
    for (var filter : active) {
      if (FilterOperator.find(filter.operator()).isEmpty()) {
        log.warn(
            "Unknown filter operator '{}' on field '{}'; rows pass unfiltered",
            filter.operator(),
            filter.field().id());
      }
    }
    return rows.stream().filter(row -> matchesAll(row, active)).toList();
  }

  public boolean matchesAll(Map<String, Object> row, List<FilterSpec> filters) {
    for (var filter : filters) {
      if (filter.active() && !matches(row, filter)) {
        return false;
      }
    }
    return true;
  }

  /** Evaluates one filter against one row. */
  public boolean matches(Map<String, Object> row, FilterSpec filter) {
    var operator = FilterOperator.find(filter.operator());
    if (operator.isEmpty()) {
      return true;
    }
    Object fieldValue = row.get(filter.field().id());
    Object filterValue = filter.value();

    return switch (operator.get()) {
      case EQUALS -> DataValues.sameValue(fieldValue, filterValue);
      case NOT_EQUALS -> !DataValues.sameValue(fieldValue, filterValue);
      case CONTAINS -> containsIgnoreCase(fieldValue, filterValue);
      case NOT_CONTAINS -> !containsIgnoreCase(fieldValue, filterValue);
      case GREATER_THAN -> DataValues.toNumber(fieldValue) > DataValues.toNumber(filterValue);
      case LESS_THAN -> DataValues.toNumber(fieldValue) < DataValues.toNumber(filterValue);
      case GREATER_THAN_OR_EQUAL ->
          DataValues.toNumber(fieldValue) >= DataValues.toNumber(filterValue);
      case LESS_THAN_OR_EQUAL ->
          DataValues.toNumber(fieldValue) <= DataValues.toNumber(filterValue);
      case IN -> filterValue instanceof Collection<?> c && containsValue(c, fieldValue);
      case NOT_IN -> filterValue instanceof Collection<?> c && !containsValue(c, fieldValue);
      case BETWEEN -> between(fieldValue, filterValue);
      case IS_EMPTY -> DataValues.isEmpty(fieldValue);
      case IS_NOT_EMPTY -> !DataValues.isEmpty(fieldValue);
    };
  }

  private boolean containsIgnoreCase(Object fieldValue, Object filterValue) {
    return DataValues.stringify(fieldValue)
        .toLowerCase(Locale.ROOT)
        .contains(DataValues.stringify(filterValue).toLowerCase(Locale.ROOT));
  }

  private boolean containsValue(Collection<?> candidates, Object fieldValue) {
    for (var candidate : candidates) {
      if (DataValues.sameValue(fieldValue, candidate)) {
        return true;
      }
    }
    return false;
  }

  private boolean between(Object fieldValue, Object filterValue) {
    if (!(filterValue instanceof Map<?, ?> range)
        || !range.containsKey("min")
        || !range.containsKey("max")) {
      return false;
    }
    double value = DataValues.toNumber(fieldValue);
    return value >= DataValues.toNumber(range.get("min"))
        && value <= DataValues.toNumber(range.get("max"));
  }
}
