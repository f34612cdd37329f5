package io.b2mash.pivot.filter;

import java.util.Arrays;
import java.util.Optional;

/** Filter operators, identified by the strings used in configurations. */
public enum FilterOperator {
  EQUALS("equals"),
  NOT_EQUALS("notEquals"),
  CONTAINS("contains"),
  NOT_CONTAINS("notContains"),
  GREATER_THAN("greaterThan"),
  LESS_THAN("lessThan"),
  GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
  LESS_THAN_OR_EQUAL("lessThanOrEqual"),
  IN("in"),
  NOT_IN("notIn"),
  BETWEEN("between"),
  IS_EMPTY("isEmpty"),
  IS_NOT_EMPTY("isNotEmpty");

  private final String id;

  FilterOperator(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /** Empty for an identifier the evaluator does not know. */
  public static Optional<FilterOperator> find(String id) {
    return Arrays.stream(values()).filter(op -> op.id.equals(id)).findFirst();
  }
}
