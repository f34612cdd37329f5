package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.model.DataValues;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/** Values derived from already aggregated results: shares of a total and running totals. */
public final class DerivedValues {

  /** How a share of a total is written. */
  public enum ShareStyle {
    /** Percent with one decimal, e.g. {@code 33.3%}. */
    PERCENTAGE,
    /** Plain ratio with three decimals, e.g. {@code 0.333}. */
    DECIMAL
  }

  private DerivedValues() {}

  /** Share of {@code value} in {@code total}; a zero total gives a zero share. */
  public static String percentageOfTotal(double value, double total, ShareStyle style) {
    if (total == 0) {
      return style == ShareStyle.PERCENTAGE ? "0%" : "0";
    }
    double ratio = value / total;
    if (style == ShareStyle.PERCENTAGE) {
      return round(ratio * 100, 1) + "%";
    }
    return round(ratio, 3);
  }

  /**
   * Cumulative sums, or cumulative averages over the positions seen so far. Values that are not
   * finite numbers count as zero.
   *
   * @throws IllegalArgumentException for aggregations other than sum and avg
   */
  public static List<Double> runningTotal(List<?> values, Aggregation aggregation) {
    if (aggregation != Aggregation.SUM && aggregation != Aggregation.AVG) {
      throw new IllegalArgumentException(
          "Running totals support sum and avg, not '" + aggregation.id() + "'");
    }
    var totals = new ArrayList<Double>(values.size());
    double accumulated = 0;
    for (int i = 0; i < values.size(); i++) {
      Double number = DataValues.asFiniteNumber(values.get(i));
      accumulated += number == null ? 0 : number;
      totals.add(aggregation == Aggregation.SUM ? accumulated : accumulated / (i + 1));
    }
    return totals;
  }

  private static String round(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).toPlainString();
  }
}
