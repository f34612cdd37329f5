package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.model.DataValues;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Formats aggregated values for display. Named formats: {@code currency} (USD), {@code
 * percentage} (value divided by 100, two decimals), {@code decimal} (two decimals, grouped) and
 * {@code integer} (no decimals, grouped). Without a known format, sums and averages show two
 * decimals unless integral, extremes use their shortest form and counts are plain integers.
 */
public final class ValueFormatter {

  private ValueFormatter() {}

  public static String format(Number value, Aggregation aggregation, String format) {
    if (value == null) {
      return "";
    }
    if (aggregation == Aggregation.COUNT || aggregation == Aggregation.COUNT_DISTINCT) {
      return Long.toString(value.longValue());
    }
    String named = formatNamed(value.doubleValue(), format);
    if (named != null) {
      return named;
    }
    double d = value.doubleValue();
    if (aggregation == Aggregation.SUM || aggregation == Aggregation.AVG) {
      if (d % 1 == 0) {
        return DataValues.stringify(d);
      }
      return BigDecimal.valueOf(d).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
    return DataValues.stringify(value);
  }

  private static String formatNamed(double value, String format) {
    if (format == null) {
      return null;
    }
    return switch (format) {
      case "currency" -> NumberFormat.getCurrencyInstance(Locale.US).format(value);
      case "percentage" -> {
        var percent = NumberFormat.getPercentInstance(Locale.US);
        percent.setMinimumFractionDigits(2);
        yield percent.format(value / 100);
      }
      case "decimal" -> new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US))
          .format(value);
      case "integer" -> new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US))
          .format(value);
      default -> null;
    };
  }
}
