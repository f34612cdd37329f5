package io.b2mash.pivot.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;

/**
 * Coercion rules for the open scalar values found in data rows. Pure utility class with no Spring
 * dependencies.
 */
public final class DataValues {

  /** Label shown for a dimension value that is null, absent or empty. */
  public static final String EMPTY_LABEL = "(empty)";

  private DataValues() {}

  /**
   * String form used for group keys and text comparisons. Null becomes the empty string and
   * integral floating point values drop their fraction, so 1000 and 1000.0 group together.
   */
  public static String stringify(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof String s) {
      return s;
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return Double.toString(d);
      }
      return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
    if (value instanceof BigDecimal bd) {
      return bd.signum() == 0 ? "0" : bd.stripTrailingZeros().toPlainString();
    }
    if (value instanceof Date date) {
      return date.toInstant().toString();
    }
    return value.toString();
  }

  /** Display label for a dimension key. */
  public static String label(String key) {
    return key == null || key.isEmpty() ? EMPTY_LABEL : key;
  }

  /**
   * Numeric coercion used by comparison filters. Returns {@link Double#NaN} when the value has no
   * numeric reading, so every comparison against it is false.
   */
  public static double toNumber(Object value) {
    if (value == null) {
      return Double.NaN;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof Boolean b) {
      return b ? 1 : 0;
    }
    if (value instanceof String s) {
      var trimmed = s.trim();
      if (trimmed.isEmpty()) {
        return Double.NaN;
      }
      try {
        return Double.parseDouble(trimmed);
      } catch (NumberFormatException e) {
        return Double.NaN;
      }
    }
    if (value instanceof Instant instant) {
      return instant.toEpochMilli();
    }
    if (value instanceof LocalDate localDate) {
      return localDate.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
    if (value instanceof LocalDateTime localDateTime) {
      return localDateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
    }
    if (value instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant().toEpochMilli();
    }
    if (value instanceof ZonedDateTime zonedDateTime) {
      return zonedDateTime.toInstant().toEpochMilli();
    }
    if (value instanceof Date date) {
      return date.getTime();
    }
    return Double.NaN;
  }

  /**
   * Finite numeric value for aggregation, or null when the value must be excluded. Only real
   * numbers qualify; numeric-looking strings do not.
   */
  public static Double asFiniteNumber(Object value) {
    if (value instanceof Number n) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? d : null;
    }
    return null;
  }

  /**
   * Equality without coercion. Numbers are compared by value so that an Integer read from JSON
   * matches a Long or Double held by a row.
   */
  public static boolean sameValue(Object left, Object right) {
    if (left instanceof Number a && right instanceof Number b) {
      if (isIntegral(a) && isIntegral(b)) {
        return toBigInteger(a).equals(toBigInteger(b));
      }
      if (isNonFinite(a) || isNonFinite(b)) {
        return a.doubleValue() == b.doubleValue();
      }
      if (a instanceof BigDecimal || b instanceof BigDecimal) {
        return toBigDecimal(a).compareTo(toBigDecimal(b)) == 0;
      }
      return a.doubleValue() == b.doubleValue();
    }
    return Objects.equals(left, right);
  }

  /** True for null, absent and the empty string. */
  public static boolean isEmpty(Object value) {
    return value == null || (value instanceof String s && s.isEmpty());
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Integer
        || n instanceof Long
        || n instanceof Short
        || n instanceof Byte
        || n instanceof BigInteger;
  }

  private static boolean isNonFinite(Number n) {
    return (n instanceof Double || n instanceof Float) && !Double.isFinite(n.doubleValue());
  }

  private static BigInteger toBigInteger(Number n) {
    return n instanceof BigInteger bi ? bi : BigInteger.valueOf(n.longValue());
  }

  private static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal bd) {
      return bd;
    }
    if (n instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (isIntegral(n)) {
      return BigDecimal.valueOf(n.longValue());
    }
    return BigDecimal.valueOf(n.doubleValue());
  }
}
