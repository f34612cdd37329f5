package io.b2mash.pivot.model;

/**
 * A row predicate. {@code value} is operator specific: a scalar, a collection for {@code in} /
 * {@code notIn}, or a map with {@code min} and {@code max} for {@code between}.
 */
public record FilterSpec(Field field, String operator, Object value, Boolean enabled) {

  public FilterSpec {
    if (field == null) {
      throw new IllegalArgumentException("Filter field must not be null");
    }
  }

  public static FilterSpec of(Field field, String operator, Object value) {
    return new FilterSpec(field, operator, value, null);
  }

  /** A filter without an explicit flag is active. */
  public boolean active() {
    return enabled == null || enabled;
  }

  public FilterSpec withEnabled(boolean enabled) {
    return new FilterSpec(field, operator, value, enabled);
  }
}
