package io.b2mash.pivot.model;

/**
 * A value field with its aggregation.
 *
 * @param field the field whose values are aggregated
 * @param aggregation aggregation identifier (sum, avg, min, max, count, countDistinct); kept as a
 *     string so an unknown identifier is only rejected when the pivot is computed
 * @param displayName optional label; defaults to the field name
 * @param format optional display format (currency, percentage, decimal, integer)
 */
public record ValueSpec(Field field, String aggregation, String displayName, String format) {

  public ValueSpec {
    if (field == null) {
      throw new IllegalArgumentException("Value field must not be null");
    }
  }

  public static ValueSpec of(Field field, String aggregation) {
    return new ValueSpec(field, aggregation, null, null);
  }

  public static ValueSpec of(Field field, String aggregation, String displayName) {
    return new ValueSpec(field, aggregation, displayName, null);
  }

  /** The label used for headers and as the key of aggregated output. */
  public String resolvedDisplayName() {
    return displayName != null && !displayName.isEmpty() ? displayName : field.name();
  }
}
