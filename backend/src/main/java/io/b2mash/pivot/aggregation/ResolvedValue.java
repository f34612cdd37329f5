package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.model.ValueSpec;

/**
 * A value spec whose aggregation identifier has been checked. Exactly one of {@code aggregation}
 * and {@code custom} is set.
 */
public record ResolvedValue(ValueSpec spec, Aggregation aggregation, CustomAggregation custom) {

  public static ResolvedValue builtIn(ValueSpec spec, Aggregation aggregation) {
    return new ResolvedValue(spec, aggregation, null);
  }

  public static ResolvedValue custom(ValueSpec spec, CustomAggregation custom) {
    return new ResolvedValue(spec, null, custom);
  }

  public String fieldId() {
    return spec.field().id();
  }

  public String displayName() {
    return spec.resolvedDisplayName();
  }

  public Accumulator newAccumulator() {
    return custom != null ? custom.accumulator().get() : aggregation.newAccumulator();
  }

  /** Display text of a result of this value. */
  public String format(Number result) {
    if (custom != null && custom.formatter() != null && result != null) {
      return custom.formatter().apply(result);
    }
    return ValueFormatter.format(result, aggregation, spec.format());
  }
}
