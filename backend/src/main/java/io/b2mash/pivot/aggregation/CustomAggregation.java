package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.model.DataType;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An aggregation contributed at runtime through {@link AggregationRegistry}.
 *
 * @param name identifier used in value specs
 * @param label display label
 * @param accumulator creates the running state for one bucket; copies must be independent so
 *     incremental updates stay exact
 * @param dataTypes field types the aggregation applies to; empty means every type
 * @param formatter optional display formatter; null falls back to the default number format
 */
public record CustomAggregation(
    String name,
    String label,
    Supplier<Accumulator> accumulator,
    Set<DataType> dataTypes,
    Function<Number, String> formatter) {

  public CustomAggregation {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Aggregation name must not be blank");
    }
    if (accumulator == null) {
      throw new IllegalArgumentException("Aggregation '" + name + "' needs an accumulator");
    }
    label = label == null || label.isBlank() ? name : label;
    dataTypes = dataTypes == null ? Set.of() : Set.copyOf(dataTypes);
  }

  public static CustomAggregation of(
      String name, Supplier<Accumulator> accumulator, DataType... dataTypes) {
    return new CustomAggregation(name, name, accumulator, Set.of(dataTypes), null);
  }

  public boolean appliesTo(DataType dataType) {
    return dataTypes.isEmpty() || dataTypes.contains(dataType);
  }
}
