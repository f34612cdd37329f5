package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.model.DataType;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Supported reductions, identified by the strings used in configurations. */
public enum Aggregation {
  SUM("sum"),
  AVG("avg"),
  MIN("min"),
  MAX("max"),
  COUNT("count"),
  COUNT_DISTINCT("countDistinct");

  private final String id;

  Aggregation(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static Optional<Aggregation> find(String id) {
    return Arrays.stream(values()).filter(a -> a.id.equals(id)).findFirst();
  }

  public Accumulator newAccumulator() {
    return switch (this) {
      case SUM -> new Accumulator.Sum();
      case AVG -> new Accumulator.Average();
      case MIN -> new Accumulator.Extreme(false);
      case MAX -> new Accumulator.Extreme(true);
      case COUNT -> new Accumulator.Count();
      case COUNT_DISTINCT -> new Accumulator.CountDistinct();
    };
  }

  /** Aggregations that make sense for a field of the given type. */
  public static List<Aggregation> applicableTo(DataType dataType) {
    return switch (dataType) {
      case NUMBER -> List.of(SUM, COUNT, AVG, MIN, MAX, COUNT_DISTINCT);
      case DATE -> List.of(COUNT, COUNT_DISTINCT, MIN, MAX);
      case STRING, BOOLEAN -> List.of(COUNT, COUNT_DISTINCT);
    };
  }

  public static Aggregation defaultFor(DataType dataType) {
    return dataType == DataType.NUMBER ? SUM : COUNT;
  }
}
