package io.b2mash.pivot.exception;

/** Thrown for an aggregation identifier the engine does not implement. */
public class UnsupportedAggregationException extends PivotComputationException {

  private final String aggregation;

  public UnsupportedAggregationException(String aggregation, String fieldId) {
    super(
        "Unsupported aggregation",
        "Unknown aggregation type '" + aggregation + "' for value field '" + fieldId + "'");
    this.aggregation = aggregation;
  }

  public String getAggregation() {
    return aggregation;
  }
}
