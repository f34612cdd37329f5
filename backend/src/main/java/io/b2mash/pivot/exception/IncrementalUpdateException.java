package io.b2mash.pivot.exception;

/** Thrown when new rows cannot be merged into a previously computed structure. */
public class IncrementalUpdateException extends PivotComputationException {

  public IncrementalUpdateException(String detail) {
    super("Incremental update not applicable", detail);
  }
}
