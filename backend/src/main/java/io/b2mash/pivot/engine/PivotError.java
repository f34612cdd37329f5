package io.b2mash.pivot.engine;

/** A reason a pivot could not be produced. */
public record PivotError(Kind kind, String message) {

  public enum Kind {
    CONFIGURATION,
    COMPUTATION
  }

  public static PivotError configuration(String message) {
    return new PivotError(Kind.CONFIGURATION, message);
  }

  public static PivotError computation(String message) {
    return new PivotError(Kind.COMPUTATION, message);
  }
}
