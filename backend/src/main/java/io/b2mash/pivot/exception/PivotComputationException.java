package io.b2mash.pivot.exception;

/**
 * Thrown when a pivot cannot be computed. The engine never returns a partially built structure;
 * callers receive either a complete result or this exception.
 */
public class PivotComputationException extends RuntimeException {

  private final String title;
  private final String detail;

  public PivotComputationException(String title, String detail) {
    this(title, detail, null);
  }

  public PivotComputationException(String title, String detail, Throwable cause) {
    super(title + ": " + detail, cause);
    this.title = title;
    this.detail = detail;
  }

  public String getTitle() {
    return title;
  }

  public String getDetail() {
    return detail;
  }
}
