package io.b2mash.pivot.exception;

import java.util.List;

/**
 * Thrown by the compute path for a configuration that cannot produce a meaningful pivot (no
 * value fields, or neither row nor column fields).
 */
public class InvalidPivotConfigurationException extends PivotComputationException {

  private final List<String> errors;

  public InvalidPivotConfigurationException(List<String> errors) {
    super("Invalid pivot configuration", String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> getErrors() {
    return errors;
  }
}
