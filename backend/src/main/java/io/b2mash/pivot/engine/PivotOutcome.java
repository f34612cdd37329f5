package io.b2mash.pivot.engine;

import io.b2mash.pivot.model.PivotStructure;
import java.util.List;

/** Either a computed structure or the errors that prevented it. */
public sealed interface PivotOutcome permits PivotOutcome.Computed, PivotOutcome.Rejected {

  default boolean isComputed() {
    return this instanceof Computed;
  }

  record Computed(PivotStructure structure) implements PivotOutcome {}

  record Rejected(List<PivotError> errors) implements PivotOutcome {

    public Rejected {
      errors = List.copyOf(errors);
    }
  }
}
