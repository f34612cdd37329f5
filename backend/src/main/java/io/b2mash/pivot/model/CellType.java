package io.b2mash.pivot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of a matrix cell, serialized with the identifiers used by renderers. */
public enum CellType {
  DATA("data"),
  SUBTOTAL("subtotal"),
  TOTAL("total"),
  GRAND_TOTAL("grandTotal"),
  EMPTY("empty");

  private final String id;

  CellType(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }
}
