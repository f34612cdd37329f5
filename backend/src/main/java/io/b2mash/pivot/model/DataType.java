package io.b2mash.pivot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Data type of a pivot field, serialized in lower case ("string", "number", ...). */
public enum DataType {
  STRING,
  NUMBER,
  DATE,
  BOOLEAN;

  @JsonValue
  public String id() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static DataType fromId(String id) {
    if (id == null || id.isBlank()) {
      return STRING;
    }
    return DataType.valueOf(id.trim().toUpperCase());
  }
}
