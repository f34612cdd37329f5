package io.b2mash.pivot.model;

/**
 * A column of the source dataset. Identity is {@code id}; {@code name} is only used for display
 * and defaults to the id.
 */
public record Field(String id, String name, DataType dataType) {

  public Field {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Field id must not be blank");
    }
    if (name == null || name.isBlank()) {
      name = id;
    }
    if (dataType == null) {
      dataType = DataType.STRING;
    }
  }

  public static Field string(String id) {
    return new Field(id, id, DataType.STRING);
  }

  public static Field number(String id) {
    return new Field(id, id, DataType.NUMBER);
  }

  public static Field date(String id) {
    return new Field(id, id, DataType.DATE);
  }

  public static Field bool(String id) {
    return new Field(id, id, DataType.BOOLEAN);
  }
}
