package io.b2mash.pivot.model;

import java.util.List;

/**
 * One matrix cell. {@code path} is the owning row path, then the column path, then the value
 * field id; together they identify the cell uniquely.
 */
public record Cell(Object value, String formattedValue, CellType type, List<String> path) {

  public Cell {
    path = path == null ? List.of() : List.copyOf(path);
    formattedValue = formattedValue == null ? "" : formattedValue;
  }

  public static Cell empty(List<String> path) {
    return new Cell(null, "", CellType.EMPTY, path);
  }

  public boolean isEmpty() {
    return type == CellType.EMPTY;
  }
}
