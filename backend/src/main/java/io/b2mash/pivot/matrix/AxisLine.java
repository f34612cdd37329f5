package io.b2mash.pivot.matrix;

import io.b2mash.pivot.model.Header;
import java.util.List;

/** One visible line of an axis and the key prefix whose aggregate it shows. */
record AxisLine(List<String> path, LineType type) {

  /** Path used in headers and cells; grand total lines carry the reserved grand total key. */
  List<String> displayPath() {
    return type == LineType.GRAND_TOTAL ? Header.GRAND_TOTAL_PATH : path;
  }
}
