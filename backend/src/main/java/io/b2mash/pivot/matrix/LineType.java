package io.b2mash.pivot.matrix;

/** What a matrix row or column line shows along one axis. */
enum LineType {
  /** A leaf combination, or a collapsed node folding its whole subtree. */
  DATA,
  /** The aggregate of an expanded node, placed after its last child. */
  SUBTOTAL,
  /** The aggregate of the whole axis. */
  GRAND_TOTAL
}
