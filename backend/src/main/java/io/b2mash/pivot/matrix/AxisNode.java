package io.b2mash.pivot.matrix;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A node of the dimension hierarchy of one axis; children keep first-appearance order. */
final class AxisNode {

  private final String key;
  private final List<String> path;
  private final Map<String, AxisNode> children = new LinkedHashMap<>();

  private AxisNode(String key, List<String> path) {
    this.key = key;
    this.path = path;
  }

  /** Builds the hierarchy of the given full-depth tuples under an unlabeled root. */
  static AxisNode rootOf(Collection<List<String>> tuples) {
    var root = new AxisNode("", List.of());
    for (var tuple : tuples) {
      var node = root;
      for (var component : tuple) {
        node = node.child(component);
      }
    }
    return root;
  }

  String key() {
    return key;
  }

  List<String> path() {
    return path;
  }

  /** Depth of this node; the root is -1 and the outermost dimension 0. */
  int level() {
    return path.size() - 1;
  }

  Collection<AxisNode> children() {
    return children.values();
  }

  boolean isLeaf() {
    return children.isEmpty();
  }

  /** Number of lines below this node if every node were expanded. */
  int expandedLineCount(boolean subtotals) {
    if (isLeaf()) {
      return 1;
    }
    int lines = 0;
    for (var child : children.values()) {
      lines += child.expandedLineCount(subtotals);
    }
    return subtotals && !path.isEmpty() ? lines + 1 : lines;
  }

  private AxisNode child(String component) {
    return children.computeIfAbsent(
        component,
        c -> {
          var childPath = new ArrayList<>(path);
          childPath.add(c);
          return new AxisNode(c, List.copyOf(childPath));
        });
  }
}
