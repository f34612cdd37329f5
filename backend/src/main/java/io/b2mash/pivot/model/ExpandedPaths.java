package io.b2mash.pivot.model;

import java.util.List;

/**
 * The header paths a caller wants expanded. A node whose full path is not listed is collapsed
 * and its descendants fold into its own line. {@link #all()} expands every node.
 */
public record ExpandedPaths(boolean expandAll, List<List<String>> paths) {

  private static final ExpandedPaths ALL = new ExpandedPaths(true, List.of());
  private static final ExpandedPaths NONE = new ExpandedPaths(false, List.of());

  public ExpandedPaths {
    paths = paths == null ? List.of() : paths.stream().map(List::copyOf).toList();
  }

  public static ExpandedPaths all() {
    return ALL;
  }

  public static ExpandedPaths none() {
    return NONE;
  }

  public static ExpandedPaths of(List<List<String>> paths) {
    return new ExpandedPaths(false, paths);
  }

  public boolean isExpanded(List<String> path) {
    return expandAll || paths.contains(path);
  }
}
