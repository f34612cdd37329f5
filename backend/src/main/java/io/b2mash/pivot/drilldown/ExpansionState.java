package io.b2mash.pivot.drilldown;

import io.b2mash.pivot.model.DataValues;
import io.b2mash.pivot.model.ExpandedPaths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable set of expanded header paths. Every operation returns a new state; paths keep the
 * order in which they were expanded.
 */
public final class ExpansionState {

  private static final Logger log = LoggerFactory.getLogger(ExpansionState.class);

  static final String ROOT_LABEL = "All Data";

  private final List<List<String>> paths;
  private final int maxDepth;

  private ExpansionState(List<List<String>> paths, int maxDepth) {
    this.paths = List.copyOf(paths);
    this.maxDepth = maxDepth;
  }

  public static ExpansionState empty(int maxDepth) {
    return new ExpansionState(List.of(), maxDepth);
  }

  public static ExpansionState of(List<List<String>> paths, int maxDepth) {
    return empty(maxDepth).expandAll(paths);
  }

  public List<List<String>> paths() {
    return paths;
  }

  public int maxDepth() {
    return maxDepth;
  }

  public boolean isExpanded(List<String> path) {
    return paths.contains(path);
  }

  /** Adds a path. Paths deeper than the maximum depth are ignored with a warning. */
  public ExpansionState expand(List<String> path) {
    if (path.size() > maxDepth) {
      log.warn("Maximum drill-down depth ({}) exceeded by path {}", maxDepth, path);
      return this;
    }
    if (isExpanded(path)) {
      return this;
    }
    var next = new ArrayList<>(paths);
    next.add(List.copyOf(path));
    return new ExpansionState(next, maxDepth);
  }

  /** Removes a path and every path beneath it. */
  public ExpansionState collapse(List<String> path) {
    if (!isExpanded(path)) {
      return this;
    }
    var next =
        paths.stream()
            .filter(expanded -> !expanded.equals(path) && !isDescendant(expanded, path))
            .toList();
    return new ExpansionState(next, maxDepth);
  }

  public ExpansionState toggle(List<String> path) {
    return isExpanded(path) ? collapse(path) : expand(path);
  }

  /** Adds every path within the maximum depth that is not already expanded. */
  public ExpansionState expandAll(List<List<String>> candidates) {
    var next = new ArrayList<>(paths);
    for (var path : candidates) {
      if (path.size() <= maxDepth && !next.contains(path)) {
        next.add(List.copyOf(path));
      }
    }
    return new ExpansionState(next, maxDepth);
  }

  public ExpansionState collapseAll() {
    return empty(maxDepth);
  }

  /** Trail from the root to {@code path}, the root step labelled "All Data". */
  public List<Breadcrumb> breadcrumbs(List<String> path) {
    var trail = new ArrayList<Breadcrumb>(path.size() + 1);
    trail.add(new Breadcrumb(ROOT_LABEL, List.of(), path.isEmpty(), false));
    for (int i = 0; i < path.size(); i++) {
      var prefix = List.copyOf(path.subList(0, i + 1));
      trail.add(
          new Breadcrumb(
              DataValues.label(path.get(i)), prefix, i == path.size() - 1, isExpanded(prefix)));
    }
    return trail;
  }

  public ExpandedPaths toExpandedPaths() {
    return ExpandedPaths.of(paths);
  }

  private static boolean isDescendant(List<String> candidate, List<String> ancestor) {
    return candidate.size() > ancestor.size()
        && candidate.subList(0, ancestor.size()).equals(ancestor);
  }
}
