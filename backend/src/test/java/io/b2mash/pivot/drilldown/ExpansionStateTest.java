package io.b2mash.pivot.drilldown;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ExpansionStateTest {

  @Test
  void expand_addsPathOnce() {
    var state = ExpansionState.empty(10).expand(List.of("North")).expand(List.of("North"));

    assertThat(state.paths()).containsExactly(List.of("North"));
    assertThat(state.isExpanded(List.of("North"))).isTrue();
  }

  @Test
  void expand_ignoresPathsBeyondMaxDepth() {
    var state = ExpansionState.empty(1).expand(List.of("North", "A"));

    assertThat(state.paths()).isEmpty();
  }

  @Test
  void collapse_removesDescendantsToo() {
    var state =
        ExpansionState.empty(10)
            .expand(List.of("North"))
            .expand(List.of("North", "A"))
            .expand(List.of("South"));

    var collapsed = state.collapse(List.of("North"));

    assertThat(collapsed.paths()).containsExactly(List.of("South"));
    assertThat(state.paths()).hasSize(3);
  }

  @Test
  void toggle_flipsExpansion() {
    var state = ExpansionState.empty(10).toggle(List.of("North"));

    assertThat(state.isExpanded(List.of("North"))).isTrue();
    assertThat(state.toggle(List.of("North")).isExpanded(List.of("North"))).isFalse();
  }

  @Test
  void expandAll_skipsDuplicatesAndTooDeepPaths() {
    var state =
        ExpansionState.of(List.of(List.of("North")), 1)
            .expandAll(List.of(List.of("North"), List.of("South"), List.of("South", "A")));

    assertThat(state.paths()).containsExactly(List.of("North"), List.of("South"));
    assertThat(state.collapseAll().paths()).isEmpty();
  }

  @Test
  void breadcrumbs_startAtAllDataAndFlagExpandedSteps() {
    var state = ExpansionState.empty(10).expand(List.of("North"));

    var trail = state.breadcrumbs(List.of("North", ""));

    assertThat(trail)
        .extracting(Breadcrumb::label)
        .containsExactly("All Data", "North", "(empty)");
    assertThat(trail).extracting(Breadcrumb::collapsible).containsExactly(false, true, false);
    assertThat(trail).extracting(Breadcrumb::current).containsExactly(false, false, true);
    assertThat(trail.get(2).path()).containsExactly("North", "");
  }

  @Test
  void toExpandedPaths_listsExactlyTheExpandedPaths() {
    var expandedPaths = ExpansionState.empty(10).expand(List.of("North")).toExpandedPaths();

    assertThat(expandedPaths.expandAll()).isFalse();
    assertThat(expandedPaths.isExpanded(List.of("North"))).isTrue();
    assertThat(expandedPaths.isExpanded(List.of("South"))).isFalse();
  }
}
