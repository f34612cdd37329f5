package io.b2mash.pivot.filter;

import static io.b2mash.pivot.testutil.PivotTestData.PRODUCT;
import static io.b2mash.pivot.testutil.PivotTestData.REGION;
import static io.b2mash.pivot.testutil.PivotTestData.SALES;
import static io.b2mash.pivot.testutil.PivotTestData.row;
import static io.b2mash.pivot.testutil.PivotTestData.sales;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.pivot.model.FilterSpec;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FilterEvaluatorTest {

  private final FilterEvaluator evaluator = new FilterEvaluator();

  @Test
  void apply_equalsComparesNumbersByValue() {
    var result = evaluator.apply(sales(), List.of(FilterSpec.of(SALES, "equals", 1000L)));

    assertThat(result).extracting(r -> r.get("sales")).containsExactly(1000);
  }

  @Test
  void apply_equalsDoesNotCoerceStrings() {
    var result = evaluator.apply(sales(), List.of(FilterSpec.of(SALES, "equals", "1000")));

    assertThat(result).isEmpty();
  }

  @Test
  void apply_nonFiniteValuesCompareAgainstDecimalFilterValues() {
    var rows =
        List.of(
            row("sales", Double.NaN),
            row("sales", Double.POSITIVE_INFINITY),
            row("sales", 5),
            row("sales", 1.0f));

    var notOne = evaluator.apply(rows, List.of(FilterSpec.of(SALES, "notEquals", BigDecimal.ONE)));
    var one = evaluator.apply(rows, List.of(FilterSpec.of(SALES, "equals", BigDecimal.ONE)));
    var candidates = List.of(new BigDecimal("5"), BigDecimal.TEN);
    var listed = evaluator.apply(rows, List.of(FilterSpec.of(SALES, "in", candidates)));

    assertThat(notOne).containsExactly(rows.get(0), rows.get(1), rows.get(2));
    assertThat(one).containsExactly(rows.get(3));
    assertThat(listed).containsExactly(rows.get(2));
  }

  @Test
  void apply_notEqualsKeepsEverythingElse() {
    var result = evaluator.apply(sales(), List.of(FilterSpec.of(REGION, "notEquals", "North")));

    assertThat(result).extracting(r -> r.get("region")).containsOnly("South").hasSize(2);
  }

  @Test
  void apply_containsIsCaseInsensitive() {
    var result = evaluator.apply(sales(), List.of(FilterSpec.of(REGION, "contains", "ORT")));

    assertThat(result).hasSize(3).allMatch(r -> r.get("region").equals("North"));
  }

  @Test
  void apply_notContainsTreatsNullAsEmptyString() {
    var rows = List.of(row("region", null), row("region", "North"));

    var result = evaluator.apply(rows, List.of(FilterSpec.of(REGION, "notContains", "north")));

    assertThat(result).containsExactly(rows.get(0));
  }

  @Test
  void apply_numericComparisonsCoerceBothSides() {
    var rows = List.of(row("sales", "1500"), row("sales", 900), row("sales", "n/a"));

    assertThat(evaluator.apply(rows, List.of(FilterSpec.of(SALES, "greaterThan", "1000"))))
        .containsExactly(rows.get(0));
    assertThat(evaluator.apply(rows, List.of(FilterSpec.of(SALES, "lessThan", 1000))))
        .containsExactly(rows.get(1));
    assertThat(evaluator.apply(rows, List.of(FilterSpec.of(SALES, "greaterThanOrEqual", 900))))
        .containsExactly(rows.get(0), rows.get(1));
    assertThat(evaluator.apply(rows, List.of(FilterSpec.of(SALES, "lessThanOrEqual", 900))))
        .containsExactly(rows.get(1));
  }

  @Test
  void apply_inRequiresACollection() {
    assertThat(
            evaluator.apply(sales(), List.of(FilterSpec.of(PRODUCT, "in", List.of("B", "C")))))
        .hasSize(2);
    assertThat(evaluator.apply(sales(), List.of(FilterSpec.of(PRODUCT, "in", "B")))).isEmpty();
    assertThat(evaluator.apply(sales(), List.of(FilterSpec.of(PRODUCT, "notIn", "B"))))
        .isEmpty();
  }

  @Test
  void apply_notInExcludesListedValues() {
    var result =
        evaluator.apply(sales(), List.of(FilterSpec.of(SALES, "notIn", List.of(500, 700))));

    assertThat(result).extracting(r -> r.get("region")).containsOnly("North");
  }

  @Test
  void apply_betweenIsInclusive() {
    var range = Map.of("min", 700, "max", 1000);

    var result = evaluator.apply(sales(), List.of(FilterSpec.of(SALES, "between", range)));

    assertThat(result).extracting(r -> r.get("sales")).containsExactly(1000, 700, 800);
  }

  @Test
  void apply_betweenRejectsMalformedRange() {
    var result =
        evaluator.apply(sales(), List.of(FilterSpec.of(SALES, "between", Map.of("min", 0))));

    assertThat(result).isEmpty();
  }

  @Test
  void apply_isEmptyMatchesNullAbsentAndEmptyString() {
    var rows =
        List.of(row("region", null), row("product", "A"), row("region", ""), row("region", "x"));

    assertThat(evaluator.apply(rows, List.of(FilterSpec.of(REGION, "isEmpty", null))))
        .containsExactly(rows.get(0), rows.get(1), rows.get(2));
    assertThat(evaluator.apply(rows, List.of(FilterSpec.of(REGION, "isNotEmpty", null))))
        .containsExactly(rows.get(3));
  }

  @Test
  void apply_skipsDisabledFilters() {
    var disabled = FilterSpec.of(REGION, "equals", "Nowhere").withEnabled(false);

    assertThat(evaluator.apply(sales(), List.of(disabled))).hasSize(5);
  }

  @Test
  void apply_unknownOperatorLetsRowsThrough() {
    var result = evaluator.apply(sales(), List.of(FilterSpec.of(REGION, "startsWith", "N")));

    assertThat(result).hasSize(5);
  }

  @Test
  void apply_combinesFiltersWithAndInAnyOrder() {
    var north = FilterSpec.of(REGION, "equals", "North");
    var productA = FilterSpec.of(PRODUCT, "equals", "A");

    var forward = evaluator.apply(sales(), List.of(north, productA));
    var reverse = evaluator.apply(sales(), List.of(productA, north));

    assertThat(forward).hasSize(2).isEqualTo(reverse);
  }

  @Test
  void apply_doesNotModifyInput() {
    var rows = new ArrayList<>(sales());

    evaluator.apply(rows, List.of(FilterSpec.of(REGION, "equals", "North")));

    assertThat(rows).hasSize(5);
    assertThat(rows.get(1).get("region")).isEqualTo("South");
  }
}
