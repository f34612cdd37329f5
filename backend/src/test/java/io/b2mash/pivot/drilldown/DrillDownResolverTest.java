package io.b2mash.pivot.drilldown;

import static io.b2mash.pivot.testutil.PivotTestData.SALES;
import static io.b2mash.pivot.testutil.PivotTestData.regionProductByQuarter;
import static io.b2mash.pivot.testutil.PivotTestData.row;
import static io.b2mash.pivot.testutil.PivotTestData.sales;
import static io.b2mash.pivot.testutil.PivotTestData.withFilter;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.pivot.aggregation.AggregationRegistry;
import io.b2mash.pivot.aggregation.Aggregator;
import io.b2mash.pivot.filter.FilterEvaluator;
import io.b2mash.pivot.grouping.GroupingEngine;
import io.b2mash.pivot.matrix.MatrixBuilder;
import io.b2mash.pivot.model.DataValues;
import io.b2mash.pivot.model.ExpandedPaths;
import io.b2mash.pivot.model.FilterSpec;
import io.b2mash.pivot.model.Header;
import io.b2mash.pivot.model.PivotOptions;
import java.util.List;
import org.junit.jupiter.api.Test;

class DrillDownResolverTest {

  private final DrillDownResolver resolver = new DrillDownResolver(new FilterEvaluator());

  @Test
  void resolve_rowPathSelectsContributingRowsInOriginalOrder() {
    var rows = sales();

    var result =
        resolver.resolve(
            rows, regionProductByQuarter(PivotOptions.none()), List.of("North"), List.of());

    assertThat(result).containsExactly(rows.get(0), rows.get(2), rows.get(4));
  }

  @Test
  void resolve_combinesRowAndColumnPaths() {
    var rows = sales();

    var result =
        resolver.resolve(
            rows,
            regionProductByQuarter(PivotOptions.none()),
            List.of("North", "A"),
            List.of("Q2"));

    assertThat(result).containsExactly(rows.get(4));
  }

  @Test
  void resolve_grandTotalPathMatchesEveryRowOnItsAxis() {
    var rows = sales();

    var result =
        resolver.resolve(
            rows,
            regionProductByQuarter(PivotOptions.grandTotals()),
            Header.GRAND_TOTAL_PATH,
            List.of("Q2"));

    assertThat(result).containsExactly(rows.get(2), rows.get(4));
  }

  @Test
  void resolve_emptyPathsMatchEveryFilteredRow() {
    var rows = sales();
    var configuration =
        withFilter(
            regionProductByQuarter(PivotOptions.none()), FilterSpec.of(SALES, "lessThan", 1000));

    var result = resolver.resolve(rows, configuration, List.of(), List.of());

    assertThat(result).containsExactly(rows.get(1), rows.get(3), rows.get(4));
  }

  @Test
  void resolve_pathDeeperThanDimensionsMatchesNothing() {
    var result =
        resolver.resolve(
            sales(),
            regionProductByQuarter(PivotOptions.none()),
            List.of("North", "A", "extra"),
            List.of());

    assertThat(result).isEmpty();
  }

  @Test
  void resolve_emptyKeyMatchesNullValues() {
    var rows = List.of(row("region", null, "sales", 1), row("region", "North", "sales", 2));

    var result =
        resolver.resolve(
            rows, regionProductByQuarter(PivotOptions.none()), List.of(""), List.of());

    assertThat(result).containsExactly(rows.get(0));
  }

  @Test
  void resolve_rowsSumToTheCellTheyWereDrilledFrom() {
    var rows = sales();
    var configuration = regionProductByQuarter(PivotOptions.all());
    var aggregator = new Aggregator(new AggregationRegistry());
    var buckets =
        new GroupingEngine()
            .groupWithRollups(rows, configuration.rows(), configuration.columns());
    var state =
        aggregator.aggregateAll(
            buckets, rows, configuration, aggregator.resolve(configuration.values()));
    var matrix = new MatrixBuilder().build(state, configuration, ExpandedPaths.all());

    // North subtotal row, Q2 column
    var cell = matrix.matrix().get(2).get(1);
    var contributing = resolver.resolve(rows, configuration, List.of("North"), List.of("Q2"));

    double total =
        contributing.stream().mapToDouble(r -> DataValues.toNumber(r.get("sales"))).sum();
    assertThat(cell.value()).isEqualTo(total);
  }
}
