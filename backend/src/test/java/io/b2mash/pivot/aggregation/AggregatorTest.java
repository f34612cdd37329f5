package io.b2mash.pivot.aggregation;

import static io.b2mash.pivot.testutil.PivotTestData.REGION;
import static io.b2mash.pivot.testutil.PivotTestData.SALES;
import static io.b2mash.pivot.testutil.PivotTestData.row;
import static io.b2mash.pivot.testutil.PivotTestData.sales;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.pivot.exception.UnsupportedAggregationException;
import io.b2mash.pivot.grouping.Bucket;
import io.b2mash.pivot.grouping.GroupKey;
import io.b2mash.pivot.grouping.GroupingEngine;
import io.b2mash.pivot.model.DataType;
import io.b2mash.pivot.model.ValueSpec;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AggregatorTest {

  private final AggregationRegistry registry = new AggregationRegistry();
  private final Aggregator aggregator = new Aggregator(registry);
  private final GroupingEngine groupingEngine = new GroupingEngine();

  @Test
  void aggregate_northRegionSalesFigures() {
    var rows = sales();
    var north = bucket(rows, "North");

    var result =
        aggregator.aggregate(
            north,
            rows,
            List.of(
                ValueSpec.of(SALES, "sum", "Total"),
                ValueSpec.of(SALES, "avg", "Average"),
                ValueSpec.of(SALES, "min", "Lowest"),
                ValueSpec.of(SALES, "max", "Highest"),
                ValueSpec.of(SALES, "count", "Orders")));

    assertThat(result.get("Total").value()).isEqualTo(3000.0);
    assertThat(result.get("Average").value()).isEqualTo(1000.0);
    assertThat(result.get("Lowest").value()).isEqualTo(800.0);
    assertThat(result.get("Highest").value()).isEqualTo(1200.0);
    assertThat(result.get("Orders").value()).isEqualTo(3L);
    assertThat(result.get("Total").rowCount()).isEqualTo(3);
  }

  @Test
  void aggregate_numericAggregationsSkipNonNumericValues() {
    var rows =
        List.of(
            row("region", "X", "sales", 10),
            row("region", "X", "sales", "20"),
            row("region", "X", "sales", null),
            row("region", "X", "sales", Double.NaN),
            row("region", "X", "sales", 30.5));
    var bucket = bucket(rows, "X");

    var result =
        aggregator.aggregate(
            bucket,
            rows,
            List.of(
                ValueSpec.of(SALES, "sum", "sum"),
                ValueSpec.of(SALES, "avg", "avg"),
                ValueSpec.of(SALES, "count", "count")));

    assertThat(result.get("sum").value()).isEqualTo(40.5);
    assertThat(result.get("avg").value()).isEqualTo(20.25);
    assertThat(result.get("count").value()).isEqualTo(5L);
  }

  @Test
  void aggregate_withoutNumericValuesYieldsZero() {
    var rows = List.of(row("region", "X", "sales", "n/a"), row("region", "X"));
    var bucket = bucket(rows, "X");

    var result =
        aggregator.aggregate(
            bucket,
            rows,
            List.of(
                ValueSpec.of(SALES, "sum", "sum"),
                ValueSpec.of(SALES, "avg", "avg"),
                ValueSpec.of(SALES, "min", "min"),
                ValueSpec.of(SALES, "max", "max")));

    assertThat(result.values()).extracting(AggregatedValue::value).containsOnly(0.0);
  }

  @Test
  void aggregate_countDistinctIgnoresNullAndComparesStringForms() {
    var rows =
        List.of(
            row("region", "X", "sales", 1),
            row("region", "X", "sales", 1.0),
            row("region", "X", "sales", "1"),
            row("region", "X", "sales", null),
            row("region", "X", "sales", 2));
    var bucket = bucket(rows, "X");

    var result =
        aggregator.aggregate(bucket, rows, List.of(ValueSpec.of(SALES, "countDistinct", "n")));

    assertThat(result.get("n").value()).isEqualTo(2L);
  }

  @Test
  void aggregate_unsupportedAggregationThrows() {
    var rows = sales();
    var north = bucket(rows, "North");

    assertThatThrownBy(
            () -> aggregator.aggregate(north, rows, List.of(ValueSpec.of(SALES, "median"))))
        .isInstanceOf(UnsupportedAggregationException.class)
        .hasMessageContaining("median")
        .hasMessageContaining("sales");
  }

  @Test
  void aggregate_usesRegisteredCustomAggregation() {
    registry.register(CustomAggregation.of("range", Range::new, DataType.NUMBER));
    var rows = sales();

    var result =
        aggregator.aggregate(bucket(rows, "North"), rows, List.of(ValueSpec.of(SALES, "range")));

    assertThat(result.get("sales").value()).isEqualTo(400.0);
  }

  @Test
  void aggregate_builtInIdentifiersTakePrecedence() {
    assertThatThrownBy(
            () -> registry.register(CustomAggregation.of("sum", Range::new, DataType.NUMBER)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("built in");
  }

  @Test
  void aggregate_unregisteredCustomAggregationIsUnsupported() {
    registry.register(CustomAggregation.of("range", Range::new));
    registry.unregister("range");
    var rows = sales();

    var north = bucket(rows, "North");

    assertThatThrownBy(
            () -> aggregator.aggregate(north, rows, List.of(ValueSpec.of(SALES, "range"))))
        .isInstanceOf(UnsupportedAggregationException.class);
  }

  @Test
  void aggregate_laterDuplicateDisplayNameWins() {
    var rows = sales();
    var north = bucket(rows, "North");

    var result =
        aggregator.aggregate(
            north,
            rows,
            List.of(ValueSpec.of(SALES, "sum", "Sales"), ValueSpec.of(SALES, "max", "Sales")));

    assertThat(result).hasSize(1);
    assertThat(result.get("Sales").value()).isEqualTo(1200.0);
  }

  @Test
  void aggregate_defaultDisplayNameIsFieldName() {
    var rows = sales();

    var result =
        aggregator.aggregate(bucket(rows, "South"), rows, List.of(ValueSpec.of(SALES, "sum")));

    assertThat(result).containsOnlyKeys("sales");
    assertThat(result.get("sales").value()).isEqualTo(1200.0);
  }

  @Test
  void accumulatorCopy_advancesIndependently() {
    var original = Aggregation.AVG.newAccumulator();
    original.add(10);
    var copy = original.copy();

    copy.add(20);

    assertThat(original.result()).isEqualTo(10.0);
    assertThat(copy.result()).isEqualTo(15.0);
  }

  @Test
  void applicableTo_limitsTextFieldsToCounts() {
    assertThat(Aggregation.applicableTo(DataType.STRING))
        .containsExactly(Aggregation.COUNT, Aggregation.COUNT_DISTINCT);
    assertThat(Aggregation.applicableTo(DataType.DATE)).contains(Aggregation.MIN, Aggregation.MAX);
    assertThat(Aggregation.defaultFor(DataType.NUMBER)).isEqualTo(Aggregation.SUM);
    assertThat(Aggregation.defaultFor(DataType.BOOLEAN)).isEqualTo(Aggregation.COUNT);
  }

  /** Spread between the largest and smallest numeric value. */
  static final class Range implements Accumulator {
    private final Accumulator min;
    private final Accumulator max;

    Range() {
      this(Aggregation.MIN.newAccumulator(), Aggregation.MAX.newAccumulator());
    }

    private Range(Accumulator min, Accumulator max) {
      this.min = min;
      this.max = max;
    }

    @Override
    public void add(Object value) {
      min.add(value);
      max.add(value);
    }

    @Override
    public Number result() {
      return max.result().doubleValue() - min.result().doubleValue();
    }

    @Override
    public Accumulator copy() {
      return new Range(min.copy(), max.copy());
    }
  }

  private Bucket bucket(List<Map<String, Object>> rows, String region) {
    return groupingEngine
        .group(rows, List.of(REGION), List.of())
        .get(new GroupKey(List.of(region), List.of()));
  }
}
