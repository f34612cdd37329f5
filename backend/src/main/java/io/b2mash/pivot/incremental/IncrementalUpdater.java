package io.b2mash.pivot.incremental;

import io.b2mash.pivot.exception.IncrementalUpdateException;
import io.b2mash.pivot.filter.FilterEvaluator;
import io.b2mash.pivot.grouping.GroupingEngine;
import io.b2mash.pivot.matrix.MatrixBuilder;
import io.b2mash.pivot.model.PivotConfiguration;
import io.b2mash.pivot.model.PivotStructure;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges newly arrived rows into a previously computed structure.
 *
 * <p>The new rows are filtered, keyed and fed into copies of the retained accumulators in arrival
 * order, which is the order a full computation over the concatenated dataset would use. The
 * result is therefore identical to recomputing from scratch. The prior structure is not
 * modified.
 */
@Component
public class IncrementalUpdater {

  private static final Logger log = LoggerFactory.getLogger(IncrementalUpdater.class);

  private final FilterEvaluator filterEvaluator;
  private final GroupingEngine groupingEngine;
  private final MatrixBuilder matrixBuilder;

  public IncrementalUpdater(
      FilterEvaluator filterEvaluator, GroupingEngine groupingEngine, MatrixBuilder matrixBuilder) {
    this.filterEvaluator = filterEvaluator;
    this.groupingEngine = groupingEngine;
    this.matrixBuilder = matrixBuilder;
  }

  /**
   * @throws IncrementalUpdateException if the prior structure carries no aggregation state or was
   *     computed with different rows, columns, values or filters
   */
  public PivotStructure update(
      PivotStructure prior, List<Map<String, Object>> deltaRows, PivotConfiguration configuration) {
    long start = System.nanoTime();
    if (prior == null || prior.state() == null) {
      throw new IncrementalUpdateException("The prior structure carries no aggregation state");
    }
    if (!configuration.hasSameShapeAs(prior.state().configuration())) {
      throw new IncrementalUpdateException(
          "Rows, columns, values and filters must match the prior computation");
    }

    var state = prior.state().copy();
    var accepted = filterEvaluator.apply(deltaRows, configuration.filters());
    for (var row : accepted) {
      state.addRow(row, groupingEngine.keysOf(row, configuration.rows(), configuration.columns()));
    }

    var matrix = matrixBuilder.build(state, configuration, prior.expandedPaths());
    double elapsed = (System.nanoTime() - start) / 1_000_000.0;
    log.debug(
        "Merged {} of {} new rows into pivot in {} ms ({} buckets)",
        accepted.size(),
        deltaRows.size(),
        elapsed,
        state.bucketCount());
    return matrix.toStructure(state, prior.expandedPaths(), elapsed);
  }
}
