package io.b2mash.pivot.engine;

import io.b2mash.pivot.aggregation.AggregationRegistry;
import io.b2mash.pivot.aggregation.Aggregator;
import io.b2mash.pivot.cache.CacheStatistics;
import io.b2mash.pivot.cache.FingerprintGenerator;
import io.b2mash.pivot.cache.PivotCache;
import io.b2mash.pivot.config.PivotProperties;
import io.b2mash.pivot.drilldown.DrillDownResolver;
import io.b2mash.pivot.drilldown.ExpansionState;
import io.b2mash.pivot.exception.InvalidPivotConfigurationException;
import io.b2mash.pivot.exception.PivotComputationException;
import io.b2mash.pivot.filter.FilterEvaluator;
import io.b2mash.pivot.grouping.GroupingEngine;
import io.b2mash.pivot.incremental.IncrementalUpdater;
import io.b2mash.pivot.matrix.MatrixBuilder;
import io.b2mash.pivot.model.DataValues;
import io.b2mash.pivot.model.ExpandedPaths;
import io.b2mash.pivot.model.FilterSpec;
import io.b2mash.pivot.model.PivotConfiguration;
import io.b2mash.pivot.model.PivotStructure;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

/**
 * Entry point of the pivot pipeline: filter, group, aggregate and lay out, optionally through the
 * result cache. Each instance owns its cache, so callers that need isolation use separate
 * instances.
 */
@Service
public class PivotEngine {

  private static final Logger log = LoggerFactory.getLogger(PivotEngine.class);

  private static final Comparator<Object> FIELD_VALUE_ORDER =
      Comparator.comparing((Object value) -> !(value instanceof Number))
          .thenComparing(
              (a, b) ->
                  a instanceof Number && b instanceof Number
                      ? Double.compare(DataValues.toNumber(a), DataValues.toNumber(b))
                      : DataValues.stringify(a).compareTo(DataValues.stringify(b)));

  private final FilterEvaluator filterEvaluator;
  private final GroupingEngine groupingEngine;
  private final Aggregator aggregator;
  private final MatrixBuilder matrixBuilder;
  private final FingerprintGenerator fingerprintGenerator;
  private final PivotCache cache;
  private final IncrementalUpdater incrementalUpdater;
  private final DrillDownResolver drillDownResolver;
  private final ConfigurationValidator configurationValidator;
  private final AggregationRegistry aggregationRegistry;
  private final PivotProperties properties;

  public PivotEngine(
      FilterEvaluator filterEvaluator,
      GroupingEngine groupingEngine,
      Aggregator aggregator,
      MatrixBuilder matrixBuilder,
      FingerprintGenerator fingerprintGenerator,
      PivotCache cache,
      IncrementalUpdater incrementalUpdater,
      DrillDownResolver drillDownResolver,
      ConfigurationValidator configurationValidator,
      AggregationRegistry aggregationRegistry,
      PivotProperties properties) {
    this.filterEvaluator = filterEvaluator;
    this.groupingEngine = groupingEngine;
    this.aggregator = aggregator;
    this.matrixBuilder = matrixBuilder;
    this.fingerprintGenerator = fingerprintGenerator;
    this.cache = cache;
    this.incrementalUpdater = incrementalUpdater;
    this.drillDownResolver = drillDownResolver;
    this.configurationValidator = configurationValidator;
    this.aggregationRegistry = aggregationRegistry;
    this.properties = properties;
  }

  /** Wires an engine without a Spring context, with its own cache. */
  public static PivotEngine create(PivotProperties properties) {
    var objectMapper = new ObjectMapper();
    var filterEvaluator = new FilterEvaluator();
    var groupingEngine = new GroupingEngine();
    var matrixBuilder = new MatrixBuilder();
    var aggregationRegistry = new AggregationRegistry();
    return new PivotEngine(
        filterEvaluator,
        groupingEngine,
        new Aggregator(aggregationRegistry),
        matrixBuilder,
        new FingerprintGenerator(objectMapper),
        new PivotCache(properties, objectMapper),
        new IncrementalUpdater(filterEvaluator, groupingEngine, matrixBuilder),
        new DrillDownResolver(filterEvaluator),
        new ConfigurationValidator(aggregationRegistry),
        aggregationRegistry,
        properties);
  }

  /** Computes a pivot with every node expanded. */
  public PivotStructure computePivot(
      List<Map<String, Object>> dataset, PivotConfiguration configuration) {
    return computePivot(dataset, configuration, ExpandedPaths.all());
  }

  /**
   * Runs the full pipeline.
   *
   * @throws InvalidPivotConfigurationException if the configuration has no value fields or no
   *     dimensions
   * @throws PivotComputationException if any stage fails; no partial result is returned
   */
  public PivotStructure computePivot(
      List<Map<String, Object>> dataset,
      PivotConfiguration configuration,
      ExpandedPaths expandedPaths) {
    long start = System.nanoTime();
    requireComputable(configuration);
    var expansion = expandedPaths == null ? ExpandedPaths.all() : expandedPaths;
    try {
      var values = aggregator.resolve(configuration.values());
      var filtered = filterInBatches(dataset, configuration.filters());
      var buckets =
          groupingEngine.groupWithRollups(filtered, configuration.rows(), configuration.columns());
      var state = aggregator.aggregateAll(buckets, filtered, configuration, values);
      var matrix = matrixBuilder.build(state, configuration, expansion);
      double elapsed = (System.nanoTime() - start) / 1_000_000.0;
      log.debug(
          "Computed pivot over {} of {} rows: {} buckets, {}x{} cells in {} ms",
          filtered.size(),
          dataset.size(),
          state.bucketCount(),
          matrix.rowCount(),
          matrix.columnCount(),
          elapsed);
      return matrix.toStructure(state, expansion, elapsed);
    } catch (PivotComputationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Pivot computation failed", e);
      throw new PivotComputationException("Pivot computation failed", e.getMessage(), e);
    }
  }

  public PivotStructure computeCached(
      List<Map<String, Object>> dataset, PivotConfiguration configuration) {
    return computeCached(dataset, configuration, ExpandedPaths.all());
  }

  /** Like {@link #computePivot}, answered from the result cache when an equal input was seen. */
  public PivotStructure computeCached(
      List<Map<String, Object>> dataset,
      PivotConfiguration configuration,
      ExpandedPaths expandedPaths) {
    var expansion = expandedPaths == null ? ExpandedPaths.all() : expandedPaths;
    var fingerprint = fingerprintGenerator.fingerprint(dataset, configuration, expansion);
    var cached = cache.get(fingerprint);
    if (cached.isPresent()) {
      log.debug("Pivot cache hit for {}", fingerprint);
      return cached.get();
    }
    var structure = computePivot(dataset, configuration, expansion);
    cache.put(fingerprint, structure);
    return structure;
  }

  /**
   * Merges new rows into a structure computed earlier by this engine.
   *
   * @throws io.b2mash.pivot.exception.IncrementalUpdateException if the structure cannot be
   *     updated with this configuration
   */
  public PivotStructure updateIncremental(
      PivotStructure prior, List<Map<String, Object>> deltaRows, PivotConfiguration configuration) {
    try {
      return incrementalUpdater.update(prior, deltaRows, configuration);
    } catch (PivotComputationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PivotComputationException("Incremental update failed", e.getMessage(), e);
    }
  }

  public List<Map<String, Object>> drillDown(
      List<Map<String, Object>> dataset,
      PivotConfiguration configuration,
      List<String> rowPath,
      List<String> columnPath) {
    return drillDownResolver.resolve(dataset, configuration, rowPath, columnPath);
  }

  public List<String> validateConfiguration(
      PivotConfiguration configuration, List<Map<String, Object>> dataset) {
    return configurationValidator.validate(configuration, dataset);
  }

  public PivotOutcome evaluate(
      List<Map<String, Object>> dataset, PivotConfiguration configuration) {
    return evaluate(dataset, configuration, ExpandedPaths.all());
  }

  /** Validates, then computes; never throws for bad input. */
  public PivotOutcome evaluate(
      List<Map<String, Object>> dataset,
      PivotConfiguration configuration,
      ExpandedPaths expandedPaths) {
    var errors = validateConfiguration(configuration, dataset);
    if (!errors.isEmpty()) {
      return new PivotOutcome.Rejected(errors.stream().map(PivotError::configuration).toList());
    }
    try {
      return new PivotOutcome.Computed(computePivot(dataset, configuration, expandedPaths));
    } catch (PivotComputationException e) {
      return new PivotOutcome.Rejected(List.of(PivotError.computation(e.getMessage())));
    }
  }

  /**
   * Distinct non-null values of a field, numbers first in ascending order, then everything else
   * by string form.
   */
  public List<Object> getFieldValues(List<Map<String, Object>> dataset, String fieldId) {
    var distinct = new LinkedHashMap<List<String>, Object>();
    for (var row : dataset) {
      var value = row.get(fieldId);
      if (value != null) {
        var kind = value instanceof Number ? "number" : value.getClass().getName();
        distinct.putIfAbsent(List.of(kind, DataValues.stringify(value)), value);
      }
    }
    var values = new ArrayList<>(distinct.values());
    values.sort(FIELD_VALUE_ORDER);
    return values;
  }

  /** A fresh expansion state limited to the configured drill-down depth. */
  public ExpansionState newExpansionState() {
    return ExpansionState.empty(properties.drillDown().maxDepth());
  }

  /** Custom aggregations usable by this engine's computations and validation. */
  public AggregationRegistry aggregationRegistry() {
    return aggregationRegistry;
  }

  public CacheStatistics cacheStatistics() {
    return cache.statistics();
  }

  public void clearCache() {
    cache.clear();
  }

  private void requireComputable(PivotConfiguration configuration) {
    var errors = new ArrayList<String>();
    if (configuration.values().isEmpty()) {
      errors.add(ConfigurationValidator.MISSING_VALUES);
    }
    if (configuration.rows().isEmpty() && configuration.columns().isEmpty()) {
      errors.add(ConfigurationValidator.MISSING_DIMENSIONS);
    }
    if (!errors.isEmpty()) {
      throw new InvalidPivotConfigurationException(errors);
    }
  }

  private List<Map<String, Object>> filterInBatches(
      List<Map<String, Object>> dataset, List<FilterSpec> filters) {
    int batchSize = properties.batchSize();
    var accepted = new ArrayList<Map<String, Object>>();
    for (int from = 0; from < dataset.size(); from += batchSize) {
      int to = Math.min(from + batchSize, dataset.size());
      accepted.addAll(filterEvaluator.apply(dataset.subList(from, to), filters));
      if (to < dataset.size()) {
        Thread.yield();
      }
    }
    return accepted;
  }
}
