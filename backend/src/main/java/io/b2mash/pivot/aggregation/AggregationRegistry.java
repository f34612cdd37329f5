package io.b2mash.pivot.aggregation;

import io.b2mash.pivot.exception.UnsupportedAggregationException;
import io.b2mash.pivot.model.DataType;
import io.b2mash.pivot.model.ValueSpec;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Custom aggregations available next to the built-in ones. Built-in identifiers always win and
 * cannot be registered.
 */
@Component
public class AggregationRegistry {

  private static final Logger log = LoggerFactory.getLogger(AggregationRegistry.class);

  private final Map<String, CustomAggregation> custom = new ConcurrentHashMap<>();

  /** Adds or replaces a custom aggregation. */
  public void register(CustomAggregation aggregation) {
    if (Aggregation.find(aggregation.name()).isPresent()) {
      throw new IllegalArgumentException(
          "Aggregation '" + aggregation.name() + "' is built in and cannot be replaced");
    }
    if (custom.put(aggregation.name(), aggregation) != null) {
      log.info("Replaced custom aggregation '{}'", aggregation.name());
    } else {
      log.debug("Registered custom aggregation '{}'", aggregation.name());
    }
  }

  public void unregister(String name) {
    custom.remove(name);
  }

  public Optional<CustomAggregation> get(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(custom.get(name));
  }

  /** Every custom aggregation, ordered by name. */
  public List<CustomAggregation> getAll() {
    return custom.values().stream().sorted(Comparator.comparing(CustomAggregation::name)).toList();
  }

  public List<CustomAggregation> getForDataType(DataType dataType) {
    return getAll().stream().filter(aggregation -> aggregation.appliesTo(dataType)).toList();
  }

  /** Whether the identifier names a built-in or a registered aggregation. */
  public boolean isKnown(String name) {
    return Aggregation.find(name).isPresent() || get(name).isPresent();
  }

  /** Whether the identified aggregation may be applied to a field of the given type. */
  public boolean isApplicable(String name, DataType dataType) {
    var builtIn = Aggregation.find(name);
    if (builtIn.isPresent()) {
      return Aggregation.applicableTo(dataType).contains(builtIn.get());
    }
    return get(name).map(aggregation -> aggregation.appliesTo(dataType)).orElse(false);
  }

  /**
   * Resolves the aggregation of a value spec, built-in first.
   *
   * @throws UnsupportedAggregationException if the identifier is neither built in nor registered
   */
  public ResolvedValue resolve(ValueSpec spec) {
    var builtIn = Aggregation.find(spec.aggregation());
    if (builtIn.isPresent()) {
      return ResolvedValue.builtIn(spec, builtIn.get());
    }
    return get(spec.aggregation())
        .map(aggregation -> ResolvedValue.custom(spec, aggregation))
        .orElseThrow(
            () -> new UnsupportedAggregationException(spec.aggregation(), spec.field().id()));
  }
}
