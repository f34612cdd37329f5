package io.b2mash.pivot.engine;

import io.b2mash.pivot.aggregation.AggregationRegistry;
import io.b2mash.pivot.model.Field;
import io.b2mash.pivot.model.FilterSpec;
import io.b2mash.pivot.model.PivotConfiguration;
import io.b2mash.pivot.model.ValueSpec;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Checks a configuration against a dataset without computing anything. Never throws; an empty
 * list means the configuration is usable.
 */
@Component
public class ConfigurationValidator {

  static final String MISSING_VALUES = "At least one value field is required";
  static final String MISSING_DIMENSIONS = "At least one row or column field is required";

  private final AggregationRegistry registry;

  public ConfigurationValidator(AggregationRegistry registry) {
    this.registry = registry;
  }

  public List<String> validate(
      PivotConfiguration configuration, List<Map<String, Object>> dataset) {
    var errors = new ArrayList<String>();
    if (configuration.values().isEmpty()) {
      errors.add(MISSING_VALUES);
    }
    if (configuration.rows().isEmpty() && configuration.columns().isEmpty()) {
      errors.add(MISSING_DIMENSIONS);
    }

    var known = fieldIds(dataset);
    var referenced = new LinkedHashSet<String>();
    Stream.of(
            configuration.rows().stream(),
            configuration.columns().stream(),
            configuration.values().stream().map(ValueSpec::field),
            configuration.filters().stream().map(FilterSpec::field))
        .flatMap(fields -> fields)
        .map(Field::id)
        .forEach(referenced::add);
    for (var id : referenced) {
      if (!known.contains(id)) {
        errors.add("Field '" + id + "' not found in data");
      }
    }

    for (var value : configuration.values()) {
      var aggregation = value.aggregation();
      var field = value.field();
      if (!registry.isKnown(aggregation)) {
        errors.add(
            "Unsupported aggregation '"
                + value.aggregation()
                + "' for value field '"
                + field.id()
                + "'");
      } else if (!registry.isApplicable(aggregation, field.dataType())) {
        errors.add(
            "Aggregation '"
                + aggregation
                + "' is not applicable to "
                + field.dataType().id()
                + " field '"
                + field.id()
                + "'");
      }
    }
    return errors;
  }

  private Set<String> fieldIds(List<Map<String, Object>> dataset) {
    var ids = new HashSet<String>();
    for (var row : dataset) {
      ids.addAll(row.keySet());
    }
    return ids;
  }
}
