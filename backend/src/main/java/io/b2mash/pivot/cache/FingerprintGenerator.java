package io.b2mash.pivot.cache;

import io.b2mash.pivot.model.DataValues;
import io.b2mash.pivot.model.ExpandedPaths;
import io.b2mash.pivot.model.FilterSpec;
import io.b2mash.pivot.model.PivotConfiguration;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Derives cache keys from a dataset and a configuration.
 *
 * <p>Only the first and last rows and the row count stand in for the dataset. Two datasets of the
 * same length that differ only in their middle rows therefore share a fingerprint; callers that
 * mutate rows in place must clear the cache.
 */
@Component
public class FingerprintGenerator {

  private static final byte SEPARATOR = 0x1f;

  private final ObjectMapper objectMapper;

  public FingerprintGenerator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String fingerprint(
      List<Map<String, Object>> dataset,
      PivotConfiguration configuration,
      ExpandedPaths expandedPaths) {
    var digest = sha256();
    update(digest, objectMapper.writeValueAsBytes(shapeOf(configuration)));
    update(digest, objectMapper.writeValueAsBytes(sampleOf(dataset)));
    update(digest, Integer.toString(dataset.size()).getBytes(StandardCharsets.UTF_8));
    update(digest, objectMapper.writeValueAsBytes(expandedPaths));
    return HexFormat.of().formatHex(digest.digest());
  }

  /**
   * Filter values are reduced to typed tokens so arbitrary row objects hash stably while 1000 and
   * "1000" stay apart.
   */
  private PivotConfiguration shapeOf(PivotConfiguration configuration) {
    return configuration.withFilters(
        configuration.filters().stream()
            .map(
                filter ->
                    new FilterSpec(
                        filter.field(),
                        filter.operator(),
                        typed(filter.value()),
                        filter.enabled()))
            .toList());
  }

  private List<Map<String, Object>> sampleOf(List<Map<String, Object>> dataset) {
    if (dataset.isEmpty()) {
      return List.of();
    }
    return List.of(signature(dataset.get(0)), signature(dataset.get(dataset.size() - 1)));
  }

  private Map<String, Object> signature(Map<String, Object> row) {
    var sorted = new TreeMap<String, Object>();
    row.forEach((key, value) -> sorted.put(key, typed(value)));
    return sorted;
  }

  /** String form prefixed with the value's kind; collections and maps are converted per element. */
  static Object typed(Object value) {
    if (value instanceof Collection<?> collection) {
      return collection.stream().map(FingerprintGenerator::typed).toList();
    }
    if (value instanceof Map<?, ?> map) {
      var sorted = new TreeMap<String, Object>();
      map.forEach((key, nested) -> sorted.put(String.valueOf(key), typed(nested)));
      return sorted;
    }
    return kindOf(value) + ":" + DataValues.stringify(value);
  }

  private static String kindOf(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof Number) {
      return "number";
    }
    if (value instanceof String) {
      return "string";
    }
    if (value instanceof Boolean) {
      return "boolean";
    }
    return value.getClass().getName();
  }

  private static void update(MessageDigest digest, byte[] bytes) {
    digest.update(bytes);
    digest.update(SEPARATOR);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
