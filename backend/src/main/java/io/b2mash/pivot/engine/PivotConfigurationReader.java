package io.b2mash.pivot.engine;

import io.b2mash.pivot.exception.PivotComputationException;
import io.b2mash.pivot.model.PivotConfiguration;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/** Reads and writes the JSON form of {@link PivotConfiguration}. */
@Component
public class PivotConfigurationReader {

  private final ObjectMapper objectMapper;

  public PivotConfigurationReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public PivotConfiguration read(String json) {
    try {
      return objectMapper.readValue(json, PivotConfiguration.class);
    } catch (JacksonException e) {
      throw new PivotComputationException(
          "Invalid pivot configuration JSON", e.getOriginalMessage(), e);
    }
  }

  public String write(PivotConfiguration configuration) {
    return objectMapper.writeValueAsString(configuration);
  }
}
