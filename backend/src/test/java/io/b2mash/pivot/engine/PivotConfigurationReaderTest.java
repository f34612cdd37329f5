package io.b2mash.pivot.engine;

import static io.b2mash.pivot.testutil.PivotTestData.REGION;
import static io.b2mash.pivot.testutil.PivotTestData.SALES;
import static io.b2mash.pivot.testutil.PivotTestData.regionProductByQuarter;
import static io.b2mash.pivot.testutil.PivotTestData.withFilter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.pivot.exception.PivotComputationException;
import io.b2mash.pivot.model.DataType;
import io.b2mash.pivot.model.FilterSpec;
import io.b2mash.pivot.model.PivotOptions;
import java.util.List;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

class PivotConfigurationReaderTest {

  private final PivotConfigurationReader reader = new PivotConfigurationReader(new ObjectMapper());

  @Test
  void read_parsesEditorJson() {
    var json =
        """
        {
          "rows": [{"id": "region", "name": "Region", "dataType": "string"}],
          "columns": [],
          "values": [
            {
              "field": {"id": "sales", "name": "Sales", "dataType": "number"},
              "aggregation": "sum",
              "displayName": "Total Sales",
              "format": "currency"
            }
          ],
          "filters": [
            {
              "field": {"id": "region", "name": "Region", "dataType": "string"},
              "operator": "in",
              "value": ["North", "South"],
              "enabled": true
            }
          ],
          "options": {"showGrandTotals": true, "showSubtotals": false}
        }
        """;

    var configuration = reader.read(json);

    assertThat(configuration.rows()).extracting(field -> field.name()).containsExactly("Region");
    assertThat(configuration.values().get(0).field().dataType()).isEqualTo(DataType.NUMBER);
    assertThat(configuration.values().get(0).resolvedDisplayName()).isEqualTo("Total Sales");
    assertThat(configuration.filters().get(0).value()).isEqualTo(List.of("North", "South"));
    assertThat(configuration.options()).isEqualTo(PivotOptions.grandTotals());
  }

  @Test
  void read_keepsUnknownIdentifiersForLaterStages() {
    var json =
        """
        {
          "rows": [{"id": "region"}],
          "values": [{"field": {"id": "sales"}, "aggregation": "median"}],
          "filters": [{"field": {"id": "region"}, "operator": "startsWith", "value": "N"}],
          "options": {"showGrandTotals": false, "showSubtotals": false}
        }
        """;

    var configuration = reader.read(json);

    assertThat(configuration.values().get(0).aggregation()).isEqualTo("median");
    assertThat(configuration.filters().get(0).operator()).isEqualTo("startsWith");
    assertThat(configuration.filters().get(0).active()).isTrue();
    assertThat(configuration.rows().get(0).name()).isEqualTo("region");
    assertThat(configuration.columns()).isEmpty();
  }

  @Test
  void write_producesJsonThatReadsBack() {
    var configuration =
        withFilter(
            regionProductByQuarter(PivotOptions.all()),
            FilterSpec.of(SALES, "greaterThan", 100),
            FilterSpec.of(REGION, "equals", "North").withEnabled(false));

    var json = reader.write(configuration);

    assertThat(json).contains("\"dataType\":\"number\"");
    assertThat(reader.read(json)).isEqualTo(configuration);
  }

  @Test
  void read_rejectsMalformedJson() {
    assertThatThrownBy(() -> reader.read("{\"rows\": ["))
        .isInstanceOfSatisfying(
            PivotComputationException.class,
            e -> assertThat(e.getTitle()).isEqualTo("Invalid pivot configuration JSON"));
  }
}
