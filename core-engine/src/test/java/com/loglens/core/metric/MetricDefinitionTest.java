package com.loglens.core.metric;

import com.loglens.core.config.ConfigurationException;
import com.loglens.core.expression.EventPredicate;
import com.loglens.core.window.WindowSpec;
import com.loglens.core.window.WindowType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricDefinition.Builder}.
 */
class MetricDefinitionTest {

    @Test
    @DisplayName("Should resolve aggregation and window from configuration text")
    void shouldResolveConfigurationText() {
        MetricDefinition definition = MetricDefinition.builder()
                .name("p99_latency")
                .aggregation("percentile", 99.0)
                .window("30s", "tumbling")
                .valueExtractor(event -> 1.0)
                .build();

        assertThat(definition.getAggregation()).isEqualTo(Aggregation.percentile(99));
        assertThat(definition.getWindow()).isEqualTo(WindowSpec.of(Duration.ofSeconds(30), WindowType.TUMBLING));
        assertThat(definition.getFilter()).isSameAs(EventPredicate.ALL);
        assertThat(definition.isGrouped()).isFalse();
    }

    @Test
    @DisplayName("Should accept avg and mean as aliases of average")
    void shouldAcceptAverageAliases() {
        assertThat(AggregationType.fromName("AVG")).isEqualTo(AggregationType.AVERAGE);
        assertThat(AggregationType.fromName("mean")).isEqualTo(AggregationType.AVERAGE);
        assertThatThrownBy(() -> AggregationType.fromName("custom"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a numeric aggregation without a value extractor")
    void shouldRequireValueExtractor() {
        assertThatThrownBy(() -> MetricDefinition.builder()
                .name("avg_latency")
                .aggregation("average")
                .window("5m", null)
                .build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("requires a value extractor");
    }

    @Test
    @DisplayName("Should reject unique_count without a value extractor")
    void shouldRequireValueExtractorForUniqueCount() {
        assertThatThrownBy(() -> MetricDefinition.builder()
                .name("unique_users")
                .aggregation("unique_count")
                .window("5m", null)
                .build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unique_users")
                .hasMessageContaining("requires a value extractor");

        MetricDefinition withExtractor = MetricDefinition.builder()
                .name("unique_users")
                .aggregation("unique_count")
                .window("5m", null)
                .valueExtractor(event -> 1.0)
                .build();
        assertThat(withExtractor.getAggregation().requiresValue()).isTrue();
    }

    @Test
    @DisplayName("Should reject a percentile without a rank or with an out-of-range rank")
    void shouldValidatePercentile() {
        assertThatThrownBy(() -> MetricDefinition.builder()
                .name("p")
                .aggregation("percentile")
                .window("5m", null)
                .valueExtractor(event -> 1.0)
                .build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("percentile");
        assertThatThrownBy(() -> Aggregation.percentile(101))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report unknown aggregations and malformed windows with the metric name")
    void shouldReportInvalidParts() {
        assertThatThrownBy(() -> MetricDefinition.builder()
                .name("bad_agg")
                .aggregation("median")
                .window("5m", null)
                .build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("bad_agg")
                .hasMessageContaining("median");
        assertThatThrownBy(() -> MetricDefinition.builder()
                .name("bad_window")
                .aggregation("count")
                .window("five minutes", null)
                .build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("bad_window")
                .hasMessageContaining("invalid window");
    }

    @Test
    @DisplayName("Should require a name, an aggregation and a window")
    void shouldRequireMandatoryParts() {
        assertThatThrownBy(() -> MetricDefinition.builder().aggregation("count").window("1m", null).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> MetricDefinition.builder().name("m").window("1m", null).build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("aggregation is required");
        assertThatThrownBy(() -> MetricDefinition.builder().name("m").aggregation("count").build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("window is required");
    }
}
