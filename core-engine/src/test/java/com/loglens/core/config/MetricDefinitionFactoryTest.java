package com.loglens.core.config;

import com.loglens.core.metric.AggregationType;
import com.loglens.core.metric.MetricDefinition;
import com.loglens.core.metric.MetricProcessor;
import com.loglens.core.model.LogEvent;
import com.loglens.core.model.MetricResult;
import com.loglens.core.window.WindowType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for {@link MetricDefinitionFactory}.
 */
class MetricDefinitionFactoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    @Test
    @DisplayName("Should compile every configured expression")
    void shouldCompileExpressions() {
        MetricConfig config = new MetricConfig();
        config.setName("slow_requests");
        config.setFilter("event.metadata.latency_ms > 500");
        config.setAggregation("max");
        config.setValueExtractor("event.metadata.latency_ms");
        config.setGroupBy("event.source");
        config.setWindow("1m");
        config.setWindowType("tumbling");

        MetricDefinition definition = MetricDefinitionFactory.create(config);

        assertThat(definition.getAggregation().getType()).isEqualTo(AggregationType.MAX);
        assertThat(definition.getWindow().getType()).isEqualTo(WindowType.TUMBLING);
        assertThat(definition.isGrouped()).isTrue();
        assertThat(definition.getFilter().test(event("api", 900))).isTrue();
        assertThat(definition.getFilter().test(event("api", 100))).isFalse();
        assertThat(definition.getValueExtractor().valueOf(event("api", 900))).isEqualTo(900.0);
    }

    @Test
    @DisplayName("Should report a syntax error with the metric name")
    void shouldReportSyntaxErrors() {
        MetricConfig config = new MetricConfig();
        config.setName("broken");
        config.setFilter("event.level = 'ERROR'");
        config.setAggregation("count");
        config.setWindow("5m");

        assertThatThrownBy(() -> MetricDefinitionFactory.create(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Metric 'broken'")
                .hasMessageContaining("==");
    }

    @Test
    @DisplayName("Should build a working processor from a loaded config")
    void shouldCreateProcessor() {
        LogLensConfig config = ConfigLoader.fromClasspath("test-config.yml");

        MetricProcessor processor = MetricDefinitionFactory.createProcessor(config);
        processor.addEvent(event("api", 100));
        processor.addEvent(event("api", 300));
        Map<String, MetricResult> flushed = processor.flush();

        assertThat(processor.getMetricNames()).containsExactly("test_errors", "test_latency");
        assertThat(flushed.get("test_latency").getGroupedValues()).containsOnly(entry("api", 200.0));
        assertThat(MetricDefinitionFactory.createAll(List.of())).isEmpty();
    }

    private static LogEvent event(String source, int latencyMs) {
        return LogEvent.builder()
                .timestamp(T0)
                .level("INFO")
                .source(source)
                .message("request served")
                .metadata("latency_ms", latencyMs)
                .build();
    }
}
