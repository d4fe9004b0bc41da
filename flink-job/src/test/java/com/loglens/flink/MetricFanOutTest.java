package com.loglens.flink;

import com.loglens.core.model.LogEvent;
import org.apache.flink.api.common.functions.util.ListCollector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricFanOut}.
 */
class MetricFanOutTest {

    @Test
    @DisplayName("Should emit one routed copy per metric, in configuration order")
    void shouldEmitOneCopyPerMetric() {
        LogEvent event = LogEvent.builder()
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .level("ERROR")
                .source("api")
                .message("boom")
                .build();
        List<RoutedEvent> out = new ArrayList<>();

        new MetricFanOut(List.of("error_count", "events_by_source")).flatMap(event, new ListCollector<>(out));

        assertThat(out).containsExactly(
                new RoutedEvent("error_count", event),
                new RoutedEvent("events_by_source", event));
    }

    @Test
    @DisplayName("Should require at least one metric")
    void shouldRejectEmptyMetricList() {
        assertThatThrownBy(() -> new MetricFanOut(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
