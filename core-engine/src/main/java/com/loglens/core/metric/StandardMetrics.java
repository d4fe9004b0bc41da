package com.loglens.core.metric;

import com.loglens.core.model.LogLevel;
import com.loglens.core.window.WindowSpec;

/**
 * Ready-made definitions for the metrics most deployments want.
 */
public final class StandardMetrics {

    private StandardMetrics() {
        // utility class
    }

    /** Count of ERROR, CRITICAL and FATAL events. */
    public static MetricDefinition errorCount(WindowSpec window) {
        return MetricDefinition.builder()
                .name("error_count")
                .description("Count of error-level events")
                .filter(event -> event.getLevel().isErrorOrAbove())
                .aggregation(Aggregation.of(AggregationType.COUNT))
                .window(window)
                .build();
    }

    /** WARNING events per second. */
    public static MetricDefinition warningRate(WindowSpec window) {
        return MetricDefinition.builder()
                .name("warning_rate")
                .description("Rate of warning events per second")
                .filter(event -> event.getLevel() == LogLevel.WARNING)
                .aggregation(Aggregation.of(AggregationType.RATE))
                .window(window)
                .build();
    }

    public static MetricDefinition eventsBySource(WindowSpec window) {
        return MetricDefinition.builder()
                .name("events_by_source")
                .description("Event count grouped by source")
                .groupBy(event -> event.getSource())
                .aggregation(Aggregation.of(AggregationType.COUNT))
                .window(window)
                .build();
    }

    public static MetricDefinition eventsByLevel(WindowSpec window) {
        return MetricDefinition.builder()
                .name("events_by_level")
                .description("Event count grouped by log level")
                .groupBy(event -> event.getLevel().name())
                .aggregation(Aggregation.of(AggregationType.COUNT))
                .window(window)
                .build();
    }
}
