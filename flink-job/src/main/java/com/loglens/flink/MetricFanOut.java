package com.loglens.flink;

import com.loglens.core.model.LogEvent;
import org.apache.flink.api.common.functions.FlatMapFunction;
import org.apache.flink.util.Collector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Emits one {@link RoutedEvent} per configured metric for every log event.
 *
 * <p>
 * Filtering is left to the metric itself so that filter failures are counted
 * as evaluation errors of that metric.
 * </p>
 */
public class MetricFanOut implements FlatMapFunction<LogEvent, RoutedEvent> {

    private static final long serialVersionUID = 1L;

    private final ArrayList<String> metricNames;

    public MetricFanOut(List<String> metricNames) {
        Objects.requireNonNull(metricNames, "metricNames must not be null");
        if (metricNames.isEmpty()) {
            throw new IllegalArgumentException("metricNames must not be empty");
        }
        this.metricNames = new ArrayList<>(metricNames);
    }

    @Override
    public void flatMap(LogEvent event, Collector<RoutedEvent> out) {
        for (String metricName : metricNames) {
            out.collect(new RoutedEvent(metricName, event));
        }
    }
}
