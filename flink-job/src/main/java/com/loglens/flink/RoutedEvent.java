package com.loglens.flink;

import com.loglens.core.model.LogEvent;

import java.io.Serializable;
import java.util.Objects;

/**
 * A log event addressed to one metric, so the stream can be keyed by metric name.
 */
public class RoutedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String metricName;
    private LogEvent event;

    public RoutedEvent() {
        // required by Flink
    }

    public RoutedEvent(String metricName, LogEvent event) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.event = Objects.requireNonNull(event, "event must not be null");
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public LogEvent getEvent() {
        return event;
    }

    public void setEvent(LogEvent event) {
        this.event = event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RoutedEvent that))
            return false;
        return Objects.equals(metricName, that.metricName) && Objects.equals(event, that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, event);
    }

    @Override
    public String toString() {
        return "RoutedEvent{metric='" + metricName + "', event=" + event + '}';
    }
}
