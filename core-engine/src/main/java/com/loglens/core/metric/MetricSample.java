package com.loglens.core.metric;

import com.loglens.core.model.LogEvent;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * An admitted event together with the value extracted from it.
 *
 * <p>
 * {@code value} is {@code null} when the metric has no value extractor.
 * </p>
 */
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LogEvent event;
    private final Double value;

    public MetricSample(LogEvent event, Double value) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.value = value;
    }

    public LogEvent getEvent() {
        return event;
    }

    public Double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return event.getTimestamp();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return event.equals(that.event) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, value);
    }

    @Override
    public String toString() {
        return "MetricSample{value=" + value + ", event=" + event + '}';
    }
}
