package com.loglens.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Value produced by a metric when its window admits an event (sliding) or
 * closes (tumbling).
 *
 * <p>
 * Ungrouped metrics carry a single {@code value}; grouped metrics leave it
 * unset and carry {@code groupedValues} instead.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MetricResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final Double value;
    private final LinkedHashMap<String, Double> groupedValues;
    private final int sampleCount;

    private MetricResult(String metricName, Instant windowStart, Instant windowEnd,
            Double value, Map<String, Double> groupedValues, int sampleCount) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        this.value = value;
        this.groupedValues = groupedValues != null ? new LinkedHashMap<>(groupedValues) : null;
        this.sampleCount = sampleCount;
    }

    /**
     * Result of an ungrouped metric.
     *
     * @param value aggregate, or {@code null} when the window held nothing to aggregate
     */
    public static MetricResult scalar(String metricName, Instant windowStart, Instant windowEnd,
            Double value, int sampleCount) {
        return new MetricResult(metricName, windowStart, windowEnd, value, null, sampleCount);
    }

    /**
     * Result of a grouped metric.
     */
    public static MetricResult grouped(String metricName, Instant windowStart, Instant windowEnd,
            Map<String, Double> groupedValues, int sampleCount) {
        Objects.requireNonNull(groupedValues, "groupedValues must not be null");
        return new MetricResult(metricName, windowStart, windowEnd, null, groupedValues, sampleCount);
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    /**
     * @return the aggregate, or {@code null} for grouped metrics
     */
    public Double getValue() {
        return value;
    }

    /**
     * @return unmodifiable group → aggregate mapping, or {@code null} for ungrouped metrics
     */
    public Map<String, Double> getGroupedValues() {
        return groupedValues != null ? Collections.unmodifiableMap(groupedValues) : null;
    }

    @JsonIgnore
    public boolean isGrouped() {
        return groupedValues != null;
    }

    /**
     * @return number of window entries the value was computed over
     */
    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricResult that))
            return false;
        return sampleCount == that.sampleCount
                && metricName.equals(that.metricName)
                && windowStart.equals(that.windowStart)
                && windowEnd.equals(that.windowEnd)
                && Objects.equals(value, that.value)
                && Objects.equals(groupedValues, that.groupedValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, windowStart, windowEnd, value, groupedValues, sampleCount);
    }

    @Override
    public String toString() {
        return "MetricResult{" + metricName + "="
                + (groupedValues != null ? groupedValues : value)
                + ", window=[" + windowStart + ", " + windowEnd + "]}";
    }
}
