package com.loglens.core.config;

import com.loglens.core.metric.MetricProcessorOptions;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the LogLens YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * maxGroupsPerMetric: 10000
 * metrics:
 *   - name: error_count
 *     filter: "event.level in ('ERROR', 'CRITICAL', 'FATAL')"
 *     aggregation: count
 *     window: 5m
 * anomalies:
 *   - metricName: error_count
 *     threshold: 2.5
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link ConfigLoader} does so.
 * </p>
 *
 * @since 1.0.0
 */
public class LogLensConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<MetricConfig> metrics = new ArrayList<>();
    private List<AnomalyConfig> anomalies = new ArrayList<>();
    private int maxGroupsPerMetric = MetricProcessorOptions.DEFAULT_MAX_GROUPS_PER_METRIC;

    /**
     * @return unmodifiable list of metric configurations
     */
    public List<MetricConfig> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    public void setMetrics(List<MetricConfig> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of anomaly configurations
     */
    public List<AnomalyConfig> getAnomalies() {
        return Collections.unmodifiableList(anomalies);
    }

    public void setAnomalies(List<AnomalyConfig> anomalies) {
        this.anomalies = anomalies != null ? new ArrayList<>(anomalies) : new ArrayList<>();
    }

    public int getMaxGroupsPerMetric() {
        return maxGroupsPerMetric;
    }

    public void setMaxGroupsPerMetric(int maxGroupsPerMetric) {
        this.maxGroupsPerMetric = maxGroupsPerMetric;
    }

    /**
     * Validate the whole configuration.
     *
     * <p>
     * Collects the errors of every metric and anomaly entry, plus duplicate
     * metric names and anomalies that reference an undefined metric, and
     * throws once.
     * </p>
     *
     * @throws ConfigurationException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (metrics.isEmpty()) {
            errors.add("At least one metric must be defined");
        }
        if (maxGroupsPerMetric < 1) {
            errors.add("'maxGroupsPerMetric' must be >= 1, got: " + maxGroupsPerMetric);
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < metrics.size(); i++) {
            MetricConfig metric = metrics.get(i);
            if (metric == null) {
                errors.add("Metric at index " + i + " is null");
                continue;
            }
            try {
                metric.validate();
            } catch (ConfigurationException e) {
                errors.add(e.getMessage());
            }
            if (metric.getName() != null && !names.add(metric.getName())) {
                errors.add("Duplicate metric name: '" + metric.getName() + "'");
            }
        }

        for (int i = 0; i < anomalies.size(); i++) {
            AnomalyConfig anomaly = anomalies.get(i);
            if (anomaly == null) {
                errors.add("Anomaly at index " + i + " is null");
                continue;
            }
            try {
                anomaly.validate();
            } catch (ConfigurationException e) {
                errors.add(e.getMessage());
            }
            if (anomaly.getMetricName() != null && !names.contains(anomaly.getMetricName())) {
                errors.add("Anomaly references undefined metric: '" + anomaly.getMetricName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "LogLens configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "LogLensConfig{metrics=" + metrics + ", anomalies=" + anomalies
                + ", maxGroupsPerMetric=" + maxGroupsPerMetric + '}';
    }
}
