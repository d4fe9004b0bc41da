package com.loglens.core.config;

import com.loglens.core.metric.AggregationType;
import com.loglens.core.window.DurationParser;
import com.loglens.core.window.WindowType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * One metric as written in YAML.
 *
 * <pre>
 * - name: p95_latency
 *   filter: "'latency_ms' in event.metadata"
 *   aggregation: percentile
 *   percentile: 95
 *   valueExtractor: event.metadata.latency_ms
 *   window: 1m
 *   windowType: tumbling
 * </pre>
 *
 * <p>
 * {@code filter}, {@code groupBy} and {@code valueExtractor} are expressions,
 * compiled by {@link MetricDefinitionFactory}.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private String description;
    private String filter;
    private String aggregation;
    private Double percentile;
    private String window;
    private String windowType = "sliding";
    private String groupBy;
    private String valueExtractor;

    public MetricConfig() {
        // required by SnakeYAML
    }

    // -------------------------------------------------------------------------
    // Getters / Setters
    // -------------------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /** Filter expression; blank admits every event. */
    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    public String getAggregation() {
        return aggregation;
    }

    public void setAggregation(String aggregation) {
        this.aggregation = aggregation;
    }

    public Double getPercentile() {
        return percentile;
    }

    public void setPercentile(Double percentile) {
        this.percentile = percentile;
    }

    public String getWindow() {
        return window;
    }

    public void setWindow(String window) {
        this.window = window;
    }

    public String getWindowType() {
        return windowType;
    }

    public void setWindowType(String windowType) {
        this.windowType = windowType;
    }

    public String getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(String groupBy) {
        this.groupBy = groupBy;
    }

    public String getValueExtractor() {
        return valueExtractor;
    }

    public void setValueExtractor(String valueExtractor) {
        this.valueExtractor = valueExtractor;
    }

    // -------------------------------------------------------------------------
    // Validation
    // -------------------------------------------------------------------------

    /**
     * Structural checks that need no expression compilation.
     *
     * @throws ConfigurationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String label = name == null || name.isBlank() ? "<unnamed>" : name;

        if (name == null || name.isBlank()) {
            errors.add("Metric 'name' is required");
        }

        if (aggregation == null || aggregation.isBlank()) {
            errors.add("Metric '" + label + "' requires 'aggregation'");
        } else {
            try {
                AggregationType type = AggregationType.fromName(aggregation);
                if (type == AggregationType.PERCENTILE
                        && (percentile == null || percentile < 0 || percentile > 100)) {
                    errors.add("Metric '" + label + "' requires 'percentile' within [0, 100]");
                }
                if (type.requiresValue() && (valueExtractor == null || valueExtractor.isBlank())) {
                    errors.add("Metric '" + label + "' with aggregation '" + aggregation
                            + "' requires 'valueExtractor'");
                }
            } catch (IllegalArgumentException e) {
                errors.add("Metric '" + label + "': " + e.getMessage());
            }
        }

        if (window == null || window.isBlank()) {
            errors.add("Metric '" + label + "' requires 'window'");
        } else {
            try {
                DurationParser.parse(window);
            } catch (IllegalArgumentException e) {
                errors.add("Metric '" + label + "': " + e.getMessage());
            }
        }
        try {
            WindowType.fromName(windowType);
        } catch (IllegalArgumentException e) {
            errors.add("Metric '" + label + "': " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid MetricConfig: " + String.join("; ", errors));
        }
    }

    @Override
    public String toString() {
        return "MetricConfig{name='" + name + "', aggregation='" + aggregation + "', window='" + window
                + "', windowType='" + windowType + "', groupBy='" + groupBy + "'}";
    }
}
