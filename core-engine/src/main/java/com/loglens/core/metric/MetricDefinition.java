package com.loglens.core.metric;

import com.loglens.core.config.ConfigurationException;
import com.loglens.core.expression.EventPredicate;
import com.loglens.core.expression.GroupKeyExtractor;
import com.loglens.core.expression.ValueExtractor;
import com.loglens.core.window.WindowSpec;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable description of one metric: which events it counts, how they are
 * grouped, which value is taken from each, the window and the aggregation.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * MetricDefinition p95 = MetricDefinition.builder()
 *         .name("p95_latency")
 *         .filter(event -> event.getMetadata().containsKey("latency_ms"))
 *         .valueExtractor(event -> ((Number) event.getMetadata().get("latency_ms")).doubleValue())
 *         .aggregation("percentile", 95.0)
 *         .window("1m", "tumbling")
 *         .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MetricDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String description;
    private final EventPredicate filter;
    private final Aggregation aggregation;
    private final WindowSpec window;
    private final GroupKeyExtractor groupBy;
    private final ValueExtractor valueExtractor;

    private MetricDefinition(Builder builder, Aggregation aggregation, WindowSpec window) {
        this.name = builder.name;
        this.description = builder.description;
        this.filter = builder.filter;
        this.aggregation = aggregation;
        this.window = window;
        this.groupBy = builder.groupBy;
        this.valueExtractor = builder.valueExtractor;
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Getters
    // -------------------------------------------------------------------------

    public String getName() {
        return name;
    }

    /**
     * @return free-form description, or {@code null}
     */
    public String getDescription() {
        return description;
    }

    public EventPredicate getFilter() {
        return filter;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public WindowSpec getWindow() {
        return window;
    }

    /**
     * @return the group key extractor, or {@code null} for an ungrouped metric
     */
    public GroupKeyExtractor getGroupBy() {
        return groupBy;
    }

    /**
     * @return the value extractor, or {@code null} if the aggregation needs none
     */
    public ValueExtractor getValueExtractor() {
        return valueExtractor;
    }

    public boolean isGrouped() {
        return groupBy != null;
    }

    @Override
    public String toString() {
        return "MetricDefinition{name='" + name + "', aggregation=" + aggregation
                + ", window=" + window + ", grouped=" + isGrouped() + '}';
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {

        private String name;
        private String description;
        private EventPredicate filter = EventPredicate.ALL;
        private Aggregation aggregation;
        private String aggregationName;
        private Double percentile;
        private WindowSpec window;
        private String windowDuration;
        private String windowType;
        private GroupKeyExtractor groupBy;
        private ValueExtractor valueExtractor;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Defaults to {@link EventPredicate#ALL}. */
        public Builder filter(EventPredicate filter) {
            this.filter = filter;
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregation = aggregation;
            this.aggregationName = null;
            return this;
        }

        /**
         * Aggregation by configuration name, resolved in {@link #build()}.
         *
         * @param name       e.g. {@code "average"}
         * @param percentile rank for {@code percentile}, otherwise ignored
         */
        public Builder aggregation(String name, Double percentile) {
            this.aggregationName = name;
            this.percentile = percentile;
            this.aggregation = null;
            return this;
        }

        public Builder aggregation(String name) {
            return aggregation(name, null);
        }

        public Builder window(WindowSpec window) {
            this.window = window;
            this.windowDuration = null;
            return this;
        }

        /**
         * Window by configuration text, resolved in {@link #build()}.
         *
         * @param duration e.g. {@code "5m"} or {@code "PT5M"}
         * @param type     {@code sliding} or {@code tumbling}; {@code null} means sliding
         */
        public Builder window(String duration, String type) {
            this.windowDuration = duration;
            this.windowType = type;
            this.window = null;
            return this;
        }

        public Builder groupBy(GroupKeyExtractor groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder valueExtractor(ValueExtractor valueExtractor) {
            this.valueExtractor = valueExtractor;
            return this;
        }

        /**
         * @throws ConfigurationException if the definition is incomplete or inconsistent
         */
        public MetricDefinition build() {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Metric name must not be blank");
            }
            if (filter == null) {
                throw new ConfigurationException("Metric '" + name + "': filter must not be null");
            }

            Aggregation resolvedAggregation = resolveAggregation();
            WindowSpec resolvedWindow = resolveWindow();

            if (resolvedAggregation.requiresValue() && valueExtractor == null) {
                throw new ConfigurationException("Metric '" + name + "': aggregation '"
                        + resolvedAggregation + "' requires a value extractor");
            }
            return new MetricDefinition(this, resolvedAggregation, resolvedWindow);
        }

        private Aggregation resolveAggregation() {
            if (aggregation != null) {
                return aggregation;
            }
            if (aggregationName == null) {
                throw new ConfigurationException("Metric '" + name + "': aggregation is required");
            }
            try {
                AggregationType type = AggregationType.fromName(aggregationName);
                if (type == AggregationType.PERCENTILE) {
                    if (percentile == null) {
                        throw new IllegalArgumentException("percentile aggregation requires a percentile value");
                    }
                    return Aggregation.percentile(percentile);
                }
                return Aggregation.of(type);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Metric '" + name + "': " + e.getMessage(), e);
            }
        }

        private WindowSpec resolveWindow() {
            if (window != null) {
                return window;
            }
            if (windowDuration == null) {
                throw new ConfigurationException("Metric '" + name + "': window is required");
            }
            try {
                return WindowSpec.parse(windowDuration, windowType);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Metric '" + name + "': invalid window: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricDefinition that))
            return false;
        return name.equals(that.name)
                && Objects.equals(description, that.description)
                && aggregation.equals(that.aggregation)
                && window.equals(that.window);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, aggregation, window);
    }
}
