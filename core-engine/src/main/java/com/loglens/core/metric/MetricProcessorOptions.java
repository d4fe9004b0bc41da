package com.loglens.core.metric;

import com.loglens.core.config.ConfigurationException;

import java.io.Serializable;
import java.util.Objects;

/**
 * Tuning for {@link MetricProcessor}.
 */
public final class MetricProcessorOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MAX_GROUPS_PER_METRIC = 10_000;

    private final int maxGroupsPerMetric;
    private final EvaluationErrorHandler errorHandler;

    private MetricProcessorOptions(Builder builder) {
        this.maxGroupsPerMetric = builder.maxGroupsPerMetric;
        this.errorHandler = builder.errorHandler;
    }

    public static MetricProcessorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return upper bound on tracked groups per grouped metric; the least
     *         recently active group is evicted beyond it
     */
    public int getMaxGroupsPerMetric() {
        return maxGroupsPerMetric;
    }

    public EvaluationErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public static final class Builder {

        private int maxGroupsPerMetric = DEFAULT_MAX_GROUPS_PER_METRIC;
        private EvaluationErrorHandler errorHandler = EvaluationErrorHandler.LOGGING;

        private Builder() {}

        public Builder maxGroupsPerMetric(int maxGroupsPerMetric) {
            this.maxGroupsPerMetric = maxGroupsPerMetric;
            return this;
        }

        public Builder errorHandler(EvaluationErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        public MetricProcessorOptions build() {
            Objects.requireNonNull(errorHandler, "errorHandler must not be null");
            if (maxGroupsPerMetric < 1) {
                throw new ConfigurationException("maxGroupsPerMetric must be >= 1, got: " + maxGroupsPerMetric);
            }
            return new MetricProcessorOptions(this);
        }
    }
}
