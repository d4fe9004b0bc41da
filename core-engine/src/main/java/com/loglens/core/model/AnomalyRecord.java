package com.loglens.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Record emitted when a metric value deviates from its rolling baseline.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricName}, {@code timestamp},
 * {@code direction} and {@code severity} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final Instant timestamp;
    private final double value;
    private final double baselineMean;
    private final double baselineStd;

    /** Signed z-score; infinite when the baseline had zero variance. */
    private final double zScore;

    private final AnomalyDirection direction;
    private final Severity severity;
    private final String explanation;

    private AnomalyRecord(Builder builder) {
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.direction = Objects.requireNonNull(builder.direction, "direction must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.value = builder.value;
        this.baselineMean = builder.baselineMean;
        this.baselineStd = builder.baselineStd;
        this.zScore = builder.zScore;
        this.explanation = builder.explanation;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyRecord}.
     */
    public static class Builder {
        private String metricName;
        private Instant timestamp;
        private double value;
        private double baselineMean;
        private double baselineStd;
        private double zScore;
        private AnomalyDirection direction;
        private Severity severity;
        private String explanation;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder baselineMean(double baselineMean) {
            this.baselineMean = baselineMean;
            return this;
        }

        public Builder baselineStd(double baselineStd) {
            this.baselineStd = baselineStd;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder direction(AnomalyDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getBaselineStd() {
        return baselineStd;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    public AnomalyDirection getDirection() {
        return direction;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getExplanation() {
        return explanation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Double.compare(value, that.value) == 0
                && metricName.equals(that.metricName)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, timestamp, value);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "metricName='" + metricName + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", zScore=" + zScore +
                ", direction=" + direction +
                ", severity=" + severity +
                '}';
    }
}
