package com.loglens.core.anomaly;

import com.loglens.core.config.ConfigurationException;
import com.loglens.core.model.AnomalyDirection;
import com.loglens.core.model.AnomalyRecord;
import com.loglens.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Z-score anomaly detector over a rolling baseline of one metric's values.
 *
 * <p>
 * Each incoming value is scored against the population mean and standard
 * deviation of the previous {@code windowSize} values, then joins the
 * baseline. Nothing is scored until {@code minSamples} values are held.
 * </p>
 *
 * <h3>Flat baseline</h3>
 * <p>
 * When the baseline's standard deviation is zero any differing value is
 * flagged with an infinite z-score; an identical value is not.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This detector is <strong>stateful</strong> and not thread-safe. One
 * instance is held per metric in Flink keyed state.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final int DEFAULT_WINDOW_SIZE = 20;
    public static final double DEFAULT_THRESHOLD = 2.0;
    public static final int DEFAULT_MIN_SAMPLES = 5;

    private final String metricName;
    private final int windowSize;
    private final double threshold;
    private final int minSamples;
    private final SeverityBands severityBands;
    private final RollingBaseline baseline;

    public AnomalyDetector(String metricName) {
        this(metricName, DEFAULT_WINDOW_SIZE, DEFAULT_THRESHOLD, DEFAULT_MIN_SAMPLES);
    }

    public AnomalyDetector(String metricName, int windowSize, double threshold, int minSamples) {
        this(metricName, windowSize, threshold, minSamples, SeverityBands.DEFAULT);
    }

    /**
     * @throws ConfigurationException if {@code windowSize < 1}, {@code threshold <= 0}
     *         or {@code minSamples} is outside {@code [1, windowSize]}
     */
    public AnomalyDetector(String metricName, int windowSize, double threshold, int minSamples,
                           SeverityBands severityBands) {
        validate(metricName, windowSize, threshold, minSamples);
        this.metricName = metricName;
        this.windowSize = windowSize;
        this.threshold = threshold;
        this.minSamples = minSamples;
        this.severityBands = Objects.requireNonNull(severityBands, "severityBands must not be null");
        this.baseline = new RollingBaseline(windowSize);
    }

    static void validate(String metricName, int windowSize, double threshold, int minSamples) {
        if (metricName == null || metricName.isBlank()) {
            throw new ConfigurationException("Anomaly detector metric name must not be blank");
        }
        if (windowSize < 1) {
            throw new ConfigurationException(
                    "windowSize must be >= 1 for metric '" + metricName + "', got: " + windowSize);
        }
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new ConfigurationException(
                    "threshold must be > 0 for metric '" + metricName + "', got: " + threshold);
        }
        if (minSamples < 1 || minSamples > windowSize) {
            throw new ConfigurationException("minSamples must be within [1, " + windowSize
                    + "] for metric '" + metricName + "', got: " + minSamples);
        }
    }

    /**
     * Score a value against the current baseline, then add it to the baseline.
     *
     * @param value     metric value
     * @param timestamp time the value refers to, copied into the record
     * @return a record if {@code |z| >= threshold}
     * @throws IllegalArgumentException if {@code value} is NaN or infinite; the
     *                                  baseline is left untouched
     */
    public Optional<AnomalyRecord> addValue(double value, Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "Value for metric '" + metricName + "' must be finite, got: " + value);
        }

        if (baseline.size() < minSamples) {
            baseline.append(value);
            LOG.trace("Detector [{}] warming up: {}/{} samples", metricName, baseline.size(), minSamples);
            return Optional.empty();
        }

        double mean = baseline.mean();
        double std = baseline.std();
        Optional<AnomalyRecord> anomaly = score(value, mean, std, timestamp);
        baseline.append(value);
        return anomaly;
    }

    private Optional<AnomalyRecord> score(double value, double mean, double std, Instant timestamp) {
        double zScore;
        if (std == 0) {
            if (value == mean) {
                return Optional.empty();
            }
            zScore = value > mean ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        } else {
            zScore = (value - mean) / std;
        }

        double absZ = Math.abs(zScore);
        if (absZ < threshold) {
            return Optional.empty();
        }

        AnomalyDirection direction = value > mean ? AnomalyDirection.SPIKE : AnomalyDirection.DROP;
        Severity severity = severityBands.classify(absZ, threshold);

        LOG.debug("Detector [{}] flagged {}: value={} mean={} std={} z={}",
                metricName, direction, value, mean, std, zScore);

        return Optional.of(AnomalyRecord.builder()
                .metricName(metricName)
                .timestamp(timestamp)
                .value(value)
                .baselineMean(mean)
                .baselineStd(std)
                .zScore(zScore)
                .direction(direction)
                .severity(severity)
                .explanation(explain(value, mean, std, absZ, direction))
                .build());
    }

    private String explain(double value, double mean, double std, double absZ, AnomalyDirection direction) {
        if (std == 0) {
            return format("%s deviated from a constant baseline (%.2f vs %.2f)", metricName, value, mean);
        }
        if (direction == AnomalyDirection.SPIKE) {
            if (mean > 0) {
                double multiplier = value / mean;
                if (multiplier >= 2.0) {
                    return format("%s spiked %.1fx above baseline (%.2f vs %.2f average)",
                            metricName, multiplier, value, mean);
                }
                return format("%s spiked %.1f standard deviations above baseline (%.2f vs %.2f average)",
                        metricName, absZ, value, mean);
            }
            return format("%s spiked to %.2f (%.1f standard deviations above baseline)", metricName, value, absZ);
        }

        if (mean > 0) {
            if (value > 0 && mean / value >= 2.0) {
                return format("%s dropped %.1fx below baseline (%.2f vs %.2f average)",
                        metricName, mean / value, value, mean);
            }
            return format("%s dropped %.1f standard deviations below baseline (%.2f vs %.2f average)",
                    metricName, absZ, value, mean);
        }
        return format("%s dropped to %.2f (%.1f standard deviations below baseline)", metricName, value, absZ);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    /**
     * @return a summary of the baseline; does not modify the detector
     */
    public BaselineStats getBaselineStats() {
        return new BaselineStats(baseline.mean(), baseline.std(), baseline.size(), windowSize, getState());
    }

    public DetectorState getState() {
        return baseline.size() < minSamples ? DetectorState.WARMING_UP : DetectorState.ACTIVE;
    }

    /**
     * Forget every held value, returning to the freshly constructed state.
     */
    public void reset() {
        baseline.clear();
        LOG.debug("Detector [{}] reset", metricName);
    }

    public String getMetricName() {
        return metricName;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public SeverityBands getSeverityBands() {
        return severityBands;
    }

    @Override
    public String toString() {
        return "AnomalyDetector{metric='" + metricName + "', windowSize=" + windowSize
                + ", threshold=" + threshold + ", minSamples=" + minSamples + ", state=" + getState() + '}';
    }
}
