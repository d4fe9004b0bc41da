package com.loglens.core.anomaly;

import com.loglens.core.model.AnomalyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes values of many metrics to one {@link AnomalyDetector} each.
 *
 * <p>
 * Detectors are either registered explicitly or created on first use with
 * the shared defaults given at construction.
 * </p>
 */
public class MultiMetricAnomalyDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MultiMetricAnomalyDetector.class);

    private final int windowSize;
    private final double threshold;
    private final int minSamples;
    private final LinkedHashMap<String, AnomalyDetector> detectors = new LinkedHashMap<>();

    public MultiMetricAnomalyDetector() {
        this(AnomalyDetector.DEFAULT_WINDOW_SIZE, AnomalyDetector.DEFAULT_THRESHOLD,
                AnomalyDetector.DEFAULT_MIN_SAMPLES);
    }

    /**
     * @throws com.loglens.core.config.ConfigurationException if the defaults
     *         would not make a valid detector
     */
    public MultiMetricAnomalyDetector(int windowSize, double threshold, int minSamples) {
        AnomalyDetector.validate("<default>", windowSize, threshold, minSamples);
        this.windowSize = windowSize;
        this.threshold = threshold;
        this.minSamples = minSamples;
    }

    /**
     * Pre-configured detectors, keyed by their metric name. Metrics without one
     * still get a default detector on first use.
     */
    public MultiMetricAnomalyDetector(Collection<AnomalyDetector> configured) {
        this();
        for (AnomalyDetector detector : configured) {
            register(detector);
        }
    }

    /**
     * Use {@code detector} for its metric, replacing any existing one.
     */
    public void register(AnomalyDetector detector) {
        Objects.requireNonNull(detector, "detector must not be null");
        detectors.put(detector.getMetricName(), detector);
    }

    public Optional<AnomalyRecord> addMetricValue(String metricName, double value, Instant timestamp) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        return detectors.computeIfAbsent(metricName, this::createDefault).addValue(value, timestamp);
    }

    /**
     * Feed one value per metric, all at the same timestamp.
     *
     * @return the anomalies found, in the map's iteration order
     */
    public List<AnomalyRecord> checkAll(Map<String, Double> metricValues, Instant timestamp) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Map.Entry<String, Double> entry : metricValues.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            addMetricValue(entry.getKey(), entry.getValue(), timestamp).ifPresent(anomalies::add);
        }
        return anomalies;
    }

    public Map<String, BaselineStats> getBaselineStats() {
        Map<String, BaselineStats> stats = new LinkedHashMap<>();
        for (Map.Entry<String, AnomalyDetector> entry : detectors.entrySet()) {
            stats.put(entry.getKey(), entry.getValue().getBaselineStats());
        }
        return Collections.unmodifiableMap(stats);
    }

    public Optional<AnomalyDetector> getDetector(String metricName) {
        return Optional.ofNullable(detectors.get(metricName));
    }

    /** No-op for an unknown metric. */
    public void reset(String metricName) {
        AnomalyDetector detector = detectors.get(metricName);
        if (detector != null) {
            detector.reset();
        }
    }

    public void resetAll() {
        detectors.values().forEach(AnomalyDetector::reset);
    }

    private AnomalyDetector createDefault(String metricName) {
        LOG.debug("Creating default anomaly detector for metric [{}]", metricName);
        return new AnomalyDetector(metricName, windowSize, threshold, minSamples);
    }
}
