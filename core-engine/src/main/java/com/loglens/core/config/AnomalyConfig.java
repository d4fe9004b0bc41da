package com.loglens.core.config;

import com.loglens.core.anomaly.AnomalyDetector;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Anomaly detection settings for one metric, as written in YAML.
 *
 * <pre>
 * - metricName: error_count
 *   windowSize: 20
 *   threshold: 2.5
 *   minSamples: 5
 * </pre>
 *
 * @since 1.0.0
 */
public class AnomalyConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String metricName;
    private int windowSize = AnomalyDetector.DEFAULT_WINDOW_SIZE;
    private double threshold = AnomalyDetector.DEFAULT_THRESHOLD;
    private int minSamples = AnomalyDetector.DEFAULT_MIN_SAMPLES;
    private boolean enabled = true;

    public AnomalyConfig() {
        // required by SnakeYAML
    }

    // -------------------------------------------------------------------------
    // Getters / Setters
    // -------------------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String label = metricName == null || metricName.isBlank() ? "<unnamed>" : metricName;

        if (metricName == null || metricName.isBlank()) {
            errors.add("Anomaly 'metricName' is required");
        }
        if (windowSize < 1) {
            errors.add("Anomaly '" + label + "' requires 'windowSize' >= 1");
        }
        if (!(threshold > 0)) {
            errors.add("Anomaly '" + label + "' requires 'threshold' > 0");
        }
        if (minSamples < 1 || minSamples > windowSize) {
            errors.add("Anomaly '" + label + "' requires 1 <= 'minSamples' <= windowSize");
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid AnomalyConfig: " + String.join("; ", errors));
        }
    }

    @Override
    public String toString() {
        return "AnomalyConfig{metricName='" + metricName + "', windowSize=" + windowSize
                + ", threshold=" + threshold + ", minSamples=" + minSamples + ", enabled=" + enabled + '}';
    }
}
