package com.loglens.core.anomaly;

import com.loglens.core.config.ConfigurationException;
import com.loglens.core.model.AnomalyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MultiMetricAnomalyDetector}.
 */
class MultiMetricAnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Test
    @DisplayName("Should create a default detector per metric on first use")
    void shouldCreateDetectorsLazily() {
        MultiMetricAnomalyDetector detectors = new MultiMetricAnomalyDetector(10, 2.0, 3);

        detectors.addMetricValue("error_count", 1, NOW);

        AnomalyDetector created = detectors.getDetector("error_count").orElseThrow();
        assertThat(created.getWindowSize()).isEqualTo(10);
        assertThat(created.getMinSamples()).isEqualTo(3);
        assertThat(detectors.getDetector("warning_rate")).isEmpty();
    }

    @Test
    @DisplayName("Metrics should keep independent baselines")
    void baselinesShouldBeIndependent() {
        MultiMetricAnomalyDetector detectors = new MultiMetricAnomalyDetector(5, 2.0, 3);
        for (int i = 0; i < 3; i++) {
            detectors.checkAll(Map.of("a", 10.0, "b", 1000.0), NOW);
        }

        List<AnomalyRecord> anomalies = detectors.checkAll(Map.of("a", 1000.0, "b", 1000.0), NOW);

        assertThat(anomalies).extracting(AnomalyRecord::getMetricName).containsExactly("a");
        assertThat(detectors.getBaselineStats()).containsOnlyKeys("a", "b");
    }

    @Test
    @DisplayName("checkAll should skip metrics without a value")
    void checkAllShouldSkipNulls() {
        MultiMetricAnomalyDetector detectors = new MultiMetricAnomalyDetector();
        Map<String, Double> values = new HashMap<>();
        values.put("p95_latency", null);

        assertThat(detectors.checkAll(values, NOW)).isEmpty();
        assertThat(detectors.getDetector("p95_latency")).isEmpty();
    }

    @Test
    @DisplayName("Registered detectors should override the defaults")
    void registeredDetectorsShouldBeUsed() {
        AnomalyDetector strict = new AnomalyDetector("latency", 3, 1.0, 2);
        MultiMetricAnomalyDetector detectors = new MultiMetricAnomalyDetector(List.of(strict));

        detectors.addMetricValue("latency", 10, NOW);
        detectors.addMetricValue("latency", 12, NOW);

        assertThat(detectors.addMetricValue("latency", 14, NOW)).isPresent();
        assertThat(detectors.getDetector("latency")).containsSame(strict);
    }

    @Test
    @DisplayName("Reset should clear one or all baselines")
    void resetShouldClearBaselines() {
        MultiMetricAnomalyDetector detectors = new MultiMetricAnomalyDetector(5, 2.0, 1);
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("a", 1.0);
        values.put("b", 2.0);
        detectors.checkAll(values, NOW);

        detectors.reset("a");
        detectors.reset("unknown");

        assertThat(detectors.getBaselineStats().get("a").getSampleCount()).isZero();
        assertThat(detectors.getBaselineStats().get("b").getSampleCount()).isEqualTo(1);

        detectors.resetAll();
        assertThat(detectors.getBaselineStats().get("b").getState()).isEqualTo(DetectorState.WARMING_UP);
    }

    @Test
    @DisplayName("Should reject invalid default parameters")
    void shouldRejectInvalidDefaults() {
        assertThatThrownBy(() -> new MultiMetricAnomalyDetector(5, -1, 3))
                .isInstanceOf(ConfigurationException.class);
    }
}
