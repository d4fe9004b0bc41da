package com.loglens.core.config;

import com.loglens.core.anomaly.AnomalyDetector;
import com.loglens.core.anomaly.MultiMetricAnomalyDetector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalyDetectorFactory}.
 */
class AnomalyDetectorFactoryTest {

    @Test
    @DisplayName("Should create detectors for enabled rules only")
    void shouldSkipDisabledRules() {
        LogLensConfig config = ConfigLoader.fromClasspath("test-config.yml");

        List<AnomalyDetector> detectors = AnomalyDetectorFactory.createAll(config.getAnomalies());

        assertThat(detectors).singleElement().satisfies(detector -> {
            assertThat(detector.getMetricName()).isEqualTo("test_errors");
            assertThat(detector.getWindowSize()).isEqualTo(10);
            assertThat(detector.getThreshold()).isEqualTo(2.0);
            assertThat(detector.getMinSamples()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("Multi-metric detector should use configured detectors")
    void multiDetectorShouldUseConfiguredDetectors() {
        LogLensConfig config = ConfigLoader.fromClasspath("test-config.yml");

        MultiMetricAnomalyDetector multi = AnomalyDetectorFactory.createMultiDetector(config.getAnomalies());

        assertThat(multi.getDetector("test_errors")).get()
                .extracting(AnomalyDetector::getMinSamples).isEqualTo(3);
        assertThat(multi.getDetector("test_latency")).isEmpty();
    }

    @Test
    @DisplayName("Should reject invalid settings")
    void shouldRejectInvalidSettings() {
        AnomalyConfig config = new AnomalyConfig();
        config.setMetricName("m");
        config.setThreshold(-1);

        assertThatThrownBy(() -> AnomalyDetectorFactory.create(config))
                .isInstanceOf(ConfigurationException.class);
    }
}
