package com.loglens.core.config;

import com.loglens.core.anomaly.AnomalyDetector;
import com.loglens.core.anomaly.MultiMetricAnomalyDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Creates {@link AnomalyDetector}s from {@link AnomalyConfig} entries.
 *
 * @since 1.0.0
 */
public final class AnomalyDetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetectorFactory.class);

    private AnomalyDetectorFactory() {
        // utility class
    }

    /**
     * @throws ConfigurationException if the settings are invalid
     */
    public static AnomalyDetector create(AnomalyConfig config) {
        Objects.requireNonNull(config, "AnomalyConfig must not be null");
        return new AnomalyDetector(config.getMetricName(), config.getWindowSize(),
                config.getThreshold(), config.getMinSamples());
    }

    /**
     * @return unmodifiable list of detectors for the enabled entries only
     */
    public static List<AnomalyDetector> createAll(List<AnomalyConfig> configs) {
        Objects.requireNonNull(configs, "Anomaly configs must not be null");
        List<AnomalyDetector> detectors = configs.stream()
                .filter(AnomalyConfig::isEnabled)
                .map(AnomalyDetectorFactory::create)
                .toList();
        LOG.info("Created {} anomaly detector(s), {} disabled", detectors.size(),
                configs.size() - detectors.size());
        return Collections.unmodifiableList(detectors);
    }

    public static MultiMetricAnomalyDetector createMultiDetector(List<AnomalyConfig> configs) {
        return new MultiMetricAnomalyDetector(createAll(configs));
    }
}
