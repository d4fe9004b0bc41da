package com.loglens.core.anomaly;

/**
 * Lifecycle of an {@link AnomalyDetector}.
 */
public enum DetectorState {

    /** Fewer than {@code minSamples} values held; nothing is scored. */
    WARMING_UP,

    /** Baseline established; every value is scored. */
    ACTIVE
}
