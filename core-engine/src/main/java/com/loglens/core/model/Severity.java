package com.loglens.core.model;

/**
 * Severity band of an anomaly, ordered from least to most severe.
 *
 * <p>
 * Bands are assigned from the absolute z-score by
 * {@link com.loglens.core.anomaly.SeverityBands}; a larger deviation never
 * maps to a lower band.
 * </p>
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
