package com.loglens.core.model;

/**
 * Whether an anomalous value sits above or below its baseline mean.
 */
public enum AnomalyDirection {
    SPIKE,
    DROP
}
