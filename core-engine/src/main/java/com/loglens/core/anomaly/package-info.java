/**
 * Z-score anomaly detection over metric values.
 *
 * <p>
 * {@link com.loglens.core.anomaly.AnomalyDetector} watches one metric;
 * {@link com.loglens.core.anomaly.MultiMetricAnomalyDetector} manages one
 * detector per metric name.
 * </p>
 */
package com.loglens.core.anomaly;
