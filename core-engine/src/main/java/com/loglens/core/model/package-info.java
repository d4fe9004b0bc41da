/**
 * Domain model classes for LogLens.
 *
 * <p>
 * This package contains the value types exchanged between the engine and its
 * collaborators:
 * </p>
 * <ul>
 * <li>{@link com.loglens.core.model.LogEvent}: structured log entry fed to
 * the engine</li>
 * <li>{@link com.loglens.core.model.MetricResult}: windowed metric value</li>
 * <li>{@link com.loglens.core.model.AnomalyRecord}: deviation flagged by the
 * anomaly detector</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.loglens.core.model;
