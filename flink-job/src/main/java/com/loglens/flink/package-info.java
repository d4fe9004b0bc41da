/**
 * Apache Flink streaming job for LogLens.
 *
 * <p>
 * This package wires the core metric engine into a Flink pipeline that
 * consumes log events from Kafka, computes windowed metrics per metric name,
 * scores them for anomalies and publishes both back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.loglens.flink.LogLensJob}: main entry point</li>
 * <li>{@link com.loglens.flink.MetricProcessFunction}: keyed metric windows</li>
 * <li>{@link com.loglens.flink.AnomalyProcessFunction}: keyed anomaly baselines</li>
 * <li>{@link com.loglens.flink.JobConfig}: environment-driven configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.loglens.flink;
