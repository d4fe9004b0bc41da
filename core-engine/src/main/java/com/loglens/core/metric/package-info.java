/**
 * Metric definitions and the processor that evaluates them.
 *
 * <p>
 * A {@link com.loglens.core.metric.MetricDefinition} pairs a filter, an
 * optional group key and value extractor, a window and an aggregation.
 * {@link com.loglens.core.metric.MetricProcessor} runs a set of them over
 * incoming events and emits {@link com.loglens.core.model.MetricResult}s.
 * </p>
 */
package com.loglens.core.metric;
