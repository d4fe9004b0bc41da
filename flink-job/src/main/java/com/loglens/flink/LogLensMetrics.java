package com.loglens.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics reported by the LogLens operators.
 * <p>
 * Reporters (e.g. Prometheus) are configured at cluster level; the job only
 * registers the metrics. Each operator registers the ones it updates.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code events_processed_total}: events routed to a metric</li>
 *   <li>{@code metric_results_total}: metric results emitted</li>
 *   <li>{@code evaluation_errors_total}: events a metric's expression failed on</li>
 *   <li>{@code anomalies_detected_total}: anomaly records emitted</li>
 *   <li>{@code processing_latency_ms}: per-element processing latency</li>
 * </ul>
 */
public class LogLensMetrics {

    private final Counter eventsProcessed;
    private final Counter metricResults;
    private final Counter evaluationErrors;
    private final Counter anomaliesDetected;
    private final Histogram processingLatency;

    public LogLensMetrics(MetricGroup metricGroup) {
        MetricGroup loglensGroup = metricGroup.addGroup("loglens");

        this.eventsProcessed = loglensGroup.counter("events_processed_total");
        this.metricResults = loglensGroup.counter("metric_results_total");
        this.evaluationErrors = loglensGroup.counter("evaluation_errors_total");
        this.anomaliesDetected = loglensGroup.counter("anomalies_detected_total");

        // sliding window of the last 350 samples
        this.processingLatency = loglensGroup
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementEventsProcessed() {
        eventsProcessed.inc();
    }

    public void incrementMetricResults(long count) {
        metricResults.inc(count);
    }

    public void incrementEvaluationErrors(long count) {
        evaluationErrors.inc(count);
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
