package com.loglens.flink;

import com.loglens.core.config.MetricConfig;
import com.loglens.core.config.MetricDefinitionFactory;
import com.loglens.core.metric.MetricDefinition;
import com.loglens.core.metric.MetricProcessor;
import com.loglens.core.metric.MetricProcessorOptions;
import com.loglens.core.model.MetricResult;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keyed by metric name: runs that metric's {@link MetricProcessor} over the
 * events routed to it.
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<MetricProcessor>} holds one single-metric processor per
 * key, created on the key's first event. The processor, its windows and
 * compiled expressions are {@link java.io.Serializable} and snapshotted with
 * Flink checkpoints.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricProcessFunction
        extends KeyedProcessFunction<String, RoutedEvent, MetricResult> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricProcessFunction.class);

    /** Metric configuration (serializable config, not runtime state). */
    private final ArrayList<MetricConfig> metricConfigs;
    private final int maxGroupsPerMetric;

    private transient Map<String, MetricDefinition> definitions;
    private transient ValueState<MetricProcessor> processorState;
    private transient LogLensMetrics metrics;

    /**
     * @param metricConfigs configured metrics; must not be {@code null} or empty
     * @param maxGroupsPerMetric cap on tracked groups per grouped metric
     */
    public MetricProcessFunction(List<MetricConfig> metricConfigs, int maxGroupsPerMetric) {
        Objects.requireNonNull(metricConfigs, "Metric configs must not be null");
        if (metricConfigs.isEmpty()) {
            throw new IllegalArgumentException("Metric configs must not be empty");
        }
        this.metricConfigs = new ArrayList<>(metricConfigs);
        this.maxGroupsPerMetric = maxGroupsPerMetric;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        definitions = new HashMap<>();
        for (MetricDefinition definition : MetricDefinitionFactory.createAll(metricConfigs)) {
            definitions.put(definition.getName(), definition);
        }

        ValueStateDescriptor<MetricProcessor> descriptor = new ValueStateDescriptor<>(
                "metric-processor", TypeInformation.of(MetricProcessor.class));
        processorState = getRuntimeContext().getState(descriptor);

        metrics = new LogLensMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("MetricProcessFunction opened with {} metric(s)", definitions.size());
    }

    @Override
    public void close() {
        LOG.info("MetricProcessFunction closing");
    }

    // -------------------------------------------------------------------------
    // Processing
    // -------------------------------------------------------------------------

    @Override
    public void processElement(RoutedEvent routed,
            KeyedProcessFunction<String, RoutedEvent, MetricResult>.Context ctx,
            Collector<MetricResult> out) throws Exception {
        long startNanos = System.nanoTime();

        MetricProcessor processor = processorState.value();
        if (processor == null) {
            MetricDefinition definition = definitions.get(ctx.getCurrentKey());
            if (definition == null) {
                LOG.warn("No metric definition for key [{}], dropping event", ctx.getCurrentKey());
                return;
            }
            processor = new MetricProcessor(List.of(definition), MetricProcessorOptions.builder()
                    .maxGroupsPerMetric(maxGroupsPerMetric)
                    .build());
        }

        long errorsBefore = processor.getEvaluationErrorCount();
        Map<String, MetricResult> results = processor.addEvent(routed.getEvent());
        long newErrors = processor.getEvaluationErrorCount() - errorsBefore;

        for (MetricResult result : results.values()) {
            out.collect(result);
        }

        processorState.update(processor);

        metrics.incrementEventsProcessed();
        if (!results.isEmpty()) {
            metrics.incrementMetricResults(results.size());
        }
        if (newErrors > 0) {
            metrics.incrementEvaluationErrors(newErrors);
        }
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
