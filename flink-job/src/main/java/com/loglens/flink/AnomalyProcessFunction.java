package com.loglens.flink;

import com.loglens.core.anomaly.AnomalyDetector;
import com.loglens.core.config.AnomalyConfig;
import com.loglens.core.config.AnomalyDetectorFactory;
import com.loglens.core.model.AnomalyRecord;
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
import java.util.Optional;

/**
 * Keyed by metric name: scores each scalar metric result with that metric's
 * {@link AnomalyDetector}.
 *
 * <p>
 * Grouped results and results without a finite value are skipped. The record's
 * timestamp is the end of the window the value was computed over.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * A {@code ValueState<AnomalyDetector>} holds the rolling baseline per
 * metric, created from the matching {@link AnomalyConfig} on first use.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyProcessFunction
        extends KeyedProcessFunction<String, MetricResult, AnomalyRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyProcessFunction.class);

    private final ArrayList<AnomalyConfig> anomalyConfigs;

    private transient Map<String, AnomalyConfig> configsByMetric;
    private transient ValueState<AnomalyDetector> detectorState;
    private transient LogLensMetrics metrics;

    /**
     * @param anomalyConfigs enabled anomaly configurations; must not be {@code null}
     */
    public AnomalyProcessFunction(List<AnomalyConfig> anomalyConfigs) {
        Objects.requireNonNull(anomalyConfigs, "Anomaly configs must not be null");
        this.anomalyConfigs = new ArrayList<>(anomalyConfigs);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        configsByMetric = new HashMap<>();
        for (AnomalyConfig config : anomalyConfigs) {
            if (config.isEnabled()) {
                configsByMetric.put(config.getMetricName(), config);
            }
        }

        ValueStateDescriptor<AnomalyDetector> descriptor = new ValueStateDescriptor<>(
                "anomaly-detector", TypeInformation.of(AnomalyDetector.class));
        detectorState = getRuntimeContext().getState(descriptor);

        metrics = new LogLensMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AnomalyProcessFunction opened for metric(s): {}", configsByMetric.keySet());
    }

    @Override
    public void close() {
        LOG.info("AnomalyProcessFunction closing");
    }

    // -------------------------------------------------------------------------
    // Processing
    // -------------------------------------------------------------------------

    @Override
    public void processElement(MetricResult result,
            KeyedProcessFunction<String, MetricResult, AnomalyRecord>.Context ctx,
            Collector<AnomalyRecord> out) throws Exception {
        if (result.isGrouped() || result.getValue() == null) {
            return;
        }
        if (!Double.isFinite(result.getValue())) {
            LOG.warn("Skipping non-finite value {} of metric [{}] at {}",
                    result.getValue(), result.getMetricName(), result.getWindowEnd());
            return;
        }

        AnomalyDetector detector = detectorState.value();
        if (detector == null) {
            AnomalyConfig config = configsByMetric.get(ctx.getCurrentKey());
            if (config == null) {
                return;
            }
            detector = AnomalyDetectorFactory.create(config);
        }

        Optional<AnomalyRecord> anomaly = detector.addValue(result.getValue(), result.getWindowEnd());
        detectorState.update(detector);

        if (anomaly.isPresent()) {
            AnomalyRecord record = anomaly.get();
            out.collect(record);
            metrics.incrementAnomaliesDetected();
            LOG.info("Anomaly detected: {}", record.getExplanation());
        }
    }
}
