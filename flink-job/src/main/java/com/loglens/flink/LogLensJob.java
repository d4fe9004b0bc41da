package com.loglens.flink;

import com.loglens.core.config.AnomalyConfig;
import com.loglens.core.config.ConfigLoader;
import com.loglens.core.config.LogLensConfig;
import com.loglens.core.config.MetricConfig;
import com.loglens.core.model.AnomalyRecord;
import com.loglens.core.model.LogEvent;
import com.loglens.core.model.MetricResult;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Main entry point for the LogLens Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (logs topic)
 *     → Deserialize JSON → LogEvent
 *     → MetricFanOut (one copy per metric)
 *     → Key by metric name → MetricProcessFunction
 *     → Kafka (metrics topic)
 *     → scalar results of metrics with anomaly rules
 *     → Key by metric name → AnomalyProcessFunction
 *     → Kafka (anomalies topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring comes from environment variables via {@link JobConfig}; metrics
 * and anomaly rules come from YAML via {@link ConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps metric windows and anomaly baselines
 * across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogLensJob {

        private static final Logger LOG = LoggerFactory.getLogger(LogLensJob.class);

        private LogLensJob() {
                // entry-point class
        }

        public static void main(String[] args) throws Exception {
                // 1. Job configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting LogLens with config: {}", config);

                // 2. Metric and anomaly definitions
                LogLensConfig loglensConfig = ConfigLoader.load(config.getConfigPath());

                // 3. Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Pipeline
                buildPipeline(env, config, loglensConfig);

                env.execute("LogLens - Log Metrics and Anomaly Detection");
        }

        // -------------------------------------------------------------------------
        // Pipeline assembly
        // -------------------------------------------------------------------------

        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        LogLensConfig loglensConfig) {
                List<MetricConfig> metricConfigs = loglensConfig.getMetrics();
                List<String> metricNames = metricConfigs.stream()
                                .map(MetricConfig::getName)
                                .toList();
                List<AnomalyConfig> anomalyConfigs = loglensConfig.getAnomalies().stream()
                                .filter(AnomalyConfig::isEnabled)
                                .toList();
                Set<String> watchedMetrics = anomalyConfigs.stream()
                                .map(AnomalyConfig::getMetricName)
                                .collect(Collectors.toSet());

                // Kafka source
                KafkaSource<LogEvent> kafkaSource = KafkaSource.<LogEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new LogEventDeserializationSchema())
                                .build();

                DataStream<LogEvent> events = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<LogEvent>forBoundedOutOfOrderness(
                                                Duration.ofMillis(config.getMaxOutOfOrdernessMs()))
                                                .withTimestampAssigner((event, recordTs) -> event.getTimestamp().toEpochMilli())
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-logs-source");

                // Metrics
                DataStream<MetricResult> results = events
                                .filter(Objects::nonNull)
                                .flatMap(new MetricFanOut(metricNames))
                                .name("metric-fan-out")
                                .keyBy(RoutedEvent::getMetricName)
                                .process(new MetricProcessFunction(metricConfigs,
                                                loglensConfig.getMaxGroupsPerMetric()))
                                .name("metric-processing");

                KafkaSink<MetricResult> metricsSink = KafkaSink.<MetricResult>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaMetricsTopic())
                                                                .setValueSerializationSchema(
                                                                                new JsonSerializationSchema<MetricResult>())
                                                                .build())
                                .build();
                results.sinkTo(metricsSink).name("kafka-metrics-sink");

                if (watchedMetrics.isEmpty()) {
                        LOG.info("No anomaly rules enabled, skipping anomaly detection stage");
                        return;
                }

                // Anomalies
                DataStream<AnomalyRecord> anomalies = results
                                .filter(result -> !result.isGrouped() && watchedMetrics.contains(result.getMetricName()))
                                .name("anomaly-candidates")
                                .keyBy(MetricResult::getMetricName)
                                .process(new AnomalyProcessFunction(anomalyConfigs))
                                .name("anomaly-detection");

                KafkaSink<AnomalyRecord> anomalySink = KafkaSink.<AnomalyRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaAnomalyTopic())
                                                                .setValueSerializationSchema(
                                                                                new JsonSerializationSchema<AnomalyRecord>())
                                                                .build())
                                .build();
                anomalies.sinkTo(anomalySink).name("kafka-anomalies-sink");
        }

        // -------------------------------------------------------------------------
        // Helpers
        // -------------------------------------------------------------------------

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
