package com.loglens.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration for the LogLens Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * can be configured through container env vars or a shell environment.
 * Metric and anomaly definitions live in the YAML file loaded by
 * {@link com.loglens.core.config.ConfigLoader}; only its location is set here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // -------------------------------------------------------------------------
    // Kafka
    // -------------------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaMetricsTopic;
    private final String kafkaAnomalyTopic;
    private final String kafkaGroupId;

    // -------------------------------------------------------------------------
    // Flink
    // -------------------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long maxOutOfOrdernessMs;

    // -------------------------------------------------------------------------
    // LogLens
    // -------------------------------------------------------------------------
    private final String configPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaMetricsTopic = b.kafkaMetricsTopic;
        this.kafkaAnomalyTopic = b.kafkaAnomalyTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.maxOutOfOrdernessMs = b.maxOutOfOrdernessMs;
        this.configPath = b.configPath;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric env var cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "logs"))
                    .kafkaMetricsTopic(env("KAFKA_METRICS_TOPIC", "metrics"))
                    .kafkaAnomalyTopic(env("KAFKA_ANOMALY_TOPIC", "anomalies"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "loglens"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .maxOutOfOrdernessMs(parseLongEnv("LOGLENS_MAX_OUT_OF_ORDERNESS_MS", "5000"))
                    .configPath(env("LOGLENS_CONFIG_FILE", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Getters
    // -------------------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaMetricsTopic() {
        return kafkaMetricsTopic;
    }

    public String getKafkaAnomalyTopic() {
        return kafkaAnomalyTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public long getMaxOutOfOrdernessMs() {
        return maxOutOfOrdernessMs;
    }

    /**
     * @return explicit YAML path, or empty to let {@link com.loglens.core.config.ConfigLoader}
     *         fall back to the classpath default
     */
    public String getConfigPath() {
        return configPath;
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks that parallelism and checkpoint interval are
     * positive, the out-of-orderness bound is not negative and topic names are
     * non-blank and distinct.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "logs";
        private String kafkaMetricsTopic = "metrics";
        private String kafkaAnomalyTopic = "anomalies";
        private String kafkaGroupId = "loglens";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long maxOutOfOrdernessMs = 5_000;
        private String configPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaMetricsTopic(String v) {
            this.kafkaMetricsTopic = v;
            return this;
        }

        public Builder kafkaAnomalyTopic(String v) {
            this.kafkaAnomalyTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder maxOutOfOrdernessMs(long v) {
            this.maxOutOfOrdernessMs = v;
            return this;
        }

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaMetricsTopic, "kafkaMetricsTopic");
            requireNonBlank(kafkaAnomalyTopic, "kafkaAnomalyTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (kafkaInputTopic.equals(kafkaMetricsTopic) || kafkaInputTopic.equals(kafkaAnomalyTopic)) {
                throw new IllegalArgumentException(
                        "Output topics must differ from the input topic '" + kafkaInputTopic + "'");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (maxOutOfOrdernessMs < 0) {
                throw new IllegalArgumentException(
                        "maxOutOfOrdernessMs must be >= 0, got: " + maxOutOfOrdernessMs);
            }
            if (configPath == null) {
                configPath = "";
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // -------------------------------------------------------------------------
    // Internal
    // -------------------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaMetricsTopic='" + kafkaMetricsTopic + '\'' +
                ", kafkaAnomalyTopic='" + kafkaAnomalyTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", maxOutOfOrdernessMs=" + maxOutOfOrdernessMs +
                ", configPath='" + configPath + '\'' +
                '}';
    }
}
