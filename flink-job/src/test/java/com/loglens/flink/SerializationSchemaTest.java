package com.loglens.flink;

import com.loglens.core.model.AnomalyDirection;
import com.loglens.core.model.AnomalyRecord;
import com.loglens.core.model.LogEvent;
import com.loglens.core.model.LogLevel;
import com.loglens.core.model.MetricResult;
import com.loglens.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LogEventDeserializationSchema} and {@link JsonSerializationSchema}.
 */
class SerializationSchemaTest {

    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    private final LogEventDeserializationSchema deserializer = new LogEventDeserializationSchema();

    @Test
    @DisplayName("Should read a JSON log event with ISO timestamp and nested metadata")
    void shouldDeserializeLogEvent() throws Exception {
        String json = "{\"timestamp\":\"2024-01-01T10:00:00Z\",\"level\":\"warn\",\"source\":\"api\","
                + "\"message\":\"slow\",\"metadata\":{\"latency\":{\"p99\":120}},\"host\":\"ignored\"}";

        LogEvent event = deserializer.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(event.getTimestamp()).isEqualTo(T0);
        assertThat(event.getLevel()).isEqualTo(LogLevel.WARNING);
        assertThat(event.getMetadata()).containsKey("latency");
    }

    @Test
    @DisplayName("Should drop malformed or invalid events instead of failing")
    void shouldDropBadEvents() throws Exception {
        assertThat(deserializer.deserialize("not json".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(deserializer.deserialize(
                "{\"timestamp\":\"2024-01-01T10:00:00Z\",\"level\":\"INFO\",\"source\":\"api\"}"
                        .getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(deserializer.deserialize(new byte[0])).isNull();
    }

    @Test
    @DisplayName("Should write metric results with ISO dates and without empty fields")
    void shouldSerializeMetricResult() {
        MetricResult scalar = MetricResult.scalar("error_count", T0, T0.plusSeconds(60), 3.0, 3);
        MetricResult grouped = MetricResult.grouped("events_by_source", T0, T0.plusSeconds(60),
                Map.of("api", 2.0), 2);

        String scalarJson = new String(new JsonSerializationSchema<MetricResult>().serialize(scalar),
                StandardCharsets.UTF_8);
        String groupedJson = new String(new JsonSerializationSchema<MetricResult>().serialize(grouped),
                StandardCharsets.UTF_8);

        assertThat(scalarJson)
                .contains("\"metricName\":\"error_count\"")
                .contains("\"windowStart\":\"2024-01-01T10:00:00Z\"")
                .contains("\"value\":3.0")
                .doesNotContain("groupedValues")
                .doesNotContain("grouped\"");
        assertThat(groupedJson)
                .contains("\"groupedValues\":{\"api\":2.0}")
                .doesNotContain("\"value\"");
    }

    @Test
    @DisplayName("Should write anomaly records with a camel-case zScore field")
    void shouldSerializeAnomalyRecord() {
        AnomalyRecord record = AnomalyRecord.builder()
                .metricName("error_count")
                .timestamp(T0)
                .value(10)
                .baselineMean(3)
                .baselineStd(1.5)
                .zScore(4.7)
                .direction(AnomalyDirection.SPIKE)
                .severity(Severity.HIGH)
                .explanation("error_count spiked")
                .build();

        String json = new String(new JsonSerializationSchema<AnomalyRecord>().serialize(record),
                StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"zScore\":4.7")
                .contains("\"direction\":\"SPIKE\"")
                .contains("\"severity\":\"HIGH\"")
                .contains("\"timestamp\":\"2024-01-01T10:00:00Z\"");
    }
}
