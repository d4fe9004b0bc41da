package com.loglens.core.expression;

import com.loglens.core.model.LogEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DefaultExpressionEvaluator}.
 */
class DefaultExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new DefaultExpressionEvaluator();

    @Test
    @DisplayName("Predicate should apply truthiness to the expression result")
    void predicateShouldUseTruthiness() throws InvalidExpressionException {
        EventPredicate isError = evaluator.compilePredicate("event.level in ('ERROR', 'CRITICAL', 'FATAL')");
        EventPredicate hasUser = evaluator.compilePredicate("event.metadata.user");

        assertThat(isError.test(event("ERROR", "api"))).isTrue();
        assertThat(isError.test(event("INFO", "api"))).isFalse();
        assertThat(hasUser.test(event("INFO", "api"))).isFalse();
        assertThat(hasUser.test(eventWith("user", "alice"))).isTrue();
    }

    @Test
    @DisplayName("Group key should stringify the result and use 'null' for missing values")
    void groupKeyShouldStringify() throws InvalidExpressionException {
        GroupKeyExtractor bySource = evaluator.compileGroupKey("event.source");
        GroupKeyExtractor byStatus = evaluator.compileGroupKey("event.metadata.status");

        assertThat(bySource.keyOf(event("INFO", "web"))).isEqualTo("web");
        assertThat(byStatus.keyOf(eventWith("status", 503))).isEqualTo("503");
        assertThat(byStatus.keyOf(event("INFO", "web"))).isEqualTo("null");
    }

    @Test
    @DisplayName("Value extractor should accept numbers and numeric strings")
    void valueExtractorShouldAcceptNumbers() throws InvalidExpressionException {
        ValueExtractor latency = evaluator.compileValue("event.metadata.latency");

        assertThat(latency.valueOf(eventWith("latency", 125))).isEqualTo(125.0);
        assertThat(latency.valueOf(eventWith("latency", " 99.5 "))).isEqualTo(99.5);
    }

    @Test
    @DisplayName("Value extractor should fail on missing or non-numeric values")
    void valueExtractorShouldRejectNonNumbers() throws InvalidExpressionException {
        ValueExtractor latency = evaluator.compileValue("event.metadata.latency");

        assertThatThrownBy(() -> latency.valueOf(event("INFO", "api")))
                .isInstanceOf(ExpressionEvaluationException.class)
                .hasMessageContaining("expected a number");
        assertThatThrownBy(() -> latency.valueOf(eventWith("latency", "fast")))
                .isInstanceOf(ExpressionEvaluationException.class)
                .hasMessageContaining("not numeric");
        assertThatThrownBy(() -> latency.valueOf(event("INFO", "api")))
                .hasMessageContaining("produced null");
    }

    @Test
    @DisplayName("Value extractor should reject NaN and infinite values")
    void valueExtractorShouldRejectNonFiniteValues() throws InvalidExpressionException {
        ValueExtractor latency = evaluator.compileValue("event.metadata.latency");

        assertThatThrownBy(() -> latency.valueOf(eventWith("latency", "NaN")))
                .isInstanceOf(ExpressionEvaluationException.class)
                .hasMessageContaining("finite");
        assertThatThrownBy(() -> latency.valueOf(eventWith("latency", Double.POSITIVE_INFINITY)))
                .isInstanceOf(ExpressionEvaluationException.class)
                .hasMessageContaining("finite");
        assertThatThrownBy(() -> latency.valueOf(eventWith("latency", "-Infinity")))
                .isInstanceOf(ExpressionEvaluationException.class);
    }

    @Test
    @DisplayName("Compilation should surface syntax errors")
    void compilationShouldFailOnSyntaxErrors() {
        assertThatThrownBy(() -> evaluator.compilePredicate("event.level = 'ERROR'"))
                .isInstanceOf(InvalidExpressionException.class);
        assertThatThrownBy(() -> evaluator.compileValue("  "))
                .isInstanceOf(InvalidExpressionException.class);
    }

    @Test
    @DisplayName("Compiled functions should survive Java serialization")
    void compiledFunctionsShouldBeSerializable() throws Exception {
        EventPredicate predicate = evaluator.compilePredicate("event.source == 'api' and event.metadata.code >= 500");

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(predicate);
        }
        EventPredicate copy;
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            copy = (EventPredicate) in.readObject();
        }

        assertThat(copy.test(eventWith("code", 503))).isTrue();
        assertThat(copy.test(eventWith("code", 200))).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static LogEvent event(String level, String source) {
        return LogEvent.builder()
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .level(level)
                .source(source)
                .message("message")
                .build();
    }

    private static LogEvent eventWith(String key, Object value) {
        return LogEvent.builder()
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .level("INFO")
                .source("api")
                .message("message")
                .metadata(key, value)
                .build();
    }
}
