package com.loglens.core.expression.grammar;

import com.loglens.core.expression.ExpressionEvaluationException;
import com.loglens.core.expression.InvalidExpressionException;
import com.loglens.core.model.LogEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExpressionParser} and the nodes it builds.
 */
class ExpressionParserTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private final LogEvent event = LogEvent.builder()
            .timestamp(NOW)
            .level("ERROR")
            .source("api")
            .message("Connection timeout to database")
            .metadata("response_time_ms", 250)
            .metadata("user", Map.of("id", "u-1", "roles", List.of("admin", "ops")))
            .build();

    @Test
    @DisplayName("Should read event attributes")
    void shouldReadAttributes() throws InvalidExpressionException {
        assertThat(eval("event.level")).isEqualTo("ERROR");
        assertThat(eval("event.source")).isEqualTo("api");
        assertThat(eval("event.timestamp")).isEqualTo(NOW.toEpochMilli());
    }

    @Test
    @DisplayName("Should walk nested metadata by key, bracket and list index")
    void shouldWalkMetadata() throws InvalidExpressionException {
        assertThat(eval("event.metadata.user.id")).isEqualTo("u-1");
        assertThat(eval("event.metadata['user']['id']")).isEqualTo("u-1");
        assertThat(eval("event.metadata.user.roles.1")).isEqualTo("ops");
        assertThat(eval("event.metadata.missing")).isNull();
        assertThat(eval("event.metadata.user.roles.7")).isNull();
    }

    @Test
    @DisplayName("Should evaluate membership against tuples, lists, strings and maps")
    void shouldEvaluateMembership() throws InvalidExpressionException {
        assertThat(eval("event.level in ('ERROR', 'CRITICAL')")).isEqualTo(true);
        assertThat(eval("event.level not in ['ERROR']")).isEqualTo(false);
        assertThat(eval("'timeout' in event.message")).isEqualTo(true);
        assertThat(eval("'response_time_ms' in event.metadata")).isEqualTo(true);
        assertThat(eval("'trace_id' in event.metadata")).isEqualTo(false);
    }

    @Test
    @DisplayName("Should honour precedence of not, and, or")
    void shouldHonourBooleanPrecedence() throws InvalidExpressionException {
        assertThat(eval("event.source == 'web' or event.level == 'ERROR' and not False")).isEqualTo(true);
        assertThat(eval("not event.source == 'api'")).isEqualTo(false);
        assertThat(eval("(event.source == 'web' or True) and False")).isEqualTo(false);
    }

    @Test
    @DisplayName("Should compare numbers across integer and decimal literals")
    void shouldCompareNumbers() throws InvalidExpressionException {
        assertThat(eval("event.metadata.response_time_ms > 200.5")).isEqualTo(true);
        assertThat(eval("event.metadata.response_time_ms == 250.0")).isEqualTo(true);
        assertThat(eval("event.metadata.response_time_ms <= 100")).isEqualTo(false);
    }

    @Test
    @DisplayName("Should evaluate arithmetic with the usual precedence")
    void shouldEvaluateArithmetic() throws InvalidExpressionException {
        assertThat(eval("event.metadata.response_time_ms / 1000")).isEqualTo(0.25);
        assertThat(eval("2 + 3 * 4")).isEqualTo(14.0);
        assertThat(eval("-(10 % 4)")).isEqualTo(-2.0);
        assertThat(eval("event.source + '-svc'")).isEqualTo("api-svc");
    }

    @Test
    @DisplayName("Should map literal keywords to values")
    void shouldParseKeywords() throws InvalidExpressionException {
        assertThat(eval("True")).isEqualTo(true);
        assertThat(eval("None")).isNull();
        assertThat(eval("event.metadata.missing == None")).isEqualTo(true);
    }

    @Test
    @DisplayName("Should fail at evaluation time on a type mismatch or division by zero")
    void shouldFailOnBadOperands() throws InvalidExpressionException {
        ExpressionNode ordering = ExpressionParser.parse("event.source > 5");
        ExpressionNode division = ExpressionParser.parse("event.metadata.response_time_ms / 0");

        assertThatThrownBy(() -> ordering.evaluate(event))
                .isInstanceOf(ExpressionEvaluationException.class)
                .hasMessageContaining("'>'");
        assertThatThrownBy(() -> division.evaluate(event))
                .isInstanceOf(ExpressionEvaluationException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "event",
            "event.host",
            "event.level.name",
            "level == 'ERROR'",
            "event.level ==",
            "(event.level == 'ERROR'",
            "event.level == 'ERROR' 'WARN'",
            "__import__('os')",
            "event.metadata.x()" })
    @DisplayName("Should reject malformed or disallowed expressions")
    void shouldRejectInvalidExpressions(String expression) {
        assertThatThrownBy(() -> ExpressionParser.parse(expression))
                .isInstanceOf(InvalidExpressionException.class);
    }

    @Test
    @DisplayName("Should report the failing position and source text")
    void shouldReportPosition() {
        assertThatThrownBy(() -> ExpressionParser.parse("event.level == 'ERROR' )"))
                .isInstanceOf(InvalidExpressionException.class)
                .hasMessageContaining("position 23")
                .hasMessageContaining("in: event.level == 'ERROR' )");
    }

    private Object eval(String expression) throws InvalidExpressionException {
        return ExpressionParser.parse(expression).evaluate(event);
    }
}
