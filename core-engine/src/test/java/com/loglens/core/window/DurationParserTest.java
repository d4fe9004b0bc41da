package com.loglens.core.window;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DurationParser} and {@link WindowSpec#parse(String, String)}.
 */
class DurationParserTest {

    @Test
    @DisplayName("Should parse shorthand units")
    void shouldParseShorthand() {
        assertThat(DurationParser.parse("500ms")).isEqualTo(Duration.ofMillis(500));
        assertThat(DurationParser.parse("30s")).isEqualTo(Duration.ofSeconds(30));
        assertThat(DurationParser.parse("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(DurationParser.parse("1h")).isEqualTo(Duration.ofHours(1));
        assertThat(DurationParser.parse("2d")).isEqualTo(Duration.ofDays(2));
    }

    @Test
    @DisplayName("Should accept upper case and surrounding whitespace")
    void shouldBeLenientOnCaseAndWhitespace() {
        assertThat(DurationParser.parse(" 5M ")).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should parse ISO-8601 durations")
    void shouldParseIso() {
        assertThat(DurationParser.parse("PT90S")).isEqualTo(Duration.ofSeconds(90));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "  ", "5", "m", "5x", "1.5m", "-5m", "0s", "PT0S", "Pgarbage" })
    @DisplayName("Should reject malformed or non-positive durations")
    void shouldRejectInvalid(String input) {
        assertThatThrownBy(() -> DurationParser.parse(input))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Window spec should default to sliding and build the matching window")
    void windowSpecShouldDefaultToSliding() {
        WindowSpec spec = WindowSpec.parse("5m", null);

        assertThat(spec.getType()).isEqualTo(WindowType.SLIDING);
        assertThat(spec.getDuration()).isEqualTo(Duration.ofMinutes(5));
        assertThat(spec.<String>newWindow()).isInstanceOf(SlidingWindow.class);
        assertThat(WindowSpec.parse("1m", "TUMBLING").<String>newWindow()).isInstanceOf(TumblingWindow.class);
    }

    @Test
    @DisplayName("Window spec should reject unknown window types")
    void windowSpecShouldRejectUnknownType() {
        assertThatThrownBy(() -> WindowSpec.parse("5m", "hopping"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hopping");
    }
}
