package com.loglens.core.anomaly;

import com.loglens.core.config.ConfigurationException;
import com.loglens.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeverityBands}.
 */
class SeverityBandsTest {

    @Test
    @DisplayName("Default bands should scale with the threshold")
    void defaultBandsShouldScaleWithThreshold() {
        SeverityBands bands = SeverityBands.DEFAULT;

        assertThat(bands.classify(2.0, 2.0)).isEqualTo(Severity.LOW);
        assertThat(bands.classify(2.99, 2.0)).isEqualTo(Severity.LOW);
        assertThat(bands.classify(3.0, 2.0)).isEqualTo(Severity.MEDIUM);
        assertThat(bands.classify(4.0, 2.0)).isEqualTo(Severity.HIGH);
        assertThat(bands.classify(6.0, 2.0)).isEqualTo(Severity.CRITICAL);
        assertThat(bands.classify(Double.POSITIVE_INFINITY, 2.0)).isEqualTo(Severity.CRITICAL);
        assertThat(bands.classify(4.5, 3.0)).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Custom bands should apply their own multiples")
    void customBands() {
        SeverityBands bands = SeverityBands.of(1.2, 1.5, 2.5);

        assertThat(bands.classify(2.5, 2.0)).isEqualTo(Severity.MEDIUM);
        assertThat(bands.classify(3.0, 2.0)).isEqualTo(Severity.HIGH);
        assertThat(bands.classify(5.0, 2.0)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should reject unordered or sub-unit multiples")
    void shouldRejectInvalidBands() {
        assertThatThrownBy(() -> SeverityBands.of(2, 2, 3)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> SeverityBands.of(0.5, 2, 3)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> SeverityBands.of(1.5, 3, 2)).isInstanceOf(ConfigurationException.class);
    }
}
