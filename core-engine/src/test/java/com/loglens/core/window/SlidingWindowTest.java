package com.loglens.core.window;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SlidingWindow}.
 */
class SlidingWindowTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private SlidingWindow<Integer> window;

    @BeforeEach
    void setUp() {
        window = new SlidingWindow<>(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Should emit a snapshot on every admission")
    void shouldEmitOnEveryAdd() {
        Optional<WindowSnapshot<Integer>> first = window.add(1, T0);
        Optional<WindowSnapshot<Integer>> second = window.add(2, T0.plusSeconds(1));

        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(second.get().getValues()).containsExactly(1, 2);
        assertThat(second.get().getStart()).isEqualTo(T0.plusSeconds(1).minusSeconds(10));
        assertThat(second.get().getEnd()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    @DisplayName("Should evict entries older than the window length")
    void shouldEvictExpiredEntries() {
        window.add(1, T0);
        window.add(2, T0.plusSeconds(5));

        WindowSnapshot<Integer> snapshot = window.add(3, T0.plusSeconds(12)).orElseThrow();

        assertThat(snapshot.getValues()).containsExactly(2, 3);
        assertThat(window.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep an entry exactly one window length old")
    void shouldKeepEntryOnLowerBound() {
        window.add(1, T0);

        WindowSnapshot<Integer> snapshot = window.add(2, T0.plusSeconds(10)).orElseThrow();

        assertThat(snapshot.getValues()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should drop and count out-of-order entries")
    void shouldDropOutOfOrderEntries() {
        window.add(1, T0.plusSeconds(5));

        Optional<WindowSnapshot<Integer>> result = window.add(2, T0);

        assertThat(result).isEmpty();
        assertThat(window.values()).containsExactly(1);
        assertThat(window.droppedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept entries sharing the latest timestamp")
    void shouldAcceptEqualTimestamps() {
        window.add(1, T0);

        assertThat(window.add(2, T0)).isPresent();
        assertThat(window.values()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Expire should evict out-of-scope entries without moving the anchor")
    void expireShouldEvictWithoutAdmitting() {
        window.add(1, T0);
        window.add(2, T0.plusSeconds(5));

        int evicted = window.expire(T0.plusSeconds(12));

        assertThat(evicted).isEqualTo(1);
        assertThat(window.values()).containsExactly(2);
        assertThat(window.end()).isEqualTo(T0.plusSeconds(5));
        assertThat(window.expire(T0.plusSeconds(30))).isEqualTo(1);
        assertThat(window.size()).isZero();
        assertThat(window.flush()).isEmpty();
    }

    @Test
    @DisplayName("Flush should report contents without clearing them")
    void flushShouldNotClear() {
        window.add(1, T0);
        window.add(2, T0.plusSeconds(1));

        WindowSnapshot<Integer> flushed = window.flush().orElseThrow();

        assertThat(flushed.getValues()).containsExactly(1, 2);
        assertThat(window.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Flush of an empty window should produce nothing")
    void flushOfEmptyWindowIsEmpty() {
        assertThat(window.flush()).isEmpty();
        assertThat(window.start()).isNull();
    }

    @Test
    @DisplayName("Clear should reset contents, bounds and the drop counter")
    void clearShouldReset() {
        window.add(1, T0.plusSeconds(5));
        window.add(2, T0);

        window.clear();

        assertThat(window.size()).isZero();
        assertThat(window.end()).isNull();
        assertThat(window.droppedCount()).isZero();
        assertThat(window.add(3, T0)).isPresent();
    }

    @Test
    @DisplayName("Should reject a non-positive duration")
    void shouldRejectNonPositiveDuration() {
        assertThatThrownBy(() -> new SlidingWindow<Integer>(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }
}
