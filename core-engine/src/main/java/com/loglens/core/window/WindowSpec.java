package com.loglens.core.window;

import java.io.Serializable;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Duration plus strategy of a metric's window. Immutable.
 *
 * @since 1.0.0
 */
public final class WindowSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Duration duration;
    private final WindowType type;

    private WindowSpec(Duration duration, WindowType type) {
        Objects.requireNonNull(duration, "Window duration must not be null");
        this.type = Objects.requireNonNull(type, "Window type must not be null");
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Window duration must be positive, got: " + duration);
        }
        if (type == WindowType.TUMBLING) {
            TumblingWindow.requireWholeMillis(duration);
        }
        this.duration = duration;
    }

    public static WindowSpec sliding(Duration duration) {
        return new WindowSpec(duration, WindowType.SLIDING);
    }

    public static WindowSpec tumbling(Duration duration) {
        return new WindowSpec(duration, WindowType.TUMBLING);
    }

    public static WindowSpec of(Duration duration, WindowType type) {
        return new WindowSpec(duration, type);
    }

    /**
     * Parse a window from its configuration form.
     *
     * @param window duration text, e.g. {@code "5m"}
     * @param type   strategy name; {@code null} means sliding
     * @return the parsed spec
     * @throws IllegalArgumentException if either part is malformed
     */
    public static WindowSpec parse(String window, String type) {
        return new WindowSpec(DurationParser.parse(window), WindowType.fromName(type));
    }

    /**
     * @param <T> type of value held by the window
     * @return a new, empty window following this spec
     */
    public <T> TimeWindow<T> newWindow() {
        return type.create(duration);
    }

    public Duration getDuration() {
        return duration;
    }

    public WindowType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowSpec that))
            return false;
        return duration.equals(that.duration) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(duration, type);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase(Locale.ROOT) + "(" + duration + ")";
    }
}
